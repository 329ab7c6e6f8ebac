package com.tony.gridironStats.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.gridironStats.exception.SourceFetchException;
import com.tony.gridironStats.model.SeasonType;

import java.util.List;

/**
 * Source distante des box-scores.
 */
public interface SourceFeed {

    /**
     * Identifiants des matchs d'une semaine, dans l'ordre du calendrier, sans doublon.
     */
    List<String> discoverGames(int season, int week, SeasonType seasonType) throws SourceFetchException;

    /**
     * Résumé complet d'un match (contient le bloc "boxscore").
     */
    JsonNode fetchGamePayload(String gameId) throws SourceFetchException;
}
