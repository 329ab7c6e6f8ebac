package com.tony.gridironStats.service.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.model.game.*;
import com.tony.gridironStats.service.ingest.BoxScoreSchema.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Transforme le résumé JSON d'un match ESPN en lignes typées, une liste par catégorie.
 * Aucune I/O ici : le JSON est déjà chargé par le SourceFeed.
 *
 * Structure lue : boxscore.players[].team + boxscore.players[].statistics[].athletes[]
 */
@Component
@Slf4j
public class BoxScoreExtractor {

    public GameStatLines extract(JsonNode gameSummary) {
        GameStatLines result = new GameStatLines();
        if (gameSummary == null) return result;

        JsonNode players = gameSummary.path("boxscore").path("players");
        if (!players.isArray()) {
            log.debug("Pas de bloc boxscore.players dans le résumé, match ignoré");
            return result;
        }

        for (JsonNode teamBlock : players) {
            JsonNode team = teamBlock.path("team");
            String teamId = textOrNull(team.path("id"));
            String teamName = textOrNull(team.path("displayName"));

            for (JsonNode group : teamBlock.path("statistics")) {
                String groupName = textOrNull(group.path("name"));
                Optional<StatCategory> category = StatCategory.fromGroupName(groupName);
                if (category.isEmpty()) {
                    // kicking, punting, kickReturns... pas suivis pour l'instant
                    log.debug("Groupe de stats non suivi : {}", groupName);
                    continue;
                }

                for (JsonNode athleteEntry : group.path("athletes")) {
                    PlayerIdentity identity = readIdentity(athleteEntry.path("athlete"), teamId, teamName);
                    StatTokens tokens = new StatTokens(athleteEntry.path("stats"), identity.playerId());
                    result.add(toRecord(category.get(), identity, tokens));
                }
            }
        }
        return result;
    }

    private PlayerGameRecord toRecord(StatCategory category, PlayerIdentity id, StatTokens t) {
        return switch (category) {
            case PASSING -> new PassingGameLine(id,
                    t.compositeAt(Passing.COMPLETIONS_ATTEMPTS),
                    t.intAt(Passing.PASSING_YARDS),
                    t.intAt(Passing.PASSING_TOUCHDOWNS),
                    t.intAt(Passing.INTERCEPTIONS),
                    t.intAt(Passing.SACKS));
            case RUSHING -> new RushingGameLine(id,
                    t.intAt(Rushing.ATTEMPTS),
                    t.intAt(Rushing.YARDS),
                    t.intAt(Rushing.TOUCHDOWNS),
                    t.intAt(Rushing.LONGEST));
            case RECEIVING -> new ReceivingGameLine(id,
                    t.intAt(Receiving.RECEPTIONS),
                    t.intAt(Receiving.YARDS),
                    t.intAt(Receiving.TOUCHDOWNS),
                    t.intAt(Receiving.LONGEST),
                    t.intAt(Receiving.TARGETS));
            case FUMBLES -> new FumbleGameLine(id,
                    t.intAt(Fumbles.FUMBLES),
                    t.intAt(Fumbles.LOST),
                    t.intAt(Fumbles.RECOVERED));
            case DEFENSIVE -> new DefensiveGameLine(id,
                    t.intAt(Defensive.TOTAL_TACKLES),
                    t.intAt(Defensive.SOLO_TACKLES),
                    t.intAt(Defensive.SACKS),
                    t.intAt(Defensive.TACKLES_FOR_LOSS),
                    t.intAt(Defensive.PASSES_DEFENDED),
                    t.intAt(Defensive.QB_HITS),
                    t.intAt(Defensive.TOUCHDOWNS));
            case INTERCEPTIONS -> new InterceptionGameLine(id,
                    t.intAt(Interceptions.INTERCEPTIONS),
                    t.intAt(Interceptions.YARDS),
                    t.intAt(Interceptions.TOUCHDOWNS));
        };
    }

    private PlayerIdentity readIdentity(JsonNode bio, String teamId, String teamName) {
        return new PlayerIdentity(
                teamId,
                teamName,
                textOrNull(bio.path("id")),
                textOrNull(bio.path("displayName")),
                textOrNull(bio.path("headshot").path("href")));
    }

    private String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
