package com.tony.gridironStats.service;

import com.opencsv.bean.StatefulBeanToCsv;
import com.opencsv.bean.StatefulBeanToCsvBuilder;
import com.opencsv.exceptions.CsvException;
import com.tony.gridironStats.model.PlayerSeasonAggregate;
import com.tony.gridironStats.model.StatCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.io.Writer;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lecture des classements (page d'accueil, fiche joueur, export CSV).
 */
@Service
@RequiredArgsConstructor
public class LeaderboardService {

    // Garde-fou : le classement défensif par défaut est déjà à 1200 lignes
    static final int MAX_LIMIT = 2000;

    private final SeasonAggregateGateway gateway;

    public List<PlayerSeasonAggregate> getLeaders(StatCategory category, Integer limit) {
        int n = (limit == null) ? category.getDefaultLeaderboardSize() : Math.min(limit, MAX_LIMIT);
        return gateway.topN(category, n);
    }

    public Map<StatCategory, List<PlayerSeasonAggregate>> getAllLeaders() {
        Map<StatCategory, List<PlayerSeasonAggregate>> leaders = new EnumMap<>(StatCategory.class);
        for (StatCategory category : StatCategory.values()) {
            leaders.put(category, getLeaders(category, null));
        }
        return leaders;
    }

    public Optional<PlayerSeasonAggregate> getPlayer(StatCategory category, String playerId) {
        return gateway.getAggregate(category, playerId);
    }

    /**
     * Écrit le classement au format CSV (une colonne par champ de l'entité).
     */
    public int exportCsv(StatCategory category, Integer limit, Writer writer) throws CsvException {
        List<PlayerSeasonAggregate> rows = getLeaders(category, limit);
        StatefulBeanToCsv<PlayerSeasonAggregate> csv = new StatefulBeanToCsvBuilder<PlayerSeasonAggregate>(writer)
                .withSeparator(',')
                .build();
        csv.write(rows);
        return rows.size();
    }
}
