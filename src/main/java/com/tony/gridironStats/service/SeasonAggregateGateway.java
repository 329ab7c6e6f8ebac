package com.tony.gridironStats.service;

import com.tony.gridironStats.model.PlayerSeasonAggregate;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.repository.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accès aux tables de cumuls par catégorie. Seul point de contact entre le pipeline et JPA.
 */
@Service
@Slf4j
public class SeasonAggregateGateway {

    private final Map<StatCategory, SeasonAggregateRepository<? extends PlayerSeasonAggregate>> repositories = new EnumMap<>(StatCategory.class);
    private final Map<StatCategory, Sort> leaderboardSorts = new EnumMap<>(StatCategory.class);

    public SeasonAggregateGateway(PassingStatsRepository passingRepository,
                                  RushingStatsRepository rushingRepository,
                                  ReceivingStatsRepository receivingRepository,
                                  FumbleStatsRepository fumbleRepository,
                                  DefensiveStatsRepository defensiveRepository,
                                  InterceptionStatsRepository interceptionRepository) {
        register(StatCategory.PASSING, passingRepository, "passingYards");
        register(StatCategory.RUSHING, rushingRepository, "rushingYards");
        register(StatCategory.RECEIVING, receivingRepository, "receivingYards");
        register(StatCategory.FUMBLES, fumbleRepository, "fumbles");
        register(StatCategory.DEFENSIVE, defensiveRepository, "totalTackles");
        register(StatCategory.INTERCEPTIONS, interceptionRepository, "interceptions");
    }

    private void register(StatCategory category, SeasonAggregateRepository<? extends PlayerSeasonAggregate> repository, String rankingField) {
        repositories.put(category, repository);
        // Départage par nom pour un classement stable d'un appel à l'autre
        leaderboardSorts.put(category, Sort.by(Sort.Order.desc(rankingField), Sort.Order.asc("playerName")));
    }

    @Transactional(readOnly = true)
    public Optional<PlayerSeasonAggregate> getAggregate(StatCategory category, String playerId) {
        return repository(category).findByPlayerId(playerId).map(PlayerSeasonAggregate.class::cast);
    }

    /**
     * Lecture verrouillée jusqu'à la fin de la transaction appelante. À utiliser dans une transaction.
     */
    public Optional<PlayerSeasonAggregate> getAggregateForUpdate(StatCategory category, String playerId) {
        return repository(category).findForUpdateByPlayerId(playerId).map(PlayerSeasonAggregate.class::cast);
    }

    @Transactional
    public <A extends PlayerSeasonAggregate> A upsertAggregate(StatCategory category, A row) {
        if (row.getCategory() != category) {
            throw new IllegalArgumentException("Ligne " + row.getCategory() + " envoyée vers la table " + category);
        }
        SeasonAggregateRepository<A> repository = repository(category);
        return repository.save(row);
    }

    public void flush(StatCategory category) {
        repository(category).flush();
    }

    @Transactional
    public void resetCategory(StatCategory category) {
        repository(category).deleteAllInBatch();
        log.info("🧹 Table {} vidée", category.getGroupName());
    }

    /**
     * Vide les six tables dans une seule transaction : soit tout est remis à zéro, soit rien.
     */
    @Transactional
    public void resetAll() {
        for (StatCategory category : StatCategory.values()) {
            repository(category).deleteAllInBatch();
        }
        log.info("🧹 Les {} tables de stats ont été vidées", StatCategory.values().length);
    }

    @Transactional(readOnly = true)
    public List<PlayerSeasonAggregate> topN(StatCategory category, int n) {
        if (n <= 0) return List.of();
        return repository(category).findAll(PageRequest.of(0, n, leaderboardSorts.get(category)))
                .stream()
                .map(PlayerSeasonAggregate.class::cast)
                .toList();
    }

    @Transactional(readOnly = true)
    public long count(StatCategory category) {
        return repository(category).count();
    }

    @SuppressWarnings("unchecked")
    private <A extends PlayerSeasonAggregate> SeasonAggregateRepository<A> repository(StatCategory category) {
        return (SeasonAggregateRepository<A>) repositories.get(category);
    }
}
