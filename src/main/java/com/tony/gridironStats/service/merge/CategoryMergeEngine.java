package com.tony.gridironStats.service.merge;

import com.tony.gridironStats.exception.StatsPersistenceException;
import com.tony.gridironStats.model.PlayerSeasonAggregate;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.model.game.PlayerGameRecord;
import com.tony.gridironStats.service.SeasonAggregateGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fusionne les lignes d'un match dans les cumuls saison.
 * Un appel = un lot (une catégorie d'un match) = une transaction : en cas d'erreur base,
 * le lot entier est annulé et les lots déjà validés restent intacts.
 */
@Service
@Slf4j
public class CategoryMergeEngine {

    private final SeasonAggregateGateway gateway;
    private final Map<StatCategory, CategoryMerger<?, ?>> mergers = new EnumMap<>(StatCategory.class);

    public CategoryMergeEngine(SeasonAggregateGateway gateway, List<CategoryMerger<?, ?>> mergerBeans) {
        this.gateway = gateway;
        for (CategoryMerger<?, ?> merger : mergerBeans) {
            if (mergers.put(merger.category(), merger) != null) {
                throw new IllegalStateException("Deux règles de fusion pour la catégorie " + merger.category());
            }
        }
        for (StatCategory category : StatCategory.values()) {
            if (!mergers.containsKey(category)) {
                throw new IllegalStateException("Aucune règle de fusion pour la catégorie " + category);
            }
        }
    }

    /**
     * @return nombre de lignes créées + mises à jour (les lignes sans player_id sont ignorées)
     */
    @Transactional
    public int mergeBatch(StatCategory category, List<? extends PlayerGameRecord> records) {
        if (records == null || records.isEmpty()) return 0;
        try {
            int touched = applyAll(mergers.get(category), records);
            gateway.flush(category); // les erreurs d'UPDATE sortent ici et pas au commit
            return touched;
        } catch (DataAccessException e) {
            throw new StatsPersistenceException(category,
                    "Échec d'écriture du lot " + category.getGroupName() + " : " + e.getMessage(), e);
        }
    }

    private <R extends PlayerGameRecord, A extends PlayerSeasonAggregate> int applyAll(
            CategoryMerger<R, A> merger, List<? extends PlayerGameRecord> records) {
        int touched = 0;
        for (PlayerGameRecord raw : records) {
            if (!merger.recordType().isInstance(raw)) {
                throw new IllegalArgumentException("Ligne " + raw.category() + " reçue dans le lot " + merger.category());
            }
            R record = merger.recordType().cast(raw);
            String playerId = record.playerId();
            if (playerId == null) {
                log.debug("Ligne {} sans player_id ignorée", merger.category());
                continue;
            }

            Optional<PlayerSeasonAggregate> existing = gateway.getAggregateForUpdate(merger.category(), playerId);
            A row;
            if (existing.isPresent()) {
                row = merger.aggregateType().cast(existing.get());
                merger.accumulate(row, record);
            } else {
                row = merger.create(record);
            }
            row.applyIdentity(record.identity()); // last-write-wins sur l'identité

            gateway.upsertAggregate(merger.category(), row);
            touched++;
        }
        return touched;
    }
}
