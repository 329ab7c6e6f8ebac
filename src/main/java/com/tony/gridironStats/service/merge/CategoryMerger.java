package com.tony.gridironStats.service.merge;

import com.tony.gridironStats.model.PlayerSeasonAggregate;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.model.game.PlayerGameRecord;

/**
 * Règles de cumul d'une catégorie. Une implémentation par {@link StatCategory}.
 * Pur calcul : la lecture/écriture en base reste dans {@link CategoryMergeEngine}.
 * L'identité (équipe, nom, photo) est écrasée par le moteur, pas ici.
 */
public interface CategoryMerger<R extends PlayerGameRecord, A extends PlayerSeasonAggregate> {

    StatCategory category();

    Class<R> recordType();

    Class<A> aggregateType();

    /**
     * Première apparition du joueur : les compteurs sont pris tels quels (null -> 0),
     * les "longest" restent null s'ils sont absents.
     */
    A create(R record);

    /**
     * Ajoute le match à un cumul existant.
     */
    void accumulate(A aggregate, R record);
}
