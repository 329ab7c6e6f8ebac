package com.tony.gridironStats.model.game;

import com.tony.gridironStats.model.StatCategory;

/**
 * Une ligne de stats d'un joueur pour un match et une catégorie.
 * Produite par l'extracteur, consommée une seule fois par le moteur de fusion.
 */
public interface PlayerGameRecord {

    StatCategory category();

    PlayerIdentity identity();

    default String playerId() {
        return identity() == null ? null : identity().playerId();
    }
}
