package com.tony.gridironStats.model.game;

import com.tony.gridironStats.model.StatCategory;

/**
 * @param completionsAttempts "C/ATT" tel que fourni par la source (ex : "23/35"), ou un simple nombre
 */
public record PassingGameLine(PlayerIdentity identity,
                              String completionsAttempts,
                              Integer passingYards,
                              Integer passingTouchdowns,
                              Integer interceptions,
                              Integer sacks) implements PlayerGameRecord {

    @Override
    public StatCategory category() {
        return StatCategory.PASSING;
    }
}
