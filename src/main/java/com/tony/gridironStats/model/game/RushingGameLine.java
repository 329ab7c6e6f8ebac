package com.tony.gridironStats.model.game;

import com.tony.gridironStats.model.StatCategory;

public record RushingGameLine(PlayerIdentity identity,
                              Integer rushingAttempts,
                              Integer rushingYards,
                              Integer rushingTouchdowns,
                              Integer longestRun) implements PlayerGameRecord {

    @Override
    public StatCategory category() {
        return StatCategory.RUSHING;
    }
}
