package com.tony.gridironStats.model.game;

import com.tony.gridironStats.model.StatCategory;

public record DefensiveGameLine(PlayerIdentity identity,
                                Integer totalTackles,
                                Integer soloTackles,
                                Integer sacks,
                                Integer tacklesForLoss,
                                Integer passesDefended,
                                Integer qbHits,
                                Integer defensiveTouchdowns) implements PlayerGameRecord {

    @Override
    public StatCategory category() {
        return StatCategory.DEFENSIVE;
    }
}
