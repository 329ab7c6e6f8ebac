package com.tony.gridironStats.model.game;

import com.tony.gridironStats.model.StatCategory;

public record InterceptionGameLine(PlayerIdentity identity,
                                   Integer interceptions,
                                   Integer interceptionYards,
                                   Integer interceptionTouchdowns) implements PlayerGameRecord {

    @Override
    public StatCategory category() {
        return StatCategory.INTERCEPTIONS;
    }
}
