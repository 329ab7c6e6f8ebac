package com.tony.gridironStats.model.game;

import com.tony.gridironStats.model.StatCategory;

public record ReceivingGameLine(PlayerIdentity identity,
                                Integer receptions,
                                Integer receivingYards,
                                Integer receivingTouchdowns,
                                Integer longestReception,
                                Integer targets) implements PlayerGameRecord {

    @Override
    public StatCategory category() {
        return StatCategory.RECEIVING;
    }
}
