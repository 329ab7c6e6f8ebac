package com.tony.gridironStats.model.game;

import com.tony.gridironStats.model.StatCategory;

public record FumbleGameLine(PlayerIdentity identity,
                             Integer fumbles,
                             Integer fumblesLost,
                             Integer fumblesRecovered) implements PlayerGameRecord {

    @Override
    public StatCategory category() {
        return StatCategory.FUMBLES;
    }
}
