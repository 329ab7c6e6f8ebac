package com.tony.gridironStats.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Les six familles de statistiques suivies par joueur.
 * Le nom de groupe correspond exactement au champ "name" des blocs "statistics" du box-score ESPN.
 */
public enum StatCategory {
    PASSING("passing", 100),
    RUSHING("rushing", 300),
    RECEIVING("receiving", 400),
    FUMBLES("fumbles", 300),
    DEFENSIVE("defensive", 1200),
    INTERCEPTIONS("interceptions", 150);

    private final String groupName;
    private final int defaultLeaderboardSize;

    StatCategory(String groupName, int defaultLeaderboardSize) {
        this.groupName = groupName;
        this.defaultLeaderboardSize = defaultLeaderboardSize;
    }

    public String getGroupName() {
        return groupName;
    }

    public int getDefaultLeaderboardSize() {
        return defaultLeaderboardSize;
    }

    public static Optional<StatCategory> fromGroupName(String name) {
        if (name == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(c -> c.groupName.equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}
