package com.tony.gridironStats.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "fumbles_stats")
@Getter @Setter @NoArgsConstructor
public class FumbleSeasonStats extends PlayerSeasonAggregate {

    private Integer fumbles = 0;
    private Integer fumblesLost = 0;
    private Integer fumblesRecovered = 0;

    @Override
    public StatCategory getCategory() {
        return StatCategory.FUMBLES;
    }
}
