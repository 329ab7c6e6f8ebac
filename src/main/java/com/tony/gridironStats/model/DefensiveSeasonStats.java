package com.tony.gridironStats.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "defensive_stats")
@Getter @Setter @NoArgsConstructor
public class DefensiveSeasonStats extends PlayerSeasonAggregate {

    private Integer totalTackles = 0;
    private Integer soloTackles = 0;
    private Integer sacks = 0;
    private Integer tacklesForLoss = 0;
    private Integer passesDefended = 0;
    private Integer qbHits = 0;
    private Integer defensiveTouchdowns = 0;

    @Override
    public StatCategory getCategory() {
        return StatCategory.DEFENSIVE;
    }
}
