package com.tony.gridironStats.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "rushing_stats")
@Getter @Setter @NoArgsConstructor
public class RushingSeasonStats extends PlayerSeasonAggregate {

    private Integer rushingAttempts = 0;
    private Integer rushingYards = 0;
    private Integer rushingTouchdowns = 0;
    private Integer longestRun; // max courant, null tant qu'aucun match ne l'a fourni

    @Override
    public StatCategory getCategory() {
        return StatCategory.RUSHING;
    }
}
