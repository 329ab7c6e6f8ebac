package com.tony.gridironStats.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "passing_stats")
@Getter @Setter @NoArgsConstructor
public class PassingSeasonStats extends PlayerSeasonAggregate {

    private String completionsAttempts; // "C/ATT" cumulé, ex : "245/370"
    private Integer passingYards = 0;
    private Integer passingTouchdowns = 0;
    private Integer interceptions = 0;
    private Integer sacks = 0;

    @Override
    public StatCategory getCategory() {
        return StatCategory.PASSING;
    }
}
