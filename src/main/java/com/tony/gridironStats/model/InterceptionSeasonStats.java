package com.tony.gridironStats.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "interceptions_stats")
@Getter @Setter @NoArgsConstructor
public class InterceptionSeasonStats extends PlayerSeasonAggregate {

    private Integer interceptions = 0;
    private Integer interceptionYards = 0;
    private Integer interceptionTouchdowns = 0;

    @Override
    public StatCategory getCategory() {
        return StatCategory.INTERCEPTIONS;
    }
}
