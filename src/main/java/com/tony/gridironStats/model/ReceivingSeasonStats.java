package com.tony.gridironStats.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "receiving_stats")
@Getter @Setter @NoArgsConstructor
public class ReceivingSeasonStats extends PlayerSeasonAggregate {

    private Integer receptions = 0;
    private Integer receivingYards = 0;
    private Integer receivingTouchdowns = 0;
    private Integer longestReception;
    private Integer targets = 0;

    @Override
    public StatCategory getCategory() {
        return StatCategory.RECEIVING;
    }
}
