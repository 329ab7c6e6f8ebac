package com.tony.gridironStats.repository;

import com.tony.gridironStats.model.ReceivingSeasonStats;

public interface ReceivingStatsRepository extends SeasonAggregateRepository<ReceivingSeasonStats> {
}
