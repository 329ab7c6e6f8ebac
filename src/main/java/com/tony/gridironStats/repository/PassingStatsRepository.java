package com.tony.gridironStats.repository;

import com.tony.gridironStats.model.PassingSeasonStats;

public interface PassingStatsRepository extends SeasonAggregateRepository<PassingSeasonStats> {
}
