package com.tony.gridironStats.repository;

import com.tony.gridironStats.model.InterceptionSeasonStats;

public interface InterceptionStatsRepository extends SeasonAggregateRepository<InterceptionSeasonStats> {
}
