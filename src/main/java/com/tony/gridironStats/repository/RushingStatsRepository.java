package com.tony.gridironStats.repository;

import com.tony.gridironStats.model.RushingSeasonStats;

public interface RushingStatsRepository extends SeasonAggregateRepository<RushingSeasonStats> {
}
