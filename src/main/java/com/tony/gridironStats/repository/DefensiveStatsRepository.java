package com.tony.gridironStats.repository;

import com.tony.gridironStats.model.DefensiveSeasonStats;

public interface DefensiveStatsRepository extends SeasonAggregateRepository<DefensiveSeasonStats> {
}
