package com.tony.gridironStats.repository;

import com.tony.gridironStats.model.FumbleSeasonStats;

public interface FumbleStatsRepository extends SeasonAggregateRepository<FumbleSeasonStats> {
}
