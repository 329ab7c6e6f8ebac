package com.tony.gridironStats.service.merge;

import com.tony.gridironStats.model.RushingSeasonStats;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.model.game.RushingGameLine;
import org.springframework.stereotype.Component;

import static com.tony.gridironStats.util.StatNormalizer.*;

@Component
public class RushingMerger implements CategoryMerger<RushingGameLine, RushingSeasonStats> {

    @Override
    public StatCategory category() { return StatCategory.RUSHING; }

    @Override
    public Class<RushingGameLine> recordType() { return RushingGameLine.class; }

    @Override
    public Class<RushingSeasonStats> aggregateType() { return RushingSeasonStats.class; }

    @Override
    public RushingSeasonStats create(RushingGameLine line) {
        RushingSeasonStats s = new RushingSeasonStats();
        s.setRushingAttempts(orZero(line.rushingAttempts()));
        s.setRushingYards(orZero(line.rushingYards()));
        s.setRushingTouchdowns(orZero(line.rushingTouchdowns()));
        s.setLongestRun(line.longestRun());
        return s;
    }

    @Override
    public void accumulate(RushingSeasonStats s, RushingGameLine line) {
        s.setRushingAttempts(add(s.getRushingAttempts(), line.rushingAttempts()));
        s.setRushingYards(add(s.getRushingYards(), line.rushingYards()));
        s.setRushingTouchdowns(add(s.getRushingTouchdowns(), line.rushingTouchdowns()));
        s.setLongestRun(max(s.getLongestRun(), line.longestRun())); // jamais sommé
    }
}
