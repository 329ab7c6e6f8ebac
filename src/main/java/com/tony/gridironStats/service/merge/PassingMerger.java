package com.tony.gridironStats.service.merge;

import com.tony.gridironStats.model.PassingSeasonStats;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.model.game.PassingGameLine;
import org.springframework.stereotype.Component;

import static com.tony.gridironStats.util.StatNormalizer.*;

@Component
public class PassingMerger implements CategoryMerger<PassingGameLine, PassingSeasonStats> {

    @Override
    public StatCategory category() { return StatCategory.PASSING; }

    @Override
    public Class<PassingGameLine> recordType() { return PassingGameLine.class; }

    @Override
    public Class<PassingSeasonStats> aggregateType() { return PassingSeasonStats.class; }

    @Override
    public PassingSeasonStats create(PassingGameLine line) {
        PassingSeasonStats s = new PassingSeasonStats();
        s.setCompletionsAttempts(line.completionsAttempts()); // gardé tel quel à la création
        s.setPassingYards(orZero(line.passingYards()));
        s.setPassingTouchdowns(orZero(line.passingTouchdowns()));
        s.setInterceptions(orZero(line.interceptions()));
        s.setSacks(orZero(line.sacks()));
        return s;
    }

    @Override
    public void accumulate(PassingSeasonStats s, PassingGameLine line) {
        s.setCompletionsAttempts(mergeFraction(s.getCompletionsAttempts(), line.completionsAttempts()));
        s.setPassingYards(add(s.getPassingYards(), line.passingYards()));
        s.setPassingTouchdowns(add(s.getPassingTouchdowns(), line.passingTouchdowns()));
        s.setInterceptions(add(s.getInterceptions(), line.interceptions()));
        s.setSacks(add(s.getSacks(), line.sacks()));
    }
}
