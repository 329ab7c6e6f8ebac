package com.tony.gridironStats.service.merge;

import com.tony.gridironStats.model.FumbleSeasonStats;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.model.game.FumbleGameLine;
import org.springframework.stereotype.Component;

import static com.tony.gridironStats.util.StatNormalizer.add;
import static com.tony.gridironStats.util.StatNormalizer.orZero;

@Component
public class FumbleMerger implements CategoryMerger<FumbleGameLine, FumbleSeasonStats> {

    @Override
    public StatCategory category() { return StatCategory.FUMBLES; }

    @Override
    public Class<FumbleGameLine> recordType() { return FumbleGameLine.class; }

    @Override
    public Class<FumbleSeasonStats> aggregateType() { return FumbleSeasonStats.class; }

    @Override
    public FumbleSeasonStats create(FumbleGameLine line) {
        FumbleSeasonStats s = new FumbleSeasonStats();
        s.setFumbles(orZero(line.fumbles()));
        s.setFumblesLost(orZero(line.fumblesLost()));
        s.setFumblesRecovered(orZero(line.fumblesRecovered()));
        return s;
    }

    @Override
    public void accumulate(FumbleSeasonStats s, FumbleGameLine line) {
        s.setFumbles(add(s.getFumbles(), line.fumbles()));
        s.setFumblesLost(add(s.getFumblesLost(), line.fumblesLost()));
        s.setFumblesRecovered(add(s.getFumblesRecovered(), line.fumblesRecovered()));
    }
}
