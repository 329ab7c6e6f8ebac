package com.tony.gridironStats.service.merge;

import com.tony.gridironStats.model.InterceptionSeasonStats;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.model.game.InterceptionGameLine;
import org.springframework.stereotype.Component;

import static com.tony.gridironStats.util.StatNormalizer.add;
import static com.tony.gridironStats.util.StatNormalizer.orZero;

@Component
public class InterceptionMerger implements CategoryMerger<InterceptionGameLine, InterceptionSeasonStats> {

    @Override
    public StatCategory category() { return StatCategory.INTERCEPTIONS; }

    @Override
    public Class<InterceptionGameLine> recordType() { return InterceptionGameLine.class; }

    @Override
    public Class<InterceptionSeasonStats> aggregateType() { return InterceptionSeasonStats.class; }

    @Override
    public InterceptionSeasonStats create(InterceptionGameLine line) {
        InterceptionSeasonStats s = new InterceptionSeasonStats();
        s.setInterceptions(orZero(line.interceptions()));
        s.setInterceptionYards(orZero(line.interceptionYards()));
        s.setInterceptionTouchdowns(orZero(line.interceptionTouchdowns()));
        return s;
    }

    @Override
    public void accumulate(InterceptionSeasonStats s, InterceptionGameLine line) {
        s.setInterceptions(add(s.getInterceptions(), line.interceptions()));
        s.setInterceptionYards(add(s.getInterceptionYards(), line.interceptionYards()));
        s.setInterceptionTouchdowns(add(s.getInterceptionTouchdowns(), line.interceptionTouchdowns()));
    }
}
