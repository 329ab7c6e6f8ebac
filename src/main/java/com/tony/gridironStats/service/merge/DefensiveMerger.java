package com.tony.gridironStats.service.merge;

import com.tony.gridironStats.model.DefensiveSeasonStats;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.model.game.DefensiveGameLine;
import org.springframework.stereotype.Component;

import static com.tony.gridironStats.util.StatNormalizer.add;
import static com.tony.gridironStats.util.StatNormalizer.orZero;

@Component
public class DefensiveMerger implements CategoryMerger<DefensiveGameLine, DefensiveSeasonStats> {

    @Override
    public StatCategory category() { return StatCategory.DEFENSIVE; }

    @Override
    public Class<DefensiveGameLine> recordType() { return DefensiveGameLine.class; }

    @Override
    public Class<DefensiveSeasonStats> aggregateType() { return DefensiveSeasonStats.class; }

    @Override
    public DefensiveSeasonStats create(DefensiveGameLine line) {
        DefensiveSeasonStats s = new DefensiveSeasonStats();
        s.setTotalTackles(orZero(line.totalTackles()));
        s.setSoloTackles(orZero(line.soloTackles()));
        s.setSacks(orZero(line.sacks()));
        s.setTacklesForLoss(orZero(line.tacklesForLoss()));
        s.setPassesDefended(orZero(line.passesDefended()));
        s.setQbHits(orZero(line.qbHits()));
        s.setDefensiveTouchdowns(orZero(line.defensiveTouchdowns()));
        return s;
    }

    @Override
    public void accumulate(DefensiveSeasonStats s, DefensiveGameLine line) {
        s.setTotalTackles(add(s.getTotalTackles(), line.totalTackles()));
        s.setSoloTackles(add(s.getSoloTackles(), line.soloTackles()));
        s.setSacks(add(s.getSacks(), line.sacks()));
        s.setTacklesForLoss(add(s.getTacklesForLoss(), line.tacklesForLoss()));
        s.setPassesDefended(add(s.getPassesDefended(), line.passesDefended()));
        s.setQbHits(add(s.getQbHits(), line.qbHits()));
        s.setDefensiveTouchdowns(add(s.getDefensiveTouchdowns(), line.defensiveTouchdowns()));
    }
}
