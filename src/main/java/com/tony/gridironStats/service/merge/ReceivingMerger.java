package com.tony.gridironStats.service.merge;

import com.tony.gridironStats.model.ReceivingSeasonStats;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.model.game.ReceivingGameLine;
import org.springframework.stereotype.Component;

import static com.tony.gridironStats.util.StatNormalizer.*;

@Component
public class ReceivingMerger implements CategoryMerger<ReceivingGameLine, ReceivingSeasonStats> {

    @Override
    public StatCategory category() { return StatCategory.RECEIVING; }

    @Override
    public Class<ReceivingGameLine> recordType() { return ReceivingGameLine.class; }

    @Override
    public Class<ReceivingSeasonStats> aggregateType() { return ReceivingSeasonStats.class; }

    @Override
    public ReceivingSeasonStats create(ReceivingGameLine line) {
        ReceivingSeasonStats s = new ReceivingSeasonStats();
        s.setReceptions(orZero(line.receptions()));
        s.setReceivingYards(orZero(line.receivingYards()));
        s.setReceivingTouchdowns(orZero(line.receivingTouchdowns()));
        s.setLongestReception(line.longestReception());
        s.setTargets(orZero(line.targets()));
        return s;
    }

    @Override
    public void accumulate(ReceivingSeasonStats s, ReceivingGameLine line) {
        s.setReceptions(add(s.getReceptions(), line.receptions()));
        s.setReceivingYards(add(s.getReceivingYards(), line.receivingYards()));
        s.setReceivingTouchdowns(add(s.getReceivingTouchdowns(), line.receivingTouchdowns()));
        s.setLongestReception(max(s.getLongestReception(), line.longestReception()));
        s.setTargets(add(s.getTargets(), line.targets()));
    }
}
