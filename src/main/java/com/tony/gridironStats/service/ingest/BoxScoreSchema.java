package com.tony.gridironStats.service.ingest;

/**
 * Position de chaque statistique dans le tableau "stats" d'un athlète ESPN.
 * Si ESPN change l'ordre de ses colonnes, c'est ici (et seulement ici) qu'il faut corriger.
 * Les colonnes de moyennes (YDS/ATT, YDS/CAR, YDS/REC...) sont volontairement absentes.
 */
public final class BoxScoreSchema {

    private BoxScoreSchema() {
    }

    /** Colonne lisible par l'extracteur. */
    public interface Column {
        int index();
    }

    // C/ATT, YDS, AVG, TD, INT, SACKS, QBR, RTG
    public enum Passing implements Column {
        COMPLETIONS_ATTEMPTS(0), PASSING_YARDS(1), PASSING_TOUCHDOWNS(3), INTERCEPTIONS(4), SACKS(5);

        private final int index;
        Passing(int index) { this.index = index; }
        @Override public int index() { return index; }
    }

    // CAR, YDS, AVG, TD, LONG
    public enum Rushing implements Column {
        ATTEMPTS(0), YARDS(1), TOUCHDOWNS(3), LONGEST(4);

        private final int index;
        Rushing(int index) { this.index = index; }
        @Override public int index() { return index; }
    }

    // REC, YDS, AVG, TD, LONG, TGTS
    public enum Receiving implements Column {
        RECEPTIONS(0), YARDS(1), TOUCHDOWNS(3), LONGEST(4), TARGETS(5);

        private final int index;
        Receiving(int index) { this.index = index; }
        @Override public int index() { return index; }
    }

    // FUM, LOST, REC
    public enum Fumbles implements Column {
        FUMBLES(0), LOST(1), RECOVERED(2);

        private final int index;
        Fumbles(int index) { this.index = index; }
        @Override public int index() { return index; }
    }

    // TOT, SOLO, SACKS, TFL, PD, QB HTS, TD
    public enum Defensive implements Column {
        TOTAL_TACKLES(0), SOLO_TACKLES(1), SACKS(2), TACKLES_FOR_LOSS(3), PASSES_DEFENDED(4), QB_HITS(5), TOUCHDOWNS(6);

        private final int index;
        Defensive(int index) { this.index = index; }
        @Override public int index() { return index; }
    }

    // INT, YDS, TD
    public enum Interceptions implements Column {
        INTERCEPTIONS(0), YARDS(1), TOUCHDOWNS(2);

        private final int index;
        Interceptions(int index) { this.index = index; }
        @Override public int index() { return index; }
    }
}
