package com.tony.gridironStats.model;

import com.tony.gridironStats.exception.InvalidCompilationRequestException;

import java.util.Arrays;

/**
 * Type de saison tel qu'ESPN l'encode dans ses URLs (seasontype/1, /2, /3).
 */
public enum SeasonType {
    PRESEASON(1, 4, "Preseason"),
    REGULAR(2, 18, "Regular Season"),
    PLAYOFFS(3, 4, "Playoffs");

    private final int code;
    private final int maxWeek;
    private final String label;

    SeasonType(int code, int maxWeek, String label) {
        this.code = code;
        this.maxWeek = maxWeek;
        this.label = label;
    }

    public int getCode() { return code; }
    public int getMaxWeek() { return maxWeek; }
    public String getLabel() { return label; }

    public static SeasonType fromCode(int code) {
        return Arrays.stream(values())
                .filter(t -> t.code == code)
                .findFirst()
                .orElseThrow(() -> new InvalidCompilationRequestException(
                        "seasonType doit valoir 1 (preseason), 2 (regular season) ou 3 (playoffs), reçu : " + code));
    }

    /**
     * Vérifie qu'une semaine de fin est jouable pour ce type de saison.
     */
    public void checkEndWeek(int endWeek) {
        if (endWeek < 1) {
            throw new InvalidCompilationRequestException("endWeek doit être >= 1, reçu : " + endWeek);
        }
        if (endWeek > maxWeek) {
            throw new InvalidCompilationRequestException(
                    String.format("%s (seasonType=%d) ne compte que les semaines 1-%d, reçu : %d", label, code, maxWeek, endWeek));
        }
    }
}
