package com.tony.gridironStats.model.dto;

import com.tony.gridironStats.model.SeasonType;
import com.tony.gridironStats.model.StatCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompilationReport {
    private int season;
    private SeasonType seasonType;
    private int endWeek;
    private CompilationStatus status;

    private int gamesProcessed;
    private int gamesFailed;

    // Lignes créées + mises à jour, par catégorie
    private Map<StatCategory, Integer> touchedRows;
    private List<GameWarning> warnings;

    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private long durationMs;

    public int getTotalTouchedRows() {
        return touchedRows == null ? 0 : touchedRows.values().stream().mapToInt(Integer::intValue).sum();
    }
}
