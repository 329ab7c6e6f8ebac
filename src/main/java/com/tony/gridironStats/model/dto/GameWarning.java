package com.tony.gridironStats.model.dto;

/**
 * Match (ou semaine, si gameId est null) ignoré pendant une compilation.
 */
public record GameWarning(String gameId, int week, String message) {
}
