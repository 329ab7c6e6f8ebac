package com.tony.gridironStats.model.dto;

public enum CompilationStatus {
    COMPLETED,
    ABORTED
}
