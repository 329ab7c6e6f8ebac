package com.tony.gridironStats.exception;

import com.tony.gridironStats.model.dto.CompilationReport;
import lombok.Getter;

/**
 * Compilation interrompue par une erreur de persistance. Le rapport partiel décrit
 * ce qui a déjà été validé en base (reset + matchs traités avant l'erreur).
 */
@Getter
public class CompilationAbortedException extends RuntimeException {

    private final transient CompilationReport partialReport;

    public CompilationAbortedException(String message, Throwable cause, CompilationReport partialReport) {
        super(message, cause);
        this.partialReport = partialReport;
    }
}
