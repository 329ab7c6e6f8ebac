package com.tony.gridironStats.exception;

/**
 * Paramètres de compilation refusés (type de saison ou semaine de fin hors bornes).
 * Levée avant tout appel réseau ou écriture en base.
 */
public class InvalidCompilationRequestException extends RuntimeException {
    public InvalidCompilationRequestException(String message) {
        super(message);
    }
}
