package com.tony.gridironStats.exception;

/**
 * Échec de récupération côté ESPN (calendrier ou résumé de match).
 * Récupérable : le match est ignoré et la compilation continue.
 */
public class SourceFetchException extends RuntimeException {
    public SourceFetchException(String message) {
        super(message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
