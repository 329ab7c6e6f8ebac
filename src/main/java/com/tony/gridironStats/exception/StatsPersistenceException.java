package com.tony.gridironStats.exception;

import com.tony.gridironStats.model.StatCategory;
import lombok.Getter;

/**
 * La base a refusé un lot d'écritures. Le lot est annulé et la compilation doit s'arrêter :
 * continuer risquerait de cumuler sur un état incohérent.
 */
@Getter
public class StatsPersistenceException extends RuntimeException {

    private final StatCategory category;

    public StatsPersistenceException(StatCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }
}
