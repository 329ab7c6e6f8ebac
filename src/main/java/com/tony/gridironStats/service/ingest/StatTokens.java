package com.tony.gridironStats.service.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.gridironStats.util.StatNormalizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Lecture tolérante du tableau positionnel "stats" d'un athlète.
 * Index absent ou valeur illisible -> null, jamais d'exception.
 */
@Slf4j
class StatTokens {

    private final JsonNode stats;
    private final String playerId;

    StatTokens(JsonNode stats, String playerId) {
        this.stats = (stats != null && stats.isArray()) ? stats : null;
        this.playerId = playerId;
    }

    Integer intAt(BoxScoreSchema.Column column) {
        Object raw = rawAt(column);
        Integer value = StatNormalizer.toInt(raw);
        if (value == null && raw != null) {
            log.debug("Stat illisible ignorée (joueur {}, colonne {}) : '{}'", playerId, column, raw);
        }
        return value;
    }

    /**
     * Valeur composite "C/ATT" : gardée telle quelle si elle contient un séparateur,
     * sinon sa forme texte (ex : "7"). Absente -> null.
     */
    String compositeAt(BoxScoreSchema.Column column) {
        Object raw = rawAt(column);
        if (raw == null) return null;
        String text = String.valueOf(raw).trim();
        return text.isEmpty() ? null : text;
    }

    private Object rawAt(BoxScoreSchema.Column column) {
        if (stats == null || column.index() >= stats.size()) return null;
        JsonNode node = stats.get(column.index());
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isIntegralNumber()) return node.asLong();
        if (node.isNumber()) return node.asDouble();
        return node.asText();
    }
}
