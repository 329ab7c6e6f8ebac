package com.tony.gridironStats.model.game;

import com.tony.gridironStats.model.StatCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Résultat de l'extraction d'un match : une liste par catégorie, toujours présente (éventuellement vide).
 */
public class GameStatLines {

    private final Map<StatCategory, List<PlayerGameRecord>> lines = new EnumMap<>(StatCategory.class);

    public GameStatLines() {
        for (StatCategory category : StatCategory.values()) {
            lines.put(category, new ArrayList<>());
        }
    }

    public void add(PlayerGameRecord record) {
        lines.get(record.category()).add(record);
    }

    public List<PlayerGameRecord> get(StatCategory category) {
        return Collections.unmodifiableList(lines.get(category));
    }

    public int size() {
        return lines.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
