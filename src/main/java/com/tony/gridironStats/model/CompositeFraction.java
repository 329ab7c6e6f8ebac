package com.tony.gridironStats.model;

import com.tony.gridironStats.util.StatNormalizer;

/**
 * Deux compteurs liés, ex : passes complétées / tentées ("23/35").
 * Le côté droit peut être absent quand la source n'a fourni qu'un nombre.
 */
public record CompositeFraction(Integer left, Integer right) {

    public static final CompositeFraction ABSENT = new CompositeFraction(null, null);

    /**
     * "23/35" -> (23, 35), "12-18" -> (12, 18), "7" -> (7, null), null -> (null, null).
     */
    public static CompositeFraction parse(String raw) {
        if (raw == null || raw.isBlank()) return ABSENT;
        String value = raw.trim();

        int sep = value.indexOf('/');
        if (sep < 0) sep = value.indexOf('-', 1); // un "-" en tête serait un signe, pas un séparateur
        if (sep >= 0) {
            return new CompositeFraction(
                    StatNormalizer.toInt(value.substring(0, sep)),
                    StatNormalizer.toInt(value.substring(sep + 1)));
        }
        return new CompositeFraction(StatNormalizer.toInt(value), null);
    }

    public boolean isAbsent() {
        return left == null && right == null;
    }

    public boolean hasRight() {
        return right != null;
    }

    public CompositeFraction plus(CompositeFraction other) {
        int leftSum = StatNormalizer.orZero(left) + StatNormalizer.orZero(other.left);
        if (hasRight() || other.hasRight()) {
            return new CompositeFraction(leftSum, StatNormalizer.orZero(right) + StatNormalizer.orZero(other.right));
        }
        return new CompositeFraction(leftSum, null);
    }

    public String format() {
        if (isAbsent()) return null;
        int l = StatNormalizer.orZero(left);
        return hasRight() ? l + "/" + right : String.valueOf(l);
    }
}
