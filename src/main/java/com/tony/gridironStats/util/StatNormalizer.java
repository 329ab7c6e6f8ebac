package com.tony.gridironStats.util;

import com.tony.gridironStats.model.CompositeFraction;

import java.math.BigDecimal;

/**
 * Conversion des valeurs brutes du box-score. Fonctions pures, aucune exception ne sort d'ici :
 * une valeur illisible devient null, et null devient 0 au moment de cumuler.
 */
public final class StatNormalizer {

    private StatNormalizer() {
    }

    /**
     * Convertit un jeton en entier.
     * <ul>
     *     <li>entiers natifs : tels quels, null hors de la plage int</li>
     *     <li>décimaux : tronqués vers zéro (12.9 -> 12)</li>
     *     <li>texte : "1,234" -> 1234, "12.0" -> 12 ; tout texte contenant "-" ou "/" est une valeur composite -> null</li>
     * </ul>
     */
    public static Integer toInt(Object token) {
        if (token == null) return null;
        if (token instanceof Integer i) return i;
        if (token instanceof Long || token instanceof Short || token instanceof Byte) {
            return narrow(((Number) token).longValue());
        }
        if (token instanceof Double || token instanceof Float || token instanceof BigDecimal) {
            return truncate(((Number) token).doubleValue());
        }
        if (token instanceof String s) {
            String v = s.trim();
            if (v.contains("-") || v.contains("/")) return null;
            v = v.replace(",", "");
            try {
                return truncate(Double.parseDouble(v));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    /**
     * Cumul d'un compteur (yards, TD, plaquages...).
     */
    public static int add(Integer stored, Integer incoming) {
        return orZero(stored) + orZero(incoming);
    }

    /**
     * Maximum courant pour les champs "longest". Une valeur absente ne participe pas.
     */
    public static Integer max(Integer stored, Integer incoming) {
        if (stored == null) return incoming;
        if (incoming == null) return stored;
        return Math.max(stored, incoming);
    }

    /**
     * Fusionne deux valeurs "complétées/tentées" en sommant chaque côté.
     * ("10/15","5/8") -> "15/23", ("10/15","7") -> "17/15", (null,"7/9") -> "7/9", ("7","3") -> "10".
     */
    public static String mergeFraction(String existing, String incoming) {
        CompositeFraction e = CompositeFraction.parse(existing);
        CompositeFraction i = CompositeFraction.parse(incoming);
        if (e.isAbsent() && i.isAbsent()) return null;
        return e.plus(i).format();
    }

    // Hors plage int -> null, comme pour le texte : jamais de valeur repliée en négatif
    private static Integer narrow(long value) {
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) return null;
        return (int) value;
    }

    private static Integer truncate(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return null;
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) return null;
        return (int) value; // le cast tronque vers zéro
    }
}
