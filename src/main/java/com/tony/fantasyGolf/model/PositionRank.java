package com.tony.fantasyGolf.model;

import java.util.Locale;
import java.util.OptionalInt;

/**
 * Position canonique dérivée d'une chaîne brute ("1", "T5", "CUT", "WD", "DQ").
 * Deux rangs numériques de même valeur sont égaux, qu'ils soient à égalité ("T") ou non.
 */
public record PositionRank(RankClass rankClass, int value, boolean tied) implements Comparable<PositionRank> {

    public static final PositionRank UNKNOWN = new PositionRank(RankClass.UNKNOWN, 0, false);

    public static PositionRank parse(String raw) {
        if (raw == null) return UNKNOWN;
        String position = raw.trim().toUpperCase(Locale.ROOT);
        if (position.isEmpty()) return UNKNOWN;

        switch (position) {
            case "CUT": return new PositionRank(RankClass.CUT, 0, false);
            case "WD": return new PositionRank(RankClass.WITHDRAWN, 0, false);
            case "DQ": return new PositionRank(RankClass.DISQUALIFIED, 0, false);
            default: break;
        }

        boolean tied = position.startsWith("T");
        String digits = tied ? position.substring(1) : position;
        try {
            int value = Integer.parseInt(digits);
            // "0", "-3" ou "T+1" ne sont pas des rangs
            if (value < 1 || !Character.isDigit(digits.charAt(0))) return UNKNOWN;
            return new PositionRank(RankClass.NUMERIC, value, tied);
        } catch (NumberFormatException e) {
            return UNKNOWN;
        }
    }

    public boolean isNumeric() {
        return rankClass == RankClass.NUMERIC;
    }

    /**
     * CUT, WD ou DQ.
     */
    public boolean isEliminated() {
        return rankClass == RankClass.CUT || rankClass == RankClass.WITHDRAWN || rankClass == RankClass.DISQUALIFIED;
    }

    public OptionalInt numericValue() {
        return isNumeric() ? OptionalInt.of(value) : OptionalInt.empty();
    }

    @Override
    public int compareTo(PositionRank other) {
        int byClass = rankClass.compareTo(other.rankClass);
        if (byClass != 0) return byClass;
        return isNumeric() ? Integer.compare(value, other.value) : 0;
    }
}
