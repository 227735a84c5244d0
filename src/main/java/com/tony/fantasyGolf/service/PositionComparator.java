package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.PositionRank;

import java.util.Comparator;
import java.util.OptionalInt;

/**
 * Ordre total sur les chaînes de position :
 * numériques croissants, puis position inconnue, puis CUT &lt; WD &lt; DQ.
 * Les égalités ("T5" contre "T5") retombent sur les critères secondaires de l'appelant.
 */
public final class PositionComparator implements Comparator<String> {

    public static final PositionComparator INSTANCE = new PositionComparator();

    private PositionComparator() {
    }

    public static PositionRank rank(String position) {
        return PositionRank.parse(position);
    }

    /**
     * Valeur numérique du rang ("T3" -> 3), vide pour CUT/WD/DQ ou une position illisible.
     */
    public static OptionalInt numericRank(String position) {
        return PositionRank.parse(position).numericValue();
    }

    public static boolean isEliminated(String position) {
        return PositionRank.parse(position).isEliminated();
    }

    @Override
    public int compare(String a, String b) {
        return rank(a).compareTo(rank(b));
    }
}
