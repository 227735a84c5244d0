package com.tony.fantasyGolf.model.dto;

import org.apache.commons.math3.util.Precision;

/**
 * Cumul de saison d'une tour card.
 */
public record SeasonTotals(int points, double earnings, int wins, int topTens, int cuts, int appearances) {

    public static final SeasonTotals ZERO = new SeasonTotals(0, 0.0, 0, 0, 0, 0);

    public SeasonTotals plus(int addPoints, double addEarnings, boolean win, boolean topTen, boolean cut) {
        return new SeasonTotals(
                points + addPoints,
                Precision.round(earnings + addEarnings, 2),
                wins + (win ? 1 : 0),
                topTens + (topTen ? 1 : 0),
                cuts + (cut ? 1 : 0),
                appearances + 1);
    }
}
