package com.tony.fantasyGolf.model.dto;

import com.tony.fantasyGolf.model.TourCard;

/**
 * @param position position au classement ("1", "T4"...), égalité sur les points uniquement
 */
public record StandingsEntry(TourCard tourCard, SeasonTotals totals, String position) {

    public StandingsEntry withPosition(String newPosition) {
        return new StandingsEntry(tourCard, totals, newPosition);
    }
}
