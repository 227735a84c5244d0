package com.tony.fantasyGolf.model;

import java.time.Duration;
import java.time.Instant;

public enum TournamentStatus {
    UPCOMING,
    CURRENT,
    RECENT,
    HISTORICAL;

    /**
     * @param recentWindow durée après la fin pendant laquelle un tournoi reste "récent"
     */
    public static TournamentStatus of(Tournament tournament, Instant now, Duration recentWindow) {
        if (now.isBefore(tournament.getStartDate())) return UPCOMING;
        if (!now.isAfter(tournament.getEndDate())) return CURRENT;
        if (now.isBefore(tournament.getEndDate().plus(recentWindow))) return RECENT;
        return HISTORICAL;
    }
}
