package com.tony.fantasyGolf.model.dto;

import java.util.List;

/**
 * Leaderboard par tour. {@code emptyReason} n'est renseigné que si aucune équipe n'a été fournie.
 */
public record LeaderboardResult(Long tournamentId,
                                List<TourLeaderboard> tours,
                                EmptyReason emptyReason,
                                List<String> diagnostics) {

    public LeaderboardResult {
        tours = tours == null ? List.of() : List.copyOf(tours);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static LeaderboardResult noTeams(Long tournamentId, EmptyReason reason) {
        return new LeaderboardResult(tournamentId, List.of(), reason, List.of());
    }

    public boolean isEmpty() {
        return tours.isEmpty();
    }
}
