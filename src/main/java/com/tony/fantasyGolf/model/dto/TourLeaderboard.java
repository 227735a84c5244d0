package com.tony.fantasyGolf.model.dto;

import com.tony.fantasyGolf.model.Tour;

import java.util.List;

public record TourLeaderboard(Tour tour, List<LeaderboardTeam> teams, int teamCount) {

    public TourLeaderboard(Tour tour, List<LeaderboardTeam> teams) {
        this(tour, List.copyOf(teams), teams.size());
    }
}
