package com.tony.fantasyGolf.model.dto;

import com.tony.fantasyGolf.model.Golfer;
import com.tony.fantasyGolf.model.Team;

import java.util.List;

public record TournamentRecords(Long tournamentId, List<Team> teams, List<Golfer> golfers) {

    public TournamentRecords {
        teams = teams == null ? List.of() : List.copyOf(teams);
        golfers = golfers == null ? List.of() : List.copyOf(golfers);
    }
}
