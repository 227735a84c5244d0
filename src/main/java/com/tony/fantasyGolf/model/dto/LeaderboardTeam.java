package com.tony.fantasyGolf.model.dto;

import com.tony.fantasyGolf.model.Golfer;
import com.tony.fantasyGolf.model.Team;
import com.tony.fantasyGolf.model.TourCard;

import java.util.List;

public record LeaderboardTeam(Team team, TourCard tourCard, List<Golfer> golfers) {
}
