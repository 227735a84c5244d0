package com.tony.fantasyGolf.model.dto;

import com.tony.fantasyGolf.model.Golfer;
import com.tony.fantasyGolf.model.Team;
import com.tony.fantasyGolf.model.Tier;
import com.tony.fantasyGolf.model.Tour;
import com.tony.fantasyGolf.model.TourCard;
import com.tony.fantasyGolf.model.Tournament;

import java.util.List;

/**
 * Tout ce qu'il faut pour construire le leaderboard d'un tournoi.
 * {@code tier} peut être null (tournoi sans barème).
 */
public record TournamentSnapshot(Tournament tournament,
                                 Tier tier,
                                 List<Team> teams,
                                 List<Golfer> golfers,
                                 List<Tour> tours,
                                 List<TourCard> tourCards) {

    public TournamentSnapshot {
        teams = teams == null ? List.of() : List.copyOf(teams);
        golfers = golfers == null ? List.of() : List.copyOf(golfers);
        tours = tours == null ? List.of() : List.copyOf(tours);
        tourCards = tourCards == null ? List.of() : List.copyOf(tourCards);
    }

    public static TournamentSnapshot of(Tournament tournament, SeasonSnapshot season, TournamentRecords records) {
        Tier tier = season.findTier(tournament.getTierId()).orElse(null);
        return new TournamentSnapshot(tournament, tier, records.teams(), records.golfers(),
                season.tours(), season.tourCards());
    }
}
