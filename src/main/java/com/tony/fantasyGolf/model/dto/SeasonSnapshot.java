package com.tony.fantasyGolf.model.dto;

import com.tony.fantasyGolf.model.Team;
import com.tony.fantasyGolf.model.Tier;
import com.tony.fantasyGolf.model.Tour;
import com.tony.fantasyGolf.model.TourCard;
import com.tony.fantasyGolf.model.Tournament;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Vue cohérente d'une saison à un instant donné. Jamais modifiée : on la remplace en entier.
 */
public record SeasonSnapshot(Long seasonId,
                             List<Tournament> tournaments,
                             List<Tour> tours,
                             List<TourCard> tourCards,
                             List<Tier> tiers,
                             List<Team> teams,
                             Instant capturedAt) {

    public SeasonSnapshot {
        tournaments = tournaments == null ? List.of() : List.copyOf(tournaments);
        tours = tours == null ? List.of() : List.copyOf(tours);
        tourCards = tourCards == null ? List.of() : List.copyOf(tourCards);
        tiers = tiers == null ? List.of() : List.copyOf(tiers);
        teams = teams == null ? List.of() : List.copyOf(teams);
    }

    public Optional<Tier> findTier(Long tierId) {
        if (tierId == null) return Optional.empty();
        return tiers.stream().filter(t -> tierId.equals(t.getId())).findFirst();
    }
}
