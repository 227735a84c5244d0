package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.Golfer;
import com.tony.fantasyGolf.model.Team;
import com.tony.fantasyGolf.model.Tier;
import com.tony.fantasyGolf.model.TierType;
import com.tony.fantasyGolf.model.Tour;
import com.tony.fantasyGolf.model.TourCard;
import com.tony.fantasyGolf.model.Tournament;

import java.time.Instant;
import java.util.List;

/**
 * Petites fabriques d'entités avec id, pour les tests unitaires (pas de base).
 */
final class Fixtures {

    static final Long SEASON = 2025L;

    private Fixtures() {
    }

    static Tour tour(long id, String name, Integer... playoffSpots) {
        Tour tour = new Tour(name, SEASON, List.of(playoffSpots));
        tour.setId(id);
        return tour;
    }

    static TourCard card(long id, long tourId, String name) {
        TourCard card = new TourCard("member-" + id, tourId, SEASON, name);
        card.setId(id);
        return card;
    }

    static Tournament tournament(long id, Instant start, Instant end, int currentRound) {
        Tournament tournament = new Tournament("Tournoi " + id, SEASON, 1L, start, end);
        tournament.setId(id);
        tournament.setCurrentRound(currentRound);
        return tournament;
    }

    static Team team(long id, long tourCardId, long tournamentId, Integer... golferIds) {
        Team team = new Team(tourCardId, tournamentId, List.of(golferIds));
        team.setId(id);
        return team;
    }

    static Team result(long id, long tourCardId, long tournamentId, String position, int points, double earnings,
                       Boolean madeCut) {
        Team team = team(id, tourCardId, tournamentId);
        team.setPosition(position);
        team.setPoints(points);
        team.setEarnings(earnings);
        team.setMadeCut(madeCut);
        return team;
    }

    static Golfer golfer(long id, int apiId, String name, String position, Integer... rounds) {
        Golfer golfer = new Golfer(apiId, name, 1L);
        golfer.setId(id);
        golfer.setPosition(position);
        golfer.setRoundOne(rounds.length > 0 ? rounds[0] : null);
        golfer.setRoundTwo(rounds.length > 1 ? rounds[1] : null);
        golfer.setRoundThree(rounds.length > 2 ? rounds[2] : null);
        golfer.setRoundFour(rounds.length > 3 ? rounds[3] : null);
        return golfer;
    }

    static Tier tier(List<Integer> points, List<Double> payouts) {
        Tier tier = new Tier(TierType.STANDARD, SEASON, payouts, points);
        tier.setId(1L);
        return tier;
    }
}
