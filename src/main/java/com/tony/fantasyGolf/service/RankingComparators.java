package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.Golfer;
import com.tony.fantasyGolf.model.Team;
import com.tony.fantasyGolf.model.dto.StandingsEntry;

import java.util.Comparator;

/**
 * Les deux configurations de départage utilisées par l'application.
 * Leaderboard : position puis score puis nom. Classement de saison : points puis gains.
 */
public final class RankingComparators {

    private RankingComparators() {
    }

    public static final Comparator<Golfer> GOLFER_LEADERBOARD = Comparator
            .comparing(Golfer::getPosition, PositionComparator.INSTANCE)
            .thenComparing(Golfer::getScore, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
            .thenComparing(Golfer::getPlayerName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER));

    // Tri stable : deux équipes à égalité parfaite gardent leur ordre d'entrée
    public static final Comparator<Team> TEAM_LEADERBOARD = Comparator
            .comparing(Team::getPosition, PositionComparator.INSTANCE)
            .thenComparing(Team::getScore, Comparator.nullsLast(Comparator.<Double>naturalOrder()));

    public static final Comparator<StandingsEntry> SEASON_STANDINGS = Comparator
            .comparingInt((StandingsEntry e) -> e.totals().points()).reversed()
            .thenComparing(Comparator.comparingDouble((StandingsEntry e) -> e.totals().earnings()).reversed())
            .thenComparing((StandingsEntry e) -> e.tourCard().getId(), Comparator.nullsLast(Comparator.<Long>naturalOrder()));
}
