package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.PositionRank;
import com.tony.fantasyGolf.model.Team;
import com.tony.fantasyGolf.model.Tour;
import com.tony.fantasyGolf.model.Tournament;
import com.tony.fantasyGolf.model.dto.SeasonSnapshot;
import com.tony.fantasyGolf.model.dto.SeasonTotals;
import com.tony.fantasyGolf.model.dto.StandingsEntry;
import com.tony.fantasyGolf.model.dto.TourStandings;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cumule les résultats d'équipe de chaque tournoi terminé sur la tour card correspondante,
 * puis classe les tour cards de chaque tour.
 * Pur : deux appels sur la même saison donnent exactement le même résultat.
 */
@Service
public class StandingsService {

    public List<TourStandings> buildSeasonStandings(SeasonSnapshot season) {
        Map<Long, SeasonTotals> totalsByCard = aggregateTotals(season);

        List<TourStandings> standings = new ArrayList<>();
        for (Tour tour : season.tours()) {
            List<StandingsEntry> ranked = season.tourCards().stream()
                    .filter(card -> tour.getId() != null && tour.getId().equals(card.getTourId()))
                    .map(card -> new StandingsEntry(card, totalsByCard.getOrDefault(card.getId(), SeasonTotals.ZERO), null))
                    .sorted(RankingComparators.SEASON_STANDINGS)
                    .toList();
            standings.add(new TourStandings(tour, assignPositions(ranked)));
        }
        return standings;
    }

    /**
     * Totaux par id de tour card, pour les seuls tournois terminés de la saison.
     */
    public Map<Long, SeasonTotals> aggregateTotals(SeasonSnapshot season) {
        Set<Long> concluded = season.tournaments().stream()
                .filter(Tournament::isConcluded)
                .map(Tournament::getId)
                .collect(Collectors.toSet());

        Map<Long, SeasonTotals> totals = new HashMap<>();
        for (Team team : season.teams()) {
            if (!concluded.contains(team.getTournamentId()) || team.getTourCardId() == null) continue;

            PositionRank rank = PositionComparator.rank(team.getPosition());
            boolean win = rank.isNumeric() && rank.value() == 1;
            boolean topTen = rank.isNumeric() && rank.value() <= 10;
            boolean cut = Boolean.TRUE.equals(team.getMadeCut());
            int points = team.getPoints() != null ? team.getPoints() : 0;
            double earnings = team.getEarnings() != null ? team.getEarnings() : 0.0;

            totals.merge(team.getTourCardId(),
                    SeasonTotals.ZERO.plus(points, earnings, win, topTen, cut),
                    StandingsService::combine);
        }
        return totals;
    }

    /**
     * Position "T" dès que plusieurs cartes du tour ont le même nombre de points.
     * Position = nombre de cartes avec strictement plus de points + 1.
     */
    static List<StandingsEntry> assignPositions(List<StandingsEntry> ranked) {
        Map<Integer, Long> countByPoints = ranked.stream()
                .collect(Collectors.groupingBy(e -> e.totals().points(), Collectors.counting()));

        List<StandingsEntry> positioned = new ArrayList<>(ranked.size());
        int better = 0;
        for (int i = 0; i < ranked.size(); i++) {
            StandingsEntry entry = ranked.get(i);
            if (i > 0 && ranked.get(i - 1).totals().points() != entry.totals().points()) {
                better = i;
            }
            boolean tied = countByPoints.get(entry.totals().points()) > 1;
            positioned.add(entry.withPosition((tied ? "T" : "") + (better + 1)));
        }
        return positioned;
    }

    private static SeasonTotals combine(SeasonTotals a, SeasonTotals b) {
        return new SeasonTotals(
                a.points() + b.points(),
                Precision.round(a.earnings() + b.earnings(), 2),
                a.wins() + b.wins(),
                a.topTens() + b.topTens(),
                a.cuts() + b.cuts(),
                a.appearances() + b.appearances());
    }
}
