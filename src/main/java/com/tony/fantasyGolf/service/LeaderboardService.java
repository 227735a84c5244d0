package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.Golfer;
import com.tony.fantasyGolf.model.Team;
import com.tony.fantasyGolf.model.Tour;
import com.tony.fantasyGolf.model.TourCard;
import com.tony.fantasyGolf.model.Tournament;
import com.tony.fantasyGolf.model.dto.EmptyReason;
import com.tony.fantasyGolf.model.dto.LeaderboardResult;
import com.tony.fantasyGolf.model.dto.LeaderboardTeam;
import com.tony.fantasyGolf.model.dto.TourLeaderboard;
import com.tony.fantasyGolf.model.dto.TournamentSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class LeaderboardService {

    private final Clock clock;

    /**
     * Construit le leaderboard d'un tournoi, groupé par tour.
     * Une équipe dont la tour card (ou le tour) est introuvable est écartée et signalée dans les diagnostics,
     * un golfeur absent du tournoi est simplement omis de son équipe.
     */
    public LeaderboardResult buildLeaderboard(TournamentSnapshot snapshot) {
        Tournament tournament = snapshot.tournament();
        Long tournamentId = tournament != null ? tournament.getId() : null;

        if (snapshot.teams().isEmpty()) {
            return LeaderboardResult.noTeams(tournamentId, emptyReason(tournament, clock.instant()));
        }

        Map<Long, TourCard> cardsById = indexById(snapshot.tourCards(), TourCard::getId);
        Map<Long, Tour> toursById = indexById(snapshot.tours(), Tour::getId);
        Map<Integer, Golfer> golfersByApiId = indexById(snapshot.golfers(), Golfer::getApiId);

        List<String> diagnostics = new ArrayList<>();
        Map<Long, List<LeaderboardTeam>> teamsByTour = new HashMap<>();

        for (Team team : snapshot.teams()) {
            TourCard tourCard = team.getTourCardId() != null ? cardsById.get(team.getTourCardId()) : null;
            if (tourCard == null) {
                diagnostics.add("Team " + team.getId() + " : tour card " + team.getTourCardId() + " introuvable");
                continue;
            }
            if (!toursById.containsKey(tourCard.getTourId())) {
                diagnostics.add("Team " + team.getId() + " : tour " + tourCard.getTourId() + " introuvable");
                continue;
            }

            List<Golfer> golfers = team.getGolferIds().stream()
                    .map(golfersByApiId::get)
                    .filter(Objects::nonNull)
                    .sorted(RankingComparators.GOLFER_LEADERBOARD)
                    .toList();

            teamsByTour.computeIfAbsent(tourCard.getTourId(), k -> new ArrayList<>())
                    .add(new LeaderboardTeam(team, tourCard, golfers));
        }

        if (!diagnostics.isEmpty()) {
            log.warn("⚠️ Leaderboard tournoi {} : {} équipe(s) écartée(s) (données incohérentes)",
                    tournamentId, diagnostics.size());
            diagnostics.forEach(d -> log.debug("   -> {}", d));
        }

        Comparator<LeaderboardTeam> teamOrder = Comparator.comparing(LeaderboardTeam::team, RankingComparators.TEAM_LEADERBOARD);

        // Ordre des tours = ordre de la saison, les tours sans équipe disparaissent
        List<TourLeaderboard> tours = snapshot.tours().stream()
                .filter(tour -> teamsByTour.containsKey(tour.getId()))
                .map(tour -> new TourLeaderboard(tour, teamsByTour.get(tour.getId()).stream().sorted(teamOrder).toList()))
                .toList();

        return new LeaderboardResult(tournamentId, tours, null, diagnostics);
    }

    static EmptyReason emptyReason(Tournament tournament, Instant now) {
        if (tournament == null || now.isBefore(tournament.getStartDate())) return EmptyReason.NOT_STARTED;
        if (tournament.isConcluded() || now.isAfter(tournament.getEndDate())) return EmptyReason.COMPLETED_NO_DATA;
        return EmptyReason.IN_PROGRESS;
    }

    // Premier élément gardé en cas de doublon d'identifiant
    private static <K, V> Map<K, V> indexById(List<V> values, Function<V, K> key) {
        return values.stream()
                .filter(v -> key.apply(v) != null)
                .collect(Collectors.toMap(key, Function.identity(), (first, second) -> first, LinkedHashMap::new));
    }
}
