package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.Golfer;
import com.tony.fantasyGolf.model.RankClass;
import com.tony.fantasyGolf.model.Team;
import com.tony.fantasyGolf.model.Tier;
import com.tony.fantasyGolf.model.TierType;
import com.tony.fantasyGolf.model.Tournament;
import com.tony.fantasyGolf.model.dto.PlayoffEvent;
import com.tony.fantasyGolf.model.dto.SeasonSnapshot;
import com.tony.fantasyGolf.model.dto.TournamentSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Calcule le résultat de chaque équipe à partir de ses golfeurs : score, cut, position, points et gains.
 * Les équipes du snapshot sont modifiées sur place puis renvoyées.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TeamScoringService {

    static final int PENALTY_STROKES = 8;
    static final int MIN_GOLFERS_FOR_CUT = 5;
    static final int COUNTING_GOLFERS_WEEKEND = 5;

    private final PlayoffScoringService playoffScoringService;

    public List<Team> scoreTournament(TournamentSnapshot snapshot) {
        return scoreTournament(snapshot, null);
    }

    /**
     * @param season saison du tournoi, sert à situer un tournoi de playoffs dans la série (peut être null)
     */
    public List<Team> scoreTournament(TournamentSnapshot snapshot, SeasonSnapshot season) {
        if (snapshot.tier() != null && snapshot.tier().getName() == TierType.PLAYOFF) {
            PlayoffEvent event = playoffScoringService.eventFor(snapshot.tournament(), season);
            return playoffScoringService.scoreTournament(snapshot, event);
        }

        Tournament tournament = snapshot.tournament();
        int par = tournament.getPar() != null ? tournament.getPar() : 72;
        int currentRound = tournament.getCurrentRound() != null ? tournament.getCurrentRound() : 1;

        Map<Integer, Golfer> golfersByApiId = snapshot.golfers().stream()
                .filter(g -> g.getApiId() != null)
                .collect(Collectors.toMap(Golfer::getApiId, Function.identity(), (a, b) -> a));

        for (Team team : snapshot.teams()) {
            List<Golfer> golfers = team.getGolferIds().stream()
                    .map(golfersByApiId::get)
                    .filter(Objects::nonNull)
                    .toList();
            scoreTeam(team, golfers, currentRound, par);
        }

        List<Team> active = snapshot.teams().stream()
                .filter(t -> !"CUT".equals(t.getPosition()) && t.getScore() != null)
                .toList();
        assignPositions(active, Team::getScore, Team::setPosition);
        assignPositions(active, t -> t.getScore() - (t.getToday() != null ? t.getToday() : 0.0), Team::setPastPosition);

        if (tournament.isConcluded()) {
            if (snapshot.tier() == null) {
                log.warn("⚠️ Tournoi {} terminé sans barème : points et gains non attribués", tournament.getName());
            } else {
                awardPointsAndEarnings(snapshot.teams(), snapshot.tier());
            }
        }

        log.info("🏌️ Tournoi {} : {} équipes calculées (round {})", tournament.getName(), snapshot.teams().size(), currentRound);
        return snapshot.teams();
    }

    void scoreTeam(Team team, List<Golfer> golfers, int currentRound, int par) {
        List<Golfer> active = golfers.stream()
                .filter(g -> !PositionComparator.isEliminated(g.getPosition()))
                .toList();

        Double r1 = currentRound > 1 ? roundAverage(golfers, 1, par, golfers.size()) : null;
        Double r2 = currentRound > 2 ? roundAverage(golfers, 2, par, golfers.size()) : null;

        team.setRound(currentRound);
        team.setPoints(0);
        team.setEarnings(0.0);

        if (currentRound >= 3 && active.size() < MIN_GOLFERS_FOR_CUT) {
            team.setPosition("CUT");
            team.setPastPosition("CUT");
            team.setMadeCut(false);
            team.setToday(null);
            team.setScore(roundOneDecimal(sum(r1, r2)));
            return;
        }

        Double r3 = currentRound > 3 ? roundAverage(active, 3, par, COUNTING_GOLFERS_WEEKEND) : null;
        Double r4 = currentRound > 4 ? roundAverage(active, 4, par, COUNTING_GOLFERS_WEEKEND) : null;

        team.setPosition(null);
        team.setPastPosition(null);
        Double lastRound = r4 != null ? r4 : r3 != null ? r3 : r2 != null ? r2 : r1;
        team.setMadeCut(currentRound >= 3 ? Boolean.TRUE : null);
        team.setToday(roundOneDecimal(lastRound));
        team.setThru(lastRound != null ? 18 : null);
        team.setScore(roundOneDecimal(sum(r1, r2, r3, r4)));
    }

    /**
     * Moyenne des {@code counting} meilleurs scores du round (par rapport au par).
     * WD/DQ sans carte pour le round comptent par + 8.
     */
    static Double roundAverage(List<Golfer> golfers, int round, int par, int counting) {
        List<Integer> scores = new ArrayList<>();
        for (Golfer golfer : golfers) {
            Integer strokes = golfer.getRound(round);
            RankClass rankClass = PositionComparator.rank(golfer.getPosition()).rankClass();
            if (strokes != null) {
                scores.add(strokes - par);
            } else if (rankClass == RankClass.WITHDRAWN || rankClass == RankClass.DISQUALIFIED) {
                scores.add(PENALTY_STROKES);
            }
        }
        if (scores.isEmpty()) return null;
        return scores.stream()
                .sorted()
                .limit(counting)
                .mapToInt(Integer::intValue)
                .average()
                .orElse(0.0);
    }

    /**
     * Classement "compétition" : égalité = même position préfixée par "T", la suivante saute les ex aequo.
     */
    static void assignPositions(List<Team> teams, ToDoubleFunction<Team> score,
                                BiConsumer<Team, String> setter) {
        List<Team> sorted = teams.stream().sorted(Comparator.comparingDouble(score)).toList();
        Map<Double, Long> countByScore = sorted.stream()
                .collect(Collectors.groupingBy(t -> score.applyAsDouble(t) + 0.0, Collectors.counting()));

        int position = 1;
        for (int i = 0; i < sorted.size(); i++) {
            Team team = sorted.get(i);
            double value = score.applyAsDouble(team) + 0.0; // -0.0 et 0.0 sont la même clé
            if (i > 0 && value != score.applyAsDouble(sorted.get(i - 1))) {
                position = i + 1;
            }
            setter.accept(team, (countByScore.get(value) > 1 ? "T" : "") + position);
        }
    }

    /**
     * k équipes à égalité en position p se partagent la moyenne des places p..p+k-1.
     */
    static void awardPointsAndEarnings(List<Team> teams, Tier tier) {
        Map<String, Long> countByPosition = teams.stream()
                .filter(t -> t.getPosition() != null)
                .collect(Collectors.groupingBy(Team::getPosition, Collectors.counting()));

        for (Team team : teams) {
            var rank = PositionComparator.numericRank(team.getPosition());
            if (rank.isEmpty()) {
                team.setPoints(0);
                team.setEarnings(0.0);
                continue;
            }
            int position = rank.getAsInt();
            int tiedCount = team.getPosition().startsWith("T") ? countByPosition.get(team.getPosition()).intValue() : 1;

            double points = 0;
            double earnings = 0;
            for (int slot = position; slot < position + tiedCount; slot++) {
                points += tier.pointsAt(slot);
                earnings += tier.payoutAt(slot);
            }
            team.setPoints((int) Math.round(points / tiedCount));
            team.setEarnings(Precision.round(earnings / tiedCount, 2) + 0.0);
        }
    }

    private static Double sum(Double... rounds) {
        double total = 0;
        boolean any = false;
        for (Double round : rounds) {
            if (round != null) {
                total += round;
                any = true;
            }
        }
        return any ? total : null;
    }

    static Double roundOneDecimal(Double value) {
        // + 0.0 : pas de "-0.0" affiché
        return value == null ? null : Precision.round(value, 1) + 0.0;
    }
}
