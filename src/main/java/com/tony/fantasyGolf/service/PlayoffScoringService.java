package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.Golfer;
import com.tony.fantasyGolf.model.Team;
import com.tony.fantasyGolf.model.Tier;
import com.tony.fantasyGolf.model.TierType;
import com.tony.fantasyGolf.model.TourCard;
import com.tony.fantasyGolf.model.Tournament;
import com.tony.fantasyGolf.model.dto.PlayoffEvent;
import com.tony.fantasyGolf.model.dto.SeasonSnapshot;
import com.tony.fantasyGolf.model.dto.TournamentSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Calcul des équipes pendant les playoffs : pas de cut, un nombre de golfeurs retenus qui dépend
 * du tournoi de la série, un départ avec des coups d'avance (1er tournoi) ou le score reporté du
 * tournoi précédent, et un classement séparé Gold / Silver.
 */
@Service
@Slf4j
public class PlayoffScoringService {

    // Les gains Silver commencent après les 75 places Gold du barème
    static final int SILVER_PAYOUT_OFFSET = 75;
    static final int SILVER = 2;

    /**
     * Position du tournoi parmi les tournois de playoffs de la saison (par date de début),
     * avec les scores finaux du tournoi de playoffs précédent.
     */
    public PlayoffEvent eventFor(Tournament tournament, SeasonSnapshot season) {
        if (season == null) return PlayoffEvent.FIRST;

        List<Tournament> playoffs = season.tournaments().stream()
                .filter(t -> season.findTier(t.getTierId()).map(tier -> tier.getName() == TierType.PLAYOFF).orElse(false))
                .sorted(Comparator.comparing(Tournament::getStartDate))
                .toList();
        List<Tournament> before = playoffs.stream()
                .filter(t -> t.getStartDate().isBefore(tournament.getStartDate()))
                .toList();
        if (before.isEmpty()) return PlayoffEvent.FIRST;

        Tournament previous = before.get(before.size() - 1);
        Map<Long, Double> carryIn = season.teams().stream()
                .filter(t -> previous.getId().equals(t.getTournamentId()) && t.getTourCardId() != null)
                .collect(Collectors.toMap(Team::getTourCardId,
                        t -> t.getScore() != null ? t.getScore() : 0.0, (a, b) -> a));
        return new PlayoffEvent(before.size() + 1, carryIn);
    }

    public List<Team> scoreTournament(TournamentSnapshot snapshot, PlayoffEvent event) {
        Tournament tournament = snapshot.tournament();
        int par = tournament.getPar() != null ? tournament.getPar() : 72;
        int currentRound = tournament.getCurrentRound() != null ? tournament.getCurrentRound() : 1;

        Map<Integer, Golfer> golfersByApiId = snapshot.golfers().stream()
                .filter(g -> g.getApiId() != null)
                .collect(Collectors.toMap(Golfer::getApiId, Function.identity(), (a, b) -> a));
        Map<Long, TourCard> cardsById = snapshot.tourCards().stream()
                .filter(c -> c.getId() != null)
                .collect(Collectors.toMap(TourCard::getId, Function.identity(), (a, b) -> a));
        List<Team> teams = snapshot.teams();

        Map<Team, List<Golfer>> golfersByTeam = new IdentityHashMap<>();
        for (Team team : teams) {
            golfersByTeam.put(team, team.getGolferIds().stream()
                    .map(golfersByApiId::get)
                    .filter(Objects::nonNull)
                    .toList());
        }

        // Rounds terminés uniquement : le round en cours n'est compté qu'une fois rendu
        Map<Team, Double[]> roundsByTeam = new IdentityHashMap<>();
        int lastCompleted = Math.min(currentRound - 1, 4);
        for (int round = 1; round <= lastCompleted; round++) {
            int required = event.countingGolfers(round);
            Map<Team, Double> contributions = new IdentityHashMap<>();
            Map<Boolean, Double> worstByBracket = new HashMap<>();
            for (Team team : teams) {
                Double contribution = contribution(golfersByTeam.get(team), round, par, required);
                if (contribution != null) {
                    contributions.put(team, contribution);
                    worstByBracket.merge(isSilver(team, cardsById), contribution, Math::max);
                }
            }
            // Équipe sans assez de golfeurs en course : pire journée de sa catégorie
            for (Team team : teams) {
                Double value = contributions.containsKey(team)
                        ? contributions.get(team)
                        : worstByBracket.getOrDefault(isSilver(team, cardsById), 0.0);
                roundsByTeam.computeIfAbsent(team, t -> new Double[4])[round - 1] = value;
            }
        }

        for (Team team : teams) {
            double total = event.index() == 1
                    ? startingStrokes(cardsById.get(team.getTourCardId()), cardsById.values(), snapshot.tier())
                    : event.carryIn().getOrDefault(team.getTourCardId(), 0.0);
            Double last = null;
            for (Double value : roundsByTeam.getOrDefault(team, new Double[4])) {
                if (value != null) {
                    total += value;
                    last = value;
                }
            }
            team.setRound(currentRound);
            team.setScore(TeamScoringService.roundOneDecimal(total));
            team.setToday(TeamScoringService.roundOneDecimal(last));
            team.setThru(last != null ? 18 : null);
            team.setMadeCut(null);
            team.setPoints(0);
            team.setEarnings(0.0);
        }

        Map<Boolean, List<Team>> brackets = teams.stream()
                .collect(Collectors.partitioningBy(t -> isSilver(t, cardsById)));
        for (List<Team> bracket : brackets.values()) {
            TeamScoringService.assignPositions(bracket, Team::getScore, Team::setPosition);
            TeamScoringService.assignPositions(bracket,
                    t -> t.getScore() - (t.getToday() != null ? t.getToday() : 0.0), Team::setPastPosition);
        }

        if (event.isFinal() && tournament.isConcluded()) {
            if (snapshot.tier() == null) {
                log.warn("⚠️ Finale {} terminée sans barème : gains non attribués", tournament.getName());
            } else {
                awardEarnings(brackets.get(false), snapshot.tier(), 0);
                awardEarnings(brackets.get(true), snapshot.tier(), SILVER_PAYOUT_OFFSET);
            }
        }

        log.info("🏆 Playoffs {} (tournoi {}/{}) : {} équipes calculées, round {}", tournament.getName(),
                event.index(), PlayoffEvent.FINAL, teams.size(), currentRound);
        return teams;
    }

    /**
     * Moyenne des {@code required} meilleurs golfeurs encore en course, ou de toute l'équipe
     * quand 10 golfeurs comptent. Null si l'équipe n'a pas assez de golfeurs en course.
     */
    static Double contribution(List<Golfer> golfers, int round, int par, int required) {
        List<Golfer> active = golfers.stream()
                .filter(g -> !PositionComparator.isEliminated(g.getPosition()))
                .toList();
        if (golfers.isEmpty() || active.size() < required) return null;
        return required >= 10
                ? TeamScoringService.roundAverage(golfers, round, par, golfers.size())
                : TeamScoringService.roundAverage(active, round, par, required);
    }

    /**
     * Coups d'avance au 1er tournoi : barème du tier ("points" = -10 à 0) indexé par le rang de la
     * tour card dans sa catégorie aux points de saison, moyenné entre ex aequo.
     */
    static double startingStrokes(TourCard card, Collection<TourCard> cards, Tier tier) {
        if (card == null || tier == null || card.getPlayoff() == null || card.getPlayoff() == 0) return 0.0;

        int points = seasonPoints(card);
        List<TourCard> division = cards.stream()
                .filter(c -> card.getPlayoff().equals(c.getPlayoff()))
                .toList();
        long better = division.stream().filter(c -> seasonPoints(c) > points).count();
        long tied = division.stream().filter(c -> seasonPoints(c) == points).count();
        if (tied == 0) return 0.0;

        double sum = 0;
        for (long slot = better + 1; slot <= better + tied; slot++) {
            sum += tier.pointsAt((int) slot);
        }
        return Precision.round(sum / tied, 1) + 0.0;
    }

    // Gains seulement : les playoffs ne rapportent pas de points
    static void awardEarnings(List<Team> bracket, Tier tier, int offset) {
        Map<String, Long> countByPosition = bracket.stream()
                .filter(t -> t.getPosition() != null)
                .collect(Collectors.groupingBy(Team::getPosition, Collectors.counting()));

        for (Team team : bracket) {
            var rank = PositionComparator.numericRank(team.getPosition());
            if (rank.isEmpty()) continue;
            int position = rank.getAsInt();
            int tiedCount = countByPosition.get(team.getPosition()).intValue();

            double earnings = 0;
            for (int slot = position; slot < position + tiedCount; slot++) {
                earnings += tier.payoutAt(slot + offset);
            }
            team.setEarnings(Precision.round(earnings / tiedCount, 2) + 0.0);
        }
    }

    static boolean isSilver(Team team, Map<Long, TourCard> cardsById) {
        TourCard card = cardsById.get(team.getTourCardId());
        return card != null && card.getPlayoff() != null && card.getPlayoff() == SILVER;
    }

    private static int seasonPoints(TourCard card) {
        return card.getPoints() != null ? card.getPoints() : 0;
    }
}
