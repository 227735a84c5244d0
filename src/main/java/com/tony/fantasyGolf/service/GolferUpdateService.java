package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.config.RankingsProperties;
import com.tony.fantasyGolf.model.Golfer;
import com.tony.fantasyGolf.model.RankClass;
import com.tony.fantasyGolf.model.Tournament;
import com.tony.fantasyGolf.model.dto.LiveGolfer;
import com.tony.fantasyGolf.model.dto.RetryPolicy;
import com.tony.fantasyGolf.repository.GolferRepository;
import com.tony.fantasyGolf.repository.TournamentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Recopie le flux live (positions, cartes, score du jour) sur les golfeurs d'un tournoi
 * et fait avancer le round du tournoi. Les équipes sont recalculées ensuite à partir de ces golfeurs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GolferUpdateService {

    // Journée d'un golfeur WD/DQ : par + 8 sur 18 trous
    static final int WITHDRAWAL_TODAY = 8;
    static final int CONCLUDED_ROUND = 5;

    private final GolferRepository golferRepository;
    private final TournamentRepository tournamentRepository;
    private final RankingsClient rankingsClient;
    private final RankingsProperties rankingsProperties;
    private final DataFreshnessService dataFreshnessService;

    /**
     * @return nombre de golfeurs du tournoi retrouvés dans le flux live
     */
    @Transactional
    public int updateGolfers(Tournament tournament) {
        RetryPolicy retry = new RetryPolicy(rankingsProperties.getRetries(), rankingsProperties.getRetryDelay());
        List<LiveGolfer> live = RetryExecutor.call("in-play", retry, rankingsClient::fetchLiveGolfers);
        Map<Integer, LiveGolfer> liveById = live.stream()
                .filter(l -> l.apiId() != null)
                .collect(Collectors.toMap(LiveGolfer::apiId, Function.identity(), (a, b) -> a));

        List<Golfer> golfers = golferRepository.findByTournamentId(tournament.getId());
        int matched = 0;
        boolean onCourse = false;
        for (Golfer golfer : golfers) {
            LiveGolfer entry = liveById.get(golfer.getApiId());
            if (entry == null) continue;
            apply(golfer, entry);
            onCourse |= entry.isOnCourse();
            matched++;
        }

        // Flux d'un autre tournoi (ou pas encore publié) : on ne touche à rien
        if (matched == 0) {
            log.warn("⚠️ {} : aucun golfeur dans le flux live ({} lignes)", tournament.getName(), live.size());
            return 0;
        }
        golferRepository.saveAll(golfers);

        int previous = tournament.getCurrentRound() != null ? tournament.getCurrentRound() : 1;
        int round = Math.max(previous, tournamentRound(golfers));
        tournament.setCurrentRound(round);
        tournament.setLivePlay(onCourse);
        tournamentRepository.save(tournament);
        dataFreshnessService.evictTournament(tournament.getId());

        if (round != previous) {
            log.info("⛳ {} : passage au round {}", tournament.getName(), round);
        }
        log.info("🏌️ {} : {}/{} golfeurs mis à jour depuis le live", tournament.getName(), matched, golfers.size());
        return matched;
    }

    static void apply(Golfer golfer, LiveGolfer live) {
        if (live.roundOne() != null) golfer.setRoundOne(live.roundOne());
        if (live.roundTwo() != null) golfer.setRoundTwo(live.roundTwo());
        if (live.roundThree() != null) golfer.setRoundThree(live.roundThree());
        if (live.roundFour() != null) golfer.setRoundFour(live.roundFour());
        if (live.round() != null) golfer.setCurrentRound(live.round());

        String position = live.position() == null || live.position().isBlank() ? null : live.position();
        golfer.setPosition(position);

        RankClass rankClass = PositionComparator.rank(position).rankClass();
        boolean withdrawn = rankClass == RankClass.WITHDRAWN || rankClass == RankClass.DISQUALIFIED;
        boolean scored = position != null && !"--".equals(position) && !withdrawn;
        golfer.setScore(scored ? live.score() : null);

        if (rankClass == RankClass.CUT) {
            golfer.setToday(null);
            golfer.setThru(null);
        } else if (withdrawn) {
            golfer.setToday(WITHDRAWAL_TODAY);
            golfer.setThru(18);
        } else {
            golfer.setToday(live.today());
            golfer.setThru(live.thru());
        }
    }

    /**
     * Plus petit round des golfeurs encore en course ; +1 quand tous ont rendu leur carte pour ce round.
     * Donne 5 une fois le dernier round rendu par tout le monde.
     */
    static int tournamentRound(List<Golfer> golfers) {
        List<Golfer> active = golfers.stream()
                .filter(g -> !PositionComparator.isEliminated(g.getPosition()))
                .toList();
        if (active.isEmpty()) return 1;

        int round = active.stream()
                .mapToInt(g -> g.getCurrentRound() != null ? g.getCurrentRound() : 1)
                .min()
                .orElse(1);
        boolean roundComplete = active.stream().allMatch(g -> g.getRound(round) != null);
        return Math.min(roundComplete ? round + 1 : round, CONCLUDED_ROUND);
    }
}
