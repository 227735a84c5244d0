package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.config.GroupProperties;
import com.tony.fantasyGolf.config.RankingsProperties;
import com.tony.fantasyGolf.model.Golfer;
import com.tony.fantasyGolf.model.Tournament;
import com.tony.fantasyGolf.model.dto.FieldEntry;
import com.tony.fantasyGolf.model.dto.GolferGroups;
import com.tony.fantasyGolf.model.dto.GroupCreationResult;
import com.tony.fantasyGolf.model.dto.PlayerRanking;
import com.tony.fantasyGolf.model.dto.RankedGolfer;
import com.tony.fantasyGolf.model.dto.RetryPolicy;
import com.tony.fantasyGolf.repository.GolferRepository;
import com.tony.fantasyGolf.repository.TournamentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Crée les golfeurs d'un tournoi à venir, répartis dans leurs 5 groupes de sélection.
 * Ne lève jamais : tout échec est rapporté dans le {@link GroupCreationResult}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupCreationService {

    // Rang mondial par défaut quand le fournisseur n'en donne pas
    static final int UNRANKED_WORLD_RANK = 501;

    private final TournamentRepository tournamentRepository;
    private final GolferRepository golferRepository;
    private final RankingsClient rankingsClient;
    private final GolferGroupService golferGroupService;
    private final GroupProperties groupProperties;
    private final RankingsProperties rankingsProperties;

    @Transactional
    public GroupCreationResult createGroups(Long tournamentId) {
        Optional<Tournament> found = tournamentRepository.findById(tournamentId);
        if (found.isEmpty()) {
            return GroupCreationResult.failure("Tournament not found");
        }
        Tournament tournament = found.get();

        if (golferRepository.countByTournamentId(tournamentId) > 0) {
            log.info("⏭️ {} : golfeurs déjà présents, groupes déjà créés", tournament.getName());
            return new GroupCreationResult(true, 0, 0, "Tournament already has golfers - groups already created");
        }

        List<FieldEntry> field;
        List<PlayerRanking> rankings;
        try {
            RetryPolicy retry = new RetryPolicy(rankingsProperties.getRetries(), rankingsProperties.getRetryDelay());
            field = RetryExecutor.call("field-updates", retry, rankingsClient::fetchField);
            rankings = RetryExecutor.call("get-dg-rankings", retry, rankingsClient::fetchRankings);
        } catch (RuntimeException e) {
            log.error("❌ Création des groupes de {} impossible", tournament.getName(), e);
            return GroupCreationResult.failure("Failed to create groups: " + e.getMessage());
        }

        List<RankedGolfer> ranked = rankField(field, rankings);
        GolferGroups groups = golferGroupService.buildGroups(ranked);

        List<Golfer> golfers = new ArrayList<>(groups.totalSize());
        for (int number = 1; number <= GolferGroups.GROUP_COUNT; number++) {
            for (RankedGolfer entry : groups.group(number)) {
                Golfer golfer = new Golfer(entry.apiId(), entry.playerName(), tournamentId);
                golfer.setGroup(number);
                golfer.setSkillEstimate(entry.skillEstimate());
                golfer.setWorldRank(entry.worldRank());
                golfer.setCountry(entry.country());
                golfers.add(golfer);
            }
        }
        golferRepository.saveAll(golfers);

        log.info("✅ {} : {} golfeurs répartis en groupes {}", tournament.getName(), golfers.size(), groups.sizes());
        return new GroupCreationResult(true, groups.nonEmptyCount(), golfers.size(),
                "Groups created for " + tournament.getName());
    }

    /**
     * Joint le field aux classements. Sont écartés : les ids exclus, les doublons
     * et les golfeurs sans rang DataGolf (niveau inconnu).
     */
    List<RankedGolfer> rankField(List<FieldEntry> field, List<PlayerRanking> rankings) {
        Map<Integer, PlayerRanking> rankingById = rankings.stream()
                .filter(r -> r.apiId() != null)
                .collect(Collectors.toMap(PlayerRanking::apiId, Function.identity(), (a, b) -> a));
        Set<Integer> excluded = new HashSet<>(groupProperties.getExcludedGolferIds());
        Set<Integer> seen = new HashSet<>();

        List<RankedGolfer> ranked = new ArrayList<>();
        int missing = 0;
        for (FieldEntry entry : field) {
            if (entry.apiId() == null || excluded.contains(entry.apiId()) || !seen.add(entry.apiId())) continue;

            PlayerRanking ranking = rankingById.get(entry.apiId());
            if (ranking == null || ranking.datagolfRank() == null) {
                missing++;
                continue;
            }
            ranked.add(new RankedGolfer(
                    entry.apiId(),
                    displayName(entry.playerName()),
                    ranking.datagolfRank().doubleValue(),
                    ranking.owgrRank() != null ? ranking.owgrRank() : UNRANKED_WORLD_RANK,
                    entry.country() != null ? entry.country() : ranking.country()));
        }
        if (missing > 0) {
            log.warn("⚠️ {} golfeur(s) du field sans classement, ignorés", missing);
        }
        return ranked;
    }

    // "Scheffler, Scottie" -> "Scottie Scheffler"
    static String displayName(String providerName) {
        if (providerName == null) return null;
        int comma = providerName.indexOf(',');
        if (comma < 0) return providerName.trim();
        return (providerName.substring(comma + 1).trim() + " " + providerName.substring(0, comma).trim()).trim();
    }
}
