package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.Team;
import com.tony.fantasyGolf.model.Tier;
import com.tony.fantasyGolf.model.TierType;
import com.tony.fantasyGolf.model.Tournament;
import com.tony.fantasyGolf.repository.TeamRepository;
import com.tony.fantasyGolf.repository.TierRepository;
import com.tony.fantasyGolf.repository.TournamentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Les équipes du 1er tournoi de playoffs sont reconduites telles quelles pour les tournois suivants de la série.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlayoffTeamService {

    // Les équipes sont figées au plus tard la veille du 1er tournoi
    static final Duration LEAD_TIME = Duration.ofDays(1);

    private final TournamentRepository tournamentRepository;
    private final TierRepository tierRepository;
    private final TeamRepository teamRepository;
    private final DataFreshnessService dataFreshnessService;
    private final Clock clock;

    /**
     * Crée, pour les tournois 2 et 3 des playoffs, les équipes manquantes à partir de celles du 1er.
     * Sans effet avant la veille du 1er tournoi ; relancer ne crée pas de doublon.
     *
     * @return nombre d'équipes créées
     */
    @Transactional
    public int carryOverTeams(Long seasonId) {
        Set<Long> playoffTierIds = tierRepository.findBySeasonId(seasonId).stream()
                .filter(t -> t.getName() == TierType.PLAYOFF)
                .map(Tier::getId)
                .collect(Collectors.toSet());
        List<Tournament> playoffs = tournamentRepository.findBySeasonIdOrderByStartDateAsc(seasonId).stream()
                .filter(t -> playoffTierIds.contains(t.getTierId()))
                .toList();
        if (playoffs.size() < 2) {
            log.info("Saison {} : {} tournoi(s) de playoffs, rien à reconduire", seasonId, playoffs.size());
            return 0;
        }

        Tournament first = playoffs.get(0);
        if (first.getStartDate().isAfter(clock.instant().plus(LEAD_TIME))) {
            log.info("⏰ {} commence le {}, équipes pas encore figées", first.getName(), first.getStartDate());
            return 0;
        }

        List<Team> source = teamRepository.findByTournamentId(first.getId());
        List<Team> created = new ArrayList<>();
        for (Tournament target : playoffs.subList(1, playoffs.size())) {
            Set<Long> existing = teamRepository.findByTournamentId(target.getId()).stream()
                    .map(Team::getTourCardId)
                    .collect(Collectors.toSet());
            for (Team team : source) {
                if (existing.contains(team.getTourCardId())) continue;
                created.add(new Team(team.getTourCardId(), target.getId(), team.getGolferIds()));
            }
        }
        if (created.isEmpty()) {
            log.info("Playoffs {} : toutes les équipes existent déjà", seasonId);
            return 0;
        }

        teamRepository.saveAll(created);
        playoffs.subList(1, playoffs.size()).forEach(t -> dataFreshnessService.evictTournament(t.getId()));
        log.info("✅ Playoffs {} : {} équipes reconduites depuis {} ({} équipes source)",
                seasonId, created.size(), first.getName(), source.size());
        return created.size();
    }
}
