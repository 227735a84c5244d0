package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.Team;
import com.tony.fantasyGolf.model.Tournament;
import com.tony.fantasyGolf.model.dto.SeasonSnapshot;
import com.tony.fantasyGolf.model.dto.TournamentRecords;
import com.tony.fantasyGolf.model.dto.TournamentSnapshot;
import com.tony.fantasyGolf.repository.RecordStore;
import com.tony.fantasyGolf.repository.TeamRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TeamUpdateService {

    private final RecordStore recordStore;
    private final TeamRepository teamRepository;
    private final TeamScoringService teamScoringService;
    private final DataFreshnessService dataFreshnessService;

    /**
     * Recalcule et enregistre le résultat de toutes les équipes du tournoi, puis invalide son cache.
     *
     * @return nombre d'équipes mises à jour
     */
    @Transactional
    public int updateTeams(Tournament tournament) {
        SeasonSnapshot season = recordStore.fetchSeason(tournament.getSeasonId());
        TournamentRecords records = recordStore.fetchTournament(tournament.getId());
        if (records.teams().isEmpty()) {
            log.info("Aucune équipe pour {}", tournament.getName());
            return 0;
        }

        List<Team> scored = teamScoringService.scoreTournament(
                TournamentSnapshot.of(tournament, season, records), season);
        teamRepository.saveAll(scored);
        dataFreshnessService.evictTournament(tournament.getId());
        if (tournament.isConcluded()) {
            dataFreshnessService.evictSeason(tournament.getSeasonId());
        }
        return scored.size();
    }
}
