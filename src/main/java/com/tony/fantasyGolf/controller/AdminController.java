package com.tony.fantasyGolf.controller;

import com.tony.fantasyGolf.model.dto.GroupCreationResult;
import com.tony.fantasyGolf.repository.TournamentRepository;
import com.tony.fantasyGolf.service.DataFreshnessService;
import com.tony.fantasyGolf.service.GolferUpdateService;
import com.tony.fantasyGolf.service.GroupCreationService;
import com.tony.fantasyGolf.service.PlayoffTeamService;
import com.tony.fantasyGolf.service.StandingsUpdateService;
import com.tony.fantasyGolf.service.TeamUpdateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final GroupCreationService groupCreationService;
    private final StandingsUpdateService standingsUpdateService;
    private final TeamUpdateService teamUpdateService;
    private final GolferUpdateService golferUpdateService;
    private final PlayoffTeamService playoffTeamService;
    private final DataFreshnessService dataFreshnessService;
    private final TournamentRepository tournamentRepository;

    @PostMapping("/tournaments/{tournamentId}/groups")
    public ResponseEntity<GroupCreationResult> createGroups(@PathVariable Long tournamentId) {
        log.info("🚀 Création manuelle des groupes du tournoi {}", tournamentId);
        return ResponseEntity.ok(groupCreationService.createGroups(tournamentId));
    }

    // Rattrapage manuel du job des 10 minutes
    @PostMapping("/tournaments/{tournamentId}/teams")
    public ResponseEntity<?> updateTeams(@PathVariable Long tournamentId) {
        return tournamentRepository.findById(tournamentId)
                .<ResponseEntity<?>>map(tournament -> {
                    try {
                        int count = teamUpdateService.updateTeams(tournament);
                        return ResponseEntity.ok(Map.of("teamsUpdated", count));
                    } catch (Exception e) {
                        log.error("❌ Erreur lors du recalcul des équipes du tournoi {}", tournamentId, e);
                        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                                .body(Map.of("error", "Erreur technique : " + e.getMessage()));
                    }
                })
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/tournaments/{tournamentId}/golfers")
    public ResponseEntity<?> updateGolfers(@PathVariable Long tournamentId) {
        return tournamentRepository.findById(tournamentId)
                .<ResponseEntity<?>>map(tournament -> {
                    try {
                        int count = golferUpdateService.updateGolfers(tournament);
                        return ResponseEntity.ok(Map.of("golfersUpdated", count,
                                "currentRound", tournament.getCurrentRound() != null ? tournament.getCurrentRound() : 1));
                    } catch (Exception e) {
                        log.error("❌ Erreur lors de la mise à jour des golfeurs du tournoi {}", tournamentId, e);
                        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                                .body(Map.of("error", "Erreur technique : " + e.getMessage()));
                    }
                })
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/seasons/{seasonId}/playoff-teams")
    public ResponseEntity<?> carryOverPlayoffTeams(@PathVariable Long seasonId) {
        log.info("🏆 Reconduction manuelle des équipes de playoffs de la saison {}", seasonId);
        try {
            return ResponseEntity.ok(Map.of("teamsCreated", playoffTeamService.carryOverTeams(seasonId)));
        } catch (Exception e) {
            log.error("❌ Erreur lors de la reconduction des équipes de playoffs {}", seasonId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Erreur technique : " + e.getMessage()));
        }
    }

    @PostMapping("/seasons/{seasonId}/standings")
    public ResponseEntity<?> updateStandings(@PathVariable Long seasonId) {
        log.info("🔄 Recalcul manuel du classement de la saison {}", seasonId);
        try {
            int count = standingsUpdateService.updateStandings(seasonId);
            return ResponseEntity.ok(Map.of("tourCardsUpdated", count));
        } catch (Exception e) {
            log.error("❌ Erreur lors du recalcul du classement de la saison {}", seasonId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Erreur technique : " + e.getMessage()));
        }
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Integer>> clearCache() {
        return ResponseEntity.ok(Map.of("entriesCleared", dataFreshnessService.evictAll()));
    }
}
