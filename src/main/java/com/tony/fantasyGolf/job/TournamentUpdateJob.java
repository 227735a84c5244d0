package com.tony.fantasyGolf.job;

import com.tony.fantasyGolf.model.Tournament;
import com.tony.fantasyGolf.model.dto.GroupCreationResult;
import com.tony.fantasyGolf.repository.TournamentRepository;
import com.tony.fantasyGolf.service.GolferUpdateService;
import com.tony.fantasyGolf.service.GroupCreationService;
import com.tony.fantasyGolf.service.PlayoffTeamService;
import com.tony.fantasyGolf.service.StandingsUpdateService;
import com.tony.fantasyGolf.service.TeamUpdateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class TournamentUpdateJob {

    private final TournamentRepository tournamentRepository;
    private final GolferUpdateService golferUpdateService;
    private final TeamUpdateService teamUpdateService;
    private final StandingsUpdateService standingsUpdateService;
    private final GroupCreationService groupCreationService;
    private final PlayoffTeamService playoffTeamService;
    private final Clock clock;

    /**
     * JOB 0 : Golfeurs du tournoi en cours depuis le flux live (positions, cartes, round du tournoi).
     * Fréquence : toutes les 10 minutes, deux minutes avant le calcul des équipes.
     */
    @Scheduled(cron = "${jobs.golfers.cron:0 */10 * * * *}")
    public void updateLiveGolfers() {
        for (Tournament tournament : tournamentRepository.findInProgress(clock.instant())) {
            try {
                golferUpdateService.updateGolfers(tournament);
            } catch (Exception e) {
                log.error("❌ [CRON] Echec de la mise à jour des golfeurs de {}", tournament.getName(), e);
            }
        }
    }

    /**
     * JOB 1 : Scores des équipes du tournoi en cours.
     * Fréquence : toutes les 10 minutes. Rien à faire hors semaine de tournoi.
     */
    @Scheduled(cron = "${jobs.teams.cron:0 2-59/10 * * * *}")
    public void updateCurrentTournament() {
        List<Tournament> current = tournamentRepository.findInProgress(clock.instant());
        if (current.isEmpty()) {
            log.debug("[CRON] Aucun tournoi en cours");
            return;
        }
        for (Tournament tournament : current) {
            try {
                int count = teamUpdateService.updateTeams(tournament);
                log.info("✅ [CRON] {} : {} équipes recalculées", tournament.getName(), count);
            } catch (Exception e) {
                log.error("❌ [CRON] Echec du calcul des équipes de {}", tournament.getName(), e);
            }
        }
    }

    /**
     * JOB 2 : Classement de la saison du dernier tournoi commencé.
     */
    @Scheduled(cron = "${jobs.standings.cron:0 5 * * * *}")
    public void updateStandings() {
        tournamentRepository.findFirstByStartDateBeforeOrderByStartDateDesc(clock.instant())
                .ifPresent(latest -> {
                    log.info("⏰ [CRON] Mise à jour du classement de la saison {}...", latest.getSeasonId());
                    try {
                        standingsUpdateService.updateStandings(latest.getSeasonId());
                    } catch (Exception e) {
                        log.error("❌ [CRON] Echec de la mise à jour du classement", e);
                    }
                });
    }

    /**
     * JOB 3 : Groupes du prochain tournoi.
     * Fréquence : le lundi à 12:00, une fois le field de la semaine publié.
     */
    @Scheduled(cron = "${jobs.groups.cron:0 0 12 * * MON}")
    public void createNextGroups() {
        tournamentRepository.findFirstByStartDateAfterOrderByStartDateAsc(clock.instant())
                .ifPresentOrElse(next -> {
                    log.info("⏰ [CRON] Création des groupes pour {}...", next.getName());
                    GroupCreationResult result = groupCreationService.createGroups(next.getId());
                    if (result.isSuccess()) {
                        log.info("   -> {} ({} golfeurs, {} groupes)", result.getMessage(),
                                result.getGolfersProcessed(), result.getGroupsCreated());
                    } else {
                        log.error("❌ [CRON] {}", result.getMessage());
                    }
                }, () -> log.info("[CRON] Aucun tournoi à venir, pas de groupes à créer"));
    }

    /**
     * JOB 4 : Reconduction des équipes du 1er tournoi de playoffs vers les suivants.
     * Fréquence : tous les jours à 06:00, le service ne fait rien avant la veille du 1er tournoi.
     */
    @Scheduled(cron = "${jobs.playoff-teams.cron:0 0 6 * * *}")
    public void carryOverPlayoffTeams() {
        tournamentRepository.findFirstByStartDateBeforeOrderByStartDateDesc(clock.instant().plus(Duration.ofDays(1)))
                .ifPresent(latest -> {
                    try {
                        int created = playoffTeamService.carryOverTeams(latest.getSeasonId());
                        if (created > 0) {
                            log.info("✅ [CRON] {} équipes de playoffs reconduites", created);
                        }
                    } catch (Exception e) {
                        log.error("❌ [CRON] Echec de la reconduction des équipes de playoffs", e);
                    }
                });
    }
}
