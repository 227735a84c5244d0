package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.config.FreshnessProperties;
import com.tony.fantasyGolf.model.Tournament;
import com.tony.fantasyGolf.model.TournamentStatus;
import com.tony.fantasyGolf.model.dto.DataResult;
import com.tony.fantasyGolf.model.dto.FreshnessBucket;
import com.tony.fantasyGolf.model.dto.FreshnessDecision;
import com.tony.fantasyGolf.model.dto.LeaderboardResult;
import com.tony.fantasyGolf.model.dto.PlayoffBracket;
import com.tony.fantasyGolf.model.dto.RetryPolicy;
import com.tony.fantasyGolf.model.dto.SeasonSnapshot;
import com.tony.fantasyGolf.model.dto.SnapshotOperation;
import com.tony.fantasyGolf.model.dto.TourStandings;
import com.tony.fantasyGolf.model.dto.TournamentRecords;
import com.tony.fantasyGolf.model.dto.TournamentSnapshot;
import com.tony.fantasyGolf.repository.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Point d'entrée des vues calculées : choisit le snapshot à utiliser (live, cache, historique),
 * puis délègue aux moteurs de classement. Ne lève jamais d'exception : un échec devient un
 * résultat étiqueté "error".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DataFreshnessService {

    static final String TOURNAMENT_KEY = "tournament:";
    static final String SEASON_KEY = "season:";

    private final RecordStore recordStore;
    private final SnapshotCache cache;
    private final FreshnessPolicy policy;
    private final FreshnessProperties properties;
    private final LeaderboardService leaderboardService;
    private final StandingsService standingsService;
    private final PlayoffService playoffService;
    private final Clock clock;

    public DataResult<LeaderboardResult> leaderboard(Long tournamentId, boolean forceRefresh) {
        Optional<Tournament> found;
        try {
            found = await("tournoi " + tournamentId, cache.fetch(TOURNAMENT_KEY + tournamentId,
                    policy.retryFor(FreshnessBucket.SEASON), () -> recordStore.findTournament(tournamentId)));
        } catch (SnapshotUnavailableException e) {
            return DataResult.error("Lecture du tournoi impossible : " + e.getMessage());
        }
        if (found.isEmpty()) {
            return DataResult.none("Tournoi " + tournamentId + " introuvable");
        }

        Tournament tournament = found.get();
        TournamentStatus status = TournamentStatus.of(tournament, clock.instant(), properties.getRecentWindow());
        FreshnessDecision decision = policy.decide(status, SnapshotOperation.LEADERBOARD, forceRefresh);
        log.debug("Leaderboard {} : statut {} -> source {}", tournamentId, status, decision.source());

        CompletableFuture<SeasonSnapshot> season = season(tournament.getSeasonId(), forceRefresh);
        CompletableFuture<TournamentRecords> records = cache.get(TOURNAMENT_KEY + tournamentId,
                TournamentRecords.class, decision.staleness(), RetryPolicy.of(decision),
                () -> recordStore.fetchTournament(tournamentId), forceRefresh);

        CompletableFuture<TournamentSnapshot> snapshot = season.thenCombine(records,
                (s, r) -> TournamentSnapshot.of(tournament, s, r));

        try {
            TournamentSnapshot loaded = await("leaderboard " + tournamentId, snapshot);
            return DataResult.of(decision.source(), leaderboardService.buildLeaderboard(loaded));
        } catch (SnapshotUnavailableException e) {
            return DataResult.error(e.getMessage());
        }
    }

    public DataResult<List<TourStandings>> standings(Long seasonId, boolean forceRefresh) {
        return fromSeason(seasonId, SnapshotOperation.STANDINGS, forceRefresh, standingsService::buildSeasonStandings);
    }

    public DataResult<List<PlayoffBracket>> playoffs(Long seasonId, boolean forceRefresh) {
        return fromSeason(seasonId, SnapshotOperation.PLAYOFFS, forceRefresh, playoffService::buildPlayoffs);
    }

    public void evictTournament(Long tournamentId) {
        cache.invalidate(TOURNAMENT_KEY + tournamentId);
    }

    public void evictSeason(Long seasonId) {
        cache.invalidate(SEASON_KEY + seasonId);
    }

    public int evictAll() {
        int size = cache.size();
        cache.invalidateAll();
        log.info("🧹 Cache vidé ({} entrées)", size);
        return size;
    }

    private <T> DataResult<T> fromSeason(Long seasonId, SnapshotOperation operation, boolean forceRefresh,
                                         Function<SeasonSnapshot, T> builder) {
        FreshnessDecision decision = policy.decide(TournamentStatus.HISTORICAL, operation, forceRefresh);
        SeasonSnapshot snapshot;
        try {
            snapshot = await("saison " + seasonId, season(seasonId, forceRefresh));
        } catch (SnapshotUnavailableException e) {
            return DataResult.error(e.getMessage());
        }
        if (snapshot.tourCards().isEmpty()) {
            return DataResult.none("Aucune tour card pour la saison " + seasonId);
        }
        return DataResult.of(decision.source(), builder.apply(snapshot));
    }

    private CompletableFuture<SeasonSnapshot> season(Long seasonId, boolean forceRefresh) {
        FreshnessDecision decision = policy.decide(TournamentStatus.HISTORICAL, SnapshotOperation.STANDINGS, forceRefresh);
        return cache.get(SEASON_KEY + seasonId, SeasonSnapshot.class, decision.staleness(), RetryPolicy.of(decision),
                () -> recordStore.fetchSeason(seasonId), forceRefresh);
    }

    /**
     * Attend au plus {@code fetchTimeout}. Le chargement partagé continue même si on abandonne ici.
     */
    private <T> T await(String label, CompletableFuture<T> future) throws SnapshotUnavailableException {
        try {
            return future.get(properties.getFetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("⏱️ {} : délai de {} dépassé", label, properties.getFetchTimeout());
            throw new SnapshotUnavailableException(label + " : délai dépassé");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                log.error("⏱️ {} : chargement abandonné, trop long", label);
                throw new SnapshotUnavailableException(label + " : délai dépassé");
            }
            log.error("❌ {} : chargement en échec", label, cause);
            throw new SnapshotUnavailableException(label + " : " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SnapshotUnavailableException(label + " : attente interrompue");
        }
    }

    private static class SnapshotUnavailableException extends Exception {
        SnapshotUnavailableException(String message) {
            super(message);
        }
    }
}
