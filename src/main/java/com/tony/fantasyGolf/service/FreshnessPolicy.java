package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.config.FreshnessProperties;
import com.tony.fantasyGolf.model.TournamentStatus;
import com.tony.fantasyGolf.model.dto.DataSource;
import com.tony.fantasyGolf.model.dto.FreshnessBucket;
import com.tony.fantasyGolf.model.dto.FreshnessDecision;
import com.tony.fantasyGolf.model.dto.RetryPolicy;
import com.tony.fantasyGolf.model.dto.SnapshotOperation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Table statique (statut du tournoi, opération) -> (source, durée de validité, retries).
 */
@Component
@RequiredArgsConstructor
public class FreshnessPolicy {

    private final FreshnessProperties properties;

    public FreshnessDecision decide(TournamentStatus status, SnapshotOperation operation, boolean forceRefresh) {
        if (operation != SnapshotOperation.LEADERBOARD) {
            return decision(forceRefresh ? DataSource.LIVE : DataSource.SEASON_CACHE, FreshnessBucket.SEASON, forceRefresh);
        }
        if (forceRefresh) {
            return decision(DataSource.LIVE, FreshnessBucket.LIVE, true);
        }
        return switch (status) {
            case CURRENT -> decision(DataSource.LIVE, FreshnessBucket.LIVE, false);
            case RECENT -> decision(DataSource.SEASON_CACHE, FreshnessBucket.RECENT, false);
            case HISTORICAL -> decision(DataSource.HISTORICAL_API, FreshnessBucket.HISTORICAL, false);
            // Avant le départ rien ne bouge : même rythme que l'historique
            case UPCOMING -> decision(DataSource.SEASON_CACHE, FreshnessBucket.HISTORICAL, false);
        };
    }

    public FreshnessProperties.Bucket settings(FreshnessBucket bucket) {
        return switch (bucket) {
            case LIVE -> properties.getLive();
            case RECENT -> properties.getRecent();
            case HISTORICAL -> properties.getHistorical();
            case SEASON -> properties.getSeason();
        };
    }

    public RetryPolicy retryFor(FreshnessBucket bucket) {
        FreshnessProperties.Bucket settings = settings(bucket);
        return new RetryPolicy(settings.getRetries(), settings.getRetryDelay());
    }

    private FreshnessDecision decision(DataSource source, FreshnessBucket bucket, boolean forceRefresh) {
        FreshnessProperties.Bucket settings = settings(bucket);
        return new FreshnessDecision(source, bucket, settings.getStaleness(), settings.getRetries(),
                settings.getRetryDelay(), forceRefresh);
    }
}
