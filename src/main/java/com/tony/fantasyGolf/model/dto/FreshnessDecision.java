package com.tony.fantasyGolf.model.dto;

import java.time.Duration;

/**
 * @param forceRefresh vrai quand l'appelant a demandé de contourner le cache
 */
public record FreshnessDecision(DataSource source,
                                FreshnessBucket bucket,
                                Duration staleness,
                                int retries,
                                Duration retryDelay,
                                boolean forceRefresh) {
}
