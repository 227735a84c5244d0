package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.exception.RecordFetchException;
import com.tony.fantasyGolf.model.dto.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Relance un appel externe avec un backoff exponentiel.
 */
@Slf4j
public final class RetryExecutor {

    private RetryExecutor() {
    }

    public static <T> T call(String label, RetryPolicy policy, Supplier<T> call) {
        for (int attempt = 0; ; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (attempt >= policy.retries()) {
                    log.error("❌ {} : échec après {} tentative(s) : {}", label, attempt + 1, e.getMessage());
                    throw e;
                }
                long delayMs = policy.delayFor(attempt).toMillis();
                log.warn("🔁 {} : tentative {} échouée ({}), nouvel essai dans {} ms", label, attempt + 1, e.getMessage(), delayMs);
                pause(label, delayMs);
            }
        }
    }

    private static void pause(String label, long delayMs) {
        if (delayMs <= 0) return;
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecordFetchException(label + " : interrompu pendant l'attente avant nouvel essai", e);
        }
    }
}
