package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.dto.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Cache à expiration, une entrée par clé ("tournament:42", "season:3").
 * <ul>
 *   <li>un seul chargement en vol par clé, les appels concurrents attendent le même résultat ;</li>
 *   <li>un chargement en échec (ou trop long) n'est jamais gardé ;</li>
 *   <li>l'abandon d'un appelant n'annule pas le chargement partagé.</li>
 * </ul>
 */
@Component
@Slf4j
public class SnapshotCache {

    private final Clock clock;
    private final ExecutorService executor;
    private final Duration maxLoadDuration;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    public SnapshotCache(Clock clock,
                         @Qualifier("snapshotExecutor") ExecutorService executor,
                         @Value("${snapshot.cache.max-load-duration:PT2M}") Duration maxLoadDuration) {
        this.clock = clock;
        this.executor = executor;
        this.maxLoadDuration = maxLoadDuration;
    }

    /**
     * Renvoie la valeur en cache si elle a moins de {@code staleness}, sinon (ou si {@code forceRefresh})
     * lance un chargement, sauf s'il y en a déjà un en cours pour cette clé.
     */
    public <T> CompletableFuture<T> get(String key, Class<T> type, Duration staleness, RetryPolicy retry,
                                        Supplier<T> loader, boolean forceRefresh) {
        Entry[] created = new Entry[1];
        Entry entry = entries.compute(key, (k, current) -> {
            if (current != null && current.isLoading()) return current;
            if (current != null && !forceRefresh && current.isFresh(clock.instant(), staleness)) return current;
            created[0] = new Entry(staleness);
            return created[0];
        });

        if (entry == created[0]) {
            log.debug("Cache MISS {} (force={})", key, forceRefresh);
            load(key, entry, retry, loader);
        } else {
            log.debug("Cache HIT {}", key);
        }
        // Vue dépendante : annuler ou abandonner ce future ne touche pas le chargement partagé
        return entry.future.thenApply(type::cast);
    }

    /**
     * Lecture hors cache, sur le même pool et avec la même durée maximale qu'un chargement.
     */
    public <T> CompletableFuture<T> fetch(String label, RetryPolicy retry, Supplier<T> loader) {
        return CompletableFuture
                .supplyAsync(() -> RetryExecutor.call(label, retry, loader), executor)
                .orTimeout(maxLoadDuration.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void invalidate(String key) {
        entries.remove(key);
    }

    public void invalidateAll() {
        entries.clear();
        log.info("🧹 Cache des snapshots vidé");
    }

    public int size() {
        return entries.size();
    }

    private <T> void load(String key, Entry entry, RetryPolicy retry, Supplier<T> loader) {
        CompletableFuture<T> loading;
        try {
            loading = fetch(key, retry, loader);
        } catch (RuntimeException e) {
            loading = CompletableFuture.failedFuture(e);
        }

        loading.whenComplete((value, error) -> {
            if (error != null) {
                entries.remove(key, entry);
                entry.future.completeExceptionally(unwrap(error));
            } else {
                entry.loadedAt = clock.instant();
                entry.future.complete(value);
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static final class Entry {
        private final CompletableFuture<Object> future = new CompletableFuture<>();
        private final Duration staleness;
        private volatile Instant loadedAt;

        private Entry(Duration staleness) {
            this.staleness = staleness;
        }

        boolean isLoading() {
            return !future.isDone();
        }

        // L'entrée garde sa propre durée de vie, un appelant plus exigeant peut la raccourcir
        boolean isFresh(Instant now, Duration requested) {
            if (loadedAt == null || future.isCompletedExceptionally()) return false;
            Duration budget = requested != null && requested.compareTo(staleness) < 0 ? requested : staleness;
            return now.isBefore(loadedAt.plus(budget));
        }
    }
}
