package com.tony.fantasyGolf.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Pool des chargements du cache (un thread par clé en cours de chargement)
    @Bean(destroyMethod = "shutdown")
    public ExecutorService snapshotExecutor(@Value("${snapshot.executor.threads:8}") int threads) {
        return Executors.newFixedThreadPool(threads);
    }

    // Pool distinct pour les requêtes lancées depuis un chargement (évite qu'un chargement attende son propre pool)
    @Bean(destroyMethod = "shutdown")
    public ExecutorService recordExecutor(@Value("${record.executor.threads:16}") int threads) {
        return Executors.newFixedThreadPool(threads);
    }
}
