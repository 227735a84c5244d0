package com.tony.fantasyGolf.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "freshness")
@Data
public class FreshnessProperties {

    // --- Tournoi en cours : données les plus fraîches, peu de retries (coût) ---
    private Bucket live = new Bucket(Duration.ofMinutes(2), 1, Duration.ofSeconds(5));

    // --- Terminé depuis moins de recentWindow : les scores peuvent encore bouger ---
    private Bucket recent = new Bucket(Duration.ofMinutes(15), 2, Duration.ofSeconds(3));

    // --- Scores figés ---
    private Bucket historical = new Bucket(Duration.ofHours(24), 1, Duration.ofSeconds(1));

    // --- Classement / playoffs de la saison ---
    private Bucket season = new Bucket(Duration.ofMinutes(5), 2, Duration.ofSeconds(2));

    private Duration recentWindow = Duration.ofHours(24);

    // Délai max d'attente d'un appelant avant de répondre "error"
    private Duration fetchTimeout = Duration.ofSeconds(20);

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Bucket {
        private Duration staleness;
        private int retries;
        private Duration retryDelay;
    }
}
