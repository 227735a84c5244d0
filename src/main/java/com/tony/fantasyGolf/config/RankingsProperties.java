package com.tony.fantasyGolf.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Fournisseur externe des classements et du field (API DataGolf).
 */
@Configuration
@ConfigurationProperties(prefix = "rankings")
@Data
public class RankingsProperties {

    private String baseUrl = "https://feeds.datagolf.com";

    // Vide = client désactivé, les créations de groupes échouent proprement
    private String apiKey = "";

    private int retries = 2;
    private Duration retryDelay = Duration.ofSeconds(2);
}
