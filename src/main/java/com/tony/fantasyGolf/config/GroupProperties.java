package com.tony.fantasyGolf.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "groups")
@Data
public class GroupProperties {

    // Golfeurs jamais proposés à la sélection (ids fournisseur)
    private List<Integer> excludedGolferIds = new ArrayList<>();
}
