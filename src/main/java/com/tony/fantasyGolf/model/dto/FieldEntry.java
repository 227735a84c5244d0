package com.tony.fantasyGolf.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Un golfeur inscrit au field de la semaine ({@code field-updates}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldEntry(
        @JsonProperty("dg_id") Integer apiId,
        @JsonProperty("player_name") String playerName,
        @JsonProperty("country") String country
) {}
