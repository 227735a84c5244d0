package com.tony.fantasyGolf.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Une ligne de {@code preds/get-dg-rankings}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlayerRanking(
        @JsonProperty("dg_id") Integer apiId,
        @JsonProperty("player_name") String playerName,
        @JsonProperty("datagolf_rank") Integer datagolfRank,
        @JsonProperty("owgr_rank") Integer owgrRank,
        @JsonProperty("dg_skill_estimate") Double skillEstimate,
        @JsonProperty("country") String country
) {}
