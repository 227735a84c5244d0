package com.tony.fantasyGolf.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Une ligne de {@code preds/in-play}. Les rounds sont en coups, le score et "today" par rapport au par.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LiveGolfer(
        @JsonProperty("dg_id") Integer apiId,
        @JsonProperty("player_name") String playerName,
        @JsonProperty("current_pos") String position,
        @JsonProperty("current_score") Integer score,
        @JsonProperty("today") Integer today,
        @JsonProperty("thru") Integer thru,
        @JsonProperty("round") Integer round,
        @JsonProperty("R1") Integer roundOne,
        @JsonProperty("R2") Integer roundTwo,
        @JsonProperty("R3") Integer roundThree,
        @JsonProperty("R4") Integer roundFour
) {

    public boolean isOnCourse() {
        return thru != null && thru > 0 && thru < 18;
    }
}
