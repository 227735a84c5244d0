package com.tony.fantasyGolf.model.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance des données servies à l'appelant.
 */
public enum DataSource {
    LIVE("live"),
    SEASON_CACHE("season-cache"),
    HISTORICAL_API("historical-api"),
    ERROR("error"),
    NONE("none");

    private final String label;

    DataSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
