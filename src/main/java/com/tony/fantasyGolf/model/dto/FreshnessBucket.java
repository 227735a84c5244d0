package com.tony.fantasyGolf.model.dto;

public enum FreshnessBucket {
    LIVE,
    RECENT,
    HISTORICAL,
    SEASON
}
