package com.tony.fantasyGolf.model.dto;

public enum SnapshotOperation {
    LEADERBOARD,
    STANDINGS,
    PLAYOFFS
}
