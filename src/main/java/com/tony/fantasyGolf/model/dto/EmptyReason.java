package com.tony.fantasyGolf.model.dto;

/**
 * Pourquoi un leaderboard n'a encore aucune équipe.
 */
public enum EmptyReason {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED_NO_DATA
}
