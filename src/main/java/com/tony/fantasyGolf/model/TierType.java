package com.tony.fantasyGolf.model;

/**
 * Classe de tournoi, dans l'ordre d'importance.
 */
public enum TierType {
    STANDARD,
    ELEVATED,
    MAJOR,
    PLAYOFF
}
