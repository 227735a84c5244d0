package com.tony.fantasyGolf.model;

/**
 * Catégorie d'une position finale. L'ordre des constantes est l'ordre de classement.
 */
public enum RankClass {
    NUMERIC,
    UNKNOWN, // Position absente ou illisible
    CUT,
    WITHDRAWN,
    DISQUALIFIED
}
