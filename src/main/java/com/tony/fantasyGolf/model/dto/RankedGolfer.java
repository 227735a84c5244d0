package com.tony.fantasyGolf.model.dto;

/**
 * Golfeur du field joint à son estimation de niveau (plus petit = meilleur).
 */
public record RankedGolfer(Integer apiId, String playerName, Double skillEstimate, Integer worldRank, String country) {
}
