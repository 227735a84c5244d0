package com.tony.fantasyGolf.model.dto;

/**
 * Valeur stockée dans {@code TourCard.playoff}.
 */
public enum PlayoffGroup {
    NONE(0),
    GOLD(1),
    SILVER(2);

    private final int code;

    PlayoffGroup(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
