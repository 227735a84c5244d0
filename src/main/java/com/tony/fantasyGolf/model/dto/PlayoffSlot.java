package com.tony.fantasyGolf.model.dto;

/**
 * @param position position dans le groupe, à partir de 1
 */
public record PlayoffSlot(StandingsEntry entry, PlayoffGroup group, int position) {
}
