package com.tony.fantasyGolf.model.dto;

import com.tony.fantasyGolf.model.Tour;

import java.util.List;

public record PlayoffBracket(Tour tour,
                             List<PlayoffSlot> gold,
                             List<PlayoffSlot> silver,
                             List<StandingsEntry> unqualified) {

    public PlayoffBracket {
        gold = List.copyOf(gold);
        silver = List.copyOf(silver);
        unqualified = List.copyOf(unqualified);
    }

    public int totalGoldTeams() {
        return gold.size();
    }

    public int totalSilverTeams() {
        return silver.size();
    }
}
