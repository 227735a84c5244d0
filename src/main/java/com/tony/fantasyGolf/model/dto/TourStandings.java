package com.tony.fantasyGolf.model.dto;

import com.tony.fantasyGolf.model.Tour;

import java.util.List;

public record TourStandings(Tour tour, List<StandingsEntry> entries) {

    public TourStandings {
        entries = List.copyOf(entries);
    }
}
