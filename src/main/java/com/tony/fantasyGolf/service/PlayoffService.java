package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.Tour;
import com.tony.fantasyGolf.model.dto.PlayoffBracket;
import com.tony.fantasyGolf.model.dto.PlayoffGroup;
import com.tony.fantasyGolf.model.dto.PlayoffSlot;
import com.tony.fantasyGolf.model.dto.SeasonSnapshot;
import com.tony.fantasyGolf.model.dto.StandingsEntry;
import com.tony.fantasyGolf.model.dto.TourStandings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlayoffService {

    private final StandingsService standingsService;

    public List<PlayoffBracket> buildPlayoffs(SeasonSnapshot season) {
        return standingsService.buildSeasonStandings(season).stream()
                .map(standings -> cut(standings.tour(), standings.entries()))
                .toList();
    }

    public PlayoffBracket cut(TourStandings standings) {
        return cut(standings.tour(), standings.entries());
    }

    /**
     * Découpe un classement déjà trié en Gold / Silver / non qualifiés selon {@code tour.playoffSpots}.
     * Un classement plus court que la config donne simplement des groupes plus petits.
     */
    public PlayoffBracket cut(Tour tour, List<StandingsEntry> ranked) {
        List<Integer> spots = tour.getPlayoffSpots() != null ? tour.getPlayoffSpots() : List.of();
        if (spots.isEmpty() || spots.size() > 2) {
            log.warn("⚠️ Tour {} : configuration playoff inattendue {}", tour.getName(), spots);
        }

        int goldSpots = spotAt(spots, 0);
        int silverSpots = spotAt(spots, 1);

        int goldEnd = Math.min(goldSpots, ranked.size());
        int silverEnd = Math.min(goldEnd + silverSpots, ranked.size());

        return new PlayoffBracket(tour,
                slots(ranked.subList(0, goldEnd), PlayoffGroup.GOLD),
                slots(ranked.subList(goldEnd, silverEnd), PlayoffGroup.SILVER),
                ranked.subList(silverEnd, ranked.size()));
    }

    private static int spotAt(List<Integer> spots, int index) {
        if (index >= spots.size() || spots.get(index) == null) return 0;
        return Math.max(0, spots.get(index));
    }

    private static List<PlayoffSlot> slots(List<StandingsEntry> entries, PlayoffGroup group) {
        List<PlayoffSlot> slots = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            slots.add(new PlayoffSlot(entries.get(i), group, i + 1));
        }
        return slots;
    }
}
