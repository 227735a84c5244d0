package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.TourCard;
import com.tony.fantasyGolf.model.dto.PlayoffBracket;
import com.tony.fantasyGolf.model.dto.PlayoffGroup;
import com.tony.fantasyGolf.model.dto.PlayoffSlot;
import com.tony.fantasyGolf.model.dto.SeasonSnapshot;
import com.tony.fantasyGolf.model.dto.SeasonTotals;
import com.tony.fantasyGolf.model.dto.StandingsEntry;
import com.tony.fantasyGolf.model.dto.TourStandings;
import com.tony.fantasyGolf.repository.RecordStore;
import com.tony.fantasyGolf.repository.TourCardRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recalcule les totaux de saison et les reporte sur les tour cards.
 * Relancer le calcul redonne exactement les mêmes valeurs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StandingsUpdateService {

    private final RecordStore recordStore;
    private final TourCardRepository tourCardRepository;
    private final StandingsService standingsService;
    private final PlayoffService playoffService;
    private final DataFreshnessService dataFreshnessService;

    @Transactional
    public int updateStandings(Long seasonId) {
        SeasonSnapshot season = recordStore.fetchSeason(seasonId);
        List<TourStandings> standings = standingsService.buildSeasonStandings(season);

        Map<Long, PlayoffGroup> playoffByCard = new HashMap<>();
        for (TourStandings tour : standings) {
            PlayoffBracket bracket = playoffService.cut(tour);
            bracket.gold().forEach(slot -> playoffByCard.put(cardId(slot), PlayoffGroup.GOLD));
            bracket.silver().forEach(slot -> playoffByCard.put(cardId(slot), PlayoffGroup.SILVER));
        }

        List<TourCard> updated = new ArrayList<>();
        for (TourStandings tour : standings) {
            for (StandingsEntry entry : tour.entries()) {
                TourCard card = entry.tourCard();
                apply(card, entry.totals(), entry.position(),
                        playoffByCard.getOrDefault(card.getId(), PlayoffGroup.NONE));
                updated.add(card);
            }
        }
        tourCardRepository.saveAll(updated);
        dataFreshnessService.evictSeason(seasonId);

        log.info("🏆 Saison {} : {} tour cards mises à jour", seasonId, updated.size());
        return updated.size();
    }

    static void apply(TourCard card, SeasonTotals totals, String position, PlayoffGroup playoff) {
        card.setPoints(totals.points());
        card.setEarnings(totals.earnings());
        card.setWin(totals.wins());
        card.setTopTen(totals.topTens());
        card.setMadeCut(totals.cuts());
        card.setAppearances(totals.appearances());
        card.setPosition(position);
        card.setPlayoff(playoff.getCode());
    }

    private static Long cardId(PlayoffSlot slot) {
        return slot.entry().tourCard().getId();
    }
}
