package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.Tour;
import com.tony.fantasyGolf.model.dto.PlayoffBracket;
import com.tony.fantasyGolf.model.dto.PlayoffGroup;
import com.tony.fantasyGolf.model.dto.PlayoffSlot;
import com.tony.fantasyGolf.model.dto.SeasonTotals;
import com.tony.fantasyGolf.model.dto.StandingsEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static com.tony.fantasyGolf.service.Fixtures.card;
import static com.tony.fantasyGolf.service.Fixtures.tour;
import static org.assertj.core.api.Assertions.assertThat;

class PlayoffServiceTest {

    private PlayoffService service;

    @BeforeEach
    void setUp() {
        service = new PlayoffService(new StandingsService());
    }

    @Test
    @DisplayName("20 tour cards, config [8, 4] : 8 Gold, 4 Silver, 8 non qualifiés")
    void shouldCutGoldAndSilver() {
        PlayoffBracket bracket = service.cut(tour(1, "PGA", 8, 4), ranked(20));

        assertThat(bracket.totalGoldTeams()).isEqualTo(8);
        assertThat(bracket.totalSilverTeams()).isEqualTo(4);
        assertThat(bracket.unqualified()).hasSize(8);
        assertThat(bracket.gold()).extracting(PlayoffSlot::position).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(bracket.silver()).extracting(s -> s.entry().tourCard().getId()).containsExactly(9L, 10L, 11L, 12L);
        assertThat(bracket.silver()).allMatch(s -> s.group() == PlayoffGroup.SILVER);
    }

    @Test
    void shortStandingsShouldGiveSmallerGroups() {
        PlayoffBracket bracket = service.cut(tour(1, "PGA", 8, 4), ranked(10));

        assertThat(bracket.totalGoldTeams()).isEqualTo(8);
        assertThat(bracket.totalSilverTeams()).isEqualTo(2);
        assertThat(bracket.unqualified()).isEmpty();
    }

    @Test
    @DisplayName("Config Gold seule : pas de groupe Silver")
    void goldOnlyConfig() {
        PlayoffBracket bracket = service.cut(tour(1, "CCG", 5), ranked(12));

        assertThat(bracket.totalGoldTeams()).isEqualTo(5);
        assertThat(bracket.silver()).isEmpty();
        assertThat(bracket.unqualified()).hasSize(7);
    }

    @Test
    void malformedConfigShouldBeTreatedAsZero() {
        Tour empty = tour(1, "X");
        Tour negative = tour(2, "Y", -3, 2);

        assertThat(service.cut(empty, ranked(5)).unqualified()).hasSize(5);
        PlayoffBracket bracket = service.cut(negative, ranked(5));
        assertThat(bracket.gold()).isEmpty();
        assertThat(bracket.totalSilverTeams()).isEqualTo(2);
    }

    @Test
    @DisplayName("Chaque tour card apparaît exactement une fois")
    void bracketShouldPartitionStandings() {
        List<StandingsEntry> standings = ranked(17);
        PlayoffBracket bracket = service.cut(tour(1, "PGA", 6, 6), standings);

        assertThat(bracket.totalGoldTeams() + bracket.totalSilverTeams() + bracket.unqualified().size())
                .isEqualTo(standings.size());
    }

    private static List<StandingsEntry> ranked(int size) {
        return IntStream.rangeClosed(1, size)
                .mapToObj(i -> new StandingsEntry(card(i, 1, "Card " + i),
                        new SeasonTotals(1000 - i, 0, 0, 0, 0, 0), String.valueOf(i)))
                .toList();
    }
}
