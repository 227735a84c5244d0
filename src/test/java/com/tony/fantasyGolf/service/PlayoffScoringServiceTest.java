package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.Golfer;
import com.tony.fantasyGolf.model.Team;
import com.tony.fantasyGolf.model.Tier;
import com.tony.fantasyGolf.model.TierType;
import com.tony.fantasyGolf.model.TourCard;
import com.tony.fantasyGolf.model.Tournament;
import com.tony.fantasyGolf.model.dto.PlayoffEvent;
import com.tony.fantasyGolf.model.dto.SeasonSnapshot;
import com.tony.fantasyGolf.model.dto.TournamentSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.tony.fantasyGolf.service.Fixtures.card;
import static com.tony.fantasyGolf.service.Fixtures.golfer;
import static com.tony.fantasyGolf.service.Fixtures.team;
import static com.tony.fantasyGolf.service.Fixtures.tournament;
import static org.assertj.core.api.Assertions.assertThat;

class PlayoffScoringServiceTest {

    private static final Instant START = Instant.parse("2025-08-07T12:00:00Z");
    private static final long PLAYOFF_TIER = 9L;

    private PlayoffScoringService service;

    @BeforeEach
    void setUp() {
        service = new PlayoffScoringService();
    }

    @Test
    @DisplayName("2e tournoi de playoffs : index 2, scores du 1er reportés par tour card")
    void secondPlayoffEventShouldCarryScoresOfFirst() {
        Tournament regular = tournament(1, START.minus(Duration.ofDays(7)), START.minus(Duration.ofDays(4)), 5);
        Tournament first = playoffTournament(2, START, 5);
        Tournament second = playoffTournament(3, START.plus(Duration.ofDays(7)), 1);
        Tournament third = playoffTournament(4, START.plus(Duration.ofDays(14)), 1);
        Team carried = team(10, 100, 2);
        carried.setScore(-14.5);
        Team otherEvent = team(11, 100, 1);
        otherEvent.setScore(-3.0);
        SeasonSnapshot season = new SeasonSnapshot(Fixtures.SEASON, List.of(regular, third, first, second), List.of(),
                List.of(), List.of(Fixtures.tier(List.of(), List.of()), playoffTier(List.of(), List.of())),
                List.of(carried, otherEvent), START);

        PlayoffEvent event = service.eventFor(second, season);

        assertThat(service.eventFor(first, season)).isEqualTo(PlayoffEvent.FIRST);
        assertThat(event.index()).isEqualTo(2);
        assertThat(event.carryIn()).containsExactly(Map.entry(100L, -14.5));
        assertThat(service.eventFor(third, season).index()).isEqualTo(3);
    }

    @Test
    @DisplayName("1er tournoi après un round : coups d'avance, 10 golfeurs comptés, classement Gold/Silver séparé")
    void firstEventShouldUseStartingStrokesAndSeparateBrackets() {
        List<Golfer> golfers = new ArrayList<>();
        for (int i = 1; i <= 10; i++) golfers.add(golfer(i, i, "A" + i, "T5", 70));
        for (int i = 11; i <= 19; i++) golfers.add(golfer(i, i, "B" + i, "T20", 72));
        golfers.add(golfer(20, 20, "B20", "WD"));
        for (int i = 21; i <= 30; i++) golfers.add(golfer(i, i, "C" + i, "T40", 74));

        TourCard goldLeader = playoffCard(100, 1, 500);
        TourCard goldSecond = playoffCard(101, 1, 400);
        TourCard goldThird = playoffCard(103, 1, 300);
        TourCard silverLeader = playoffCard(102, 2, 300);

        Team a = team(1, 100, 2, range(1, 10));
        Team b = team(2, 101, 2, range(11, 20));
        Team c = team(3, 103, 2, range(21, 30));
        Team d = team(4, 102, 2, range(1, 10));
        Tier tier = playoffTier(List.of(-10, -8, -6, -4), List.of());

        service.scoreTournament(new TournamentSnapshot(playoffTournament(2, START, 2), tier, List.of(a, b, c, d),
                golfers, List.of(), List.of(goldLeader, goldSecond, goldThird, silverLeader)), PlayoffEvent.FIRST);

        assertThat(a.getScore()).isEqualTo(-12.0);
        assertThat(a.getToday()).isEqualTo(-2.0);
        // 9 golfeurs en course sur 10 requis : pire journée Gold (+2)
        assertThat(b.getScore()).isEqualTo(-6.0);
        assertThat(c.getScore()).isEqualTo(-4.0);
        assertThat(d.getScore()).isEqualTo(-12.0);

        assertThat(List.of(a, b, c)).extracting(Team::getPosition).containsExactly("1", "2", "3");
        assertThat(d.getPosition()).isEqualTo("1");
        assertThat(List.of(a, b, c, d)).allMatch(t -> t.getPoints() == 0 && t.getEarnings() == 0.0);
        assertThat(b.getPosition()).isNotEqualTo("CUT");
    }

    @Test
    @DisplayName("Finale terminée : 3 meilleurs golfeurs, score reporté, gains Gold puis Silver décalés")
    void concludedFinalShouldAwardEarningsPerBracket() {
        List<Golfer> golfers = new ArrayList<>();
        for (int i = 1; i <= 3; i++) golfers.add(golfer(i, i, "A" + i, "T2", 70, 70, 70, 70));
        for (int i = 4; i <= 5; i++) golfers.add(golfer(i, i, "A" + i, "T20", 76, 76, 76, 76));
        for (int i = 6; i <= 10; i++) golfers.add(golfer(i, i, "B" + i, "T10", 72, 72, 72, 72));

        Team gold = team(1, 100, 4, range(1, 5));
        Team goldSecond = team(2, 101, 4, range(6, 10));
        Team silver = team(3, 102, 4, range(6, 10));

        List<Double> payouts = new ArrayList<>(Collections.nCopies(80, 0.0));
        payouts.set(0, 1000.0);
        payouts.set(1, 500.0);
        payouts.set(PlayoffScoringService.SILVER_PAYOUT_OFFSET, 300.0);
        Tier tier = playoffTier(List.of(), payouts);
        PlayoffEvent finalEvent = new PlayoffEvent(3, Map.of(100L, -12.0, 101L, -15.0, 102L, -5.0));

        service.scoreTournament(new TournamentSnapshot(playoffTournament(4, START, 5), tier,
                List.of(gold, goldSecond, silver), golfers, List.of(),
                List.of(playoffCard(100, 1, 500), playoffCard(101, 1, 400), playoffCard(102, 2, 300))), finalEvent);

        assertThat(gold.getScore()).isEqualTo(-20.0);
        assertThat(goldSecond.getScore()).isEqualTo(-15.0);
        assertThat(silver.getScore()).isEqualTo(-5.0);
        assertThat(gold.getPosition()).isEqualTo("1");
        assertThat(goldSecond.getPosition()).isEqualTo("2");
        assertThat(silver.getPosition()).isEqualTo("1");
        assertThat(gold.getEarnings()).isEqualTo(1000.0);
        assertThat(goldSecond.getEarnings()).isEqualTo(500.0);
        assertThat(silver.getEarnings()).isEqualTo(300.0);
        assertThat(gold.getPoints()).isZero();
    }

    @Test
    void countingGolfersShouldDependOnEvent() {
        assertThat(PlayoffEvent.FIRST.countingGolfers(2)).isEqualTo(10);
        assertThat(PlayoffEvent.FIRST.countingGolfers(3)).isEqualTo(5);
        assertThat(new PlayoffEvent(2, null).countingGolfers(1)).isEqualTo(5);
        assertThat(new PlayoffEvent(3, null).countingGolfers(4)).isEqualTo(3);
        assertThat(new PlayoffEvent(7, null).index()).isEqualTo(3);
    }

    @Test
    @DisplayName("Coups d'avance moyennés entre ex aequo aux points de saison")
    void tiedCardsShouldShareStartingStrokes() {
        TourCard first = playoffCard(100, 1, 500);
        TourCard tiedA = playoffCard(101, 1, 400);
        TourCard tiedB = playoffCard(102, 1, 400);
        TourCard silver = playoffCard(103, 2, 600);
        Tier tier = playoffTier(List.of(-10, -8, -7, -4), List.of());
        List<TourCard> cards = List.of(first, tiedA, tiedB, silver);

        assertThat(PlayoffScoringService.startingStrokes(tiedA, cards, tier)).isEqualTo(-7.5);
        assertThat(PlayoffScoringService.startingStrokes(silver, cards, tier)).isEqualTo(-10.0);
        assertThat(PlayoffScoringService.startingStrokes(card(104, 1, "Hors playoffs"), cards, tier)).isZero();
    }

    private static Tournament playoffTournament(long id, Instant start, int currentRound) {
        Tournament tournament = tournament(id, start, start.plus(Duration.ofDays(3)), currentRound);
        tournament.setTierId(PLAYOFF_TIER);
        return tournament;
    }

    private static Tier playoffTier(List<Integer> points, List<Double> payouts) {
        Tier tier = new Tier(TierType.PLAYOFF, Fixtures.SEASON, payouts, points);
        tier.setId(PLAYOFF_TIER);
        return tier;
    }

    private static TourCard playoffCard(long id, int playoff, int points) {
        TourCard card = card(id, 1, "Carte " + id);
        card.setPlayoff(playoff);
        card.setPoints(points);
        return card;
    }

    private static Integer[] range(int from, int to) {
        Integer[] ids = new Integer[to - from + 1];
        for (int i = from; i <= to; i++) ids[i - from] = i;
        return ids;
    }
}
