package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.config.RankingsProperties;
import com.tony.fantasyGolf.exception.RecordFetchException;
import com.tony.fantasyGolf.model.Golfer;
import com.tony.fantasyGolf.model.Tournament;
import com.tony.fantasyGolf.model.dto.LiveGolfer;
import com.tony.fantasyGolf.repository.GolferRepository;
import com.tony.fantasyGolf.repository.TournamentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.tony.fantasyGolf.service.Fixtures.golfer;
import static com.tony.fantasyGolf.service.Fixtures.tournament;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GolferUpdateServiceTest {

    private static final Instant START = Instant.parse("2025-04-10T12:00:00Z");

    @Mock
    private GolferRepository golferRepository;

    @Mock
    private TournamentRepository tournamentRepository;

    @Mock
    private RankingsClient rankingsClient;

    @Mock
    private DataFreshnessService dataFreshnessService;

    private GolferUpdateService service;

    @BeforeEach
    void setUp() {
        RankingsProperties properties = new RankingsProperties();
        properties.setRetries(0);
        properties.setRetryDelay(Duration.ZERO);
        service = new GolferUpdateService(golferRepository, tournamentRepository, rankingsClient, properties,
                dataFreshnessService);
    }

    @Test
    @DisplayName("Round 2 en cours : cartes, positions et pénalité WD recopiées, tournoi au round 2")
    void shouldCopyLiveDataDuringSecondRound() {
        Tournament tournament = tournament(7, START, START.plus(Duration.ofDays(3)), 1);
        Golfer leader = golfer(1, 101, "Scottie Scheffler", null);
        Golfer waiting = golfer(2, 102, "Rory McIlroy", null);
        Golfer withdrawn = golfer(3, 103, "Tiger Woods", null);
        Golfer cut = golfer(4, 104, "Shane Lowry", null);
        List<Golfer> golfers = List.of(leader, waiting, withdrawn, cut);
        when(golferRepository.findByTournamentId(7L)).thenReturn(golfers);
        when(rankingsClient.fetchLiveGolfers()).thenReturn(List.of(
                live(101, "T1", -6, -2, 9, 2, 68),
                live(102, "T5", -1, 0, 0, 2, 71),
                live(103, "WD", 4, null, null, 1),
                live(104, "CUT", 7, 3, 18, 2, 75, 76),
                live(999, "T30", 2, 1, 5, 2, 73)));

        int updated = service.updateGolfers(tournament);

        assertThat(updated).isEqualTo(4);
        assertThat(leader.getRoundOne()).isEqualTo(68);
        assertThat(leader.getPosition()).isEqualTo("T1");
        assertThat(leader.getScore()).isEqualTo(-6);
        assertThat(leader.getToday()).isEqualTo(-2);
        assertThat(leader.getThru()).isEqualTo(9);
        assertThat(leader.getCurrentRound()).isEqualTo(2);

        assertThat(withdrawn.getToday()).isEqualTo(GolferUpdateService.WITHDRAWAL_TODAY);
        assertThat(withdrawn.getThru()).isEqualTo(18);
        assertThat(withdrawn.getScore()).isNull();

        assertThat(cut.getRoundTwo()).isEqualTo(76);
        assertThat(cut.getToday()).isNull();
        assertThat(cut.getThru()).isNull();

        assertThat(tournament.getCurrentRound()).isEqualTo(2);
        assertThat(tournament.getLivePlay()).isTrue();
        verify(golferRepository).saveAll(golfers);
        verify(tournamentRepository).save(tournament);
        verify(dataFreshnessService).evictTournament(7L);
    }

    @Test
    @DisplayName("Toutes les cartes du round 4 rendues : le tournoi passe à 5 (terminé)")
    void lastRoundCompleteShouldConcludeTournament() {
        Tournament tournament = tournament(7, START, START.plus(Duration.ofDays(3)), 4);
        Golfer winner = golfer(1, 101, "Scottie Scheffler", null);
        Golfer second = golfer(2, 102, "Rory McIlroy", null);
        Golfer cut = golfer(3, 103, "Shane Lowry", null);
        when(golferRepository.findByTournamentId(7L)).thenReturn(List.of(winner, second, cut));
        when(rankingsClient.fetchLiveGolfers()).thenReturn(List.of(
                live(101, "1", -12, -4, 18, 4, 68, 70, 66, 68),
                live(102, "2", -10, -2, 18, 4, 69, 69, 68, 70),
                live(103, "CUT", 6, null, null, 2, 75, 75)));

        service.updateGolfers(tournament);

        assertThat(tournament.getCurrentRound()).isEqualTo(5);
        assertThat(tournament.isConcluded()).isTrue();
        assertThat(tournament.getLivePlay()).isFalse();
        assertThat(winner.getRoundFour()).isEqualTo(68);
    }

    @Test
    @DisplayName("Flux d'un autre tournoi : rien n'est modifié")
    void unrelatedFeedShouldChangeNothing() {
        Tournament tournament = tournament(7, START, START.plus(Duration.ofDays(3)), 2);
        when(golferRepository.findByTournamentId(7L)).thenReturn(List.of(golfer(1, 101, "Scottie Scheffler", null)));
        when(rankingsClient.fetchLiveGolfers()).thenReturn(List.of(live(999, "1", -3, -3, 18, 1, 69)));

        assertThat(service.updateGolfers(tournament)).isZero();

        assertThat(tournament.getCurrentRound()).isEqualTo(2);
        verify(golferRepository, never()).saveAll(anyList());
        verifyNoInteractions(tournamentRepository, dataFreshnessService);
    }

    @Test
    void staleFeedShouldNotMoveRoundBackwards() {
        Tournament tournament = tournament(7, START, START.plus(Duration.ofDays(3)), 3);
        when(golferRepository.findByTournamentId(7L)).thenReturn(List.of(golfer(1, 101, "Scottie Scheffler", null)));
        when(rankingsClient.fetchLiveGolfers()).thenReturn(List.of(live(101, "T3", -4, -1, 10, 2, 69)));

        service.updateGolfers(tournament);

        assertThat(tournament.getCurrentRound()).isEqualTo(3);
    }

    @Test
    void feedFailureShouldPropagate() {
        Tournament tournament = tournament(7, START, START.plus(Duration.ofDays(3)), 2);
        when(rankingsClient.fetchLiveGolfers()).thenThrow(new RecordFetchException("in-play en échec"));

        assertThatThrownBy(() -> service.updateGolfers(tournament)).isInstanceOf(RecordFetchException.class);

        verifyNoInteractions(golferRepository, tournamentRepository);
    }

    private static LiveGolfer live(int apiId, String position, Integer score, Integer today, Integer thru,
                                   int round, Integer... rounds) {
        return new LiveGolfer(apiId, "Golfer " + apiId, position, score, today, thru, round,
                rounds.length > 0 ? rounds[0] : null,
                rounds.length > 1 ? rounds[1] : null,
                rounds.length > 2 ? rounds[2] : null,
                rounds.length > 3 ? rounds[3] : null);
    }
}
