package com.tony.fantasyGolf.repository;

import com.tony.fantasyGolf.exception.RecordFetchException;
import com.tony.fantasyGolf.model.Golfer;
import com.tony.fantasyGolf.model.Team;
import com.tony.fantasyGolf.model.Tier;
import com.tony.fantasyGolf.model.Tour;
import com.tony.fantasyGolf.model.TourCard;
import com.tony.fantasyGolf.model.Tournament;
import com.tony.fantasyGolf.model.dto.SeasonSnapshot;
import com.tony.fantasyGolf.model.dto.TournamentRecords;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

@Component
@Slf4j
public class JpaRecordStore implements RecordStore {

    private final TournamentRepository tournamentRepository;
    private final TourRepository tourRepository;
    private final TourCardRepository tourCardRepository;
    private final TierRepository tierRepository;
    private final TeamRepository teamRepository;
    private final GolferRepository golferRepository;
    private final ExecutorService executor;
    private final Clock clock;

    public JpaRecordStore(TournamentRepository tournamentRepository,
                          TourRepository tourRepository,
                          TourCardRepository tourCardRepository,
                          TierRepository tierRepository,
                          TeamRepository teamRepository,
                          GolferRepository golferRepository,
                          @Qualifier("recordExecutor") ExecutorService executor,
                          Clock clock) {
        this.tournamentRepository = tournamentRepository;
        this.tourRepository = tourRepository;
        this.tourCardRepository = tourCardRepository;
        this.tierRepository = tierRepository;
        this.teamRepository = teamRepository;
        this.golferRepository = golferRepository;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public Optional<Tournament> findTournament(Long tournamentId) {
        return read("tournament " + tournamentId, () -> tournamentRepository.findById(tournamentId));
    }

    /**
     * Les collections sont indépendantes : on les lit en parallèle puis on assemble.
     */
    @Override
    public SeasonSnapshot fetchSeason(Long seasonId) {
        CompletableFuture<List<Tournament>> tournaments = async(() -> tournamentRepository.findBySeasonIdOrderByStartDateAsc(seasonId));
        CompletableFuture<List<Tour>> tours = async(() -> tourRepository.findBySeasonIdOrderByIdAsc(seasonId));
        CompletableFuture<List<TourCard>> tourCards = async(() -> tourCardRepository.findBySeasonIdOrderByIdAsc(seasonId));
        CompletableFuture<List<Tier>> tiers = async(() -> tierRepository.findBySeasonId(seasonId));
        CompletableFuture<List<Team>> teams = async(() -> teamRepository.findBySeasonId(seasonId));

        try {
            CompletableFuture.allOf(tournaments, tours, tourCards, tiers, teams).join();
        } catch (CompletionException e) {
            throw new RecordFetchException("Lecture de la saison " + seasonId + " impossible", e.getCause());
        }

        SeasonSnapshot snapshot = new SeasonSnapshot(seasonId, tournaments.join(), tours.join(), tourCards.join(),
                tiers.join(), teams.join(), clock.instant());
        log.debug("Saison {} chargée : {} tournois, {} tours, {} tour cards, {} équipes", seasonId,
                snapshot.tournaments().size(), snapshot.tours().size(), snapshot.tourCards().size(), snapshot.teams().size());
        return snapshot;
    }

    @Override
    public TournamentRecords fetchTournament(Long tournamentId) {
        CompletableFuture<List<Team>> teams = async(() -> teamRepository.findByTournamentId(tournamentId));
        CompletableFuture<List<Golfer>> golfers = async(() -> golferRepository.findByTournamentId(tournamentId));
        try {
            return new TournamentRecords(tournamentId, teams.join(), golfers.join());
        } catch (CompletionException e) {
            throw new RecordFetchException("Lecture du tournoi " + tournamentId + " impossible", e.getCause());
        }
    }

    private <T> CompletableFuture<T> async(Supplier<T> query) {
        return CompletableFuture.supplyAsync(query, executor);
    }

    private <T> T read(String label, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new RecordFetchException("Lecture " + label + " impossible", e);
        }
    }
}
