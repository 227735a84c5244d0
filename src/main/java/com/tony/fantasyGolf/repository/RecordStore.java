package com.tony.fantasyGolf.repository;

import com.tony.fantasyGolf.model.Tournament;
import com.tony.fantasyGolf.model.dto.SeasonSnapshot;
import com.tony.fantasyGolf.model.dto.TournamentRecords;

import java.util.Optional;

/**
 * Accès en lecture aux données brutes. Les implémentations lèvent
 * {@link com.tony.fantasyGolf.exception.RecordFetchException} quand la source est indisponible.
 */
public interface RecordStore {

    Optional<Tournament> findTournament(Long tournamentId);

    SeasonSnapshot fetchSeason(Long seasonId);

    TournamentRecords fetchTournament(Long tournamentId);
}
