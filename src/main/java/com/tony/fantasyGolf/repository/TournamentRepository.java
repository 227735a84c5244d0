package com.tony.fantasyGolf.repository;

import com.tony.fantasyGolf.model.Tournament;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TournamentRepository extends JpaRepository<Tournament, Long> {
    List<Tournament> findBySeasonIdOrderByStartDateAsc(Long seasonId);

    // Tournoi en cours : commencé et pas encore terminé
    @Query("SELECT t FROM Tournament t WHERE t.startDate <= :now AND t.endDate >= :now ORDER BY t.startDate ASC")
    List<Tournament> findInProgress(@Param("now") Instant now);

    Optional<Tournament> findFirstByStartDateAfterOrderByStartDateAsc(Instant now);

    Optional<Tournament> findFirstByStartDateBeforeOrderByStartDateDesc(Instant now);
}
