package com.tony.fantasyGolf.repository;

import com.tony.fantasyGolf.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TeamRepository extends JpaRepository<Team, Long> {
    // golferIds chargés d'un coup pour éviter le N+1
    @Query("SELECT DISTINCT t FROM Team t LEFT JOIN FETCH t.golferIds WHERE t.tournamentId = :tournamentId ORDER BY t.id")
    List<Team> findByTournamentId(@Param("tournamentId") Long tournamentId);

    // Toutes les équipes des tournois d'une saison
    @Query("SELECT DISTINCT t FROM Team t LEFT JOIN FETCH t.golferIds WHERE t.tournamentId IN " +
            "(SELECT tr.id FROM Tournament tr WHERE tr.seasonId = :seasonId) ORDER BY t.id")
    List<Team> findBySeasonId(@Param("seasonId") Long seasonId);
}
