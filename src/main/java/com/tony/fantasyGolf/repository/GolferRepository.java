package com.tony.fantasyGolf.repository;

import com.tony.fantasyGolf.model.Golfer;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface GolferRepository extends JpaRepository<Golfer, Long> {
    List<Golfer> findByTournamentId(Long tournamentId);

    long countByTournamentId(Long tournamentId);
}
