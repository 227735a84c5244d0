package com.tony.fantasyGolf.repository;

import com.tony.fantasyGolf.model.Tour;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TourRepository extends JpaRepository<Tour, Long> {
    List<Tour> findBySeasonIdOrderByIdAsc(Long seasonId);
}
