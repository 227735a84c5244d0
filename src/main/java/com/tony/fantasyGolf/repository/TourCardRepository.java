package com.tony.fantasyGolf.repository;

import com.tony.fantasyGolf.model.TourCard;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TourCardRepository extends JpaRepository<TourCard, Long> {
    List<TourCard> findBySeasonIdOrderByIdAsc(Long seasonId);
}
