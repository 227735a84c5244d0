package com.tony.fantasyGolf.repository;

import com.tony.fantasyGolf.model.Tier;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TierRepository extends JpaRepository<Tier, Long> {
    List<Tier> findBySeasonId(Long seasonId);
}
