package com.tony.fantasyGolf.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Getter @Setter @NoArgsConstructor
public class Tournament {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "season_id", nullable = false)
    private Long seasonId;

    @Column(name = "tier_id")
    private Long tierId;

    @Column(nullable = false)
    private Instant startDate;

    @Column(nullable = false)
    private Instant endDate;

    // 1 à 4 pendant le tournoi, 5 une fois terminé
    private Integer currentRound = 1;

    @Column(nullable = false, columnDefinition = "integer default 72")
    private Integer par = 72;

    private Boolean livePlay = false;

    public Tournament(String name, Long seasonId, Long tierId, Instant startDate, Instant endDate) {
        this.name = name;
        this.seasonId = seasonId;
        this.tierId = tierId;
        this.startDate = startDate;
        this.endDate = endDate;
    }

    public boolean isConcluded() {
        return currentRound != null && currentRound > 4;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tournament)) return false;
        return id != null && id.equals(((Tournament) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
