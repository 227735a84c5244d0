package com.tony.fantasyGolf.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Équipe d'un membre (tour card) pour un tournoi.
 * La sélection de golfeurs est figée au départ du tournoi.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(uniqueConstraints = {
        @UniqueConstraint(columnNames = {"tour_card_id", "tournament_id"})
})
public class Team {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tour_card_id", nullable = false)
    private Long tourCardId;

    @Column(name = "tournament_id", nullable = false)
    private Long tournamentId;

    // apiId des golfeurs choisis (10 : deux par groupe)
    @ElementCollection
    @CollectionTable(name = "team_golfer", joinColumns = @JoinColumn(name = "team_id"))
    @OrderColumn(name = "pick_order")
    @Column(name = "golfer_api_id")
    private List<Integer> golferIds = new ArrayList<>();

    private String position;
    private String pastPosition;

    private Double score;
    private Double today;
    private Integer thru;
    private Integer round;

    private Integer points = 0;
    private Double earnings = 0.0;

    private Boolean madeCut;

    public Team(Long tourCardId, Long tournamentId, List<Integer> golferIds) {
        this.tourCardId = tourCardId;
        this.tournamentId = tournamentId;
        this.golferIds = new ArrayList<>(golferIds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Team)) return false;
        return id != null && id.equals(((Team) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
