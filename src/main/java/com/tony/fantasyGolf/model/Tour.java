package com.tony.fantasyGolf.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Entity
@Data
@NoArgsConstructor
public class Tour {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String shortForm;

    @Column(name = "season_id", nullable = false)
    private Long seasonId;

    // [gold] ou [gold, silver]
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tour_playoff_spot", joinColumns = @JoinColumn(name = "tour_id"))
    @OrderColumn(name = "slot")
    @Column(name = "spots")
    private List<Integer> playoffSpots = new ArrayList<>();

    public Tour(String name, Long seasonId, List<Integer> playoffSpots) {
        this.name = name;
        this.seasonId = seasonId;
        this.playoffSpots = new ArrayList<>(playoffSpots);
    }
}
