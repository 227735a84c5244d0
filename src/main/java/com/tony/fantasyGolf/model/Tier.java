package com.tony.fantasyGolf.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Barème d'un type de tournoi : gains et points indexés par rang final (rang 1 = index 0).
 */
@Entity
@Data
@NoArgsConstructor
public class Tier {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TierType name;

    @Column(name = "season_id", nullable = false)
    private Long seasonId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tier_payout", joinColumns = @JoinColumn(name = "tier_id"))
    @OrderColumn(name = "rank_index")
    @Column(name = "payout")
    private List<Double> payouts = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tier_points", joinColumns = @JoinColumn(name = "tier_id"))
    @OrderColumn(name = "rank_index")
    @Column(name = "points")
    private List<Integer> points = new ArrayList<>();

    public Tier(TierType name, Long seasonId, List<Double> payouts, List<Integer> points) {
        this.name = name;
        this.seasonId = seasonId;
        this.payouts = new ArrayList<>(payouts);
        this.points = new ArrayList<>(points);
    }

    public int pointsAt(int rank) {
        return rank >= 1 && rank <= points.size() && points.get(rank - 1) != null ? points.get(rank - 1) : 0;
    }

    public double payoutAt(int rank) {
        return rank >= 1 && rank <= payouts.size() && payouts.get(rank - 1) != null ? payouts.get(rank - 1) : 0.0;
    }
}
