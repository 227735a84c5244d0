package com.tony.fantasyGolf.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(uniqueConstraints = {
        @UniqueConstraint(columnNames = {"member_id", "tour_id", "season_id"})
})
public class TourCard {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "member_id", nullable = false)
    private String memberId;

    @Column(name = "tour_id", nullable = false)
    private Long tourId;

    @Column(name = "season_id", nullable = false)
    private Long seasonId;

    @Column(nullable = false)
    private String displayName;

    // --- Totaux de saison (recalculés par StandingsUpdateService) ---
    private Integer points = 0;
    private Double earnings = 0.0;
    private Integer win = 0;
    private Integer topTen = 0;
    private Integer madeCut = 0;
    private Integer appearances = 0;

    private String position;

    // 0 = non qualifié, 1 = Gold, 2 = Silver
    private Integer playoff = 0;

    public TourCard(String memberId, Long tourId, Long seasonId, String displayName) {
        this.memberId = memberId;
        this.tourId = tourId;
        this.seasonId = seasonId;
        this.displayName = displayName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TourCard)) return false;
        return id != null && id.equals(((TourCard) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
