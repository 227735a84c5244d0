package com.tony.fantasyGolf.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(uniqueConstraints = {
        @UniqueConstraint(columnNames = {"api_id", "tournament_id"})
})
public class Golfer {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Identifiant stable côté fournisseur de classements (dg_id)
    @Column(name = "api_id", nullable = false)
    private Integer apiId;

    @Column(nullable = false)
    private String playerName;

    @Column(name = "tournament_id", nullable = false)
    private Long tournamentId;

    private String position; // "1", "T5", "CUT", "WD", "DQ" ou null

    private Integer roundOne;
    private Integer roundTwo;
    private Integer roundThree;
    private Integer roundFour;

    private Integer score; // Total par rapport au par
    private Integer today;
    private Integer thru;
    private Integer currentRound; // Round en cours pour ce golfeur (flux live)

    private Double skillEstimate; // Plus petit = meilleur
    private Integer worldRank;
    private String country;

    // Groupe de sélection (1 à 5)
    @Column(name = "group_number")
    private Integer group;

    public Golfer(Integer apiId, String playerName, Long tournamentId) {
        this.apiId = apiId;
        this.playerName = playerName;
        this.tournamentId = tournamentId;
    }

    public Integer getRound(int round) {
        return switch (round) {
            case 1 -> roundOne;
            case 2 -> roundTwo;
            case 3 -> roundThree;
            case 4 -> roundFour;
            default -> null;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Golfer)) return false;
        return id != null && id.equals(((Golfer) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
