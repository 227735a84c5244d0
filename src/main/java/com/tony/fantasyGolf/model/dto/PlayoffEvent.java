package com.tony.fantasyGolf.model.dto;

import java.util.Map;

/**
 * Place d'un tournoi dans la série de playoffs (1, 2 ou 3) et scores reportés du tournoi précédent.
 *
 * @param index   1 pour le premier tournoi de playoffs, 3 pour la finale (et au-delà)
 * @param carryIn score final de chaque tour card au tournoi de playoffs précédent (vide pour le premier)
 */
public record PlayoffEvent(int index, Map<Long, Double> carryIn) {

    public static final PlayoffEvent FIRST = new PlayoffEvent(1, Map.of());
    public static final int FINAL = 3;

    public PlayoffEvent {
        index = Math.max(1, Math.min(index, FINAL));
        carryIn = carryIn == null ? Map.of() : Map.copyOf(carryIn);
    }

    /**
     * Nombre de golfeurs retenus par round : 10 puis 5 au 1er tournoi, 5 au 2e, 3 en finale.
     */
    public int countingGolfers(int round) {
        return switch (index) {
            case 1 -> round <= 2 ? 10 : 5;
            case 2 -> 5;
            default -> 3;
        };
    }

    public boolean isFinal() {
        return index == FINAL;
    }
}
