package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.dto.GolferGroups;
import com.tony.fantasyGolf.model.dto.RankedGolfer;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Répartit le field d'un tournoi en 5 groupes de niveau.
 *
 * <pre>
 * Groupe 1 : 10 %   du field, 10 max
 * Groupe 2 : 17,5 % du field, 16 max
 * Groupe 3 : 22,5 % du field, 22 max
 * Groupe 4 : 25 %   du field, 30 max
 * Groupe 5 : le reste
 * </pre>
 *
 * Chaque golfeur doit avoir une estimation de niveau (filtrage fait en amont).
 */
@Service
public class GolferGroupService {

    // Pourcentages en pour-mille pour éviter les arrondis flottants (0.175 * 40 = 7.000000000000001)
    private static final int[] SHARE_PER_MILLE = {100, 175, 225, 250};
    private static final int[] MAX_COUNT = {10, 16, 22, 30};

    static final Comparator<RankedGolfer> BY_SKILL = Comparator
            .comparing(RankedGolfer::skillEstimate, Comparator.nullsLast(Comparator.<Double>naturalOrder()))
            .thenComparing(RankedGolfer::apiId, Comparator.nullsLast(Comparator.<Integer>naturalOrder()));

    public GolferGroups buildGroups(List<RankedGolfer> golfers) {
        return buildGroups(golfers, golfers.size());
    }

    /**
     * @param fieldSize taille du field retenu : seuls les {@code fieldSize} meilleurs golfeurs sont répartis
     */
    public GolferGroups buildGroups(List<RankedGolfer> golfers, int fieldSize) {
        List<RankedGolfer> ranked = golfers.stream().sorted(BY_SKILL).toList();
        int size = Math.max(0, Math.min(fieldSize, ranked.size()));

        List<List<RankedGolfer>> groups = new ArrayList<>();
        int cumulative = 0;
        for (int i = 0; i < SHARE_PER_MILLE.length; i++) {
            int slice = Math.min(Math.min(MAX_COUNT[i], ceilShare(SHARE_PER_MILLE[i], size)), size - cumulative);
            groups.add(ranked.subList(cumulative, cumulative + slice));
            cumulative += slice;
        }
        // Le groupe 5 n'a pas de plafond
        groups.add(ranked.subList(cumulative, size));

        return new GolferGroups(groups);
    }

    private static int ceilShare(int perMille, int size) {
        return (perMille * size + 999) / 1000;
    }
}
