package com.tony.fantasyGolf.model.dto;

import java.util.List;

/**
 * Les cinq groupes de sélection, du plus fort (groupe 1) au plus faible (groupe 5).
 */
public record GolferGroups(List<List<RankedGolfer>> groups) {

    public static final int GROUP_COUNT = 5;

    public GolferGroups {
        groups = groups.stream().map(List::copyOf).toList();
    }

    /**
     * @param number numéro de groupe, de 1 à 5
     */
    public List<RankedGolfer> group(int number) {
        return groups.get(number - 1);
    }

    public List<Integer> sizes() {
        return groups.stream().map(List::size).toList();
    }

    public int totalSize() {
        return groups.stream().mapToInt(List::size).sum();
    }

    public long nonEmptyCount() {
        return groups.stream().filter(g -> !g.isEmpty()).count();
    }
}
