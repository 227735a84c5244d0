package com.tony.fantasyGolf.service;

import com.tony.fantasyGolf.model.dto.GolferGroups;
import com.tony.fantasyGolf.model.dto.RankedGolfer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class GolferGroupServiceTest {

    private GolferGroupService service;

    @BeforeEach
    void setUp() {
        service = new GolferGroupService();
    }

    @Test
    @DisplayName("Field de 100 golfeurs : 10 / 16 / 22 / 25 / 27")
    void shouldSplitHundredGolfers() {
        GolferGroups groups = service.buildGroups(field(100));

        assertThat(groups.sizes()).containsExactly(10, 16, 22, 25, 27);
        assertThat(groups.group(1)).extracting(RankedGolfer::apiId)
                .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
    }

    @Test
    @DisplayName("Les plafonds s'appliquent sur un gros field")
    void shouldCapGroupsOnLargeField() {
        GolferGroups groups = service.buildGroups(field(156));

        assertThat(groups.sizes()).containsExactly(10, 16, 22, 30, 78);
    }

    @Test
    void smallFieldShouldStillBePartitioned() {
        assertThat(service.buildGroups(field(40)).sizes()).containsExactly(4, 7, 9, 10, 10);
        assertThat(service.buildGroups(field(3)).sizes()).containsExactly(1, 1, 1, 0, 0);
        assertThat(service.buildGroups(List.of()).sizes()).containsExactly(0, 0, 0, 0, 0);
    }

    @Test
    @DisplayName("Chaque golfeur est dans exactement un groupe, trié par niveau")
    void groupsShouldPartitionTheField() {
        List<RankedGolfer> golfers = new ArrayList<>(field(73));
        Collections.reverse(golfers);

        GolferGroups groups = service.buildGroups(golfers);

        Set<Integer> seen = new HashSet<>();
        double previous = Double.NEGATIVE_INFINITY;
        for (int n = 1; n <= GolferGroups.GROUP_COUNT; n++) {
            for (RankedGolfer golfer : groups.group(n)) {
                assertThat(seen.add(golfer.apiId())).isTrue();
                assertThat(golfer.skillEstimate()).isGreaterThanOrEqualTo(previous);
                previous = golfer.skillEstimate();
            }
        }
        assertThat(seen).hasSize(73);
    }

    @Test
    @DisplayName("fieldSize limite la répartition aux meilleurs golfeurs")
    void fieldSizeShouldKeepOnlyTheBest() {
        GolferGroups groups = service.buildGroups(field(120), 100);

        assertThat(groups.totalSize()).isEqualTo(100);
        assertThat(groups.group(5)).extracting(RankedGolfer::apiId).doesNotContain(101, 120);
    }

    @Test
    void shouldBeDeterministicOnEqualSkill() {
        List<RankedGolfer> golfers = List.of(
                new RankedGolfer(30, "C", 1.0, null, null),
                new RankedGolfer(10, "A", 1.0, null, null),
                new RankedGolfer(20, "B", 1.0, null, null));

        assertThat(service.buildGroups(golfers).group(1)).extracting(RankedGolfer::apiId).containsExactly(10);
        assertThat(service.buildGroups(golfers).nonEmptyCount()).isEqualTo(3);
    }

    private static List<RankedGolfer> field(int size) {
        return IntStream.rangeClosed(1, size)
                .mapToObj(i -> new RankedGolfer(i, "Golfer " + i, (double) i, i, "USA"))
                .toList();
    }
}
