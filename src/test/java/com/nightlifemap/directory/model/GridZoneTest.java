package com.nightlifemap.directory.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GridZoneTest {

    @Nested
    @DisplayName("LK Metro L-shape")
    class LkMetro {

        private final GridZone zone = GridZone.LK_METRO;

        @Test
        void row2_ExcludesLastColumn() {
            assertThat(zone.contains(2, 9)).isFalse();
            assertThat(zone.contains(2, 8)).isTrue();
        }

        @Test
        void row3_ExcludesFirstTwoColumns() {
            assertThat(zone.contains(3, 1)).isFalse();
            assertThat(zone.contains(3, 2)).isFalse();
            assertThat(zone.contains(3, 3)).isTrue();
            assertThat(zone.contains(3, 9)).isTrue();
        }

        @Test
        void rows1And4_AcceptFullColumnRange() {
            for (int col = 1; col <= 9; col++) {
                assertThat(zone.contains(1, col)).as("row 1 col %d", col).isTrue();
                assertThat(zone.contains(4, col)).as("row 4 col %d", col).isTrue();
            }
            assertThat(zone.contains(1, 10)).isFalse();
            assertThat(zone.contains(5, 1)).isFalse();
        }

        @Test
        void cellCount_CountsOnlyUnmaskedCells() {
            assertThat(zone.getShape().getCellCount()).isEqualTo(36 - 1 - 2);
            assertThat(zone.getShape().getMaxCols()).isEqualTo(9);
        }
    }

    @Test
    void treetown_MainStreetWithTwoVerticalBranches() {
        GridZone zone = GridZone.TREETOWN;

        assertThat(zone.contains(1, 1)).isTrue();
        assertThat(zone.contains(1, 10)).isTrue();
        assertThat(zone.contains(2, 1)).isFalse();
        assertThat(zone.contains(2, 9)).isTrue();
        assertThat(zone.contains(2, 10)).isFalse();
        assertThat(zone.contains(3, 1)).isTrue();
        assertThat(zone.contains(8, 2)).isTrue();
        assertThat(zone.contains(9, 1)).isTrue();
        assertThat(zone.contains(14, 2)).isTrue();
        assertThat(zone.getShape().columnRange(8)).containsExactly(1, 2);
        assertThat(zone.getShape().columnRange(9)).containsExactly(1, 2);
        assertThat(zone.contains(7, 3)).isFalse();
        assertThat(zone.contains(15, 1)).isFalse();
        assertThat(zone.getShape().getCellCount()).isEqualTo(10 + 8 + 12 * 2);
    }

    @Test
    void rectangles_MatchZoneTable() {
        assertThat(GridZone.SOI_6.getShape().getRows()).isEqualTo(2);
        assertThat(GridZone.SOI_6.getShape().getMaxCols()).isEqualTo(20);
        assertThat(GridZone.WALKING_STREET.getShape().getCellCount()).isEqualTo(42 * 24);
        assertThat(GridZone.SOI_BUAKHAO.getShape().getMaxCols()).isEqualTo(18);
        assertThat(GridZone.JOMTIEN_COMPLEX.getShape().getMaxCols()).isEqualTo(15);
        assertThat(GridZone.BOYZTOWN.getShape().getMaxCols()).isEqualTo(12);
        assertThat(GridZone.SOI_7_8.getShape().getRows()).isEqualTo(3);
        assertThat(GridZone.BEACH_ROAD.getShape().getMaxCols()).isEqualTo(40);
    }

    @Test
    void fromId_ExactMatchOnly() {
        assertThat(GridZone.fromId("walkingstreet")).contains(GridZone.WALKING_STREET);
        assertThat(GridZone.fromId("WalkingStreet")).isEmpty();
        assertThat(GridZone.fromId("")).isEmpty();
        assertThat(GridZone.fromId(null)).isEmpty();
    }

    @Test
    void columnRange_ReturnsCopy() {
        int[] range = GridZone.LK_METRO.getShape().columnRange(3);
        range[0] = 1;

        assertThat(GridZone.LK_METRO.contains(3, 1)).isFalse();
        assertThat(GridZone.LK_METRO.getShape().columnRange(0)).isNull();
    }
}
