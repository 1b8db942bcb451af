package com.nightlifemap.directory.service;

import com.nightlifemap.directory.exception.OutOfBoundsException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class ZoneShapeValidatorTest {

    private final ZoneShapeValidator validator = new ZoneShapeValidator();

    @ParameterizedTest
    @CsvSource({
        "soi6, 1, 1, true",
        "soi6, 2, 20, true",
        "soi6, 3, 1, false",
        "soi6, 1, 21, false",
        "walkingstreet, 42, 24, true",
        "walkingstreet, 43, 1, false",
        "soi78, 3, 16, true",
        "beachroad, 2, 40, true",
        "beachroad, 2, 41, false",
        "lkmetro, 2, 9, false",
        "lkmetro, 3, 2, false",
        "lkmetro, 3, 3, true",
        "unknownzone, 1, 1, false"
    })
    void isValid_MatchesZoneTable(String zone, int row, int col, boolean expected) {
        assertThat(validator.isValid(zone, row, col)).isEqualTo(expected);
    }

    @Test
    void isValid_NullZone_Invalid() {
        assertThat(validator.isValid(null, 1, 1)).isFalse();
    }

    @Test
    void requireValid_ValidCell_DoesNotThrow() {
        assertThatCode(() -> validator.requireValid("boyztown", 2, 12)).doesNotThrowAnyException();
    }

    @Test
    void requireValid_BadColumn_ReportsRangesForRow() {
        assertThatThrownBy(() -> validator.requireValid("lkmetro", 2, 9))
            .isInstanceOfSatisfying(OutOfBoundsException.class, e -> {
                assertThat(e.getZone()).isEqualTo("lkmetro");
                assertThat(e.getValidRows()).containsExactly(1, 4);
                assertThat(e.getValidCols()).containsExactly(1, 8);
            })
            .hasMessageContaining("LK Metro row 2 columns must be between 1 and 8");
    }

    @Test
    void requireValid_BadRow_NoColumnRange() {
        assertThatThrownBy(() -> validator.requireValid("soi6", 5, 1))
            .isInstanceOfSatisfying(OutOfBoundsException.class, e -> {
                assertThat(e.getValidRows()).containsExactly(1, 2);
                assertThat(e.getValidCols()).isNull();
            });
    }

    @Test
    void requireValid_UnknownZone_NoRanges() {
        assertThatThrownBy(() -> validator.requireValid("pattaya", 1, 1))
            .isInstanceOfSatisfying(OutOfBoundsException.class, e -> {
                assertThat(e.getValidRows()).isNull();
                assertThat(e.getValidCols()).isNull();
            });
    }
}
