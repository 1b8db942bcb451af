package com.nightlifemap.directory.util;

import com.nightlifemap.directory.exception.InvalidKeyException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DirectoryKeyFactoryTest {

    private static final String VENUE_ID = "12345678-1234-1234-1234-123456789abc";

    @Test
    void getVenuePk_ValidId() {
        assertThat(DirectoryKeyFactory.getVenuePk(VENUE_ID)).isEqualTo("VENUE#" + VENUE_ID);
        assertThat(DirectoryKeyFactory.getLeasePk(VENUE_ID)).isEqualTo("LEASE#" + VENUE_ID);
    }

    @Test
    void getVenuePk_InvalidId_Throws() {
        assertThatThrownBy(() -> DirectoryKeyFactory.getVenuePk("venue-1"))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("Invalid Venue ID format");
        assertThatThrownBy(() -> DirectoryKeyFactory.getVenuePk(" "))
            .isInstanceOf(InvalidKeyException.class);
    }

    @Test
    void getCellGsi1Sk_ZeroPaddedForRowMajorOrder() {
        assertThat(DirectoryKeyFactory.getCellGsi1Sk(1, 5)).isEqualTo("CELL#001#005");
        assertThat(DirectoryKeyFactory.getCellGsi1Sk(2, 1)).isGreaterThan(DirectoryKeyFactory.getCellGsi1Sk(1, 24));
        assertThat(DirectoryKeyFactory.getCellGsi1Sk(42, 24)).isLessThan(DirectoryKeyFactory.STATE_DETACHED);
        assertThat(DirectoryKeyFactory.isCellKey("CELL#001#005")).isTrue();
        assertThat(DirectoryKeyFactory.isCellKey(DirectoryKeyFactory.STATE_UNPLACED)).isFalse();
    }

    @Test
    void getCellGsi1Sk_NonPositive_Throws() {
        assertThatThrownBy(() -> DirectoryKeyFactory.getCellGsi1Sk(0, 1))
            .isInstanceOf(InvalidKeyException.class);
    }

    @Test
    void keyHelpers() {
        assertThat(DirectoryKeyFactory.getZoneGsi1Pk("soi6")).isEqualTo("ZONE#soi6");
        assertThat(DirectoryKeyFactory.getOwnerSk("user-1")).isEqualTo("OWNER#user-1");
        assertThat(DirectoryKeyFactory.isVenueMetadata("VENUE#" + VENUE_ID, "METADATA")).isTrue();
        assertThat(DirectoryKeyFactory.isVenueMetadata("LEASE#" + VENUE_ID, "METADATA")).isFalse();
        assertThat(DirectoryKeyFactory.isValidId(VENUE_ID.toUpperCase())).isTrue();
        assertThat(DirectoryKeyFactory.isValidId(null)).isFalse();
    }
}
