package com.nightlifemap.directory.util;

import com.nightlifemap.directory.exception.InvalidKeyException;

import java.util.regex.Pattern;

/**
 * Type-safe key factory for the DirectoryTable single-table design.
 * Provides validated key generation with consistent patterns.
 */
public final class DirectoryKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}",
        Pattern.CASE_INSENSITIVE
    );

    public static final String TABLE_NAME = "DirectoryTable";
    public static final String ZONE_CELL_INDEX = "ZoneCellIndex";

    // Constants for magic strings
    public static final String VENUE_PREFIX = "VENUE";
    public static final String ZONE_PREFIX = "ZONE";
    public static final String CELL_PREFIX = "CELL";
    public static final String OWNER_PREFIX = "OWNER";
    public static final String LEASE_PREFIX = "LEASE";
    public static final String METADATA_SUFFIX = "METADATA";

    // Placement state constants, also used as the GSI sort key for venues without a cell
    public static final String STATE_PLACED = "PLACED";
    public static final String STATE_DETACHED = "DETACHED";
    public static final String STATE_UNPLACED = "UNPLACED";

    // Private constructor to prevent instantiation
    private DirectoryKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validateId(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
        if (!UUID_PATTERN.matcher(id).matches()) {
            throw new InvalidKeyException("Invalid " + type + " ID format: " + id);
        }
    }

    public static boolean isValidId(String id) {
        return id != null && UUID_PATTERN.matcher(id).matches();
    }

    // Venue Keys
    public static String getVenuePk(String venueId) {
        validateId(venueId, "Venue");
        return VENUE_PREFIX + DELIMITER + venueId;
    }

    public static String getMetadataSk() {
        return METADATA_SUFFIX;
    }

    public static String getOwnerSk(String userId) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new InvalidKeyException("User ID cannot be null or empty");
        }
        return OWNER_PREFIX + DELIMITER + userId;
    }

    // Lease Keys
    public static String getLeasePk(String venueId) {
        validateId(venueId, "Venue");
        return LEASE_PREFIX + DELIMITER + venueId;
    }

    // GSI Keys
    public static String getZoneGsi1Pk(String zone) {
        if (zone == null || zone.trim().isEmpty()) {
            throw new InvalidKeyException("Zone cannot be null or empty");
        }
        return ZONE_PREFIX + DELIMITER + zone;
    }

    /**
     * Cell sort key, zero-padded so a zone query returns cells in row-major order.
     */
    public static String getCellGsi1Sk(int row, int col) {
        if (row < 1 || col < 1) {
            throw new InvalidKeyException("Cell coordinates must be positive: " + row + "," + col);
        }
        return String.format("%s%s%03d%s%03d", CELL_PREFIX, DELIMITER, row, DELIMITER, col);
    }

    public static boolean isCellKey(String sortKey) {
        return sortKey != null && sortKey.startsWith(CELL_PREFIX + DELIMITER);
    }

    public static boolean isVenueMetadata(String pk, String sk) {
        return pk != null && pk.startsWith(VENUE_PREFIX + DELIMITER) && METADATA_SUFFIX.equals(sk);
    }
}
