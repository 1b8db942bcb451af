package com.nightlifemap.directory.repository.impl;

import com.nightlifemap.directory.model.GridCell;
import com.nightlifemap.directory.model.Venue;
import com.nightlifemap.directory.util.DirectoryKeyFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds the key, condition and update expressions shared by the single-row position writes
 * and the atomic exchange.
 *
 * {@code zone} is a DynamoDB reserved word, hence the {@code #zone} placeholder.
 */
final class PositionExpressions {

    static final String MOVE_UPDATE =
        "SET #zone = :zone, gridRow = :row, gridCol = :col, placementState = :state, "
            + "gsi1pk = :gsi1pk, gsi1sk = :gsi1sk, updatedAt = :now";

    static final String CLEAR_CELL_UPDATE =
        "SET #zone = :zone, placementState = :state, gsi1pk = :gsi1pk, gsi1sk = :gsi1sk, updatedAt = :now "
            + "REMOVE gridRow, gridCol";

    static final String EXPECT_PLACED =
        "attribute_exists(pk) AND #zone = :expZone AND gridRow = :expRow AND gridCol = :expCol";

    static final String EXPECT_NO_CELL =
        "attribute_exists(pk) AND #zone = :expZone AND attribute_not_exists(gridRow)";

    static final Map<String, String> ATTRIBUTE_NAMES = Map.of("#zone", "zone");

    private PositionExpressions() {
    }

    static Map<String, AttributeValue> venueKey(String venueId) {
        return Map.of(
            "pk", AttributeValue.builder().s(DirectoryKeyFactory.getVenuePk(venueId)).build(),
            "sk", AttributeValue.builder().s(DirectoryKeyFactory.getMetadataSk()).build()
        );
    }

    /**
     * Condition asserting the venue still holds the position it had when read.
     */
    static String expectedCondition(Venue expected) {
        return expected.isPlaced() ? EXPECT_PLACED : EXPECT_NO_CELL;
    }

    static Map<String, AttributeValue> expectedValues(Venue expected) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":expZone", s(expected.getZone()));
        if (expected.isPlaced()) {
            values.put(":expRow", n(expected.getGridRow()));
            values.put(":expCol", n(expected.getGridCol()));
        }
        return values;
    }

    static Map<String, AttributeValue> moveValues(Venue expected, GridCell newCell, long nowMillis) {
        Map<String, AttributeValue> values = expectedValues(expected);
        values.put(":zone", s(newCell.zone()));
        values.put(":row", n(newCell.row()));
        values.put(":col", n(newCell.col()));
        values.put(":state", s(DirectoryKeyFactory.STATE_PLACED));
        values.put(":gsi1pk", s(DirectoryKeyFactory.getZoneGsi1Pk(newCell.zone())));
        values.put(":gsi1sk", s(DirectoryKeyFactory.getCellGsi1Sk(newCell.row(), newCell.col())));
        values.put(":now", n(nowMillis));
        return values;
    }

    /**
     * Values for clearing a cell and listing the venue under {@code zone}; the state doubles as the
     * GSI sort key.
     */
    static Map<String, AttributeValue> clearCellValues(Venue expected, String zone, String state, long nowMillis) {
        Map<String, AttributeValue> values = expectedValues(expected);
        values.put(":zone", s(zone));
        values.put(":gsi1pk", s(DirectoryKeyFactory.getZoneGsi1Pk(zone)));
        values.put(":state", s(state));
        values.put(":gsi1sk", s(state));
        values.put(":now", n(nowMillis));
        return values;
    }

    private static AttributeValue s(String value) {
        return AttributeValue.builder().s(value).build();
    }

    private static AttributeValue n(long value) {
        return AttributeValue.builder().n(String.valueOf(value)).build();
    }
}
