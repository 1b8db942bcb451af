package com.nightlifemap.directory.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Zones of the venue map with their hand-specified layouts.
 */
public enum GridZone {
    SOI_6("soi6", "Soi 6", ZoneShape.rectangle(2, 20)),
    WALKING_STREET("walkingstreet", "Walking Street", ZoneShape.rectangle(42, 24)),
    // L-shape: row 2 loses its upper-right cell, row 3 its two lower-left cells where the arms meet
    LK_METRO("lkmetro", "LK Metro", ZoneShape.builder(4, 9)
        .maskTrailing(2, 1)
        .maskLeading(3, 2)
        .build()),
    // Main street on rows 1-2, then two vertical branches two columns wide: left on rows 3-8, right on rows 9-14
    TREETOWN("treetown", "Tree Town", treetownShape()),
    SOI_BUAKHAO("soibuakhao", "Soi Buakhao", ZoneShape.rectangle(2, 18)),
    JOMTIEN_COMPLEX("jomtiencomplex", "Jomtien Complex", ZoneShape.rectangle(2, 15)),
    BOYZTOWN("boyztown", "Boyztown", ZoneShape.rectangle(2, 12)),
    SOI_7_8("soi78", "Soi 7/8", ZoneShape.rectangle(3, 16)),
    BEACH_ROAD("beachroad", "Beach Road", ZoneShape.rectangle(2, 40));

    private final String id;
    private final String displayName;
    private final ZoneShape shape;

    GridZone(String id, String displayName, ZoneShape shape) {
        this.id = id;
        this.displayName = displayName;
        this.shape = shape;
    }

    private static ZoneShape treetownShape() {
        ZoneShape.Builder builder = ZoneShape.builder(14, 10)
            .row(2, 2, 9);
        for (int row = 3; row <= 14; row++) {
            builder.row(row, 1, 2);
        }
        return builder.build();
    }

    /**
     * Look up a zone by its identifier. Identifiers are matched exactly.
     */
    public static Optional<GridZone> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(zone -> zone.id.equals(id))
            .findFirst();
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public ZoneShape getShape() {
        return shape;
    }

    public boolean contains(int row, int col) {
        return shape.contains(row, col);
    }
}
