package com.nightlifemap.directory.testutil;

import com.nightlifemap.directory.model.GridCell;
import com.nightlifemap.directory.model.Venue;

import java.util.UUID;

public class VenueTestBuilder {

    private String venueId;
    private String name;
    private String zone;
    private Integer row;
    private Integer col;

    private VenueTestBuilder() {
        this.venueId = UUID.randomUUID().toString();
        this.name = "Test Venue";
        this.zone = "soi6";
        this.row = 1;
        this.col = 1;
    }

    public static VenueTestBuilder aVenue() {
        return new VenueTestBuilder();
    }

    public VenueTestBuilder withId(String venueId) {
        this.venueId = venueId;
        return this;
    }

    public VenueTestBuilder withName(String name) {
        this.name = name;
        return this;
    }

    public VenueTestBuilder at(String zone, int row, int col) {
        this.zone = zone;
        this.row = row;
        this.col = col;
        return this;
    }

    public VenueTestBuilder unplacedIn(String zone) {
        this.zone = zone;
        this.row = null;
        this.col = null;
        return this;
    }

    public Venue build() {
        if (row == null) {
            return Venue.unplaced(venueId, name, zone);
        }
        return new Venue(venueId, name, new GridCell(zone, row, col));
    }
}
