package com.nightlifemap.directory.exception;

/**
 * Exception thrown when a referenced venue does not exist.
 */
public class VenueNotFoundException extends ResourceNotFoundException {

    private final String venueId;

    public VenueNotFoundException(String venueId) {
        super("Venue not found: " + venueId);
        this.venueId = venueId;
    }

    public String getVenueId() {
        return venueId;
    }
}
