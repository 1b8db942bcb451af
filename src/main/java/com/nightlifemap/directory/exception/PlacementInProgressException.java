package com.nightlifemap.directory.exception;

/**
 * Exception thrown when another placement already holds the lease for a venue.
 */
public class PlacementInProgressException extends RuntimeException {

    private final String venueId;

    public PlacementInProgressException(String venueId) {
        super("Another placement is in progress for venue " + venueId);
        this.venueId = venueId;
    }

    public String getVenueId() {
        return venueId;
    }
}
