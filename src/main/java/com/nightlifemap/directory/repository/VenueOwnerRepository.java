package com.nightlifemap.directory.repository;

/**
 * Lookup of venue ownership records ({@code VENUE#{venueId}} / {@code OWNER#{userId}}).
 */
public interface VenueOwnerRepository {

    boolean isOwner(String venueId, String userId);
}
