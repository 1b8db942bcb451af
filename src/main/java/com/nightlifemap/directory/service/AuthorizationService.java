package com.nightlifemap.directory.service;

/**
 * Service interface for placement authorization checks.
 */
public interface AuthorizationService {

    /**
     * Check if a user may change a venue's grid position.
     * Admins and moderators may place any venue; other users only venues they own.
     */
    boolean canPlaceVenue(String userId, String userRole, String venueId);
}
