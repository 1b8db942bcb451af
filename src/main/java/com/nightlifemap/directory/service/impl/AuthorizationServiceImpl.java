package com.nightlifemap.directory.service.impl;

import com.nightlifemap.directory.repository.VenueOwnerRepository;
import com.nightlifemap.directory.service.AuthorizationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Implementation of AuthorizationService.
 * Roles come from the upstream authentication layer; ownership from the venue's OWNER items.
 */
@Service
public class AuthorizationServiceImpl implements AuthorizationService {

    private static final Logger logger = LoggerFactory.getLogger(AuthorizationServiceImpl.class);
    private static final Set<String> PRIVILEGED_ROLES = Set.of("admin", "moderator");

    private final VenueOwnerRepository ownerRepository;

    @Autowired
    public AuthorizationServiceImpl(VenueOwnerRepository ownerRepository) {
        this.ownerRepository = ownerRepository;
    }

    @Override
    public boolean canPlaceVenue(String userId, String userRole, String venueId) {
        if (userRole != null && PRIVILEGED_ROLES.contains(userRole.toLowerCase())) {
            return true;
        }

        try {
            return ownerRepository.isOwner(venueId, userId);
        } catch (Exception e) {
            logger.warn("Error checking ownership of venue {} for user {}: {}",
                venueId, userId, e.getMessage());
            return false;
        }
    }
}
