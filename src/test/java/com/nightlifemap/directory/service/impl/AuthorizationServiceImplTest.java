package com.nightlifemap.directory.service.impl;

import com.nightlifemap.directory.exception.RepositoryException;
import com.nightlifemap.directory.repository.VenueOwnerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthorizationServiceImplTest {

    private static final String VENUE_ID = "12345678-1234-1234-1234-123456789abc";
    private static final String USER_ID = "user-1";

    @Mock
    private VenueOwnerRepository ownerRepository;

    private AuthorizationServiceImpl authorizationService;

    @BeforeEach
    void setUp() {
        authorizationService = new AuthorizationServiceImpl(ownerRepository);
    }

    @Test
    void canPlaceVenue_Admin_AllowedWithoutOwnershipLookup() {
        assertThat(authorizationService.canPlaceVenue(USER_ID, "ADMIN", VENUE_ID)).isTrue();
        assertThat(authorizationService.canPlaceVenue(USER_ID, "moderator", VENUE_ID)).isTrue();
        verifyNoInteractions(ownerRepository);
    }

    @Test
    void canPlaceVenue_Owner_Allowed() {
        when(ownerRepository.isOwner(VENUE_ID, USER_ID)).thenReturn(true);

        assertThat(authorizationService.canPlaceVenue(USER_ID, "owner", VENUE_ID)).isTrue();
    }

    @Test
    void canPlaceVenue_NotOwner_Denied() {
        when(ownerRepository.isOwner(VENUE_ID, USER_ID)).thenReturn(false);

        assertThat(authorizationService.canPlaceVenue(USER_ID, null, VENUE_ID)).isFalse();
    }

    @Test
    void canPlaceVenue_LookupFails_Denied() {
        when(ownerRepository.isOwner(VENUE_ID, USER_ID)).thenThrow(new RepositoryException("Throttled"));

        assertThat(authorizationService.canPlaceVenue(USER_ID, "owner", VENUE_ID)).isFalse();
    }
}
