package com.nightlifemap.directory.repository;

import java.time.Instant;

/**
 * Short-lived exclusive leases keyed by venue ID, used to keep placements of the same venue
 * from overlapping.
 */
public interface PlacementLeaseRepository {

    /**
     * Take the lease unless someone else holds an unexpired one.
     * @param venueId The venue to lock
     * @param ownerToken Token identifying this holder
     * @param expiresAt When the lease lapses if never released
     * @return true if the lease was taken
     */
    boolean tryAcquire(String venueId, String ownerToken, Instant expiresAt);

    /**
     * Release a lease this holder owns. Releasing someone else's lease is a no-op.
     */
    void release(String venueId, String ownerToken);
}
