package org.jouca.live_arrivals.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Cached visits of one stop, replaced wholesale on every refresh.
 *
 * @param visits the visits delivered for the stop, in arrival order
 * @param timestamp response timestamp of the fetch that produced them, may be null
 *
 * @author Jouca
 * @since 1.0
 */
public record CacheEntry(List<Visit> visits, OffsetDateTime timestamp) {

    public CacheEntry {
        visits = List.copyOf(visits);
    }
}
