package org.jouca.live_arrivals.codecs;

import java.util.LinkedHashSet;
import java.util.Set;

import com.google.transit.realtime.GtfsRealtime.FeedEntity;
import com.google.transit.realtime.GtfsRealtime.FeedMessage;
import com.google.transit.realtime.GtfsRealtime.TripUpdate;

/**
 * One downloaded delta feed, shared by every request until the snapshot cache expires.
 *
 * @param feed the parsed feed message
 *
 * @author Jouca
 * @since 1.0
 */
public record FeedSnapshot(FeedMessage feed) {

    /**
     * Schedule trip ids referenced by the trip updates, i.e. the feed trip ids with {@code prefix}.
     */
    public Set<String> tripIds(String prefix) {
        Set<String> ids = new LinkedHashSet<>();
        for (FeedEntity entity : feed.getEntityList()) {
            if (entity.hasTripUpdate()) {
                ids.add(prefix + entity.getTripUpdate().getTrip().getTripId());
            }
        }
        return ids;
    }

    /** Feed-local stop ids referenced by the stop time updates. */
    public Set<String> feedStopIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (FeedEntity entity : feed.getEntityList()) {
            if (!entity.hasTripUpdate()) {
                continue;
            }
            for (TripUpdate.StopTimeUpdate update : entity.getTripUpdate().getStopTimeUpdateList()) {
                ids.add(update.getStopId());
            }
        }
        return ids;
    }
}
