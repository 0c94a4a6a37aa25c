package org.jouca.live_arrivals.codecs;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.jouca.live_arrivals.model.AggregatedResponse;
import org.jouca.live_arrivals.model.Visit;
import org.jouca.live_arrivals.records.Location;
import org.jouca.live_arrivals.records.TripInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.transit.realtime.GtfsRealtime.FeedEntity;
import com.google.transit.realtime.GtfsRealtime.FeedMessage;
import com.google.transit.realtime.GtfsRealtime.TripUpdate;
import com.google.transit.realtime.GtfsRealtime.VehiclePosition;

/**
 * Decodes the GTFS-RT delta feed into visits.
 *
 * <p>The feed carries neither stop codes nor route metadata:
 * <ul>
 *   <li>feed stop ids are translated to stop codes through the feed stop mapping; updates for
 *       unmapped stops are skipped</li>
 *   <li>route, direction, operator and destination come from the schedule, looked up by the
 *       feed trip id with the configured prefix; a trip the schedule does not know is dropped
 *       with a warning</li>
 * </ul>
 * Vehicle positions are indexed by vehicle id first so every update can carry the position of
 * its vehicle; a vehicle without a position entity simply has no location.
 *
 * @author Jouca
 * @since 1.0
 */
public class GtfsRtCodec {
    private static final Logger logger = LoggerFactory.getLogger(GtfsRtCodec.class);

    private final String tripIdPrefix;
    private final ZoneId zone;

    /**
     * @param tripIdPrefix prefix turning a feed trip id into a schedule trip id
     * @param zone zone in which feed times are reported
     */
    public GtfsRtCodec(String tripIdPrefix, ZoneId zone) {
        this.tripIdPrefix = tripIdPrefix;
        this.zone = zone;
    }

    public String getTripIdPrefix() {
        return tripIdPrefix;
    }

    /**
     * Decodes the visits of {@code requestedStopCodes}.
     *
     * @param snapshot the feed snapshot
     * @param requestedStopCodes stop codes to report; every one of them is a key of the result
     * @param tripInfo schedule metadata by schedule trip id
     * @param stopMapping stop code by feed stop id
     * @return the decoded visits, timestamped with the feed header time
     */
    public AggregatedResponse decode(FeedSnapshot snapshot, Collection<String> requestedStopCodes,
                                     Map<String, TripInfo> tripInfo, Map<String, String> stopMapping) {
        FeedMessage feed = snapshot.feed();
        OffsetDateTime timestamp = toTime(feed.getHeader().getTimestamp());
        AggregatedResponse result = new AggregatedResponse(requestedStopCodes, timestamp);
        Set<String> requested = new HashSet<>(requestedStopCodes);

        Map<String, Location> vehiclePositions = new HashMap<>();
        for (FeedEntity entity : feed.getEntityList()) {
            if (entity.hasVehicle()) {
                VehiclePosition vehicle = entity.getVehicle();
                if (vehicle.hasPosition()) {
                    vehiclePositions.put(vehicle.getVehicle().getId(),
                        new Location(vehicle.getPosition().getLatitude(), vehicle.getPosition().getLongitude()));
                }
            }
        }

        for (FeedEntity entity : feed.getEntityList()) {
            if (!entity.hasTripUpdate()) {
                continue;
            }
            TripUpdate tripUpdate = entity.getTripUpdate();
            String tripId = tripIdPrefix + tripUpdate.getTrip().getTripId();
            String vehicleId = tripUpdate.hasVehicle() ? tripUpdate.getVehicle().getId() : null;

            for (TripUpdate.StopTimeUpdate update : tripUpdate.getStopTimeUpdateList()) {
                String stopCode = stopMapping.get(update.getStopId());
                if (stopCode == null || !requested.contains(stopCode)) {
                    continue;
                }
                TripInfo info = tripInfo.get(tripId);
                if (info == null) {
                    logger.warn("Missing schedule info for trip {}, dropping its visit to stop {}", tripId, stopCode);
                    continue;
                }
                OffsetDateTime eta = eta(update);
                if (eta == null) {
                    logger.debug("Stop time update of trip {} at stop {} has no time", tripId, stopCode);
                    continue;
                }
                result.addVisit(Visit.builder(Visit.PRODUCER_GTFS_RT)
                    .timestamp(timestamp)
                    .stopCode(stopCode)
                    .routeId(info.routeId())
                    .directionId(info.directionId() == null ? null : String.valueOf(info.directionId()))
                    .lineName(info.routeShortName())
                    .operatorId(info.agencyId())
                    .destinationId(info.destinationCode())
                    .vehicleRef(vehicleId)
                    .tripId(tripId)
                    .eta(eta)
                    .location(vehicleId == null ? null : vehiclePositions.get(vehicleId))
                    .build());
            }
        }
        return result;
    }

    private OffsetDateTime eta(TripUpdate.StopTimeUpdate update) {
        if (update.hasArrival() && update.getArrival().hasTime()) {
            return toTime(update.getArrival().getTime());
        }
        if (update.hasDeparture() && update.getDeparture().hasTime()) {
            return toTime(update.getDeparture().getTime());
        }
        return null;
    }

    private OffsetDateTime toTime(long epochSeconds) {
        return OffsetDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), zone);
    }
}
