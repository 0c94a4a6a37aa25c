package org.jouca.live_arrivals.services;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jouca.live_arrivals.cache.TtlCache;
import org.jouca.live_arrivals.codecs.FeedSnapshot;
import org.jouca.live_arrivals.codecs.GtfsRtCodec;
import org.jouca.live_arrivals.fetchers.GtfsRtFetcher;
import org.jouca.live_arrivals.finders.ScheduleStore;
import org.jouca.live_arrivals.model.AggregatedResponse;
import org.jouca.live_arrivals.model.Visit;
import org.jouca.live_arrivals.records.TripInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delta-feed source.
 *
 * <p>The whole feed is downloaded at most once per snapshot TTL, whatever the number of
 * concurrent requests: the snapshot cache loads it single-flight under the key {@code feed}.
 * Trip metadata and the feed stop mapping are resolved in batch against the schedule and cached
 * per trip ({@code trip:{trip_id}}) and per feed stop ({@code stop:{feed_stop_id}}).
 *
 * @author Jouca
 * @since 1.0
 */
public class GtfsRtSource implements ArrivalSource {
    private static final Logger logger = LoggerFactory.getLogger(GtfsRtSource.class);

    static final String SNAPSHOT_KEY = "feed";

    private final GtfsRtCodec codec;
    private final GtfsRtFetcher fetcher;
    private final ScheduleStore store;
    private final TtlCache<String, FeedSnapshot> snapshotCache;
    private final TtlCache<String, TripInfo> tripInfoCache;
    private final TtlCache<String, String> stopMappingCache;
    private final int groupSize;

    public GtfsRtSource(GtfsRtCodec codec, GtfsRtFetcher fetcher, ScheduleStore store,
                        TtlCache<String, FeedSnapshot> snapshotCache,
                        TtlCache<String, TripInfo> tripInfoCache,
                        TtlCache<String, String> stopMappingCache,
                        int groupSize) {
        if (groupSize < 1) {
            throw new IllegalArgumentException("Group size must be positive: " + groupSize);
        }
        this.codec = codec;
        this.fetcher = fetcher;
        this.store = store;
        this.snapshotCache = snapshotCache;
        this.tripInfoCache = tripInfoCache;
        this.stopMappingCache = stopMappingCache;
        this.groupSize = groupSize;
    }

    @Override
    public String getProducer() {
        return Visit.PRODUCER_GTFS_RT;
    }

    @Override
    public int getGroupSize() {
        return groupSize;
    }

    /**
     * Returns the cached feed, downloading it when the snapshot has expired.
     */
    public FeedSnapshot fetchSnapshot() {
        return snapshotCache.get(SNAPSHOT_KEY, key -> new FeedSnapshot(fetcher.fetchFeed()));
    }

    @Override
    public AggregatedResponse fetch(List<String> stopCodes, int maxVisits) {
        FeedSnapshot snapshot = fetchSnapshot();
        Map<String, TripInfo> tripInfo = resolveTrips(snapshot.tripIds(codec.getTripIdPrefix()));
        Map<String, String> stopMapping = resolveStops(snapshot.feedStopIds());
        return codec.decode(snapshot, stopCodes, tripInfo, stopMapping);
    }

    private Map<String, TripInfo> resolveTrips(Set<String> tripIds) {
        Map<String, TripInfo> resolved = new HashMap<>();
        Set<String> missing = new HashSet<>();
        for (String tripId : tripIds) {
            TripInfo cached = tripInfoCache.getIfPresent("trip:" + tripId);
            if (cached == null) {
                missing.add(tripId);
            } else {
                resolved.put(tripId, cached);
            }
        }
        if (!missing.isEmpty()) {
            Map<String, TripInfo> loaded = store.findTripInfo(missing);
            logger.debug("Resolved {} of {} uncached trips", loaded.size(), missing.size());
            loaded.forEach((tripId, info) -> {
                tripInfoCache.put("trip:" + tripId, info);
                resolved.put(tripId, info);
            });
        }
        return resolved;
    }

    private Map<String, String> resolveStops(Set<String> feedStopIds) {
        Map<String, String> resolved = new HashMap<>();
        Set<String> missing = new HashSet<>();
        for (String feedStopId : feedStopIds) {
            String cached = stopMappingCache.getIfPresent("stop:" + feedStopId);
            if (cached == null) {
                missing.add(feedStopId);
            } else {
                resolved.put(feedStopId, cached);
            }
        }
        if (!missing.isEmpty()) {
            store.findMappedStopCodes(missing).forEach((feedStopId, stopCode) -> {
                stopMappingCache.put("stop:" + feedStopId, stopCode);
                resolved.put(feedStopId, stopCode);
            });
        }
        return resolved;
    }
}
