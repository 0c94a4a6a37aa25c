package org.jouca.live_arrivals.services;

import org.jouca.live_arrivals.cache.TtlCache;
import org.jouca.live_arrivals.codecs.FeedSnapshot;
import org.jouca.live_arrivals.codecs.GtfsRtCodec;
import org.jouca.live_arrivals.exceptions.TransportException;
import org.jouca.live_arrivals.fetchers.GtfsRtFetcher;
import org.jouca.live_arrivals.finders.ScheduleStore;
import org.jouca.live_arrivals.model.AggregatedResponse;
import org.jouca.live_arrivals.records.TripInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.transit.realtime.GtfsRealtime.FeedEntity;
import com.google.transit.realtime.GtfsRealtime.FeedHeader;
import com.google.transit.realtime.GtfsRealtime.FeedMessage;
import com.google.transit.realtime.GtfsRealtime.TripDescriptor;
import com.google.transit.realtime.GtfsRealtime.TripUpdate;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GtfsRtSource class.
 * 
 * Tests snapshot sharing and schedule lookups caching.
 */
class GtfsRtSourceTest {

    private AtomicLong nanos;
    private GtfsRtFetcher fetcher;
    private ScheduleStore store;
    private FeedMessage feed;
    private GtfsRtSource source;

    @BeforeEach
    void setUp() {
        nanos = new AtomicLong();
        fetcher = mock(GtfsRtFetcher.class);
        store = mock(ScheduleStore.class);

        feed = FeedMessage.newBuilder()
            .setHeader(FeedHeader.newBuilder().setGtfsRealtimeVersion("2.0").setTimestamp(1742277600L))
            .addEntity(FeedEntity.newBuilder().setId("t1").setTripUpdate(TripUpdate.newBuilder()
                .setTrip(TripDescriptor.newBuilder().setTripId("900"))
                .addStopTimeUpdate(TripUpdate.StopTimeUpdate.newBuilder().setStopId("f1")
                    .setArrival(TripUpdate.StopTimeEvent.newBuilder().setTime(1742278200L)))))
            .build();
        when(fetcher.fetchFeed()).thenReturn(feed);
        when(store.findTripInfo(anyCollection()))
            .thenReturn(Map.of("ta900", new TripInfo("ta900", "1003", 0, "25", "5", "21473")));
        when(store.findMappedStopCodes(anyCollection())).thenReturn(Map.of("f1", "21471"));

        source = new GtfsRtSource(
            new GtfsRtCodec("ta", ZoneId.of("Asia/Jerusalem")),
            fetcher,
            store,
            new TtlCache<String, FeedSnapshot>("feed-snapshot", Duration.ofSeconds(30), nanos::get),
            new TtlCache<String, TripInfo>("trip-info", Duration.ofMinutes(30), nanos::get),
            new TtlCache<String, String>("feed-stops", Duration.ofMinutes(30), nanos::get),
            100);
    }

    @Test
    void testFeedIsDownloadedOncePerSnapshotTtl() {
        source.fetch(List.of("21471"), 50);
        source.fetch(List.of("21470"), 50);
        verify(fetcher, times(1)).fetchFeed();

        nanos.addAndGet(Duration.ofSeconds(31).toNanos());
        source.fetch(List.of("21471"), 50);
        verify(fetcher, times(2)).fetchFeed();
    }

    @Test
    void testScheduleLookupsAreCached() {
        source.fetch(List.of("21471"), 50);
        nanos.addAndGet(Duration.ofSeconds(31).toNanos());
        source.fetch(List.of("21471"), 50);

        verify(store, times(1)).findTripInfo(anyCollection());
        verify(store, times(1)).findMappedStopCodes(anyCollection());
    }

    @Test
    void testFetchDecodesRequestedStops() {
        AggregatedResponse response = source.fetch(List.of("21471", "21470"), 50);

        assertEquals(1, response.getVisits("21471").size());
        assertTrue(response.getVisits("21470").isEmpty());
        assertEquals("GTFS-RT", source.getProducer());
    }

    @Test
    void testDownloadFailurePropagatesAndIsNotCached() {
        when(fetcher.fetchFeed()).thenThrow(new TransportException("down")).thenReturn(feed);

        assertThrows(TransportException.class, () -> source.fetch(List.of("21471"), 50));
        // Nothing was cached, the next call downloads again
        assertSame(feed, source.fetchSnapshot().feed());
        verify(fetcher, times(2)).fetchFeed();
    }

    @Test
    void testInvalidGroupSizeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new GtfsRtSource(null, fetcher, store,
            null, null, null, 0));
    }
}
