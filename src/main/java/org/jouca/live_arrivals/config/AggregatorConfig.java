package org.jouca.live_arrivals.config;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.jouca.live_arrivals.cache.TtlCache;
import org.jouca.live_arrivals.codecs.GtfsRtCodec;
import org.jouca.live_arrivals.codecs.SiriCodec;
import org.jouca.live_arrivals.codecs.SiriEnvelopeReader;
import org.jouca.live_arrivals.fetchers.GtfsRtFetcher;
import org.jouca.live_arrivals.fetchers.SiriFetcher;
import org.jouca.live_arrivals.finders.SqliteScheduleStore;
import org.jouca.live_arrivals.services.AddressParser;
import org.jouca.live_arrivals.services.GtfsRtSource;
import org.jouca.live_arrivals.services.LiveArrivalsService;
import org.jouca.live_arrivals.services.PropertiesOperatorDirectory;
import org.jouca.live_arrivals.services.RequestBatcher;
import org.jouca.live_arrivals.services.ResponseMerger;
import org.jouca.live_arrivals.services.RouteNameTranslator;
import org.jouca.live_arrivals.services.ScheduleCrossReferencer;
import org.jouca.live_arrivals.services.SiriSource;
import org.jouca.live_arrivals.services.TownSynonyms;
import org.jouca.live_arrivals.services.TranslationResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Wires the aggregation engine.
 *
 * <p>Non-secret settings come from {@code application.properties}. The stop-monitoring requestor
 * reference and the delta feed key are secrets read from a {@code .env} file, or from the
 * process environment when there is none.
 *
 * @author Jouca
 * @since 1.0
 */
@Configuration
public class AggregatorConfig {
    private static final Logger logger = LoggerFactory.getLogger(AggregatorConfig.class);

    private static final Duration TRANSLATION_TTL = Duration.ofMinutes(30);

    @Value("${siri.url}")
    private String siriUrl;

    @Value("${siri.group-size:25}")
    private int siriGroupSize;

    @Value("${siri.max-visits:50}")
    private int siriMaxVisits;

    @Value("${siri.cache-ttl-seconds:30}")
    private long siriCacheTtlSeconds;

    @Value("${siri.preview-interval:PT30M}")
    private String siriPreviewInterval;

    @Value("${gtfsrt.url:}")
    private String gtfsRtUrl;

    @Value("${gtfsrt.group-size:100}")
    private int gtfsRtGroupSize;

    @Value("${gtfsrt.snapshot-ttl-seconds:30}")
    private long gtfsRtSnapshotTtlSeconds;

    @Value("${gtfsrt.cache-ttl-seconds:30}")
    private long gtfsRtCacheTtlSeconds;

    @Value("${gtfsrt.trip-id-prefix:ta}")
    private String gtfsRtTripIdPrefix;

    @Value("${gtfsrt.trip-info-ttl-minutes:30}")
    private long gtfsRtTripInfoTtlMinutes;

    @Value("${gtfsrt.active-days:5,6}")
    private int[] gtfsRtActiveDays;

    @Value("${gtfs.db-path}")
    private String gtfsDbPath;

    @Value("${http.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${http.read-timeout-ms:20000}")
    private int readTimeoutMs;

    @Value("${aggregator.request-timeout-ms:25000}")
    private long requestTimeoutMs;

    @Value("${aggregator.max-stops:30}")
    private int maxStops;

    @Value("${aggregator.zone:Asia/Jerusalem}")
    private String zone;

    @Bean
    public Dotenv dotenv() {
        return Dotenv.configure().ignoreIfMissing().load();
    }

    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of(zone));
    }

    @Bean(destroyMethod = "close")
    public SqliteScheduleStore scheduleStore() {
        return new SqliteScheduleStore(gtfsDbPath);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public ResponseMerger responseMerger() {
        return new ResponseMerger();
    }

    @Bean
    public SiriSource siriSource(ObjectMapper objectMapper, Dotenv dotenv, Clock clock) {
        String requestorRef = dotenv.get("SIRI_REQUESTOR_REF");
        if (requestorRef == null) {
            logger.warn("SIRI_REQUESTOR_REF is not set, stop-monitoring requests will be rejected");
        }
        SiriCodec codec = new SiriCodec(new SiriEnvelopeReader(objectMapper), requestorRef, siriPreviewInterval, clock);
        return new SiriSource(codec, new SiriFetcher(siriUrl, connectTimeoutMs, readTimeoutMs), siriGroupSize);
    }

    @Bean
    public TranslationResolver translationResolver(SqliteScheduleStore scheduleStore) {
        return new TranslationResolver(scheduleStore, new AddressParser(),
            new TtlCache<String, Map<String, String>>("translations", TRANSLATION_TTL),
            new TtlCache<String, Optional<String>>("cities", TRANSLATION_TTL));
    }

    @Bean
    public ScheduleCrossReferencer scheduleCrossReferencer(SqliteScheduleStore scheduleStore,
                                                           TranslationResolver translationResolver) {
        RouteNameTranslator routeNames = new RouteNameTranslator(translationResolver,
            TownSynonyms.fromResource("town-synonyms.properties"),
            new TtlCache<String, String>("route-names", TRANSLATION_TTL));
        return new ScheduleCrossReferencer(scheduleStore, translationResolver, routeNames,
            new PropertiesOperatorDirectory("operators.properties"));
    }

    @Bean
    public LiveArrivalsService liveArrivalsService(SiriSource siriSource, SqliteScheduleStore scheduleStore,
                                                   ScheduleCrossReferencer scheduleCrossReferencer,
                                                   ResponseMerger responseMerger, ExecutorService fetchExecutor,
                                                   Dotenv dotenv, Clock clock) {
        Duration timeout = Duration.ofMillis(requestTimeoutMs);
        RequestBatcher siriBatcher = new RequestBatcher(siriSource,
            new TtlCache<>("siri-visits", Duration.ofSeconds(siriCacheTtlSeconds)),
            responseMerger, fetchExecutor, timeout);

        RequestBatcher deltaFeedBatcher = null;
        if (gtfsRtUrl != null && !gtfsRtUrl.isBlank()) {
            GtfsRtSource deltaFeed = new GtfsRtSource(
                new GtfsRtCodec(gtfsRtTripIdPrefix, clock.getZone()),
                new GtfsRtFetcher(gtfsRtUrl, dotenv.get("GTFS_RT_AUTH_KEY"), connectTimeoutMs, readTimeoutMs),
                scheduleStore,
                new TtlCache<>("feed-snapshot", Duration.ofSeconds(gtfsRtSnapshotTtlSeconds)),
                new TtlCache<>("trip-info", Duration.ofMinutes(gtfsRtTripInfoTtlMinutes)),
                new TtlCache<>("feed-stops", Duration.ofMinutes(gtfsRtTripInfoTtlMinutes)),
                gtfsRtGroupSize);
            deltaFeedBatcher = new RequestBatcher(deltaFeed,
                new TtlCache<>("delta-feed-visits", Duration.ofSeconds(gtfsRtCacheTtlSeconds)),
                responseMerger, fetchExecutor, timeout);
        } else {
            logger.info("gtfsrt.url is not set, the delta feed is disabled");
        }

        return new LiveArrivalsService(siriBatcher, deltaFeedBatcher, responseMerger, scheduleCrossReferencer,
            activeDays(gtfsRtActiveDays), maxStops, siriMaxVisits, clock);
    }

    static Set<DayOfWeek> activeDays(int[] isoDays) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (int day : isoDays) {
            days.add(DayOfWeek.of(day));
        }
        return days;
    }
}
