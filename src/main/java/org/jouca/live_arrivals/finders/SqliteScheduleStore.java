package org.jouca.live_arrivals.finders;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.commons.dbcp2.BasicDataSource;
import org.jouca.live_arrivals.exceptions.ScheduleStoreException;
import org.jouca.live_arrivals.records.Agency;
import org.jouca.live_arrivals.records.City;
import org.jouca.live_arrivals.records.Route;
import org.jouca.live_arrivals.records.Stop;
import org.jouca.live_arrivals.records.StopTime;
import org.jouca.live_arrivals.records.Translation;
import org.jouca.live_arrivals.records.Trip;
import org.jouca.live_arrivals.records.TripInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ScheduleStore} backed by a SQLite copy of the static schedule.
 *
 * <p>Expected tables: {@code agency, routes, trips, stops, stop_times, translations, cities}
 * with GTFS column names, plus {@code feed_stop_mappings(feed_stop_id, stop_id)} produced by
 * {@link FeedStopMatcher}. All queries use prepared statements from a pooled data source.
 *
 * @author Jouca
 * @since 1.0
 */
public class SqliteScheduleStore implements ScheduleStore, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SqliteScheduleStore.class);

    private static final String STOP_COLUMNS =
        "stop_id, stop_code, stop_name, stop_desc, stop_lat, stop_lon";

    /** Connection pool; the database is only read, so WAL lets many readers run at once. */
    private final BasicDataSource dataSource = new BasicDataSource();

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /**
     * Opens a pool on the SQLite file at {@code dbPath}.
     *
     * @param dbPath path of the database file
     */
    public SqliteScheduleStore(String dbPath) {
        dataSource.setUrl("jdbc:sqlite:" + dbPath);
        dataSource.setMinIdle(2);
        dataSource.setMaxIdle(8);
        dataSource.setMaxTotal(16);
        dataSource.setPoolPreparedStatements(true);
        dataSource.setMaxOpenPreparedStatements(128);
        dataSource.setDefaultQueryTimeout(Duration.ofSeconds(10));
        dataSource.setConnectionInitSqls(Arrays.asList(
            "PRAGMA journal_mode=WAL",
            "PRAGMA temp_store=MEMORY",
            "PRAGMA cache_size=-65536"
        ));
        logger.info("Static schedule store opened on {}", dbPath);
    }

    @Override
    public Agency findAgency(String agencyId) {
        return first("SELECT agency_id, agency_name, agency_url FROM agency WHERE agency_id = ? LIMIT 1;",
            List.of(agencyId),
            rs -> new Agency(rs.getString("agency_id"), rs.getString("agency_name"), rs.getString("agency_url")));
    }

    @Override
    public Route findRoute(String routeId) {
        return first("SELECT * FROM routes WHERE route_id = ? LIMIT 1;", List.of(routeId), SqliteScheduleStore::mapRoute);
    }

    @Override
    public List<Route> findRoutes(String agencyId, String routeShortName) {
        return query("SELECT * FROM routes WHERE agency_id = ? AND route_short_name = ? ORDER BY route_id;",
            List.of(agencyId, routeShortName), SqliteScheduleStore::mapRoute);
    }

    @Override
    public Trip findTrip(String tripId) {
        return first("SELECT * FROM trips WHERE trip_id = ? LIMIT 1;", List.of(tripId), SqliteScheduleStore::mapTrip);
    }

    @Override
    public List<Trip> findTripsByRoute(String routeId, Integer directionId) {
        if (directionId == null) {
            return query("SELECT * FROM trips WHERE route_id = ? ORDER BY trip_id;",
                List.of(routeId), SqliteScheduleStore::mapTrip);
        }
        return query("SELECT * FROM trips WHERE route_id = ? AND direction_id = ? ORDER BY trip_id;",
            List.of(routeId, directionId), SqliteScheduleStore::mapTrip);
    }

    @Override
    public List<StopTime> findStopTimes(String tripId) {
        return query("""
                SELECT trip_id, stop_id, stop_sequence, arrival_time, departure_time
                FROM stop_times WHERE trip_id = ? ORDER BY stop_sequence;
            """, List.of(tripId), rs -> new StopTime(
                rs.getString("trip_id"),
                rs.getString("stop_id"),
                rs.getInt("stop_sequence"),
                rs.getString("arrival_time"),
                rs.getString("departure_time")));
    }

    @Override
    public Stop findStopById(String stopId) {
        return first("SELECT " + STOP_COLUMNS + " FROM stops WHERE stop_id = ? LIMIT 1;",
            List.of(stopId), SqliteScheduleStore::mapStop);
    }

    @Override
    public Stop findStopByCode(String stopCode) {
        return first("SELECT " + STOP_COLUMNS + " FROM stops WHERE stop_code = ? LIMIT 1;",
            List.of(stopCode), SqliteScheduleStore::mapStop);
    }

    @Override
    public List<Stop> findStopsByIds(Collection<String> stopIds) {
        if (stopIds.isEmpty()) {
            return List.of();
        }
        return query("SELECT " + STOP_COLUMNS + " FROM stops WHERE stop_id IN (" + placeholders(stopIds.size()) + ");",
            new ArrayList<>(stopIds), SqliteScheduleStore::mapStop);
    }

    @Override
    public List<Stop> findStopsAt(double lat, double lon) {
        return query("SELECT " + STOP_COLUMNS + " FROM stops WHERE stop_lat = ? AND stop_lon = ?;",
            List.of(lat, lon), SqliteScheduleStore::mapStop);
    }

    @Override
    public List<Stop> findStopsByName(String stopName) {
        return query("SELECT " + STOP_COLUMNS + " FROM stops WHERE stop_name = ?;",
            List.of(stopName), SqliteScheduleStore::mapStop);
    }

    @Override
    public List<Stop> findStopsInBox(double minLat, double maxLat, double minLon, double maxLon) {
        return query("SELECT " + STOP_COLUMNS + " FROM stops"
                + " WHERE stop_lat BETWEEN ? AND ? AND stop_lon BETWEEN ? AND ?;",
            List.of(minLat, maxLat, minLon, maxLon), SqliteScheduleStore::mapStop);
    }

    @Override
    public List<Translation> findTranslations(Collection<String> sources, String lang) {
        if (sources.isEmpty()) {
            return List.of();
        }
        List<Object> params = new ArrayList<>(sources);
        String sql = "SELECT trans_id, lang, translation FROM translations WHERE trans_id IN ("
            + placeholders(sources.size()) + ")";
        if (lang != null) {
            sql += " AND lang = ?";
            params.add(lang);
        }
        return query(sql + ";", params,
            rs -> new Translation(rs.getString("trans_id"), rs.getString("lang"), rs.getString("translation")));
    }

    @Override
    public City findCity(String name) {
        return first("SELECT name, english_name FROM cities WHERE name = ? LIMIT 1;", List.of(name),
            rs -> new City(rs.getString("name"), rs.getString("english_name")));
    }

    @Override
    public int countRoutes(String agencyId) {
        Integer count = first("""
                SELECT COUNT(DISTINCT CASE
                    WHEN instr(route_desc, '-') > 0 THEN substr(route_desc, 1, instr(route_desc, '-') - 1)
                    ELSE route_desc END) AS route_count
                FROM routes WHERE agency_id = ?;
            """, List.of(agencyId), rs -> rs.getInt("route_count"));
        return count == null ? 0 : count;
    }

    @Override
    public Map<String, TripInfo> findTripInfo(Collection<String> tripIds) {
        if (tripIds.isEmpty()) {
            return Map.of();
        }
        String sql = """
                SELECT t.trip_id, t.route_id, t.direction_id, r.route_short_name, r.agency_id,
                    (SELECT s.stop_code FROM stop_times st
                     JOIN stops s ON s.stop_id = st.stop_id
                     WHERE st.trip_id = t.trip_id
                     ORDER BY st.stop_sequence DESC LIMIT 1) AS destination_code
                FROM trips t
                LEFT JOIN routes r ON r.route_id = t.route_id
                WHERE t.trip_id IN (%s);
            """.formatted(placeholders(tripIds.size()));
        List<TripInfo> rows = query(sql, new ArrayList<>(tripIds), rs -> new TripInfo(
            rs.getString("trip_id"),
            rs.getString("route_id"),
            nullableInt(rs, "direction_id"),
            rs.getString("route_short_name"),
            rs.getString("agency_id"),
            rs.getString("destination_code")));
        Map<String, TripInfo> result = new HashMap<>();
        for (TripInfo row : rows) {
            result.put(row.tripId(), row);
        }
        return result;
    }

    @Override
    public Map<String, String> findMappedStopCodes(Collection<String> feedStopIds) {
        if (feedStopIds.isEmpty()) {
            return Map.of();
        }
        String sql = """
                SELECT m.feed_stop_id, s.stop_code
                FROM feed_stop_mappings m
                JOIN stops s ON s.stop_id = m.stop_id
                WHERE m.feed_stop_id IN (%s);
            """.formatted(placeholders(feedStopIds.size()));
        Map<String, String> result = new HashMap<>();
        for (String[] row : query(sql, new ArrayList<>(feedStopIds),
                rs -> new String[] {rs.getString("feed_stop_id"), rs.getString("stop_code")})) {
            if (row[1] != null) {
                result.put(row[0], row[1]);
            }
        }
        return result;
    }

    @Override
    public void close() throws SQLException {
        dataSource.close();
    }

    private <T> T first(String sql, List<?> params, RowMapper<T> mapper) {
        List<T> rows = query(sql, params, mapper);
        return rows.isEmpty() ? null : rows.get(0);
    }

    private <T> List<T> query(String sql, List<?> params, RowMapper<T> mapper) {
        List<T> results = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            int i = 1;
            for (Object param : params) {
                stmt.setObject(i++, param);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
            }
        } catch (SQLException e) {
            logger.error("Static schedule query failed: {}", sql.strip(), e);
            throw new ScheduleStoreException("Static schedule query failed", e);
        }
        return results;
    }

    private static String placeholders(int count) {
        return Collections.nCopies(count, "?").stream().collect(Collectors.joining(","));
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static Route mapRoute(ResultSet rs) throws SQLException {
        return new Route(
            rs.getString("route_id"),
            rs.getString("agency_id"),
            rs.getString("route_short_name"),
            rs.getString("route_long_name"),
            rs.getString("route_desc"),
            nullableInt(rs, "route_type"));
    }

    private static Trip mapTrip(ResultSet rs) throws SQLException {
        return new Trip(
            rs.getString("trip_id"),
            rs.getString("route_id"),
            rs.getString("service_id"),
            rs.getString("trip_headsign"),
            nullableInt(rs, "direction_id"));
    }

    private static Stop mapStop(ResultSet rs) throws SQLException {
        return new Stop(
            rs.getString("stop_id"),
            rs.getString("stop_code"),
            rs.getString("stop_name"),
            rs.getString("stop_desc"),
            nullableDouble(rs, "stop_lat"),
            nullableDouble(rs, "stop_lon"));
    }
}
