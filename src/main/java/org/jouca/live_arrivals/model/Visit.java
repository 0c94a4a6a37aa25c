package org.jouca.live_arrivals.model;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jouca.live_arrivals.records.Location;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One normalized real-time prediction of a vehicle arriving at a stop.
 *
 * <p>Both live-data sources decode into this shape. A visit is immutable once decoded: static
 * schedule information is attached by the owning {@link AggregatedResponse}, never to the visit,
 * so a cached visit can be shared by concurrent requests.
 *
 * <p><b>Equality:</b> two visits are equal when they describe the same prediction, i.e. they
 * share producer, stop code, ETA, route, vehicle, direction and record timestamp. Everything
 * else, in particular the raw decoded payload, is ignored. The producer takes part in equality
 * because the two sources use independent id spaces.
 *
 * @author Jouca
 * @since 1.0
 */
public final class Visit {

    /** Producer tag of visits decoded from the stop-monitoring protocol. */
    public static final String PRODUCER_SIRI = "SIRI";

    /** Producer tag of visits decoded from the delta feed. */
    public static final String PRODUCER_GTFS_RT = "GTFS-RT";

    private final String producer;
    private final OffsetDateTime timestamp;
    private final String stopCode;
    private final String routeId;
    private final String directionId;
    private final String lineName;
    private final String operatorId;
    private final String destinationId;
    private final String vehicleRef;
    private final String tripId;
    private final OffsetDateTime eta;
    private final OffsetDateTime departed;
    private final String status;
    private final Location location;

    /** Decoded source record, kept for diagnostics only. */
    private final transient JsonNode raw;

    private Visit(Builder builder) {
        this.producer = builder.producer;
        this.timestamp = builder.timestamp;
        this.stopCode = builder.stopCode;
        this.routeId = builder.routeId;
        this.directionId = builder.directionId;
        this.lineName = builder.lineName;
        this.operatorId = builder.operatorId;
        this.destinationId = builder.destinationId;
        this.vehicleRef = builder.vehicleRef;
        this.tripId = builder.tripId;
        this.eta = builder.eta;
        this.departed = builder.departed;
        this.status = builder.status;
        this.location = builder.location;
        this.raw = builder.raw;
    }

    public static Builder builder(String producer) {
        return new Builder(producer);
    }

    public String getProducer() {
        return producer;
    }

    /** Time at which the source made this prediction. */
    public OffsetDateTime getTimestamp() {
        return timestamp;
    }

    public String getStopCode() {
        return stopCode;
    }

    /** Static schedule route id. Same value as {@link #getLineId()}. */
    public String getRouteId() {
        return routeId;
    }

    /** Stop-monitoring name of {@link #getRouteId()}. */
    public String getLineId() {
        return routeId;
    }

    public String getDirectionId() {
        return directionId;
    }

    public String getLineName() {
        return lineName;
    }

    public String getOperatorId() {
        return operatorId;
    }

    /** Stop code of the trip's destination as reported by the live data. */
    public String getDestinationId() {
        return destinationId;
    }

    public String getVehicleRef() {
        return vehicleRef;
    }

    /** Day-scoped trip id, {@code {trip-number}_{ddMMyy}}, or null when the source did not frame it. */
    public String getTripId() {
        return tripId;
    }

    public OffsetDateTime getEta() {
        return eta;
    }

    /** Aimed departure from the origin, may be null. */
    public OffsetDateTime getDeparted() {
        return departed;
    }

    /** Arrival status such as {@code onTime} or {@code delayed}, may be null. */
    public String getStatus() {
        return status;
    }

    public Location getLocation() {
        return location;
    }

    public JsonNode getRaw() {
        return raw;
    }

    /**
     * Serializes every public field. Timestamps are written as ISO-8601 strings and the
     * location as a {@code {lat, lon}} object.
     *
     * @return an ordered map ready for JSON serialization
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("producer", producer);
        out.put("timestamp", asString(timestamp));
        out.put("stop_code", stopCode);
        out.put("line_id", routeId);
        out.put("route_id", routeId);
        out.put("direction_id", directionId);
        out.put("line_name", lineName);
        out.put("operator_id", operatorId);
        out.put("destination_id", destinationId);
        out.put("vehicle_ref", vehicleRef);
        out.put("trip_id", tripId);
        out.put("eta", asString(eta));
        out.put("departed", asString(departed));
        out.put("status", status);
        if (location != null) {
            Map<String, Object> loc = new LinkedHashMap<>();
            loc.put("lat", location.lat());
            loc.put("lon", location.lon());
            out.put("location", loc);
        } else {
            out.put("location", null);
        }
        return out;
    }

    private static String asString(OffsetDateTime time) {
        return time == null ? null : time.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Visit)) {
            return false;
        }
        Visit other = (Visit) o;
        return Objects.equals(producer, other.producer)
            && Objects.equals(stopCode, other.stopCode)
            && sameInstant(eta, other.eta)
            && Objects.equals(routeId, other.routeId)
            && Objects.equals(vehicleRef, other.vehicleRef)
            && Objects.equals(directionId, other.directionId)
            && sameInstant(timestamp, other.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(producer, stopCode, eta == null ? null : eta.toInstant(), routeId, vehicleRef,
            directionId, timestamp == null ? null : timestamp.toInstant());
    }

    private static boolean sameInstant(OffsetDateTime a, OffsetDateTime b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.isEqual(b);
    }

    @Override
    public String toString() {
        return "Visit <producer: " + producer + ", line: " + routeId + ", eta: " + eta + ">";
    }

    /**
     * Builder used by the codecs; only the producer is mandatory.
     */
    public static final class Builder {
        private final String producer;
        private OffsetDateTime timestamp;
        private String stopCode;
        private String routeId;
        private String directionId;
        private String lineName;
        private String operatorId;
        private String destinationId;
        private String vehicleRef;
        private String tripId;
        private OffsetDateTime eta;
        private OffsetDateTime departed;
        private String status;
        private Location location;
        private JsonNode raw;

        private Builder(String producer) {
            this.producer = Objects.requireNonNull(producer, "producer");
        }

        public Builder timestamp(OffsetDateTime timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder stopCode(String stopCode) {
            this.stopCode = stopCode;
            return this;
        }

        public Builder routeId(String routeId) {
            this.routeId = routeId;
            return this;
        }

        public Builder directionId(String directionId) {
            this.directionId = directionId;
            return this;
        }

        public Builder lineName(String lineName) {
            this.lineName = lineName;
            return this;
        }

        public Builder operatorId(String operatorId) {
            this.operatorId = operatorId;
            return this;
        }

        public Builder destinationId(String destinationId) {
            this.destinationId = destinationId;
            return this;
        }

        public Builder vehicleRef(String vehicleRef) {
            this.vehicleRef = vehicleRef;
            return this;
        }

        public Builder tripId(String tripId) {
            this.tripId = tripId;
            return this;
        }

        public Builder eta(OffsetDateTime eta) {
            this.eta = eta;
            return this;
        }

        public Builder departed(OffsetDateTime departed) {
            this.departed = departed;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder location(Location location) {
            this.location = location;
            return this;
        }

        public Builder raw(JsonNode raw) {
            this.raw = raw;
            return this;
        }

        public Visit build() {
            return new Visit(this);
        }
    }
}
