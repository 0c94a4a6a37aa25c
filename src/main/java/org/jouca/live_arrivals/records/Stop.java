package org.jouca.live_arrivals.records;

import java.util.function.Function;

/**
 * A row of the static schedule {@code stops} table.
 *
 * <p>The parsed {@link Address} is computed on first access and kept for the lifetime of the
 * object: the description never changes while a request is served.
 *
 * @author Jouca
 * @since 1.0
 */
public final class Stop {
    private final String stopId;
    private final String stopCode;
    private final String stopName;
    private final String stopDesc;
    private final Double stopLat;
    private final Double stopLon;

    private volatile Address address;

    public Stop(String stopId, String stopCode, String stopName, String stopDesc,
                Double stopLat, Double stopLon) {
        this.stopId = stopId;
        this.stopCode = stopCode;
        this.stopName = stopName;
        this.stopDesc = stopDesc;
        this.stopLat = stopLat;
        this.stopLon = stopLon;
    }

    public String getStopId() {
        return stopId;
    }

    public String getStopCode() {
        return stopCode;
    }

    public String getStopName() {
        return stopName;
    }

    public String getStopDesc() {
        return stopDesc;
    }

    public Double getStopLat() {
        return stopLat;
    }

    public Double getStopLon() {
        return stopLon;
    }

    /**
     * Returns the stop location, or null when the schedule has no coordinates for it.
     */
    public Location getLocation() {
        if (stopLat == null || stopLon == null) {
            return null;
        }
        return new Location(stopLat, stopLon);
    }

    /**
     * Returns the parsed address, parsing the description with {@code parser} the first time.
     *
     * @param parser turns the raw description into an address, never returning null
     * @return the cached address
     */
    public Address getAddress(Function<String, Address> parser) {
        Address parsed = address;
        if (parsed == null) {
            parsed = parser.apply(stopDesc);
            address = parsed;
        }
        return parsed;
    }

    @Override
    public String toString() {
        return "Stop <code: " + stopCode + ", name: " + stopName + ">";
    }
}
