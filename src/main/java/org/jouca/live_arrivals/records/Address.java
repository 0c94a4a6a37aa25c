package org.jouca.live_arrivals.records;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A stop address parsed from the schedule's descriptive text.
 *
 * <p>An address that could not be parsed is {@link #EMPTY}: every field is null, and it
 * serializes as an empty object.
 *
 * @author Jouca
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Address(String street, String city, String platform, String floor) {

    /** The address of a stop whose description did not match any known layout. */
    public static final Address EMPTY = new Address(null, null, null, null);

    @JsonIgnore
    public boolean isEmpty() {
        return street == null && city == null && platform == null && floor == null;
    }

    /**
     * Returns a copy with the city replaced, used once the city name has been translated.
     *
     * @param translatedCity the new city value
     * @return a new address, or this one when it is empty
     */
    public Address withCity(String translatedCity) {
        if (isEmpty()) {
            return this;
        }
        return new Address(street, translatedCity, platform, floor);
    }
}
