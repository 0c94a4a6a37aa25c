package org.jouca.live_arrivals.services;

import java.util.List;

import org.jouca.live_arrivals.model.AggregatedResponse;

/**
 * A live-data source able to answer for a group of stops in one fetch.
 *
 * @author Jouca
 * @since 1.0
 */
public interface ArrivalSource {

    /** Producer tag of the visits this source decodes. */
    String getProducer();

    /** Maximum number of stop codes per fetch. */
    int getGroupSize();

    /**
     * Fetches and decodes the visits of one group of stops.
     *
     * @param stopCodes stop codes of the group, at most {@link #getGroupSize()}
     * @param maxVisits maximum number of visits per stop, ignored by sources without such a limit
     * @return a response keyed by exactly {@code stopCodes}
     * @throws org.jouca.live_arrivals.exceptions.TransportException when the source cannot be reached
     * @throws org.jouca.live_arrivals.exceptions.SchemaException when the answer cannot be decoded
     */
    AggregatedResponse fetch(List<String> stopCodes, int maxVisits);
}
