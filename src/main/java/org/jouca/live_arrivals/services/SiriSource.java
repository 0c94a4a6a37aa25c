package org.jouca.live_arrivals.services;

import java.util.List;

import org.jouca.live_arrivals.codecs.SiriCodec;
import org.jouca.live_arrivals.fetchers.SiriFetcher;
import org.jouca.live_arrivals.model.AggregatedResponse;
import org.jouca.live_arrivals.model.Visit;

/**
 * Stop-monitoring source: one SOAP request per group of stops.
 *
 * @author Jouca
 * @since 1.0
 */
public class SiriSource implements ArrivalSource {

    private final SiriCodec codec;
    private final SiriFetcher fetcher;
    private final int groupSize;

    public SiriSource(SiriCodec codec, SiriFetcher fetcher, int groupSize) {
        if (groupSize < 1) {
            throw new IllegalArgumentException("Group size must be positive: " + groupSize);
        }
        this.codec = codec;
        this.fetcher = fetcher;
        this.groupSize = groupSize;
    }

    @Override
    public String getProducer() {
        return Visit.PRODUCER_SIRI;
    }

    @Override
    public int getGroupSize() {
        return groupSize;
    }

    @Override
    public AggregatedResponse fetch(List<String> stopCodes, int maxVisits) {
        String payload = codec.encode(stopCodes, maxVisits);
        String raw = fetcher.post(payload, stopCodes);
        return codec.decode(raw, stopCodes);
    }
}
