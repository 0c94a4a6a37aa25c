package org.jouca.live_arrivals.services;

import org.jouca.live_arrivals.model.AggregatedResponse;

/**
 * Unions responses coming from several groups of one source or from several sources.
 *
 * <p>Visits equal to one already present for the same stop are dropped, so merging a response
 * with a copy of itself changes nothing. Visits of different producers never compare equal.
 *
 * @author Jouca
 * @since 1.0
 */
public class ResponseMerger {

    /**
     * Merges {@code other} into {@code target}.
     *
     * @param target the response receiving the visits, modified in place
     * @param other the response to merge, left unchanged
     * @return {@code target}
     */
    public AggregatedResponse merge(AggregatedResponse target, AggregatedResponse other) {
        target.append(other);
        return target;
    }
}
