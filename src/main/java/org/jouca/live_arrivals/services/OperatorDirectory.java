package org.jouca.live_arrivals.services;

/**
 * English display names of transit operators, which the schedule only has in Hebrew.
 *
 * @author Jouca
 * @since 1.0
 */
public interface OperatorDirectory {

    /**
     * @param operatorId agency id of the operator
     * @return the English name, or null when the operator is not listed
     */
    String englishName(String operatorId);
}
