package com.policysonar.analog;

import java.util.List;

/**
 * Storage boundary for policy analogs. Durability is up to the implementation.
 */
public interface AnalogRepository {

    /**
     * @return the stored analog with its assigned id
     */
    PolicyAnalog save(PolicyAnalog analog);

    /**
     * All analogs recorded for the exact policy text, best similarity first.
     */
    List<PolicyAnalog> findByPolicyText(String policyText);

    List<PolicyAnalog> findTopMatches(String policyText, int limit);
}
