package com.policysonar.external;

import com.policysonar.errors.ExternalServiceException;

import java.time.Duration;

/**
 * PolicyAnalysisClient - Access to the external policy analysis service
 * (news sentiment, academic sources).
 */
public interface PolicyAnalysisClient {

    String FOCUS_NEWS = "news";
    String FOCUS_ACADEMIC = "academic";

    /**
     * Analyze a policy text with the given focus.
     *
     * @param timeout upper bound for the whole call
     * @throws ExternalServiceException on transport failure, non-2xx status, malformed payload or timeout
     */
    AnalysisResponse analyzePolicy(String policyText, String focus, Duration timeout) throws ExternalServiceException;
}
