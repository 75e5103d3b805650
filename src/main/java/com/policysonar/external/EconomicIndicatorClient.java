package com.policysonar.external;

import com.policysonar.errors.ExternalServiceException;

import java.time.Duration;

/**
 * Source of recent economic indicator deltas for a policy category.
 */
public interface EconomicIndicatorClient {

    IndicatorSnapshot getIndicators(String policyType, String timeframe, Duration timeout) throws ExternalServiceException;
}
