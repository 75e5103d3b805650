package com.policysonar.alerts;

import com.policysonar.errors.ExternalServiceException;
import com.policysonar.external.EconomicIndicatorClient;
import com.policysonar.external.PolicyAnalysisClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * AlertMonitor - Runs the sentiment and economic indicator checks for a policy.
 *
 * <p>The two checks run concurrently on the supplied executor and each is bounded by the
 * caller's timeout. A check that fails or times out is logged and contributes no alerts;
 * the pass still completes with whatever the other check produced. Nothing is retried.
 */
public class AlertMonitor {

    private static final Logger log = LoggerFactory.getLogger(AlertMonitor.class);

    public static final String SENTIMENT_CHECK = "sentiment";
    public static final String INDICATOR_CHECK = "economic-indicators";
    public static final String DEFAULT_TIMEFRAME = "30d";

    private final PolicyAnalysisClient analysisClient;
    private final EconomicIndicatorClient indicatorClient;
    private final AlertThresholdEngine engine;
    private final Executor executor;

    public AlertMonitor(PolicyAnalysisClient analysisClient, EconomicIndicatorClient indicatorClient,
                        AlertThresholdEngine engine, Executor executor) {
        this.analysisClient = analysisClient;
        this.indicatorClient = indicatorClient;
        this.engine = engine;
        this.executor = executor;
    }

    public CompletionStage<MonitoringReport> monitorPolicy(String policyId, String policyText,
                                                           String policyType, Duration timeout) {
        CompletableFuture<CheckOutcome> sentiment = runCheck(SENTIMENT_CHECK, policyId, timeout, () ->
            engine.checkSentiment(policyId,
                analysisClient.analyzePolicy(policyText, PolicyAnalysisClient.FOCUS_NEWS, timeout).sources));

        CompletableFuture<CheckOutcome> indicators = runCheck(INDICATOR_CHECK, policyId, timeout, () ->
            engine.checkIndicators(policyId,
                indicatorClient.getIndicators(policyType, DEFAULT_TIMEFRAME, timeout)));

        return sentiment.thenCombine(indicators, (s, i) -> {
            List<Alert> alerts = new ArrayList<>(s.alerts);
            alerts.addAll(i.alerts);

            List<String> failed = new ArrayList<>();
            if (s.failed) failed.add(s.name);
            if (i.failed) failed.add(i.name);

            MonitoringReport report = new MonitoringReport(policyId, alerts, failed);
            log.info("Monitoring pass for policy {} finished: {}", policyId, report);
            return report;
        });
    }

    private CompletableFuture<CheckOutcome> runCheck(String name, String policyId, Duration timeout, Check check) {
        return CompletableFuture
            .supplyAsync(() -> {
                try {
                    return check.run();
                } catch (ExternalServiceException e) {
                    throw new CompletionException(e);
                }
            }, executor)
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((alerts, failure) -> {
                if (failure == null) {
                    return new CheckOutcome(name, alerts, false);
                }
                Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                    ? failure.getCause() : failure;
                if (cause instanceof TimeoutException) {
                    log.warn("{} check for policy {} timed out after {} ms", name, policyId, timeout.toMillis());
                } else {
                    log.error("{} check for policy {} failed: {}", name, policyId, cause.getMessage(), cause);
                }
                return new CheckOutcome(name, List.of(), true);
            });
    }

    @FunctionalInterface
    private interface Check {
        List<Alert> run() throws ExternalServiceException;
    }

    private static final class CheckOutcome {
        final String name;
        final List<Alert> alerts;
        final boolean failed;

        CheckOutcome(String name, List<Alert> alerts, boolean failed) {
            this.name = name;
            this.alerts = alerts;
            this.failed = failed;
        }
    }
}
