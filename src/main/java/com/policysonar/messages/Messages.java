package com.policysonar.messages;

import akka.actor.typed.ActorRef;
import com.policysonar.alerts.Alert;
import com.policysonar.alerts.MonitoringReport;
import com.policysonar.retrieval.CacheStats;
import com.policysonar.retrieval.PolicyRecord;
import com.policysonar.retrieval.SimilarityMatch;
import com.policysonar.risk.RiskAssessment;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Message protocol of the Policy Sonar actors.
 */
public class Messages {

    // ========== ANALYSIS MESSAGES ==========
    public interface AnalysisCommand {}

    public static class LoadCorpus implements AnalysisCommand {
        public final String requestId;
        public final List<PolicyRecord> records;
        public final ActorRef<CorpusLoaded> replyTo;

        public LoadCorpus(String requestId, List<PolicyRecord> records, ActorRef<CorpusLoaded> replyTo) {
            this.requestId = requestId;
            this.records = List.copyOf(records);
            this.replyTo = replyTo;
        }
    }

    public static class CorpusLoaded {
        public final String requestId;
        public final int documentCount;
        public final boolean success;
        public final String errorMessage;

        public CorpusLoaded(String requestId, int documentCount, boolean success, String errorMessage) {
            this.requestId = requestId;
            this.documentCount = documentCount;
            this.success = success;
            this.errorMessage = errorMessage;
        }

        public static CorpusLoaded success(String requestId, int documentCount) {
            return new CorpusLoaded(requestId, documentCount, true, null);
        }

        public static CorpusLoaded failure(String requestId, String errorMessage) {
            return new CorpusLoaded(requestId, 0, false, errorMessage);
        }
    }

    public static class AnalyzePolicy implements AnalysisCommand {
        public final String requestId;
        public final String policyText;
        public final double threshold;
        public final int batchSize;
        public final ActorRef<PolicyAnalysisResult> replyTo;

        public AnalyzePolicy(String requestId, String policyText, double threshold, int batchSize,
                             ActorRef<PolicyAnalysisResult> replyTo) {
            this.requestId = requestId;
            this.policyText = policyText;
            this.threshold = threshold;
            this.batchSize = batchSize;
            this.replyTo = replyTo;
        }
    }

    public static class PolicyAnalysisResult {
        public final String requestId;
        public final List<SimilarityMatch> matches;
        public final RiskAssessment assessment;
        public final boolean success;
        public final String errorMessage;

        public PolicyAnalysisResult(String requestId, List<SimilarityMatch> matches, RiskAssessment assessment,
                                    boolean success, String errorMessage) {
            this.requestId = requestId;
            this.matches = matches;
            this.assessment = assessment;
            this.success = success;
            this.errorMessage = errorMessage;
        }

        public static PolicyAnalysisResult success(String requestId, List<SimilarityMatch> matches,
                                                   RiskAssessment assessment) {
            return new PolicyAnalysisResult(requestId, matches, assessment, true, null);
        }

        public static PolicyAnalysisResult failure(String requestId, String errorMessage) {
            return new PolicyAnalysisResult(requestId, List.of(),
                RiskAssessment.insufficient("Assessment unavailable: " + errorMessage), false, errorMessage);
        }
    }

    public static class GetCacheStats implements AnalysisCommand {
        public final ActorRef<CacheStats> replyTo;

        public GetCacheStats(ActorRef<CacheStats> replyTo) {
            this.replyTo = replyTo;
        }
    }

    // ========== MONITORING MESSAGES ==========
    public interface MonitorCommand {}

    public static class MonitorPolicy implements MonitorCommand {
        public final String requestId;
        public final String policyId;
        public final String policyText;
        public final String policyType;
        public final Duration timeout;
        public final ActorRef<MonitoringResult> replyTo;

        public MonitorPolicy(String requestId, String policyId, String policyText, String policyType,
                             Duration timeout, ActorRef<MonitoringResult> replyTo) {
            this.requestId = requestId;
            this.policyId = policyId;
            this.policyText = policyText;
            this.policyType = policyType;
            this.timeout = timeout;
            this.replyTo = replyTo;
        }
    }

    /** Internal: completion of an asynchronous monitoring pass, piped back to the actor. */
    public static class MonitoringFinished implements MonitorCommand {
        public final MonitorPolicy request;
        public final MonitoringReport report;
        public final Throwable failure;

        public MonitoringFinished(MonitorPolicy request, MonitoringReport report, Throwable failure) {
            this.request = request;
            this.report = report;
            this.failure = failure;
        }
    }

    public static class MonitoringResult {
        public final String requestId;
        public final String policyId;
        public final List<Alert> alerts;
        public final List<String> failedChecks;
        public final boolean success;
        public final String errorMessage;

        public MonitoringResult(String requestId, String policyId, List<Alert> alerts,
                                List<String> failedChecks, boolean success, String errorMessage) {
            this.requestId = requestId;
            this.policyId = policyId;
            this.alerts = alerts;
            this.failedChecks = failedChecks;
            this.success = success;
            this.errorMessage = errorMessage;
        }
    }

    // ========== LOGGING MESSAGES ==========
    public interface LogCommand {}

    public static class LogEvent implements LogCommand {
        public final String requestId;
        public final String component;
        public final String event;
        public final String level;
        public final Instant timestamp;

        public LogEvent(String requestId, String component, String event, String level) {
            this.requestId = requestId;
            this.component = component;
            this.event = event;
            this.level = level;
            this.timestamp = Instant.now();
        }

        public LogEvent(String requestId, String component, String event) {
            this(requestId, component, event, "INFO");
        }
    }
}
