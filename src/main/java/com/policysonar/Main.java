package com.policysonar;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.policysonar.actors.AlertMonitorActor;
import com.policysonar.actors.LoggerActor;
import com.policysonar.actors.PolicyAnalysisActor;
import com.policysonar.alerts.Alert;
import com.policysonar.alerts.AlertThresholds;
import com.policysonar.analog.PolicyAnalogService;
import com.policysonar.analog.impl.InMemoryAnalogRepository;
import com.policysonar.external.HttpEconomicIndicatorClient;
import com.policysonar.external.SonarApiClient;
import com.policysonar.messages.Messages.*;
import com.policysonar.retrieval.EmbeddingService;
import com.policysonar.retrieval.PolicyCorpusStore;
import com.policysonar.retrieval.PolicyRecord;
import com.policysonar.retrieval.SimilarityMatch;
import com.policysonar.risk.RiskFactor;
import com.policysonar.risk.RiskScorer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Policy Sonar - command line entry point.
 *
 * <p>Usage: {@code mvn exec:java -Dexec.args="Tariff increase on imported steel"}.
 * Historical analogs and the risk assessment are always printed; the monitoring pass runs only
 * when SONAR_API_KEY is configured.
 */
public class Main {

    private static final String CORPUS_RESOURCE = "/corpus/policies.jsonl";
    private static final String DEFAULT_QUERY = "Tariff increase of 20% on imported steel products";
    private static final Duration ASK_TIMEOUT = Duration.ofSeconds(30);

    private static volatile ActorRef<AnalysisCommand> analysisActor;
    private static volatile ActorRef<MonitorCommand> monitorActor;
    private static final CountDownLatch ready = new CountDownLatch(1);

    public static void main(String[] args) throws Exception {
        SonarConfig config = new SonarConfig();
        System.out.println("📡 Starting Policy Sonar with " + config);

        List<PolicyRecord> corpus = loadCorpus(config);
        PolicyAnalogService analogService = new PolicyAnalogService(
            new EmbeddingService(config.embeddingCacheSize), new RiskScorer(), new InMemoryAnalogRepository());

        ActorSystem<Void> system = ActorSystem.create(rootBehavior(config, analogService), "PolicySonarSystem");
        try {
            if (!ready.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Actor system did not start in time");
            }
            String query = args.length > 0 ? String.join(" ", args) : DEFAULT_QUERY;
            run(system, config, corpus, query);
        } finally {
            system.terminate();
        }
    }

    private static Behavior<Void> rootBehavior(SonarConfig config, PolicyAnalogService analogService) {
        return Behaviors.setup(context -> {
            ActorRef<LogCommand> logger = context.spawn(LoggerActor.create(), "audit-log");
            analysisActor = context.spawn(PolicyAnalysisActor.create(logger, analogService), "policy-analysis");
            monitorActor = context.spawn(AlertMonitorActor.create(logger,
                new SonarApiClient(config.sonarBaseUrl, config.sonarApiKey),
                new HttpEconomicIndicatorClient(config.indicatorBaseUrl),
                AlertThresholds.fromConfig(context.getSystem().settings().config())), "alert-monitor");
            ready.countDown();
            return Behaviors.empty();
        });
    }

    private static List<PolicyRecord> loadCorpus(SonarConfig config) throws IOException {
        try (PolicyCorpusStore store = PolicyCorpusStore.open(Path.of(config.corpusIndexPath))) {
            if (config.rebuildIndexOnStart || store.size() == 0) {
                try (InputStream corpus = Main.class.getResourceAsStream(CORPUS_RESOURCE)) {
                    if (corpus == null) {
                        throw new IOException("Corpus file not found on classpath: " + CORPUS_RESOURCE);
                    }
                    store.buildFromJsonl(corpus);
                }
            }
            return store.loadAll();
        }
    }

    private static void run(ActorSystem<Void> system, SonarConfig config, List<PolicyRecord> corpus, String query) {
        String requestId = UUID.randomUUID().toString().substring(0, 8);

        CorpusLoaded loaded = AskPattern.<AnalysisCommand, CorpusLoaded>ask(analysisActor,
            replyTo -> new LoadCorpus(requestId, corpus, replyTo), ASK_TIMEOUT, system.scheduler())
            .toCompletableFuture().join();
        if (!loaded.success) {
            System.out.println("❌ Corpus load failed: " + loaded.errorMessage);
            return;
        }
        System.out.println("📚 Trained on " + loaded.documentCount + " historical policies");

        PolicyAnalysisResult result = AskPattern.<AnalysisCommand, PolicyAnalysisResult>ask(analysisActor,
            replyTo -> new AnalyzePolicy(requestId, query, config.similarityThreshold,
                config.similarityBatchSize, replyTo), ASK_TIMEOUT, system.scheduler())
            .toCompletableFuture().join();

        printAnalysis(query, result);

        if (config.sonarApiKey.isEmpty()) {
            System.out.println("ℹ️ SONAR_API_KEY not set - skipping indicator monitoring");
            return;
        }
        MonitoringResult monitoring = AskPattern.<MonitorCommand, MonitoringResult>ask(monitorActor,
            replyTo -> new MonitorPolicy(requestId, "adhoc-" + requestId, query, "general",
                config.monitorTimeout, replyTo), ASK_TIMEOUT, system.scheduler())
            .toCompletableFuture().join();
        printMonitoring(monitoring);
    }

    private static void printAnalysis(String query, PolicyAnalysisResult result) {
        System.out.println("\n" + "─".repeat(60));
        System.out.println("📝 Policy: " + query);
        if (!result.success) {
            System.out.println("❌ Analysis failed: " + result.errorMessage);
            return;
        }
        System.out.println("🔎 Historical analogs: " + result.matches.size());
        for (SimilarityMatch match : result.matches) {
            System.out.printf("   %.3f  [%d %s] %s%n", match.score, match.record.year,
                match.record.policyType, match.record.text);
        }
        System.out.printf("⚖️ Risk: %s (score %.3f, confidence %.2f)%n", result.assessment.level.label(),
            result.assessment.score, result.assessment.confidence);
        for (RiskFactor factor : result.assessment.factors) {
            System.out.println("   ⚠️ " + factor.year + " " + factor.policyType + ": " + factor.outcomeNarrative);
        }
        for (String recommendation : result.assessment.recommendations) {
            System.out.println("   • " + recommendation);
        }
    }

    private static void printMonitoring(MonitoringResult monitoring) {
        if (!monitoring.success) {
            System.out.println("❌ Monitoring failed: " + monitoring.errorMessage);
            return;
        }
        System.out.println("🚨 Alerts: " + monitoring.alerts.size()
            + (monitoring.failedChecks.isEmpty() ? "" : " (failed checks: " + monitoring.failedChecks + ")"));
        for (Alert alert : monitoring.alerts) {
            System.out.println("   [" + alert.severity + "] " + alert.message + " related=" + alert.relatedIndicators);
        }
    }
}
