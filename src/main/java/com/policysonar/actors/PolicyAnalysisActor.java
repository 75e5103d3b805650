package com.policysonar.actors;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.policysonar.analog.AnalogReport;
import com.policysonar.analog.PolicyAnalogService;
import com.policysonar.errors.InvalidInputException;
import com.policysonar.messages.Messages.*;

/**
 * PolicyAnalysisActor - Owns the analog service and processes corpus loads and analyses
 * one message at a time, so a corpus reload never interleaves with an analysis it serves.
 */
public class PolicyAnalysisActor extends AbstractBehavior<AnalysisCommand> {

    private final ActorRef<LogCommand> logger;
    private final PolicyAnalogService analogService;

    public static Behavior<AnalysisCommand> create(ActorRef<LogCommand> logger, PolicyAnalogService analogService) {
        return Behaviors.setup(context -> new PolicyAnalysisActor(context, logger, analogService));
    }

    private PolicyAnalysisActor(ActorContext<AnalysisCommand> context, ActorRef<LogCommand> logger,
                                PolicyAnalogService analogService) {
        super(context);
        this.logger = logger;
        this.analogService = analogService;
        getContext().getLog().info("🔍 PolicyAnalysisActor ready ({} policies loaded)", analogService.corpus().size());
    }

    @Override
    public Receive<AnalysisCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(LoadCorpus.class, this::onLoadCorpus)
                .onMessage(AnalyzePolicy.class, this::onAnalyzePolicy)
                .onMessage(GetCacheStats.class, this::onGetCacheStats)
                .build();
    }

    private Behavior<AnalysisCommand> onLoadCorpus(LoadCorpus msg) {
        try {
            int count = analogService.loadCorpus(msg.records);
            logger.tell(new LogEvent(msg.requestId, "PolicyAnalysis",
                "Corpus reloaded with " + count + " historical policies; embedding cache purged"));
            msg.replyTo.tell(CorpusLoaded.success(msg.requestId, count));

        } catch (RuntimeException e) {
            getContext().getLog().error("❌ Corpus load failed for request [{}]", msg.requestId, e);
            logger.tell(new LogEvent(msg.requestId, "PolicyAnalysis", "Corpus load error: " + e.getMessage(), "ERROR"));
            msg.replyTo.tell(CorpusLoaded.failure(msg.requestId, e.getMessage()));
        }
        return this;
    }

    private Behavior<AnalysisCommand> onAnalyzePolicy(AnalyzePolicy msg) {
        getContext().getLog().info("🔍 Analyzing policy for request [{}] (threshold {})", msg.requestId, msg.threshold);

        try {
            AnalogReport report = analogService.assess(msg.policyText, msg.threshold, msg.batchSize);

            logger.tell(new LogEvent(msg.requestId, "PolicyAnalysis",
                String.format("Found %d analogs, risk %s (score %.3f, confidence %.2f)",
                    report.matches.size(), report.assessment.level.label(),
                    report.assessment.score, report.assessment.confidence)));

            msg.replyTo.tell(PolicyAnalysisResult.success(msg.requestId, report.matches, report.assessment));

        } catch (InvalidInputException e) {
            logger.tell(new LogEvent(msg.requestId, "PolicyAnalysis", "Rejected input: " + e.getMessage(), "WARNING"));
            msg.replyTo.tell(PolicyAnalysisResult.failure(msg.requestId, e.getMessage()));

        } catch (RuntimeException e) {
            getContext().getLog().error("❌ Analysis failed for request [{}]", msg.requestId, e);
            logger.tell(new LogEvent(msg.requestId, "PolicyAnalysis", "Analysis error: " + e.getMessage(), "ERROR"));
            msg.replyTo.tell(PolicyAnalysisResult.failure(msg.requestId, e.getMessage()));
        }
        return this;
    }

    private Behavior<AnalysisCommand> onGetCacheStats(GetCacheStats msg) {
        msg.replyTo.tell(analogService.embeddings().stats());
        return this;
    }
}
