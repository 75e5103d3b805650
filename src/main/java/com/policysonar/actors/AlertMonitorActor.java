package com.policysonar.actors;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.policysonar.alerts.AlertMonitor;
import com.policysonar.alerts.AlertThresholdEngine;
import com.policysonar.alerts.AlertThresholds;
import com.policysonar.external.EconomicIndicatorClient;
import com.policysonar.external.PolicyAnalysisClient;
import com.policysonar.messages.Messages.*;

import java.util.List;

/**
 * AlertMonitorActor - Runs monitoring passes without blocking its mailbox.
 * The external calls run on the blocking dispatcher and their result is piped back as a
 * {@link MonitoringFinished} message.
 */
public class AlertMonitorActor extends AbstractBehavior<MonitorCommand> {

    private final ActorRef<LogCommand> logger;
    private final AlertMonitor monitor;

    public static Behavior<MonitorCommand> create(ActorRef<LogCommand> logger,
                                                  PolicyAnalysisClient analysisClient,
                                                  EconomicIndicatorClient indicatorClient,
                                                  AlertThresholds thresholds) {
        return Behaviors.setup(context -> {
            AlertMonitor monitor = new AlertMonitor(analysisClient, indicatorClient,
                new AlertThresholdEngine(thresholds),
                context.getSystem().dispatchers().lookup(DispatcherSelector.blocking()));
            return new AlertMonitorActor(context, logger, monitor);
        });
    }

    public static Behavior<MonitorCommand> create(ActorRef<LogCommand> logger, AlertMonitor monitor) {
        return Behaviors.setup(context -> new AlertMonitorActor(context, logger, monitor));
    }

    private AlertMonitorActor(ActorContext<MonitorCommand> context, ActorRef<LogCommand> logger,
                              AlertMonitor monitor) {
        super(context);
        this.logger = logger;
        this.monitor = monitor;
        getContext().getLog().info("🚨 AlertMonitorActor ready");
    }

    @Override
    public Receive<MonitorCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(MonitorPolicy.class, this::onMonitorPolicy)
                .onMessage(MonitoringFinished.class, this::onMonitoringFinished)
                .build();
    }

    private Behavior<MonitorCommand> onMonitorPolicy(MonitorPolicy msg) {
        logger.tell(new LogEvent(msg.requestId, "AlertMonitor",
            "Monitoring policy " + msg.policyId + " (timeout " + msg.timeout.toMillis() + " ms)"));

        getContext().pipeToSelf(
            monitor.monitorPolicy(msg.policyId, msg.policyText, msg.policyType, msg.timeout),
            (report, failure) -> new MonitoringFinished(msg, report, failure));
        return this;
    }

    private Behavior<MonitorCommand> onMonitoringFinished(MonitoringFinished msg) {
        MonitorPolicy request = msg.request;

        if (msg.failure != null) {
            getContext().getLog().error("❌ Monitoring pass for policy {} failed", request.policyId, msg.failure);
            logger.tell(new LogEvent(request.requestId, "AlertMonitor",
                "Monitoring failed: " + msg.failure.getMessage(), "ERROR"));
            request.replyTo.tell(new MonitoringResult(request.requestId, request.policyId, List.of(),
                List.of(), false, msg.failure.getMessage()));
            return this;
        }

        if (!msg.report.isComplete()) {
            logger.tell(new LogEvent(request.requestId, "AlertMonitor",
                "Checks degraded to no alerts: " + msg.report.failedChecks, "WARNING"));
        }
        logger.tell(new LogEvent(request.requestId, "AlertMonitor",
            msg.report.alerts.size() + " alerts raised for policy " + request.policyId));

        request.replyTo.tell(new MonitoringResult(request.requestId, request.policyId, msg.report.alerts,
            msg.report.failedChecks, true, null));
        return this;
    }
}
