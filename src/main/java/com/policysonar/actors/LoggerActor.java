package com.policysonar.actors;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.policysonar.messages.Messages.*;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * LoggerActor - Audit trail of analysis and monitoring requests.
 * Other actors tell it {@link LogEvent}s and never wait for it.
 */
public class LoggerActor extends AbstractBehavior<LogCommand> {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    private long eventCount = 0;

    public static Behavior<LogCommand> create() {
        return Behaviors.setup(LoggerActor::new);
    }

    private LoggerActor(ActorContext<LogCommand> context) {
        super(context);
        getContext().getLog().info("📝 Audit logger started");
    }

    @Override
    public Receive<LogCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(LogEvent.class, this::onLogEvent)
                .onSignal(PostStop.class, this::onPostStop)
                .build();
    }

    private Behavior<LogCommand> onLogEvent(LogEvent msg) {
        eventCount++;
        String line = String.format("[%s] request=%s | %s: %s",
            TIMESTAMP_FORMAT.format(msg.timestamp), msg.requestId, msg.component, msg.event);

        switch (msg.level.toUpperCase()) {
            case "ERROR":
                getContext().getLog().error(line);
                break;
            case "WARNING":
                getContext().getLog().warn(line);
                break;
            case "DEBUG":
                getContext().getLog().debug(line);
                break;
            default:
                getContext().getLog().info(line);
        }
        return this;
    }

    private Behavior<LogCommand> onPostStop(PostStop signal) {
        getContext().getLog().info("📝 Audit logger stopped after {} events", eventCount);
        return this;
    }
}
