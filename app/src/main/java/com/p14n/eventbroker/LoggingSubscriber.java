package com.p14n.eventbroker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventbroker.broker.EventSubscriber;
import com.p14n.eventbroker.data.Event;

/**
 * Logs every event it receives.
 */
public enum LoggingSubscriber implements EventSubscriber {
    INSTANCE;

    private static final Logger logger = LoggerFactory.getLogger(LoggingSubscriber.class);

    @Override
    public void onEvent(Event event) {
        logger.atInfo()
                .addArgument(event::eventType)
                .addArgument(event)
                .log("Received {}: {}");
    }
}
