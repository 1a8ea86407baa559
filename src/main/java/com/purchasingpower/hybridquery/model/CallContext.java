package com.purchasingpower.hybridquery.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One timed call to a store collaborator.
 *
 * <p>Request and response lines share a short call id so concurrent sibling
 * evaluations can be told apart in the log.
 *
 * @see com.purchasingpower.hybridquery.util.ExternalCallLogger
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary, Object... details) {
        logger.debug("{} {} → {} [{}] {}",
                service.getEmoji(), service.getName(), operation, callId, summary == null ? "" : summary);
        logDetails(details);
    }

    public void logResponse(int matches) {
        logger.debug("{} {} ← {} [{}] ({}ms) {} ids",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs(), matches);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    private void logDetails(Object... details) {
        if (details == null) {
            return;
        }
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.trace("  {}: {}", details[i], details[i + 1]);
        }
    }

    public String getCallId() {
        return callId;
    }

    public ServiceType getService() {
        return service;
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
