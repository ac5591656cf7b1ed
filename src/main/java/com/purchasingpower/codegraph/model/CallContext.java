package com.purchasingpower.codegraph.model;

import lombok.Getter;
import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Tracks one call that leaves the process (a Neo4j transaction sequence, a directory walk).
 *
 * <p>Every line carries the service, the operation and a short call id so the request,
 * progress and response lines of one call can be grepped together. Key/value details go to
 * DEBUG.
 *
 * @see com.purchasingpower.codegraph.util.ExternalCallLogger
 * @see ServiceType
 */
@Getter
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
        logger.info("{} {} → {} [{}]", service.getEmoji(), service.getName(), operation, callId);
        if (summary != null && !summary.isEmpty()) {
            logger.debug("  Request: {}", summary);
        }
        logDetails(details);
    }

    /**
     * Intermediate step of a long call, e.g. one written batch or one visited directory.
     */
    public void logProgress(String step, Object... details) {
        logger.debug("{} {} … {} [{}] ({}ms) {}",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs(), step);
        logDetails(details);
    }

    public void logResponse(String summary, Object... details) {
        logger.info("{} {} ← {} [{}] ({}ms)",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs());
        if (summary != null && !summary.isEmpty()) {
            logger.debug("  Response: {}", summary);
        }
        logDetails(details);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }

    // key/value pairs; a trailing key without value is dropped
    private void logDetails(Object... details) {
        if (details == null) {
            return;
        }
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.debug("  {}: {}", details[i], details[i + 1]);
        }
    }
}
