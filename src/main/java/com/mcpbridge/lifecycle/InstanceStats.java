package com.mcpbridge.lifecycle;

import java.time.Instant;

/**
 * Rolling request statistics of one instance. Thread-safe.
 */
public class InstanceStats {

    private long requestCount;
    private long errorCount;
    private Instant lastRequestTime;
    private double averageResponseTimeMs;
    private long timedResponses;

    public synchronized long getRequestCount() {
        return requestCount;
    }

    public synchronized long getErrorCount() {
        return errorCount;
    }

    public synchronized Instant getLastRequestTime() {
        return lastRequestTime;
    }

    public synchronized double getAverageResponseTimeMs() {
        return averageResponseTimeMs;
    }

    synchronized void recordRequest(Instant at) {
        requestCount++;
        lastRequestTime = at;
    }

    synchronized void recordError() {
        errorCount++;
    }

    synchronized void recordResponseTime(long millis) {
        timedResponses++;
        averageResponseTimeMs += (millis - averageResponseTimeMs) / timedResponses;
    }
}
