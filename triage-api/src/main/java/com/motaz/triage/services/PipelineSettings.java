package com.motaz.triage.services;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class PipelineSettings {

    private final Duration staleAfter;
    private final int triageParallelism;
    private final Duration triageCallTimeout;
    private final int defaultMaxAnomalies;
    private final Duration triageQueueTimeout;
    private final Duration triageStaleAfter;

    public PipelineSettings(@Value("${anomaly.session.stale-after:30m}") Duration staleAfter,
                            @Value("${anomaly.triage.parallelism:1}") int triageParallelism,
                            @Value("${anomaly.triage.call-timeout:30s}") Duration triageCallTimeout,
                            @Value("${anomaly.triage.default-max-anomalies:2}") int defaultMaxAnomalies,
                            @Value("${anomaly.triage.queue-timeout:2m}") Duration triageQueueTimeout,
                            @Value("${anomaly.triage.stale-after:15m}") Duration triageStaleAfter) {
        this.staleAfter = staleAfter;
        this.triageParallelism = Math.max(1, triageParallelism);
        this.triageCallTimeout = triageCallTimeout;
        this.defaultMaxAnomalies = defaultMaxAnomalies;
        this.triageQueueTimeout = triageQueueTimeout;
        this.triageStaleAfter = triageStaleAfter;
    }

    public Duration staleAfter() {
        return staleAfter;
    }

    /** Reasoning calls one triage run keeps in flight at a time. */
    public int triageParallelism() {
        return triageParallelism;
    }

    /** Budget for a single reasoning call, measured from the moment it starts running. */
    public Duration triageCallTimeout() {
        return triageCallTimeout;
    }

    public int defaultMaxAnomalies() {
        return defaultMaxAnomalies;
    }

    /** How long a submitted reasoning call may wait for a worker before it is given up. */
    public Duration triageQueueTimeout() {
        return triageQueueTimeout;
    }

    /** A triaging dataset with no heartbeat for this long is reclaimed by the sweeper. */
    public Duration triageStaleAfter() {
        return triageStaleAfter;
    }
}
