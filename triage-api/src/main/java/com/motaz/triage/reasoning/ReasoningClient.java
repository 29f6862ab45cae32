package com.motaz.triage.reasoning;

/**
 * External reasoning service that turns the evidence of one anomaly into a
 * triage verdict. Calls are slow and may fail; callers bound and isolate them.
 */
public interface ReasoningClient {

    ReasoningVerdict analyze(AnomalyEvidence evidence);
}
