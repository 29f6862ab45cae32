package com.motaz.triage.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically reclaims work whose worker died: analysis sessions stuck in
 * processing and datasets stuck in triaging.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleSessionSweeper {

    private final AnalysisSessionManager analysisSessionManager;
    private final TriageOrchestrator triageOrchestrator;

    @Scheduled(fixedDelayString = "${anomaly.session.sweep-interval-ms:60000}",
            initialDelayString = "${anomaly.session.sweep-interval-ms:60000}")
    public void sweep() {
        try {
            analysisSessionManager.reclaimStaleSessions();
        } catch (RuntimeException e) {
            log.error("Stale session sweep failed", e);
        }
        try {
            triageOrchestrator.reclaimStaleRuns();
        } catch (RuntimeException e) {
            log.error("Stale triage sweep failed", e);
        }
    }
}
