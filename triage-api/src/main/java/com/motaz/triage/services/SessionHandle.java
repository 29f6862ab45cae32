package com.motaz.triage.services;

import com.motaz.triage.model.entities.AnalysisSessionEntity;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** A processing session plus whether the caller created it or joined one already running. */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class SessionHandle {

    private final AnalysisSessionEntity session;
    private final boolean reused;

    public static SessionHandle created(AnalysisSessionEntity session) {
        return new SessionHandle(session, false);
    }

    public static SessionHandle reused(AnalysisSessionEntity session) {
        return new SessionHandle(session, true);
    }
}
