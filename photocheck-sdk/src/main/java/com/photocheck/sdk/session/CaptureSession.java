package com.photocheck.sdk.session;

import com.photocheck.sdk.api.CaptureState;
import com.photocheck.sdk.quality.ValidationReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only snapshot of a capture attempt, taken from {@link CaptureStateMachine#session()}.
 */
public final class CaptureSession {

    public final int          attempt;
    public final CaptureState state;
    public final int          consecutivePassCount;
    /** Timestamp of the first frame of the attempt, -1 before any frame. */
    public final long         startTimestampMs;
    /** Timestamp of the latest frame or tick, -1 before any frame. */
    public final long         lastTimestampMs;
    /** Most recent reports, oldest first. */
    public final List<ValidationReport> recentReports;
    /** Cause of ERROR, null otherwise. */
    public final Throwable    failureCause;

    CaptureSession(int attempt, CaptureState state, int consecutivePassCount,
                   long startTimestampMs, long lastTimestampMs,
                   List<ValidationReport> recentReports, Throwable failureCause) {
        this.attempt              = attempt;
        this.state                = state;
        this.consecutivePassCount = consecutivePassCount;
        this.startTimestampMs     = startTimestampMs;
        this.lastTimestampMs      = lastTimestampMs;
        this.recentReports        = Collections.unmodifiableList(new ArrayList<>(recentReports));
        this.failureCause         = failureCause;
    }

    public long elapsedMs() {
        return startTimestampMs < 0 ? 0L : lastTimestampMs - startTimestampMs;
    }

    public ValidationReport latestReport() {
        return recentReports.isEmpty() ? null : recentReports.get(recentReports.size() - 1);
    }

    @Override public String toString() {
        return "CaptureSession{attempt=" + attempt + ", state=" + state
                + ", passes=" + consecutivePassCount + ", elapsedMs=" + elapsedMs() + "}";
    }
}
