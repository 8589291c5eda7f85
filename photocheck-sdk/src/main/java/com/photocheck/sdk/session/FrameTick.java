package com.photocheck.sdk.session;

import com.photocheck.sdk.api.CaptureState;
import com.photocheck.sdk.feedback.GuidanceMessage;
import com.photocheck.sdk.quality.ValidationReport;
import com.photocheck.sdk.storage.RecordId;

import java.util.Collections;
import java.util.List;

/**
 * Result of feeding one frame to a {@link BoothSession}.
 */
public final class FrameTick {

    public final long             timestampMs;
    /** False for frames skipped by the stride. */
    public final boolean          evaluated;
    /** Null when skipped or when perception was unavailable. */
    public final ValidationReport report;
    public final List<GuidanceMessage> guidance;
    public final CaptureState     state;
    public final CaptureDecision  decision;
    /** Set when this frame was captured and persisted. */
    public final RecordId         recordId;
    /** Perception or storage failure raised while handling this frame, null otherwise. */
    public final Throwable        failure;

    FrameTick(long timestampMs, boolean evaluated, ValidationReport report,
              List<GuidanceMessage> guidance, CaptureState state, CaptureDecision decision,
              RecordId recordId, Throwable failure) {
        this.timestampMs = timestampMs;
        this.evaluated   = evaluated;
        this.report      = report;
        this.guidance    = guidance != null ? guidance : Collections.<GuidanceMessage>emptyList();
        this.state       = state;
        this.decision    = decision;
        this.recordId    = recordId;
        this.failure     = failure;
    }

    public boolean isCaptured() { return recordId != null; }

    /** Top guidance line, null when nothing needs fixing. */
    public GuidanceMessage primaryGuidance() {
        return guidance.isEmpty() ? null : guidance.get(0);
    }

    @Override public String toString() {
        return "FrameTick{ts=" + timestampMs + ", state=" + state + ", decision=" + decision
                + (report != null ? ", passed=" + report.overallPassed : "")
                + (recordId != null ? ", record=" + recordId : "")
                + (failure != null ? ", failure=" + failure.getClass().getSimpleName() : "") + "}";
    }
}
