package com.photocheck.sdk.session;

import com.photocheck.sdk.api.CaptureState;
import com.photocheck.sdk.config.CaptureConfig;
import com.photocheck.sdk.logging.CaptureEventLogger;
import com.photocheck.sdk.quality.ValidationReport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decides when a frame is stable enough to auto-capture.
 * <pre>
 *   WAITING_FOR_FACE → EVALUATING → STABLE_PASS → CAPTURED
 *   any non-terminal → TIMEOUT | ERROR
 * </pre>
 * Stability: N consecutive passing reports whose first and last timestamps are at
 * most T ms apart. Any failing or face-less report resets the count to zero.
 * All timing comes from frame timestamps; the attempt starts at the first frame
 * seen after construction or {@link #cancel()}.
 * <p>
 * Owns the session data exclusively; callers see {@link CaptureSession} snapshots.
 * Not thread-safe, driven from the booth loop.
 */
public final class CaptureStateMachine {

    private final String sessionId;
    private final int    requiredPasses;
    private final long   windowMs;
    private final long   timeoutMs;
    private final int    historySize;

    private CaptureState state = CaptureState.WAITING_FOR_FACE;
    private final Deque<Long> passTimes = new ArrayDeque<>();
    private final Deque<ValidationReport> history = new ArrayDeque<>();
    private int       consecutivePassCount;
    private long      startTs = -1L;
    private long      lastTs  = -1L;
    private int       attempt = 1;
    private Throwable failureCause;

    public CaptureStateMachine(String sessionId, CaptureConfig config) {
        this.sessionId      = sessionId;
        this.requiredPasses = config.stableFramesRequired;
        this.windowMs       = config.stabilityWindowMs;
        this.timeoutMs      = config.sessionTimeoutMs;
        this.historySize    = config.reportHistorySize;
    }

    public CaptureState state() { return state; }

    public CaptureDecision onReport(ValidationReport report) {
        if (state.isTerminal()) return CaptureDecision.IGNORED;
        long ts = report.timestamp;
        if (timedOut(ts)) return CaptureDecision.TIMED_OUT;
        // capture pending: reports do not count until it is committed or abandoned
        if (state == CaptureState.STABLE_PASS) return CaptureDecision.IGNORED;

        history.addLast(report);
        while (history.size() > historySize) history.removeFirst();

        if (!report.faceDetected) {
            resetPasses();
            return CaptureDecision.CONTINUE;
        }
        if (state == CaptureState.WAITING_FOR_FACE) {
            transition(CaptureState.EVALUATING, ts);
        }
        if (!report.overallPassed) {
            resetPasses();
            return CaptureDecision.CONTINUE;
        }

        consecutivePassCount++;
        passTimes.addLast(ts);
        while (passTimes.size() > requiredPasses) passTimes.removeFirst();
        if (passTimes.size() == requiredPasses && passTimes.peekLast() - passTimes.peekFirst() <= windowMs) {
            transition(CaptureState.STABLE_PASS, ts);
            return CaptureDecision.CAPTURE_NOW;
        }
        return CaptureDecision.CONTINUE;
    }

    /** Timeout check for frames that are not evaluated. */
    public CaptureDecision tick(long timestampMs) {
        if (state.isTerminal()) return CaptureDecision.IGNORED;
        return timedOut(timestampMs) ? CaptureDecision.TIMED_OUT : CaptureDecision.CONTINUE;
    }

    /**
     * @throws IllegalStateException unless in STABLE_PASS
     */
    public void markCaptured() {
        requireState(CaptureState.STABLE_PASS, "markCaptured");
        transition(CaptureState.CAPTURED, lastTs);
    }

    /**
     * The pending capture could not be committed: go back to EVALUATING and
     * require a fresh stable run.
     *
     * @throws IllegalStateException unless in STABLE_PASS
     */
    public void abandonCapture() {
        requireState(CaptureState.STABLE_PASS, "abandonCapture");
        resetPasses();
        transition(CaptureState.EVALUATING, lastTs);
    }

    /** @return false when already terminal */
    public boolean fail(Throwable cause) {
        if (state.isTerminal()) return false;
        failureCause = cause;
        transition(CaptureState.ERROR, lastTs);
        return true;
    }

    /** User abort: clears history and start time, back to WAITING_FOR_FACE. Allowed in any state. */
    public void cancel() {
        CaptureState from = state;
        state = CaptureState.WAITING_FOR_FACE;
        history.clear();
        resetPasses();
        startTs = -1L;
        lastTs  = -1L;
        failureCause = null;
        attempt++;
        Map<String, Object> ctx = context();
        ctx.put("from", from.name());
        CaptureEventLogger.event("capture_session_cancelled", ctx);
    }

    public CaptureSession session() {
        return new CaptureSession(attempt, state, consecutivePassCount, startTs, lastTs,
                new ArrayList<>(history), failureCause);
    }

    // ── internal ─────────────────────────────────────────────────────────

    private boolean timedOut(long ts) {
        if (startTs < 0) {
            startTs = ts;
            Map<String, Object> ctx = context();
            ctx.put("ts", ts);
            ctx.put("timeoutMs", timeoutMs);
            ctx.put("requiredPasses", requiredPasses);
            CaptureEventLogger.event("capture_session_start", ctx);
        }
        lastTs = ts;
        if (ts - startTs >= timeoutMs) {
            resetPasses();
            transition(CaptureState.TIMEOUT, ts);
            return true;
        }
        return false;
    }

    private void resetPasses() {
        consecutivePassCount = 0;
        passTimes.clear();
    }

    private void requireState(CaptureState expected, String op) {
        if (state != expected) {
            throw new IllegalStateException(op + " not allowed in " + state);
        }
    }

    private void transition(CaptureState to, long ts) {
        CaptureState from = state;
        state = to;
        Map<String, Object> ctx = context();
        ctx.put("from", from.name());
        ctx.put("to", to.name());
        ctx.put("ts", ts);
        ctx.put("elapsedMs", startTs < 0 ? 0L : ts - startTs);
        if (failureCause != null && to == CaptureState.ERROR) {
            ctx.put("cause", failureCause.getClass().getSimpleName());
        }
        CaptureEventLogger.event("capture_state_changed", ctx);
    }

    private Map<String, Object> context() {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("sessionId", sessionId);
        ctx.put("attempt", attempt);
        return ctx;
    }
}
