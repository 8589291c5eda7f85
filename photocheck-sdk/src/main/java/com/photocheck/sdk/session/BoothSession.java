package com.photocheck.sdk.session;

import com.photocheck.sdk.api.CaptureState;
import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.config.CaptureConfig;
import com.photocheck.sdk.detection.PerceptionUnavailableException;
import com.photocheck.sdk.feedback.FeedbackTranslator;
import com.photocheck.sdk.feedback.GuidanceMessage;
import com.photocheck.sdk.logging.CaptureErrorLogger;
import com.photocheck.sdk.logging.CaptureEventLogger;
import com.photocheck.sdk.logging.SafeLogger;
import com.photocheck.sdk.quality.ValidationOrchestrator;
import com.photocheck.sdk.quality.ValidationReport;
import com.photocheck.sdk.storage.CapturePersister;
import com.photocheck.sdk.storage.RecordId;
import com.photocheck.sdk.storage.StorageException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One booth capture session: the per-frame loop.
 * <pre>
 *   frame → (stride) → perception + validators → guidance → state machine
 *         → on CAPTURE_NOW: persist (bounded retries) → CAPTURED
 * </pre>
 * If persisting fails the session stays in STABLE_PASS with the frame held in memory
 * until {@link #retryCapture()} succeeds, {@link #abandonCapture()} drops it or the session times out.
 * Frames arriving meanwhile are only checked for timeout.
 * <p>
 * Frames are fed from a single loop thread. {@link #cancel()} may be called from another.
 */
public final class BoothSession {

    private static final String TAG = "BoothSession";

    private final String                 sessionId;
    private final ValidationOrchestrator orchestrator;
    private final FeedbackTranslator     translator;
    private final CaptureStateMachine    stateMachine;
    private final CapturePersister       persister;
    private final int                    frameStride;
    private final List<FrameTickListener> listeners = new CopyOnWriteArrayList<>();

    private long             frameCount;
    private Frame            pendingFrame;
    private ValidationReport pendingReport;
    private RecordId         capturedRecord;

    public BoothSession(String sessionId,
                        ValidationOrchestrator orchestrator,
                        FeedbackTranslator translator,
                        CapturePersister persister,
                        CaptureConfig config) {
        this.sessionId    = sessionId;
        this.orchestrator = orchestrator;
        this.translator   = translator;
        this.persister    = persister;
        this.frameStride  = config.frameStride;
        this.stateMachine = new CaptureStateMachine(sessionId, config);
    }

    public String getSessionId() { return sessionId; }

    public void addListener(FrameTickListener l)    { listeners.add(l); }
    public void removeListener(FrameTickListener l) { listeners.remove(l); }

    public synchronized FrameTick onFrame(Frame frame) {
        long ts = frame.timestampMs;
        FrameTick tick;
        if (stateMachine.state().isTerminal()) {
            tick = new FrameTick(ts, false, null, null, stateMachine.state(), CaptureDecision.IGNORED,
                    null, null);
        } else if (frameCount++ % frameStride != 0 || stateMachine.state() == CaptureState.STABLE_PASS) {
            CaptureDecision d = stateMachine.tick(ts);
            tick = new FrameTick(ts, false, null, null, stateMachine.state(), d, null, null);
        } else {
            tick = evaluate(frame);
        }
        if (pendingFrame != null && stateMachine.state().isTerminal()) {
            SafeLogger.w(TAG, "session ended in " + stateMachine.state() + ", pending capture dropped");
            clearPending();
        }
        notifyListeners(tick);
        return tick;
    }

    private FrameTick evaluate(Frame frame) {
        long ts = frame.timestampMs;
        ValidationReport report;
        try {
            report = orchestrator.run(frame);
        } catch (PerceptionUnavailableException e) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("sessionId", sessionId);
            ctx.put("frameTs", ts);
            CaptureErrorLogger.log(e, "perception", ctx);
            stateMachine.tick(ts);
            stateMachine.fail(e);
            return new FrameTick(ts, true, null, null, stateMachine.state(), CaptureDecision.IGNORED,
                    null, e);
        }

        List<GuidanceMessage> guidance = translator.translate(report);
        CaptureDecision decision = stateMachine.onReport(report);
        RecordId id = null;
        Throwable failure = null;
        if (decision == CaptureDecision.CAPTURE_NOW) {
            pendingFrame  = frame;
            pendingReport = report;
            try {
                id = commitPending();
            } catch (StorageException e) {
                SafeLogger.w(TAG, "capture could not be persisted, holding frame ts=" + ts);
                failure = e;
            }
        }
        return new FrameTick(ts, true, report, guidance, stateMachine.state(), decision, id, failure);
    }

    /**
     * Try again to persist the held capture.
     *
     * @throws IllegalStateException when no capture is pending
     * @throws StorageException      when persisting fails again; the capture stays pending
     */
    public synchronized RecordId retryCapture() throws StorageException {
        if (pendingFrame == null) {
            throw new IllegalStateException("no capture pending");
        }
        return commitPending();
    }

    /**
     * Drop the held capture and go back to evaluating frames.
     *
     * @throws IllegalStateException when no capture is pending
     */
    public synchronized void abandonCapture() {
        if (pendingFrame == null) {
            throw new IllegalStateException("no capture pending");
        }
        clearPending();
        stateMachine.abandonCapture();
    }

    /** User abort: history and timer reset, any pending capture is dropped. */
    public synchronized void cancel() {
        clearPending();
        capturedRecord = null;
        frameCount = 0;
        stateMachine.cancel();
    }

    public synchronized boolean hasPendingCapture() { return pendingFrame != null; }

    /** Record id of the committed capture, null until CAPTURED. */
    public synchronized RecordId getCapturedRecord() { return capturedRecord; }

    public synchronized CaptureState getState() { return stateMachine.state(); }

    public synchronized CaptureSession snapshot() { return stateMachine.session(); }

    private RecordId commitPending() throws StorageException {
        RecordId id = persister.persist(pendingFrame, pendingReport);
        stateMachine.markCaptured();
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("sessionId", sessionId);
        ctx.put("recordId", id.value);
        ctx.put("frameTs", pendingFrame.timestampMs);
        CaptureEventLogger.event("capture_persisted", ctx);
        capturedRecord = id;
        clearPending();
        return id;
    }

    private void clearPending() {
        pendingFrame  = null;
        pendingReport = null;
    }

    private void notifyListeners(FrameTick tick) {
        for (FrameTickListener l : listeners) {
            try {
                l.onFrameTick(tick);
            } catch (RuntimeException e) {
                CaptureErrorLogger.log(e, "listener",
                        Collections.<String, Object>singletonMap("sessionId", sessionId));
            }
        }
    }
}
