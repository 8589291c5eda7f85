package com.photocheck.sdk.session;

import com.photocheck.sdk.TestFaces;
import com.photocheck.sdk.TestFrames;
import com.photocheck.sdk.api.CaptureState;
import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.config.CaptureConfig;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.NoFaceDetected;
import com.photocheck.sdk.detection.PerceptionAdapter;
import com.photocheck.sdk.detection.PerceptionUnavailableException;
import com.photocheck.sdk.feedback.FeedbackTranslator;
import com.photocheck.sdk.feedback.GuidanceCatalog;
import com.photocheck.sdk.quality.StubValidator;
import com.photocheck.sdk.quality.ValidationOrchestrator;
import com.photocheck.sdk.quality.ValidationReport;
import com.photocheck.sdk.quality.ValidatorRegistry;
import com.photocheck.sdk.storage.CapturePersister;
import com.photocheck.sdk.storage.RecordId;
import com.photocheck.sdk.storage.StorageCollaborator;
import com.photocheck.sdk.storage.StorageException;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class BoothSessionTest {

    private PerceptionAdapter   perception;
    private StorageCollaborator storage;
    private ValidationOrchestrator orchestrator;
    private FeedbackTranslator  translator;

    @Before
    public void setUp() throws Exception {
        perception = mock(PerceptionAdapter.class);
        storage    = mock(StorageCollaborator.class);
        when(perception.detect(any(Frame.class))).thenReturn(TestFaces.frontal());

        ValidatorRegistry registry = new ValidatorRegistry();
        registry.register(new StubValidator("Check", true));
        orchestrator = new ValidationOrchestrator(registry, perception, ValidatorConfig.defaults());
        translator   = new FeedbackTranslator(GuidanceCatalog.defaults());
    }

    private BoothSession session(CaptureConfig config) {
        CapturePersister persister = new CapturePersister(storage,
                config.storageRetries, config.storageRetryBackoffMs);
        return new BoothSession("booth-test", orchestrator, translator, persister, config);
    }

    private static Frame frame(long ts) {
        return TestFrames.uniform(128, ts);
    }

    @Test
    public void stablePasses_captureAndPersistOnce() throws Exception {
        when(storage.persist(any(Frame.class), any(ValidationReport.class))).thenReturn(new RecordId("r-1"));
        BoothSession s = session(CaptureConfig.defaults());

        for (int i = 0; i < 4; i++) {
            FrameTick t = s.onFrame(frame(i * 100L));
            assertEquals(CaptureDecision.CONTINUE, t.decision);
            assertTrue(t.evaluated);
            assertNull(t.primaryGuidance());
        }
        FrameTick fifth = s.onFrame(frame(400L));

        assertEquals(CaptureDecision.CAPTURE_NOW, fifth.decision);
        assertEquals(CaptureState.CAPTURED, fifth.state);
        assertTrue(fifth.isCaptured());
        assertEquals(new RecordId("r-1"), s.getCapturedRecord());
        assertFalse(s.hasPendingCapture());

        FrameTick after = s.onFrame(frame(500L));
        assertEquals(CaptureDecision.IGNORED, after.decision);
        assertFalse(after.evaluated);
        verify(storage, times(1)).persist(any(Frame.class), any(ValidationReport.class));
    }

    @Test
    public void storageFailsOnce_retriedWithinTheSameFrame() throws Exception {
        when(storage.persist(any(Frame.class), any(ValidationReport.class)))
                .thenThrow(new StorageException("disk busy"))
                .thenReturn(new RecordId("r-2"));
        BoothSession s = session(CaptureConfig.defaults());

        FrameTick last = null;
        for (int i = 0; i < 5; i++) last = s.onFrame(frame(i * 100L));

        assertEquals(CaptureState.CAPTURED, last.state);
        assertEquals(new RecordId("r-2"), last.recordId);
        assertNull(last.failure);
        verify(storage, times(2)).persist(any(Frame.class), any(ValidationReport.class));
    }

    @Test
    public void storageKeepsFailing_holdsCaptureUntilRetry() throws Exception {
        when(storage.persist(any(Frame.class), any(ValidationReport.class)))
                .thenThrow(new StorageException("disk full"));
        BoothSession s = session(CaptureConfig.builder().storageRetries(1).build());

        FrameTick last = null;
        for (int i = 0; i < 5; i++) last = s.onFrame(frame(i * 100L));

        assertEquals(CaptureDecision.CAPTURE_NOW, last.decision);
        assertEquals(CaptureState.STABLE_PASS, last.state);
        assertTrue(last.failure instanceof StorageException);
        assertTrue(s.hasPendingCapture());
        assertNull(s.getCapturedRecord());
        verify(storage, times(2)).persist(any(Frame.class), any(ValidationReport.class));

        FrameTick waiting = s.onFrame(frame(500L));
        assertFalse(waiting.evaluated);
        assertEquals(CaptureDecision.CONTINUE, waiting.decision);

        doReturn(new RecordId("r-3")).when(storage).persist(any(Frame.class), any(ValidationReport.class));
        assertEquals(new RecordId("r-3"), s.retryCapture());
        assertEquals(CaptureState.CAPTURED, s.getState());
        assertFalse(s.hasPendingCapture());
    }

    @Test
    public void abandonCapture_returnsToEvaluating() throws Exception {
        when(storage.persist(any(Frame.class), any(ValidationReport.class)))
                .thenThrow(new StorageException("disk full"));
        BoothSession s = session(CaptureConfig.builder().storageRetries(0).build());
        for (int i = 0; i < 5; i++) s.onFrame(frame(i * 100L));

        s.abandonCapture();

        assertEquals(CaptureState.EVALUATING, s.getState());
        assertFalse(s.hasPendingCapture());
        assertEquals(0, s.snapshot().consecutivePassCount);
    }

    @Test(expected = IllegalStateException.class)
    public void retryCapture_withoutPendingCapture_throws() throws Exception {
        session(CaptureConfig.defaults()).retryCapture();
    }

    @Test
    public void timeoutWhilePending_dropsCapture() throws Exception {
        when(storage.persist(any(Frame.class), any(ValidationReport.class)))
                .thenThrow(new StorageException("disk full"));
        BoothSession s = session(CaptureConfig.builder().storageRetries(0).build());
        for (int i = 0; i < 5; i++) s.onFrame(frame(i * 100L));

        FrameTick t = s.onFrame(frame(30_000L));

        assertEquals(CaptureDecision.TIMED_OUT, t.decision);
        assertEquals(CaptureState.TIMEOUT, s.getState());
        assertFalse(s.hasPendingCapture());
    }

    @Test
    public void frameStride_evaluatesEveryOtherFrame() throws Exception {
        when(storage.persist(any(Frame.class), any(ValidationReport.class))).thenReturn(new RecordId("r-4"));
        BoothSession s = session(CaptureConfig.builder().frameStride(2).build());

        List<FrameTick> ticks = new ArrayList<>();
        for (int i = 0; i < 9; i++) ticks.add(s.onFrame(frame(i * 100L)));

        for (int i = 0; i < 9; i++) {
            assertEquals("frame " + i, i % 2 == 0, ticks.get(i).evaluated);
        }
        assertEquals(CaptureDecision.CAPTURE_NOW, ticks.get(8).decision);
        verify(perception, times(5)).detect(any(Frame.class));
    }

    @Test
    public void noFace_givesGuidanceAndNoCapture() throws Exception {
        when(perception.detect(any(Frame.class))).thenReturn(new NoFaceDetected("test"));
        BoothSession s = session(CaptureConfig.defaults());

        FrameTick t = s.onFrame(frame(0L));

        assertEquals(CaptureState.WAITING_FOR_FACE, t.state);
        assertFalse(t.report.faceDetected);
        verify(storage, never()).persist(any(Frame.class), any(ValidationReport.class));
    }

    @Test
    public void perceptionUnavailable_movesToError() throws Exception {
        PerceptionUnavailableException down = new PerceptionUnavailableException("model not loaded");
        when(perception.detect(any(Frame.class))).thenThrow(down);
        BoothSession s = session(CaptureConfig.defaults());

        FrameTick t = s.onFrame(frame(0L));

        assertEquals(CaptureState.ERROR, t.state);
        assertSame(down, t.failure);
        assertNull(t.report);
        assertSame(down, s.snapshot().failureCause);
        assertEquals(CaptureDecision.IGNORED, s.onFrame(frame(100L)).decision);
    }

    @Test
    public void adapterCrash_movesToErrorAndNotifiesListeners() throws Exception {
        IllegalStateException crash = new IllegalStateException("native model crashed");
        when(perception.detect(any(Frame.class))).thenThrow(crash);
        BoothSession s = session(CaptureConfig.defaults());
        final List<FrameTick> seen = new ArrayList<>();
        s.addListener(seen::add);

        FrameTick t = s.onFrame(frame(0L));

        assertEquals(CaptureState.ERROR, t.state);
        assertTrue(t.failure instanceof PerceptionUnavailableException);
        assertSame(crash, t.failure.getCause());
        assertNull(t.report);
        assertEquals(1, seen.size());
        assertSame(t, seen.get(0));
        assertEquals(CaptureDecision.IGNORED, s.onFrame(frame(100L)).decision);
    }

    @Test
    public void listeners_seeEveryTickEvenWhenOneThrows() {
        BoothSession s = session(CaptureConfig.defaults());
        final List<FrameTick> seen = new ArrayList<>();
        s.addListener(tick -> { throw new IllegalStateException("broken display"); });
        s.addListener(seen::add);

        s.onFrame(frame(0L));
        s.onFrame(frame(100L));

        assertEquals(2, seen.size());
        assertEquals(100L, seen.get(1).timestampMs);
    }

    @Test
    public void cancel_startsNewAttempt() {
        BoothSession s = session(CaptureConfig.defaults());
        s.onFrame(frame(0L));
        s.onFrame(frame(100L));

        s.cancel();

        CaptureSession snap = s.snapshot();
        assertEquals(CaptureState.WAITING_FOR_FACE, snap.state);
        assertEquals(2, snap.attempt);
        assertTrue(snap.recentReports.isEmpty());
    }
}
