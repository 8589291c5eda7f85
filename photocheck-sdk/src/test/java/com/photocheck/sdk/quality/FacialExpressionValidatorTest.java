package com.photocheck.sdk.quality;

import com.photocheck.sdk.TestFaces;
import com.photocheck.sdk.TestFrames;
import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.NoFaceDetected;

import org.junit.Test;

import static org.junit.Assert.*;

public class FacialExpressionValidatorTest {

    private final FacialExpressionValidator validator = new FacialExpressionValidator();
    private final ValidatorConfig config = ValidatorConfig.defaults();
    private final Frame frame = TestFrames.checkerboard(0L);

    @Test
    public void neutralClosedMouth_passes() {
        ValidationOutcome o = validator.evaluate(frame, TestFaces.frontal(), config);
        assertTrue(o.passed);
        assertEquals(2d, (Double) o.details.get("mouthGapPx"), 1e-6);
    }

    @Test
    public void smiling_failsNonNeutral() {
        ValidationOutcome o = validator.evaluate(frame, TestFaces.builder().neutral(0.4f).build(), config);
        assertEquals(OutcomeCodes.NON_NEUTRAL_EXPRESSION, o.code);
        assertEquals(0.5d, o.score, 1e-6);
    }

    @Test
    public void openMouth_failsMouthOpen() {
        ValidationOutcome o = validator.evaluate(frame, TestFaces.builder().mouthGap(10f).build(), config);
        assertEquals(OutcomeCodes.MOUTH_OPEN, o.code);
        assertEquals(0.5d, o.score, 1e-6);
    }

    @Test
    public void wrongLandmarkCount_failsGracefully() {
        ValidationOutcome o = validator.evaluate(frame, TestFaces.builder().landmarkCount(5).build(), config);
        assertFalse(o.passed);
        assertEquals(OutcomeCodes.LANDMARK_COUNT_MISMATCH, o.code);
        assertEquals(68, o.details.get("expected"));
        assertEquals(5, o.details.get("actual"));
    }

    @Test
    public void noFace_failsFaceNotDetected() {
        ValidationOutcome o = validator.evaluate(frame, new NoFaceDetected("ibug-68"), config);
        assertEquals(OutcomeCodes.FACE_NOT_DETECTED, o.code);
    }

    @Test
    public void nanNeutralScore_failsNonNeutral() {
        ValidationOutcome o = validator.evaluate(frame, TestFaces.builder().neutral(Float.NaN).build(), config);
        assertFalse(o.passed);
        assertEquals(OutcomeCodes.NON_NEUTRAL_EXPRESSION, o.code);
        assertEquals(0d, o.score, 0d);
    }

    @Test
    public void nanMouthGap_failsMouthOpen() {
        ValidationOutcome o = validator.evaluate(frame, TestFaces.builder().mouthGap(Float.NaN).build(), config);
        assertFalse(o.passed);
        assertEquals(OutcomeCodes.MOUTH_OPEN, o.code);
    }
}
