package com.photocheck.sdk.quality;

import com.photocheck.sdk.TestFaces;
import com.photocheck.sdk.TestFrames;
import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.NoFaceDetected;

import org.junit.Test;

import static org.junit.Assert.*;

public class BrightnessValidatorTest {

    private final BrightnessValidator validator = new BrightnessValidator();
    private final ValidatorConfig config = ValidatorConfig.defaults();
    private final NoFaceDetected noFace = new NoFaceDetected("ibug-68");

    @Test
    public void meanTwenty_failsTooDark() {
        ValidationOutcome o = validator.evaluate(TestFrames.uniform(20, 0L), noFace, config);
        assertFalse(o.passed);
        assertEquals(OutcomeCodes.TOO_DARK, o.code);
        assertEquals(Severity.ERROR, o.severity);
        // flat frame also has no spread, the weaker margin wins
        assertEquals(0d, o.score, 1e-9);
        assertEquals(20d, (Double) o.details.get("mean"), 1e-9);
    }

    @Test
    public void overexposed_failsTooBright() {
        ValidationOutcome o = validator.evaluate(TestFrames.uniform(230, 0L), noFace, config);
        assertEquals(OutcomeCodes.TOO_BRIGHT, o.code);
        assertTrue(o.score < 1d);
    }

    @Test
    public void flatGray_failsLowContrast() {
        ValidationOutcome o = validator.evaluate(TestFrames.uniform(130, 0L), noFace, config);
        assertEquals(OutcomeCodes.LOW_CONTRAST, o.code);
        assertEquals(0d, o.score, 1e-9);
    }

    @Test
    public void blackWhiteCheckerboard_failsHighContrast() {
        Frame harsh = TestFrames.checkerboard(0, 255, 0L);
        ValidationOutcome o = validator.evaluate(harsh, noFace, config);
        assertEquals(OutcomeCodes.HIGH_CONTRAST, o.code);
    }

    @Test
    public void wellExposed_passesWithFullScore() {
        ValidationOutcome o = validator.evaluate(TestFrames.checkerboard(0L), TestFaces.frontal(), config);
        assertTrue(o.passed);
        assertEquals(OutcomeCodes.OK, o.code);
        assertEquals(Severity.INFO, o.severity);
        assertEquals(1d, o.score, 1e-9);
        assertEquals(130d, (Double) o.details.get("mean"), 1e-9);
        assertEquals(30d, (Double) o.details.get("stdDev"), 1e-9);
    }

    @Test
    public void faceDetected_measuresFaceRegionOnly() {
        Frame darkFace = TestFrames.checkerboardWithPatch(TestFrames.FACE, 20, 0L);

        assertTrue(validator.evaluate(darkFace, noFace, config).passed);

        ValidationOutcome o = validator.evaluate(darkFace, TestFaces.frontal(), config);
        assertEquals(OutcomeCodes.TOO_DARK, o.code);
        assertEquals(Boolean.TRUE, o.details.get("faceRegion"));
    }
}
