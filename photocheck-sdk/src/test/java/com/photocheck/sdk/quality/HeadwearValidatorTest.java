package com.photocheck.sdk.quality;

import com.photocheck.sdk.TestFaces;
import com.photocheck.sdk.TestFrames;
import com.photocheck.sdk.camera.PixelRegion;
import com.photocheck.sdk.config.ValidatorConfig;

import org.junit.Test;

import java.awt.Color;

import static org.junit.Assert.*;

public class HeadwearValidatorTest {

    /** Strip above the {@link TestFaces#frontal()} box: 30% of its 80 px height. */
    private static final PixelRegion FOREHEAD = new PixelRegion(70, 36, 60, 24);

    private final HeadwearValidator validator = new HeadwearValidator();
    private final ValidatorConfig config = ValidatorConfig.defaults();

    @Test
    public void skinAboveFace_passes() {
        ValidationOutcome o = validator.evaluate(
                TestFrames.checkerboardWithColor(FOREHEAD, 0xE0AC8C, 0L), TestFaces.frontal(), config);
        assertTrue(o.passed);
        assertEquals(1d, (Double) o.details.get("skinRatio"), 1e-9);
    }

    @Test
    public void darkCap_failsHeadwear() {
        ValidationOutcome o = validator.evaluate(
                TestFrames.checkerboardWithPatch(FOREHEAD, 20, 0L), TestFaces.frontal(), config);
        assertFalse(o.passed);
        assertEquals(OutcomeCodes.HEADWEAR_DETECTED, o.code);
        assertEquals(0.4d, o.score, 1e-6);
    }

    @Test
    public void faceAtTopEdge_passesWithNote() {
        ValidationOutcome o = validator.evaluate(TestFrames.uniform(20, 0L),
                TestFaces.builder().box(70, 0, 130, 80).build(), config);
        assertTrue(o.passed);
        assertEquals("no_forehead_region", o.details.get("note"));
    }

    @Test
    public void skinTone_coversLightAndDarkSkin() {
        float[] hsb = new float[3];
        Color.RGBtoHSB(0xE0, 0xAC, 0x8C, hsb);
        assertTrue(HeadwearValidator.isSkinTone(hsb));
        Color.RGBtoHSB(0x8D, 0x55, 0x24, hsb);
        assertTrue(HeadwearValidator.isSkinTone(hsb));
        Color.RGBtoHSB(0x20, 0x40, 0xC0, hsb);
        assertFalse(HeadwearValidator.isSkinTone(hsb));
    }
}
