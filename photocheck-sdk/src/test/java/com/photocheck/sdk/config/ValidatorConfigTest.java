package com.photocheck.sdk.config;

import com.photocheck.sdk.api.ValidatorConfigException;
import com.photocheck.sdk.detection.LandmarkLayout;

import org.junit.Test;

import static org.junit.Assert.*;

public class ValidatorConfigTest {

    @Test
    public void defaults_areConsistent() {
        ValidatorConfig c = ValidatorConfig.defaults();
        assertEquals(60f, c.brightnessMeanMin, 0f);
        assertEquals(200f, c.brightnessMeanMax, 0f);
        assertEquals(0.12f, c.faceCenterTolerance, 0f);
        assertSame(LandmarkLayout.IBUG_68, c.landmarkLayout);
    }

    @Test
    public void everyProblemIsListed() {
        try {
            ValidatorConfig.builder()
                    .eyeVisibilityMin(1.5f)
                    .sharpnessMin(-1f)
                    .reflectionMinClusterPx(0)
                    .landmarkLayout(null)
                    .build();
            fail("invalid thresholds accepted");
        } catch (ValidatorConfigException e) {
            assertEquals(4, e.getProblems().size());
            assertTrue(e.getProblems().contains("sharpness.min must be >= 0"));
            assertTrue(e.getProblems().contains("reflection.minClusterPx must be >= 1"));
        }
    }

    @Test(expected = ValidatorConfigException.class)
    public void faceHeightBandReversed_rejected() {
        ValidatorConfig.builder().faceHeightRatio(0.7f, 0.4f).build();
    }

    @Test
    public void captureConfig_rejectsZeroStableFrames() {
        try {
            CaptureConfig.builder().stableFramesRequired(0).sessionTimeoutMs(0L).build();
            fail("invalid capture settings accepted");
        } catch (ValidatorConfigException e) {
            assertEquals(2, e.getProblems().size());
        }
    }
}
