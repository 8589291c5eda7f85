package com.photocheck.sdk.quality;

import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.camera.ImageUtils;
import com.photocheck.sdk.camera.PixelRegion;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.BoundingBox;
import com.photocheck.sdk.detection.PerceptionResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain, light background. Luminance outside the head-and-shoulders region
 * (face box grown 30% sideways, 20% up, to 1.6x width and 1.8x height).
 * Registered as advisory by default.
 */
public final class BackgroundValidator implements Validator {

    public static final String NAME = "Background";

    /** Below this many background pixels the check is not meaningful. */
    static final int MIN_BACKGROUND_PIXELS = 100;

    @Override public String name() { return NAME; }

    @Override public LandmarkRequirement landmarkRequirement() { return LandmarkRequirement.FACE_BOX; }

    @Override
    public ValidationOutcome evaluate(Frame frame, PerceptionResult perception, ValidatorConfig config) {
        ValidationOutcome unmet = RequirementGuard.check(this, perception, config);
        if (unmet != null) return unmet;

        BoundingBox box = perception.asFace().boundingBox;
        PixelRegion head = PixelRegion.fromEdges(
                box.left - box.width() * 0.3f,
                box.top - box.height() * 0.2f,
                box.left - box.width() * 0.3f + box.width() * 1.6f,
                box.top - box.height() * 0.2f + box.height() * 1.8f);

        int[] hist = new int[256];
        int count = 0;
        for (int y = 0; y < frame.height; y++) {
            for (int x = 0; x < frame.width; x++) {
                if (head.contains(x, y)) continue;
                hist[frame.lumaAt(x, y)]++;
                count++;
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("backgroundPixels", count);
        if (count < MIN_BACKGROUND_PIXELS) {
            details.put("note", "small_background");
            return ValidationOutcome.pass(NAME, 1d, details);
        }

        double mean = ImageUtils.histogramMean(hist);
        double std  = ImageUtils.histogramStdDev(hist);
        details.put("mean", mean);
        details.put("stdDev", std);

        double score = Math.min(
                Scores.atMost(std, config.backgroundStdMax),
                Scores.atLeast(mean, config.backgroundMeanMin));
        if (std > config.backgroundStdMax) {
            return ValidationOutcome.fail(NAME, OutcomeCodes.BACKGROUND_NOT_UNIFORM,
                    score, Severity.WARNING, details);
        }
        if (mean < config.backgroundMeanMin) {
            return ValidationOutcome.fail(NAME, OutcomeCodes.BACKGROUND_TOO_DARK,
                    score, Severity.WARNING, details);
        }
        return ValidationOutcome.pass(NAME, score, details);
    }
}
