package com.photocheck.sdk.quality;

import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.camera.ImageUtils;
import com.photocheck.sdk.camera.PixelRegion;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.PerceptionResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Focus / motion blur: Laplacian variance over the padded face region.
 * Lower variance means more blur.
 */
public final class SharpnessValidator implements Validator {

    public static final String NAME = "Sharpness";

    @Override public String name() { return NAME; }

    @Override public LandmarkRequirement landmarkRequirement() { return LandmarkRequirement.NONE; }

    @Override
    public ValidationOutcome evaluate(Frame frame, PerceptionResult perception, ValidatorConfig config) {
        PixelRegion region = perception.isFaceDetected()
                ? perception.asFace().boundingBox.toRegion()
                        .pad(config.sharpnessPadRatio, config.sharpnessPadRatio)
                : frame.bounds();
        double variance = ImageUtils.laplacianVariance(frame, region);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("laplacianVariance", variance);

        double score = Scores.atLeast(variance, config.sharpnessMin);
        if (variance < config.sharpnessMin) {
            return ValidationOutcome.fail(NAME, OutcomeCodes.BLURRY, score, Severity.ERROR, details);
        }
        return ValidationOutcome.pass(NAME, score, details);
    }
}
