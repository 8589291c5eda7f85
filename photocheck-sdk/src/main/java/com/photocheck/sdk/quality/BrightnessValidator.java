package com.photocheck.sdk.quality;

import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.camera.ImageUtils;
import com.photocheck.sdk.camera.PixelRegion;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.PerceptionResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exposure: mean and spread of the luminance histogram over the face
 * (whole frame when no face is found). Mean is checked before spread.
 */
public final class BrightnessValidator implements Validator {

    public static final String NAME = "Brightness";

    @Override public String name() { return NAME; }

    @Override public LandmarkRequirement landmarkRequirement() { return LandmarkRequirement.NONE; }

    @Override
    public ValidationOutcome evaluate(Frame frame, PerceptionResult perception, ValidatorConfig config) {
        PixelRegion region = perception.isFaceDetected()
                ? perception.asFace().boundingBox.toRegion()
                : frame.bounds();
        int[] hist = ImageUtils.histogram(frame, region);
        double mean = ImageUtils.histogramMean(hist);
        double std  = ImageUtils.histogramStdDev(hist);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("mean", mean);
        details.put("stdDev", std);
        details.put("faceRegion", perception.isFaceDetected());

        double score = Math.min(
                Scores.band(mean, config.brightnessMeanMin, config.brightnessMeanMax),
                Scores.band(std, config.brightnessStdMin, config.brightnessStdMax));

        String code = null;
        if (mean < config.brightnessMeanMin) {
            code = OutcomeCodes.TOO_DARK;
        } else if (mean > config.brightnessMeanMax) {
            code = OutcomeCodes.TOO_BRIGHT;
        } else if (std < config.brightnessStdMin) {
            code = OutcomeCodes.LOW_CONTRAST;
        } else if (std > config.brightnessStdMax) {
            code = OutcomeCodes.HIGH_CONTRAST;
        }
        if (code != null) {
            return ValidationOutcome.fail(NAME, code, score, Severity.ERROR, details);
        }
        return ValidationOutcome.pass(NAME, score, details);
    }
}
