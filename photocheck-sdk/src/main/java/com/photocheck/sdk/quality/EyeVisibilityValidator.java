package com.photocheck.sdk.quality;

import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.DetectedFace;
import com.photocheck.sdk.detection.PerceptionResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Both eyes unobstructed: mean landmark visibility of each eye must reach the threshold.
 */
public final class EyeVisibilityValidator implements Validator {

    public static final String NAME = "EyeVisibility";

    @Override public String name() { return NAME; }

    @Override public LandmarkRequirement landmarkRequirement() { return LandmarkRequirement.LANDMARKS; }

    @Override
    public ValidationOutcome evaluate(Frame frame, PerceptionResult perception, ValidatorConfig config) {
        ValidationOutcome unmet = RequirementGuard.check(this, perception, config);
        if (unmet != null) return unmet;

        DetectedFace face = perception.asFace();
        double left  = meanVisibility(face, config.landmarkLayout.leftEye());
        double right = meanVisibility(face, config.landmarkLayout.rightEye());
        double worst = Math.min(left, right);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("leftEyeVisibility", left);
        details.put("rightEyeVisibility", right);

        double score = Scores.atLeast(worst, config.eyeVisibilityMin);
        // NaN visibility counts as obstructed
        if (!(worst >= config.eyeVisibilityMin)) {
            return ValidationOutcome.fail(NAME, OutcomeCodes.EYES_OBSTRUCTED, score, Severity.ERROR, details);
        }
        return ValidationOutcome.pass(NAME, score, details);
    }

    private static double meanVisibility(DetectedFace face, int[] indices) {
        if (indices.length == 0) return 0d;
        double sum = 0;
        for (int i : indices) {
            sum += face.landmark(i).visibility;
        }
        return sum / indices.length;
    }
}
