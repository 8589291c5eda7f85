package com.photocheck.sdk.quality;

import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.DetectedFace;
import com.photocheck.sdk.detection.PerceptionResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks a validator's {@link LandmarkRequirement} before any pixel work.
 */
final class RequirementGuard {

    private RequirementGuard() {}

    /**
     * @return failing outcome when the requirement is not met, null when the validator may run
     */
    static ValidationOutcome check(Validator v, PerceptionResult perception, ValidatorConfig config) {
        LandmarkRequirement req = v.landmarkRequirement();
        if (req == LandmarkRequirement.NONE) return null;
        if (!perception.isFaceDetected()) {
            return ValidationOutcome.faceNotDetected(v.name());
        }
        if (req == LandmarkRequirement.LANDMARKS) {
            DetectedFace face = perception.asFace();
            int expected = config.landmarkLayout.landmarkCount;
            if (face.landmarkCount() != expected) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("expected", expected);
                details.put("actual", face.landmarkCount());
                details.put("layout", config.landmarkLayout.modelVersion);
                return ValidationOutcome.fail(v.name(), OutcomeCodes.LANDMARK_COUNT_MISMATCH,
                        0d, Severity.ERROR, details);
            }
        }
        return null;
    }
}
