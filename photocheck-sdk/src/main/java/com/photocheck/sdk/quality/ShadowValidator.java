package com.photocheck.sdk.quality;

import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.camera.ImageUtils;
import com.photocheck.sdk.camera.PixelRegion;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.PerceptionResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Side lighting: relative luminance difference between the left and right face halves.
 */
public final class ShadowValidator implements Validator {

    public static final String NAME = "Shadow";

    @Override public String name() { return NAME; }

    @Override public LandmarkRequirement landmarkRequirement() { return LandmarkRequirement.FACE_BOX; }

    @Override
    public ValidationOutcome evaluate(Frame frame, PerceptionResult perception, ValidatorConfig config) {
        ValidationOutcome unmet = RequirementGuard.check(this, perception, config);
        if (unmet != null) return unmet;

        PixelRegion face = perception.asFace().boundingBox.toRegion().clampTo(frame.width, frame.height);
        int half = face.width / 2;
        PixelRegion leftHalf  = new PixelRegion(face.x, face.y, half, face.height);
        PixelRegion rightHalf = new PixelRegion(face.right() - half, face.y, half, face.height);
        double left  = ImageUtils.mean(frame, leftHalf);
        double right = ImageUtils.mean(frame, rightHalf);
        double brighter = Math.max(left, right);
        double asymmetry = brighter > 0 ? Math.abs(left - right) / brighter : 0d;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("leftMean", left);
        details.put("rightMean", right);
        details.put("asymmetry", asymmetry);

        double score = Scores.atMost(asymmetry, config.shadowMaxAsymmetry);
        if (asymmetry >= config.shadowMaxAsymmetry) {
            return ValidationOutcome.fail(NAME, OutcomeCodes.SHADOW_DETECTED, score, Severity.WARNING, details);
        }
        return ValidationOutcome.pass(NAME, score, details);
    }
}
