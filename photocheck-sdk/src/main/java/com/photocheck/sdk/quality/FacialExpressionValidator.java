package com.photocheck.sdk.quality;

import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.DetectedFace;
import com.photocheck.sdk.detection.LandmarkLayout;
import com.photocheck.sdk.detection.PerceptionResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Neutral expression with closed mouth. Neutral confidence comes from the
 * expression model; mouth opening is the inner-lip landmark distance.
 */
public final class FacialExpressionValidator implements Validator {

    public static final String NAME = "FacialExpression";

    @Override public String name() { return NAME; }

    @Override public LandmarkRequirement landmarkRequirement() { return LandmarkRequirement.LANDMARKS; }

    @Override
    public ValidationOutcome evaluate(Frame frame, PerceptionResult perception, ValidatorConfig config) {
        ValidationOutcome unmet = RequirementGuard.check(this, perception, config);
        if (unmet != null) return unmet;

        DetectedFace face = perception.asFace();
        LandmarkLayout layout = config.landmarkLayout;
        double neutral = face.expressionScore(DetectedFace.NEUTRAL);
        double mouthGap = face.landmark(layout.mouthInnerTop)
                .distanceTo(face.landmark(layout.mouthInnerBottom));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("neutral", neutral);
        details.put("mouthGapPx", mouthGap);

        double score = Math.min(
                Scores.atLeast(neutral, config.neutralMin),
                Scores.atMost(mouthGap, config.mouthOpenMaxPx));

        if (!(neutral >= config.neutralMin)) {
            return ValidationOutcome.fail(NAME, OutcomeCodes.NON_NEUTRAL_EXPRESSION,
                    score, Severity.WARNING, details);
        }
        if (!(mouthGap <= config.mouthOpenMaxPx)) {
            return ValidationOutcome.fail(NAME, OutcomeCodes.MOUTH_OPEN,
                    score, Severity.WARNING, details);
        }
        return ValidationOutcome.pass(NAME, score, details);
    }
}
