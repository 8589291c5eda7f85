package com.photocheck.sdk.quality;

import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.BoundingBox;
import com.photocheck.sdk.detection.DetectedFace;
import com.photocheck.sdk.detection.HeadPose;
import com.photocheck.sdk.detection.PerceptionResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Head size, centering and pose. Checked in that order; the first failure names the code.
 */
public final class FacePositionValidator implements Validator {

    public static final String NAME = "FacePosition";

    @Override public String name() { return NAME; }

    @Override public LandmarkRequirement landmarkRequirement() { return LandmarkRequirement.FACE_BOX; }

    @Override
    public ValidationOutcome evaluate(Frame frame, PerceptionResult perception, ValidatorConfig config) {
        ValidationOutcome unmet = RequirementGuard.check(this, perception, config);
        if (unmet != null) return unmet;

        DetectedFace face = perception.asFace();
        BoundingBox box = face.boundingBox;
        HeadPose pose = face.headPose;

        double heightRatio = box.height() / frame.height;
        double offsetX = Math.abs(box.centerX() - frame.width * 0.5) / frame.width;
        double offsetY = Math.abs(box.centerY() - frame.height * 0.5) / frame.height;
        double offset = Math.max(offsetX, offsetY);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("heightRatio", heightRatio);
        details.put("centerOffsetX", offsetX);
        details.put("centerOffsetY", offsetY);
        details.put("yaw", (double) pose.yaw);
        details.put("pitch", (double) pose.pitch);
        details.put("roll", (double) pose.roll);

        double poseScore = Math.min(
                Scores.atMost(Math.abs(pose.yaw), config.yawMaxDeg),
                Math.min(Scores.atMost(Math.abs(pose.pitch), config.pitchMaxDeg),
                         Scores.atMost(Math.abs(pose.roll), config.rollMaxDeg)));
        double score = Math.min(
                Scores.band(heightRatio, config.faceHeightRatioMin, config.faceHeightRatioMax),
                Math.min(Scores.atMost(offset, config.faceCenterTolerance), poseScore));

        // written so that a NaN measurement fails
        String code = null;
        if (!(heightRatio >= config.faceHeightRatioMin)) {
            code = OutcomeCodes.FACE_TOO_SMALL;
        } else if (heightRatio > config.faceHeightRatioMax) {
            code = OutcomeCodes.FACE_TOO_LARGE;
        } else if (!(offset <= config.faceCenterTolerance)) {
            code = OutcomeCodes.FACE_OFF_CENTER;
        } else if (!(Math.abs(pose.yaw) <= config.yawMaxDeg)
                || !(Math.abs(pose.pitch) <= config.pitchMaxDeg)
                || !(Math.abs(pose.roll) <= config.rollMaxDeg)) {
            code = OutcomeCodes.HEAD_NOT_FRONTAL;
        }
        if (code != null) {
            return ValidationOutcome.fail(NAME, code, score, Severity.ERROR, details);
        }
        return ValidationOutcome.pass(NAME, score, details);
    }
}
