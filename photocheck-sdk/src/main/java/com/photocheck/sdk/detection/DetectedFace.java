package com.photocheck.sdk.detection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A detected face: bounding box, ordered landmarks, expression confidences and head pose.
 * Landmark count is fixed per model version (see {@link LandmarkLayout}).
 */
public final class DetectedFace extends PerceptionResult {

    public static final String NEUTRAL = "neutral";

    public final BoundingBox          boundingBox;
    public final List<Landmark>       landmarks;
    public final Map<String, Float>   expressionScores;
    public final HeadPose             headPose;

    public DetectedFace(BoundingBox boundingBox,
                        List<Landmark> landmarks,
                        Map<String, Float> expressionScores,
                        HeadPose headPose,
                        String modelVersion) {
        super(modelVersion);
        if (boundingBox == null) {
            throw new IllegalArgumentException("boundingBox must not be null");
        }
        this.boundingBox      = boundingBox;
        this.landmarks        = landmarks != null
                ? Collections.unmodifiableList(new ArrayList<>(landmarks))
                : Collections.<Landmark>emptyList();
        this.expressionScores = expressionScores != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(expressionScores))
                : Collections.<String, Float>emptyMap();
        this.headPose         = headPose != null ? headPose : HeadPose.FRONTAL;
    }

    @Override public boolean isFaceDetected() { return true; }

    public int landmarkCount() { return landmarks.size(); }

    public Landmark landmark(int index) { return landmarks.get(index); }

    /** Confidence for the label, 0 when the model did not report it. */
    public float expressionScore(String label) {
        Float v = expressionScores.get(label);
        return v != null ? v : 0f;
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof DetectedFace)) return false;
        DetectedFace f = (DetectedFace) o;
        return boundingBox.equals(f.boundingBox)
                && landmarks.equals(f.landmarks)
                && expressionScores.equals(f.expressionScores)
                && headPose.equals(f.headPose)
                && (modelVersion == null ? f.modelVersion == null : modelVersion.equals(f.modelVersion));
    }

    @Override public int hashCode() {
        int h = boundingBox.hashCode();
        h = 31 * h + landmarks.hashCode();
        h = 31 * h + expressionScores.hashCode();
        return 31 * h + headPose.hashCode();
    }

    @Override public String toString() {
        return "DetectedFace{box=" + boundingBox + ", landmarks=" + landmarks.size()
                + ", pose=" + headPose + ", model=" + modelVersion + "}";
    }
}
