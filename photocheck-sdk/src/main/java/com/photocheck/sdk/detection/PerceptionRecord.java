package com.photocheck.sdk.detection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON form of one perception result, as written next to a recorded frame.
 * <pre>
 * {"source":"frame_001.png","face":true,
 *  "boundingBox":{"left":..,"top":..,"right":..,"bottom":..},
 *  "landmarks":[{"x":..,"y":..,"visibility":..}, ...],
 *  "expressionScores":{"neutral":0.93},
 *  "headPose":{"yaw":0,"pitch":0,"roll":0},
 *  "modelVersion":"ibug-68"}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PerceptionRecord {

    public String             source;
    public boolean            face;
    public Box                boundingBox;
    public List<Point>        landmarks;
    public Map<String, Float> expressionScores;
    public Pose               headPose;
    public String             modelVersion;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Box {
        public float left;
        public float top;
        public float right;
        public float bottom;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Point {
        public float x;
        public float y;
        public float visibility = 1f;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Pose {
        public float yaw;
        public float pitch;
        public float roll;
    }

    /**
     * @throws IllegalArgumentException when a face record has no bounding box
     */
    PerceptionResult toResult(String defaultModelVersion) {
        String model = modelVersion != null ? modelVersion : defaultModelVersion;
        if (!face) {
            return new NoFaceDetected(model);
        }
        if (boundingBox == null) {
            throw new IllegalArgumentException("face record without boundingBox: " + source);
        }
        List<Landmark> points = new ArrayList<>();
        if (landmarks != null) {
            for (Point p : landmarks) {
                points.add(new Landmark(p.x, p.y, p.visibility));
            }
        }
        HeadPose pose = headPose != null
                ? new HeadPose(headPose.yaw, headPose.pitch, headPose.roll)
                : HeadPose.FRONTAL;
        return new DetectedFace(
                new BoundingBox(boundingBox.left, boundingBox.top, boundingBox.right, boundingBox.bottom),
                points, expressionScores, pose, model);
    }
}
