package com.photocheck.sdk.detection;

/**
 * Normalized perception output for one frame: either {@link DetectedFace} or {@link NoFaceDetected}.
 */
public abstract class PerceptionResult {

    /** Perception model version that produced this result. */
    public final String modelVersion;

    PerceptionResult(String modelVersion) {
        this.modelVersion = modelVersion;
    }

    public abstract boolean isFaceDetected();

    /**
     * @throws IllegalStateException when no face was detected
     */
    public DetectedFace asFace() {
        if (!isFaceDetected()) {
            throw new IllegalStateException("no face detected");
        }
        return (DetectedFace) this;
    }
}
