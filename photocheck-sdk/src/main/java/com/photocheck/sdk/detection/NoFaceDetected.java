package com.photocheck.sdk.detection;

/** The model ran but found no face. A normal outcome, not an error. */
public final class NoFaceDetected extends PerceptionResult {

    public NoFaceDetected(String modelVersion) {
        super(modelVersion);
    }

    @Override public boolean isFaceDetected() { return false; }

    @Override public boolean equals(Object o) {
        if (!(o instanceof NoFaceDetected)) return false;
        String other = ((NoFaceDetected) o).modelVersion;
        return modelVersion == null ? other == null : modelVersion.equals(other);
    }

    @Override public int hashCode() {
        return modelVersion != null ? modelVersion.hashCode() : 0;
    }

    @Override public String toString() {
        return "NoFaceDetected{model=" + modelVersion + "}";
    }
}
