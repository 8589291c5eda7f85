package com.photocheck.sdk.api;

/**
 * Capture pipeline state of one booth session.
 * Status line text for callers comes from {@link #getDisplayMessage()}.
 */
public enum CaptureState {
    WAITING_FOR_FACE,
    EVALUATING,
    /** Required checks held for the stability window; capture signal pending. */
    STABLE_PASS,
    CAPTURED,
    TIMEOUT,
    ERROR;

    public boolean isTerminal() {
        return this == CAPTURED || this == TIMEOUT || this == ERROR;
    }

    public String getDisplayMessage() {
        switch (this) {
            case EVALUATING:
                return "Checking photo";
            case STABLE_PASS:
                return "Hold still";
            case CAPTURED:
                return "Photo taken";
            case TIMEOUT:
                return "Time is up, please start again";
            case ERROR:
                return "Camera check unavailable";
            case WAITING_FOR_FACE:
            default:
                return "Please look into the camera";
        }
    }
}
