package com.photocheck.sdk.detection;

/**
 * The perception model could not run at all. Distinct from finding no face,
 * which is reported as {@link NoFaceDetected}.
 */
public class PerceptionUnavailableException extends Exception {
    public PerceptionUnavailableException(String msg, Throwable cause) { super(msg, cause); }
    public PerceptionUnavailableException(String msg) { super(msg); }
}
