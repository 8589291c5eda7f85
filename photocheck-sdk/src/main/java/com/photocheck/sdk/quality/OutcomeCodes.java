package com.photocheck.sdk.quality;

/**
 * Diagnostic codes carried by {@link ValidationOutcome#code}.
 */
public final class OutcomeCodes {

    private OutcomeCodes() {}

    public static final String OK                       = "OK";
    public static final String FACE_NOT_DETECTED        = "FACE_NOT_DETECTED";
    public static final String LANDMARK_COUNT_MISMATCH  = "LANDMARK_COUNT_MISMATCH";
    public static final String VALIDATOR_INTERNAL_ERROR = "VALIDATOR_INTERNAL_ERROR";

    // Brightness
    public static final String TOO_DARK      = "TOO_DARK";
    public static final String TOO_BRIGHT    = "TOO_BRIGHT";
    public static final String LOW_CONTRAST  = "LOW_CONTRAST";
    public static final String HIGH_CONTRAST = "HIGH_CONTRAST";

    // Sharpness
    public static final String BLURRY = "BLURRY";

    // Face position
    public static final String FACE_TOO_SMALL   = "FACE_TOO_SMALL";
    public static final String FACE_TOO_LARGE   = "FACE_TOO_LARGE";
    public static final String FACE_OFF_CENTER  = "FACE_OFF_CENTER";
    public static final String HEAD_NOT_FRONTAL = "HEAD_NOT_FRONTAL";

    // Expression
    public static final String NON_NEUTRAL_EXPRESSION = "NON_NEUTRAL_EXPRESSION";
    public static final String MOUTH_OPEN             = "MOUTH_OPEN";

    public static final String EYES_OBSTRUCTED     = "EYES_OBSTRUCTED";
    public static final String REFLECTION_DETECTED = "REFLECTION_DETECTED";
    public static final String SHADOW_DETECTED     = "SHADOW_DETECTED";

    // Advisory
    public static final String BACKGROUND_NOT_UNIFORM = "BACKGROUND_NOT_UNIFORM";
    public static final String BACKGROUND_TOO_DARK    = "BACKGROUND_TOO_DARK";
    public static final String HEADWEAR_DETECTED      = "HEADWEAR_DETECTED";
}
