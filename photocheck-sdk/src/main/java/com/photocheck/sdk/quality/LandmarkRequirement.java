package com.photocheck.sdk.quality;

/** What a validator needs from perception before it can measure anything. */
public enum LandmarkRequirement {
    /** Works on the whole frame when no face is found. */
    NONE,
    /** Needs the face bounding box. */
    FACE_BOX,
    /** Needs the full landmark set of the configured layout. */
    LANDMARKS
}
