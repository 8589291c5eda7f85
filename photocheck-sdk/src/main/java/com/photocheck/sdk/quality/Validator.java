package com.photocheck.sdk.quality;

import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.PerceptionResult;

/**
 * One passport-photo criterion. Implementations are stateless and pure:
 * the same frame, perception and config always yield the same outcome.
 */
public interface Validator {

    /** Unique name, also the key in {@link ValidationReport}. */
    String name();

    LandmarkRequirement landmarkRequirement();

    /**
     * Never returns null. Without a face, validators requiring one return
     * {@link ValidationOutcome#faceNotDetected(String)}.
     */
    ValidationOutcome evaluate(Frame frame, PerceptionResult perception, ValidatorConfig config);
}
