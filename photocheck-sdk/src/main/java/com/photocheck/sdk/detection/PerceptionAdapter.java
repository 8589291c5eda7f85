package com.photocheck.sdk.detection;

import com.photocheck.sdk.camera.Frame;

/**
 * Boundary to the face detection / landmark / expression models.
 * Called once per evaluated frame, synchronously, from the booth loop thread.
 */
public interface PerceptionAdapter {

    /**
     * @param frame frame to analyse
     * @return {@link DetectedFace} or {@link NoFaceDetected}, never null
     * @throws PerceptionUnavailableException when the underlying model cannot run
     */
    PerceptionResult detect(Frame frame) throws PerceptionUnavailableException;
}
