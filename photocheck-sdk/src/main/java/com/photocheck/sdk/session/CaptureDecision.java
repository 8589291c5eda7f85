package com.photocheck.sdk.session;

/** What the capture loop should do after a report or tick. */
public enum CaptureDecision {
    /** Keep feeding frames. */
    CONTINUE,
    /** Stability reached: commit the current frame. Emitted once per stable run. */
    CAPTURE_NOW,
    /** Session timeout reached. */
    TIMED_OUT,
    /** Input had no effect (terminal state, or a capture is pending). */
    IGNORED
}
