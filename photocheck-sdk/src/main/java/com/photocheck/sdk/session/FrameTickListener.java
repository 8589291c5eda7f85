package com.photocheck.sdk.session;

/** Observer of a booth session, called on the loop thread after each frame. */
public interface FrameTickListener {

    void onFrameTick(FrameTick tick);
}
