package com.photocheck.sdk.detection;

/** Head Euler angles in degrees. yaw = left/right turn, pitch = nod, roll = tilt. */
public final class HeadPose {

    public static final HeadPose FRONTAL = new HeadPose(0f, 0f, 0f);

    public final float yaw;
    public final float pitch;
    public final float roll;

    public HeadPose(float yaw, float pitch, float roll) {
        this.yaw   = yaw;
        this.pitch = pitch;
        this.roll  = roll;
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof HeadPose)) return false;
        HeadPose p = (HeadPose) o;
        return yaw == p.yaw && pitch == p.pitch && roll == p.roll;
    }

    @Override public int hashCode() {
        return 31 * (31 * Float.hashCode(yaw) + Float.hashCode(pitch)) + Float.hashCode(roll);
    }

    @Override public String toString() {
        return "HeadPose{yaw=" + yaw + ", pitch=" + pitch + ", roll=" + roll + "}";
    }
}
