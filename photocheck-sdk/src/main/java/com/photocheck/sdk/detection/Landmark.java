package com.photocheck.sdk.detection;

/** One landmark point in frame pixels with the model's visibility confidence (0~1). */
public final class Landmark {

    public final float x;
    public final float y;
    public final float visibility;

    public Landmark(float x, float y, float visibility) {
        this.x          = x;
        this.y          = y;
        this.visibility = visibility;
    }

    public float distanceTo(Landmark other) {
        float dx = x - other.x, dy = y - other.y;
        return (float) Math.sqrt(dx * dx + dy * dy);
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof Landmark)) return false;
        Landmark l = (Landmark) o;
        return x == l.x && y == l.y && visibility == l.visibility;
    }

    @Override public int hashCode() {
        return 31 * (31 * Float.hashCode(x) + Float.hashCode(y)) + Float.hashCode(visibility);
    }
}
