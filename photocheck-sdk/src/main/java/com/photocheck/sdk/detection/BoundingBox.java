package com.photocheck.sdk.detection;

import com.photocheck.sdk.camera.PixelRegion;

/** Face bounding box in frame pixels (left/top inclusive, right/bottom exclusive). */
public final class BoundingBox {

    public final float left;
    public final float top;
    public final float right;
    public final float bottom;

    public BoundingBox(float left, float top, float right, float bottom) {
        if (right < left || bottom < top) {
            throw new IllegalArgumentException("inverted bounding box");
        }
        this.left   = left;
        this.top    = top;
        this.right  = right;
        this.bottom = bottom;
    }

    public float width()   { return right - left; }
    public float height()  { return bottom - top; }
    public float centerX() { return (left + right) * 0.5f; }
    public float centerY() { return (top + bottom) * 0.5f; }

    public PixelRegion toRegion() {
        return PixelRegion.fromEdges(left, top, right, bottom);
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof BoundingBox)) return false;
        BoundingBox b = (BoundingBox) o;
        return left == b.left && top == b.top && right == b.right && bottom == b.bottom;
    }

    @Override public int hashCode() {
        int h = Float.hashCode(left);
        h = 31 * h + Float.hashCode(top);
        h = 31 * h + Float.hashCode(right);
        return 31 * h + Float.hashCode(bottom);
    }

    @Override public String toString() {
        return "BoundingBox{" + left + "," + top + " - " + right + "," + bottom + "}";
    }
}
