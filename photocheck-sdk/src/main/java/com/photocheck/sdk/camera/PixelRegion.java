package com.photocheck.sdk.camera;

/**
 * Axis-aligned integer rectangle in frame pixels. x/y inclusive, width/height exclusive.
 */
public final class PixelRegion {

    public final int x;
    public final int y;
    public final int width;
    public final int height;

    public PixelRegion(int x, int y, int width, int height) {
        this.x      = x;
        this.y      = y;
        this.width  = Math.max(0, width);
        this.height = Math.max(0, height);
    }

    /** Rectangle spanning [left, right) x [top, bottom), rounded outward. */
    public static PixelRegion fromEdges(float left, float top, float right, float bottom) {
        int l = (int) Math.floor(left);
        int t = (int) Math.floor(top);
        int r = (int) Math.ceil(right);
        int b = (int) Math.ceil(bottom);
        return new PixelRegion(l, t, r - l, b - t);
    }

    public int right()  { return x + width; }
    public int bottom() { return y + height; }
    public int area()   { return width * height; }
    public boolean isEmpty() { return width == 0 || height == 0; }

    /** Grow each side by the given fraction of the current width/height. */
    public PixelRegion pad(float ratioX, float ratioY) {
        int dx = Math.round(width * ratioX);
        int dy = Math.round(height * ratioY);
        return new PixelRegion(x - dx, y - dy, width + 2 * dx, height + 2 * dy);
    }

    public PixelRegion clampTo(int frameWidth, int frameHeight) {
        int l = Math.max(0, x);
        int t = Math.max(0, y);
        int r = Math.min(frameWidth, right());
        int b = Math.min(frameHeight, bottom());
        return new PixelRegion(l, t, r - l, b - t);
    }

    public boolean contains(int px, int py) {
        return px >= x && px < right() && py >= y && py < bottom();
    }

    @Override public String toString() {
        return "PixelRegion{" + x + "," + y + " " + width + "x" + height + "}";
    }
}
