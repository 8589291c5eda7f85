package com.photocheck.sdk.camera;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * A single camera sample plus its monotonic timestamp. Immutable once produced.
 * <p>
 * ARGB pixels are copied on construction and the 8-bit luminance plane is computed once,
 * so validators read the same values on every evaluation.
 */
public final class Frame {

    public final int    width;
    public final int    height;
    public final long   timestampMs;
    /** Caller-assigned id (file name, sequence number). May be null. */
    public final String sourceId;

    private final int[] argb;
    private final int[] luma;

    private Frame(int width, int height, int[] argb, int[] luma, long timestampMs, String sourceId) {
        this.width       = width;
        this.height      = height;
        this.argb        = argb;
        this.luma        = luma;
        this.timestampMs = timestampMs;
        this.sourceId    = sourceId;
    }

    public static Frame of(BufferedImage image, long timestampMs) {
        return of(image, timestampMs, null);
    }

    public static Frame of(BufferedImage image, long timestampMs, String sourceId) {
        if (image == null) {
            throw new IllegalArgumentException("image must not be null");
        }
        int w = image.getWidth();
        int h = image.getHeight();
        checkSize(w, h);
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        int[] luma = new int[argb.length];
        for (int i = 0; i < argb.length; i++) {
            luma[i] = ImageUtils.luma(argb[i]);
        }
        return new Frame(w, h, argb, luma, timestampMs, sourceId);
    }

    /**
     * Frame from a grayscale plane (row-major, values 0~255). ARGB is derived as gray.
     */
    public static Frame ofLuma(int width, int height, int[] lumaPlane, long timestampMs) {
        checkSize(width, height);
        if (lumaPlane == null || lumaPlane.length != width * height) {
            throw new IllegalArgumentException("luma plane must hold width*height values");
        }
        int[] luma = new int[lumaPlane.length];
        int[] argb = new int[lumaPlane.length];
        for (int i = 0; i < lumaPlane.length; i++) {
            int v = ImageUtils.clamp(lumaPlane[i]);
            luma[i] = v;
            argb[i] = 0xff000000 | (v << 16) | (v << 8) | v;
        }
        return new Frame(width, height, argb, luma, timestampMs, null);
    }

    private static void checkSize(int w, int h) {
        if (w <= 0 || h <= 0) {
            throw new IllegalArgumentException("frame size must be positive: " + w + "x" + h);
        }
    }

    /** Luminance (0~255) at x, y. */
    public int lumaAt(int x, int y) {
        return luma[y * width + x];
    }

    /** Packed ARGB at x, y. */
    public int argbAt(int x, int y) {
        return argb[y * width + x];
    }

    public PixelRegion bounds() {
        return new PixelRegion(0, 0, width, height);
    }

    /** Copy of the pixels as a new image, e.g. for the storage collaborator. */
    public BufferedImage toImage() {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        img.setRGB(0, 0, width, height, Arrays.copyOf(argb, argb.length), 0, width);
        return img;
    }

    @Override public String toString() {
        return "Frame{" + width + "x" + height + ", ts=" + timestampMs
                + (sourceId != null ? ", source=" + sourceId : "") + "}";
    }
}
