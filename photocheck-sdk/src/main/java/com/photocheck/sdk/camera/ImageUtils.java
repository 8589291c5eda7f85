package com.photocheck.sdk.camera;

/**
 * Pixel statistics over frame regions. Shared by the image-based validators.
 */
public final class ImageUtils {

    private ImageUtils() {}

    /** Integer BT.601 luma, exact for gray pixels. */
    static int luma(int argb) {
        int r = (argb >> 16) & 0xFF;
        int g = (argb >> 8)  & 0xFF;
        int b =  argb        & 0xFF;
        return (77 * r + 150 * g + 29 * b) >> 8;
    }

    static int clamp(int value) {
        return value < 0 ? 0 : (value > 255 ? 255 : value);
    }

    /** 256-bin luminance histogram over the region (clamped to the frame). */
    public static int[] histogram(Frame frame, PixelRegion region) {
        PixelRegion r = region.clampTo(frame.width, frame.height);
        int[] hist = new int[256];
        for (int y = r.y; y < r.bottom(); y++) {
            for (int x = r.x; x < r.right(); x++) {
                hist[frame.lumaAt(x, y)]++;
            }
        }
        return hist;
    }

    /** Mean luminance of the region, 0 when empty. */
    public static double mean(Frame frame, PixelRegion region) {
        PixelRegion r = region.clampTo(frame.width, frame.height);
        if (r.isEmpty()) return 0d;
        long sum = 0;
        for (int y = r.y; y < r.bottom(); y++) {
            for (int x = r.x; x < r.right(); x++) {
                sum += frame.lumaAt(x, y);
            }
        }
        return (double) sum / r.area();
    }

    /** Mean of a histogram. */
    public static double histogramMean(int[] hist) {
        long count = 0;
        long sum = 0;
        for (int v = 0; v < hist.length; v++) {
            count += hist[v];
            sum   += (long) v * hist[v];
        }
        return count > 0 ? (double) sum / count : 0d;
    }

    /** Population standard deviation of a histogram. */
    public static double histogramStdDev(int[] hist) {
        long count = 0;
        double sum = 0;
        double sumSq = 0;
        for (int v = 0; v < hist.length; v++) {
            count += hist[v];
            sum   += (double) v * hist[v];
            sumSq += (double) v * v * hist[v];
        }
        if (count == 0) return 0d;
        double mean = sum / count;
        double var  = sumSq / count - mean * mean;
        return var > 0 ? Math.sqrt(var) : 0d;
    }

    /**
     * Laplacian variance. Lower means more blur.
     * 4-neighbour kernel over the interior pixels of the region.
     */
    public static double laplacianVariance(Frame frame, PixelRegion region) {
        PixelRegion r = region.clampTo(frame.width, frame.height);
        if (r.width < 3 || r.height < 3) return 0d;

        double sum = 0, sumSq = 0;
        int count = 0;

        for (int y = r.y + 1; y < r.bottom() - 1; y++) {
            for (int x = r.x + 1; x < r.right() - 1; x++) {
                double lap = 4 * frame.lumaAt(x, y)
                        - frame.lumaAt(x - 1, y)
                        - frame.lumaAt(x + 1, y)
                        - frame.lumaAt(x, y - 1)
                        - frame.lumaAt(x, y + 1);
                sum   += lap;
                sumSq += lap * lap;
                count++;
            }
        }

        if (count == 0) return 0d;
        double mean = sum / count;
        return sumSq / count - mean * mean;
    }
}
