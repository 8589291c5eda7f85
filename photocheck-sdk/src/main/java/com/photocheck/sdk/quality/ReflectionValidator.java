package com.photocheck.sdk.quality;

import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.camera.PixelRegion;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.DetectedFace;
import com.photocheck.sdk.detection.Landmark;
import com.photocheck.sdk.detection.PerceptionResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Glare on eyes or glasses. Bright pixels inside the padded eye regions are grouped
 * into 8-connected clusters; clusters of at least the minimum size count as reflection.
 */
public final class ReflectionValidator implements Validator {

    public static final String NAME = "Reflection";

    @Override public String name() { return NAME; }

    @Override public LandmarkRequirement landmarkRequirement() { return LandmarkRequirement.LANDMARKS; }

    @Override
    public ValidationOutcome evaluate(Frame frame, PerceptionResult perception, ValidatorConfig config) {
        ValidationOutcome unmet = RequirementGuard.check(this, perception, config);
        if (unmet != null) return unmet;

        DetectedFace face = perception.asFace();
        float pad = config.reflectionEyePadRatio;
        PixelRegion left  = eyeRegion(face, config.landmarkLayout.leftEye()).pad(pad, pad)
                .clampTo(frame.width, frame.height);
        PixelRegion right = eyeRegion(face, config.landmarkLayout.rightEye()).pad(pad, pad)
                .clampTo(frame.width, frame.height);

        // all work stays inside the box spanning both eye regions
        PixelRegion area = union(left, right);
        boolean[] mask = new boolean[area.area()];
        int regionArea = mark(mask, area, left) + mark(mask, area, right);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("eyeRegionArea", regionArea);
        if (regionArea == 0) {
            details.put("note", "empty_eye_region");
            return ValidationOutcome.pass(NAME, 1d, details);
        }

        int[] clusters = clusterBrightPixels(frame, area, mask, config.reflectionLumaMin, config.reflectionMinClusterPx);
        int reflectionArea = clusters[0];
        double ratio = (double) reflectionArea / regionArea;

        details.put("reflectionArea", reflectionArea);
        details.put("clusterCount", clusters[1]);
        details.put("reflectionRatio", ratio);

        double score = Scores.atMost(ratio, config.reflectionMaxRatio);
        if (ratio >= config.reflectionMaxRatio) {
            return ValidationOutcome.fail(NAME, OutcomeCodes.REFLECTION_DETECTED,
                    score, Severity.WARNING, details);
        }
        return ValidationOutcome.pass(NAME, score, details);
    }

    private static PixelRegion eyeRegion(DetectedFace face, int[] indices) {
        float minX = Float.MAX_VALUE, minY = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE, maxY = -Float.MAX_VALUE;
        for (int i : indices) {
            Landmark p = face.landmark(i);
            minX = Math.min(minX, p.x);
            minY = Math.min(minY, p.y);
            maxX = Math.max(maxX, p.x);
            maxY = Math.max(maxY, p.y);
        }
        return PixelRegion.fromEdges(minX, minY, maxX, maxY);
    }

    private static PixelRegion union(PixelRegion a, PixelRegion b) {
        if (a.isEmpty()) return b;
        if (b.isEmpty()) return a;
        int l = Math.min(a.x, b.x);
        int t = Math.min(a.y, b.y);
        int r = Math.max(a.right(), b.right());
        int bottom = Math.max(a.bottom(), b.bottom());
        return new PixelRegion(l, t, r - l, bottom - t);
    }

    /**
     * Marks the region in the mask, which covers {@code area} row by row.
     * Returns the number of newly marked pixels.
     */
    private static int mark(boolean[] mask, PixelRegion area, PixelRegion r) {
        int added = 0;
        for (int y = r.y; y < r.bottom(); y++) {
            for (int x = r.x; x < r.right(); x++) {
                int idx = (y - area.y) * area.width + (x - area.x);
                if (!mask[idx]) {
                    mask[idx] = true;
                    added++;
                }
            }
        }
        return added;
    }

    /**
     * @return {area of qualifying clusters, number of qualifying clusters}
     */
    private static int[] clusterBrightPixels(Frame frame, PixelRegion area, boolean[] mask,
                                             int lumaMin, int minCluster) {
        int w = area.width, h = area.height;
        boolean[] seen = new boolean[mask.length];
        int[] stack = new int[mask.length];
        int brightArea = 0, count = 0;

        for (int start = 0; start < mask.length; start++) {
            if (seen[start] || !isBright(frame, area, mask, start, lumaMin)) continue;
            int top = 0, size = 0;
            stack[top++] = start;
            seen[start] = true;
            while (top > 0) {
                int idx = stack[--top];
                size++;
                int cx = idx % w, cy = idx / w;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        if (dx == 0 && dy == 0) continue;
                        int nx = cx + dx, ny = cy + dy;
                        if (nx < 0 || ny < 0 || nx >= w || ny >= h) continue;
                        int n = ny * w + nx;
                        if (!seen[n] && isBright(frame, area, mask, n, lumaMin)) {
                            seen[n] = true;
                            stack[top++] = n;
                        }
                    }
                }
            }
            if (size >= minCluster) {
                brightArea += size;
                count++;
            }
        }
        return new int[]{brightArea, count};
    }

    private static boolean isBright(Frame frame, PixelRegion area, boolean[] mask, int idx, int lumaMin) {
        return mask[idx] && frame.lumaAt(area.x + idx % area.width, area.y + idx / area.width) >= lumaMin;
    }
}
