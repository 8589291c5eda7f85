package com.photocheck.sdk.quality;

import com.photocheck.sdk.camera.Frame;
import com.photocheck.sdk.camera.ImageUtils;
import com.photocheck.sdk.camera.PixelRegion;
import com.photocheck.sdk.config.ValidatorConfig;
import com.photocheck.sdk.detection.BoundingBox;
import com.photocheck.sdk.detection.PerceptionResult;

import java.awt.Color;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cap or hat above the forehead. Looks at a strip 30% of the face height above
 * the box: little skin tone together with many dark pixels means headwear.
 * Registered as advisory by default.
 */
public final class HeadwearValidator implements Validator {

    public static final String NAME = "Headwear";

    static final int DARK_LUMA = 60;

    @Override public String name() { return NAME; }

    @Override public LandmarkRequirement landmarkRequirement() { return LandmarkRequirement.FACE_BOX; }

    @Override
    public ValidationOutcome evaluate(Frame frame, PerceptionResult perception, ValidatorConfig config) {
        ValidationOutcome unmet = RequirementGuard.check(this, perception, config);
        if (unmet != null) return unmet;

        BoundingBox box = perception.asFace().boundingBox;
        PixelRegion strip = PixelRegion.fromEdges(
                box.left, box.top - box.height() * 0.3f, box.right, box.top)
                .clampTo(frame.width, frame.height);

        Map<String, Object> details = new LinkedHashMap<>();
        if (strip.isEmpty()) {
            details.put("note", "no_forehead_region");
            return ValidationOutcome.pass(NAME, 1d, details);
        }

        int skin = 0, dark = 0;
        float[] hsb = new float[3];
        for (int y = strip.y; y < strip.bottom(); y++) {
            for (int x = strip.x; x < strip.right(); x++) {
                int argb = frame.argbAt(x, y);
                Color.RGBtoHSB((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF, hsb);
                if (isSkinTone(hsb)) skin++;
                if (frame.lumaAt(x, y) < DARK_LUMA) dark++;
            }
        }
        double skinRatio = (double) skin / strip.area();
        double darkRatio = (double) dark / strip.area();
        details.put("skinRatio", skinRatio);
        details.put("darkRatio", darkRatio);
        details.put("foreheadMean", ImageUtils.mean(frame, strip));

        double score = Math.max(
                Scores.atLeast(skinRatio, config.headwearSkinMin),
                Scores.atMost(darkRatio, config.headwearDarkMax));
        if (skinRatio < config.headwearSkinMin && darkRatio > config.headwearDarkMax) {
            return ValidationOutcome.fail(NAME, OutcomeCodes.HEADWEAR_DETECTED,
                    score, Severity.WARNING, details);
        }
        return ValidationOutcome.pass(NAME, score, details);
    }

    /** Reddish-to-yellow hue, some saturation, not too dark. Covers light and dark skin. */
    static boolean isSkinTone(float[] hsb) {
        float hue = hsb[0], sat = hsb[1], bri = hsb[2];
        boolean warmHue = hue <= 50f / 360f || hue >= 345f / 360f;
        return warmHue && sat >= 0.08f && sat <= 0.8f && bri >= 0.16f;
    }
}
