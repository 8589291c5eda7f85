package com.photocheck.sdk.config;

import com.photocheck.sdk.api.ValidatorConfigException;
import com.photocheck.sdk.detection.LandmarkLayout;

import java.util.ArrayList;
import java.util.List;

/**
 * Validator thresholds. Immutable, loaded once per session through a
 * {@link ConfigurationSource} or built directly with {@link #builder()}.
 * Every field starts at the booth default listed on its builder field.
 */
public final class ValidatorConfig {

    // ── Brightness ──────────────────────────────────────────────────────
    /** Mean face luminance band (0~255). */
    public final float brightnessMeanMin;
    public final float brightnessMeanMax;
    /** Luminance standard deviation band: below = flat, above = harsh. */
    public final float brightnessStdMin;
    public final float brightnessStdMax;

    // ── Sharpness ───────────────────────────────────────────────────────
    /** Minimum Laplacian variance over the padded face region. */
    public final float sharpnessMin;
    /** Face box padding on each side, as a fraction of box size. */
    public final float sharpnessPadRatio;

    // ── Face position ───────────────────────────────────────────────────
    /** Max center offset as a fraction of frame width/height. */
    public final float faceCenterTolerance;
    /** Face box height / frame height band. */
    public final float faceHeightRatioMin;
    public final float faceHeightRatioMax;
    public final float yawMaxDeg;
    public final float pitchMaxDeg;
    public final float rollMaxDeg;

    // ── Expression ──────────────────────────────────────────────────────
    public final float neutralMin;
    /** Max inner-lip distance in pixels. */
    public final float mouthOpenMaxPx;

    // ── Eyes ────────────────────────────────────────────────────────────
    /** Mean landmark visibility required for each eye. */
    public final float eyeVisibilityMin;

    // ── Reflection ──────────────────────────────────────────────────────
    public final int   reflectionLumaMin;
    /** Smallest 8-connected bright cluster that counts as a reflection. */
    public final int   reflectionMinClusterPx;
    /** Reflection area / eye region area must stay below this. */
    public final float reflectionMaxRatio;
    /** Eye box padding on each side (covers glasses frames). */
    public final float reflectionEyePadRatio;

    // ── Shadow ──────────────────────────────────────────────────────────
    public final float shadowMaxAsymmetry;

    // ── Background (advisory) ───────────────────────────────────────────
    public final boolean backgroundEnabled;
    public final float   backgroundStdMax;
    public final float   backgroundMeanMin;

    // ── Headwear (advisory) ─────────────────────────────────────────────
    public final boolean headwearEnabled;
    /** Skin-tone share of the forehead strip below which headwear is suspected. */
    public final float   headwearSkinMin;
    /** Dark-pixel share above which headwear is suspected. */
    public final float   headwearDarkMax;

    /** Landmark index map of the perception model in use. */
    public final LandmarkLayout landmarkLayout;

    private ValidatorConfig(Builder b) {
        this.brightnessMeanMin      = b.brightnessMeanMin;
        this.brightnessMeanMax      = b.brightnessMeanMax;
        this.brightnessStdMin       = b.brightnessStdMin;
        this.brightnessStdMax       = b.brightnessStdMax;
        this.sharpnessMin           = b.sharpnessMin;
        this.sharpnessPadRatio      = b.sharpnessPadRatio;
        this.faceCenterTolerance    = b.faceCenterTolerance;
        this.faceHeightRatioMin     = b.faceHeightRatioMin;
        this.faceHeightRatioMax     = b.faceHeightRatioMax;
        this.yawMaxDeg              = b.yawMaxDeg;
        this.pitchMaxDeg            = b.pitchMaxDeg;
        this.rollMaxDeg             = b.rollMaxDeg;
        this.neutralMin             = b.neutralMin;
        this.mouthOpenMaxPx         = b.mouthOpenMaxPx;
        this.eyeVisibilityMin       = b.eyeVisibilityMin;
        this.reflectionLumaMin      = b.reflectionLumaMin;
        this.reflectionMinClusterPx = b.reflectionMinClusterPx;
        this.reflectionMaxRatio     = b.reflectionMaxRatio;
        this.reflectionEyePadRatio  = b.reflectionEyePadRatio;
        this.shadowMaxAsymmetry     = b.shadowMaxAsymmetry;
        this.backgroundEnabled      = b.backgroundEnabled;
        this.backgroundStdMax       = b.backgroundStdMax;
        this.backgroundMeanMin      = b.backgroundMeanMin;
        this.headwearEnabled        = b.headwearEnabled;
        this.headwearSkinMin        = b.headwearSkinMin;
        this.headwearDarkMax        = b.headwearDarkMax;
        this.landmarkLayout         = b.landmarkLayout;
    }

    public static ValidatorConfig defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        float   brightnessMeanMin      = 60f;
        float   brightnessMeanMax      = 200f;
        float   brightnessStdMin       = 10f;
        float   brightnessStdMax       = 80f;
        float   sharpnessMin           = 80f;
        float   sharpnessPadRatio      = 0.10f;
        float   faceCenterTolerance    = 0.12f;
        float   faceHeightRatioMin     = 0.30f;
        float   faceHeightRatioMax     = 0.60f;
        float   yawMaxDeg              = 15f;
        float   pitchMaxDeg            = 15f;
        float   rollMaxDeg             = 10f;
        float   neutralMin             = 0.80f;
        float   mouthOpenMaxPx         = 5f;
        float   eyeVisibilityMin       = 0.70f;
        int     reflectionLumaMin      = 240;
        int     reflectionMinClusterPx = 4;
        float   reflectionMaxRatio     = 0.05f;
        float   reflectionEyePadRatio  = 0.60f;
        float   shadowMaxAsymmetry     = 0.25f;
        boolean backgroundEnabled      = true;
        float   backgroundStdMax       = 40f;
        float   backgroundMeanMin      = 110f;
        boolean headwearEnabled        = true;
        float   headwearSkinMin        = 0.20f;
        float   headwearDarkMax        = 0.40f;
        LandmarkLayout landmarkLayout  = LandmarkLayout.IBUG_68;

        public Builder brightnessMean(float min, float max) {
            brightnessMeanMin = min; brightnessMeanMax = max; return this;
        }
        public Builder brightnessStd(float min, float max) {
            brightnessStdMin = min; brightnessStdMax = max; return this;
        }
        public Builder sharpnessMin(float v)            { sharpnessMin = v;           return this; }
        public Builder sharpnessPadRatio(float v)       { sharpnessPadRatio = v;      return this; }
        public Builder faceCenterTolerance(float v)     { faceCenterTolerance = v;    return this; }
        public Builder faceHeightRatio(float min, float max) {
            faceHeightRatioMin = min; faceHeightRatioMax = max; return this;
        }
        public Builder headPoseMaxDeg(float yaw, float pitch, float roll) {
            yawMaxDeg = yaw; pitchMaxDeg = pitch; rollMaxDeg = roll; return this;
        }
        public Builder neutralMin(float v)              { neutralMin = v;             return this; }
        public Builder mouthOpenMaxPx(float v)          { mouthOpenMaxPx = v;         return this; }
        public Builder eyeVisibilityMin(float v)        { eyeVisibilityMin = v;       return this; }
        public Builder reflectionLumaMin(int v)         { reflectionLumaMin = v;      return this; }
        public Builder reflectionMinClusterPx(int v)    { reflectionMinClusterPx = v; return this; }
        public Builder reflectionMaxRatio(float v)      { reflectionMaxRatio = v;     return this; }
        public Builder reflectionEyePadRatio(float v)   { reflectionEyePadRatio = v;  return this; }
        public Builder shadowMaxAsymmetry(float v)      { shadowMaxAsymmetry = v;     return this; }
        public Builder backgroundEnabled(boolean v)     { backgroundEnabled = v;      return this; }
        public Builder backgroundStdMax(float v)        { backgroundStdMax = v;       return this; }
        public Builder backgroundMeanMin(float v)       { backgroundMeanMin = v;      return this; }
        public Builder headwearEnabled(boolean v)       { headwearEnabled = v;        return this; }
        public Builder headwearSkinMin(float v)         { headwearSkinMin = v;        return this; }
        public Builder headwearDarkMax(float v)         { headwearDarkMax = v;        return this; }
        public Builder landmarkLayout(LandmarkLayout v) { landmarkLayout = v;         return this; }

        /**
         * @throws ValidatorConfigException listing every inconsistent value
         */
        public ValidatorConfig build() {
            List<String> problems = new ArrayList<>();
            band(problems, "brightness.mean", brightnessMeanMin, brightnessMeanMax, 0f, 255f);
            band(problems, "brightness.std", brightnessStdMin, brightnessStdMax, 0f, 255f);
            band(problems, "facePosition.heightRatio", faceHeightRatioMin, faceHeightRatioMax, 0f, 1f);
            band(problems, "facialExpression.neutralMin", neutralMin, neutralMin, 0f, 1f);
            band(problems, "eyeVisibility.min", eyeVisibilityMin, eyeVisibilityMin, 0f, 1f);
            band(problems, "reflection.maxRatio", reflectionMaxRatio, reflectionMaxRatio, 0f, 1f);
            band(problems, "reflection.lumaMin", reflectionLumaMin, reflectionLumaMin, 0f, 255f);
            band(problems, "shadow.maxAsymmetry", shadowMaxAsymmetry, shadowMaxAsymmetry, 0f, 1f);
            band(problems, "headwear.skinMin", headwearSkinMin, headwearSkinMin, 0f, 1f);
            band(problems, "headwear.darkMax", headwearDarkMax, headwearDarkMax, 0f, 1f);
            nonNegative(problems, "sharpness.min", sharpnessMin);
            nonNegative(problems, "sharpness.padRatio", sharpnessPadRatio);
            nonNegative(problems, "facePosition.centerTolerance", faceCenterTolerance);
            nonNegative(problems, "facePosition.yawMaxDeg", yawMaxDeg);
            nonNegative(problems, "facePosition.pitchMaxDeg", pitchMaxDeg);
            nonNegative(problems, "facePosition.rollMaxDeg", rollMaxDeg);
            nonNegative(problems, "facialExpression.mouthOpenMaxPx", mouthOpenMaxPx);
            nonNegative(problems, "reflection.eyePadRatio", reflectionEyePadRatio);
            nonNegative(problems, "background.stdMax", backgroundStdMax);
            nonNegative(problems, "background.meanMin", backgroundMeanMin);
            if (reflectionMinClusterPx < 1) problems.add("reflection.minClusterPx must be >= 1");
            if (landmarkLayout == null) problems.add("landmarkLayout must be set");
            if (!problems.isEmpty()) {
                throw new ValidatorConfigException("Invalid validator thresholds", problems);
            }
            return new ValidatorConfig(this);
        }

        private static void band(List<String> problems, String key,
                                 float min, float max, float lower, float upper) {
            if (Float.isNaN(min) || Float.isNaN(max) || min < lower || max > upper) {
                problems.add(key + " outside [" + lower + ", " + upper + "]");
            } else if (min > max) {
                problems.add(key + " min greater than max");
            }
        }

        private static void nonNegative(List<String> problems, String key, float v) {
            if (Float.isNaN(v) || v < 0f) problems.add(key + " must be >= 0");
        }
    }
}
