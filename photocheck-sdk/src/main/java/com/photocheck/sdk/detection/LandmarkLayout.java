package com.photocheck.sdk.detection;

/**
 * Landmark index map for one perception model version.
 * Validators read eye and mouth points through this layout only.
 */
public final class LandmarkLayout {

    /** 68-point iBUG annotation. "left" is the image-left side. */
    public static final LandmarkLayout IBUG_68 = new LandmarkLayout(
            "ibug-68", 68,
            new int[]{36, 37, 38, 39, 40, 41},
            new int[]{42, 43, 44, 45, 46, 47},
            62, 66, 48, 54);

    public final String modelVersion;
    public final int    landmarkCount;
    public final int    mouthInnerTop;
    public final int    mouthInnerBottom;
    public final int    mouthLeftCorner;
    public final int    mouthRightCorner;

    private final int[] leftEye;
    private final int[] rightEye;

    public LandmarkLayout(String modelVersion, int landmarkCount,
                          int[] leftEye, int[] rightEye,
                          int mouthInnerTop, int mouthInnerBottom,
                          int mouthLeftCorner, int mouthRightCorner) {
        this.modelVersion     = modelVersion;
        this.landmarkCount    = landmarkCount;
        this.leftEye          = leftEye.clone();
        this.rightEye         = rightEye.clone();
        this.mouthInnerTop    = mouthInnerTop;
        this.mouthInnerBottom = mouthInnerBottom;
        this.mouthLeftCorner  = mouthLeftCorner;
        this.mouthRightCorner = mouthRightCorner;
        checkIndices();
    }

    public int[] leftEye()  { return leftEye.clone(); }
    public int[] rightEye() { return rightEye.clone(); }

    private void checkIndices() {
        int max = Math.max(Math.max(mouthInnerTop, mouthInnerBottom),
                Math.max(mouthLeftCorner, mouthRightCorner));
        for (int i : leftEye)  max = Math.max(max, i);
        for (int i : rightEye) max = Math.max(max, i);
        if (max >= landmarkCount) {
            throw new IllegalArgumentException("landmark index " + max
                    + " outside layout of " + landmarkCount + " points");
        }
    }
}
