package com.photocheck.sdk.feedback;

import com.photocheck.sdk.quality.OutcomeCodes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Subject-facing text and ordering priority per outcome code. Lower priority is shown first.
 * Immutable; start from {@link #defaults()} and override through {@link #toBuilder()}.
 */
public final class GuidanceCatalog {

    public static final String GENERIC_MESSAGE  = "Please adjust your position and look straight into the camera.";
    public static final int    LOWEST_PRIORITY  = Integer.MAX_VALUE;

    private final Map<String, String>  messages;
    private final Map<String, Integer> priorities;

    private GuidanceCatalog(Builder b) {
        this.messages   = Collections.unmodifiableMap(new LinkedHashMap<>(b.messages));
        this.priorities = Collections.unmodifiableMap(new LinkedHashMap<>(b.priorities));
    }

    public String messageFor(String code) {
        String m = messages.get(code);
        return m != null ? m : GENERIC_MESSAGE;
    }

    public int priorityFor(String code) {
        Integer p = priorities.get(code);
        return p != null ? p : LOWEST_PRIORITY;
    }

    public boolean isKnown(String code) {
        return messages.containsKey(code);
    }

    public static GuidanceCatalog defaults() {
        return new Builder()
                .entry(OutcomeCodes.FACE_NOT_DETECTED,        0, "We cannot see your face. Please step in front of the camera.")
                .entry(OutcomeCodes.FACE_TOO_SMALL,          10, "Please move closer to the camera.")
                .entry(OutcomeCodes.FACE_TOO_LARGE,          11, "Please move back a little.")
                .entry(OutcomeCodes.FACE_OFF_CENTER,         12, "Please center your face in the frame.")
                .entry(OutcomeCodes.HEAD_NOT_FRONTAL,        13, "Please face the camera directly and keep your head straight.")
                .entry(OutcomeCodes.TOO_DARK,                20, "The photo is too dark. Please step into the light.")
                .entry(OutcomeCodes.TOO_BRIGHT,              21, "The photo is too bright. Please step out of direct light.")
                .entry(OutcomeCodes.LOW_CONTRAST,            22, "The lighting is too flat. Please step closer to the light.")
                .entry(OutcomeCodes.HIGH_CONTRAST,           23, "The lighting is too harsh. Please avoid direct light.")
                .entry(OutcomeCodes.SHADOW_DETECTED,         30, "There is a shadow on your face. Please face the light evenly.")
                .entry(OutcomeCodes.BLURRY,                  40, "Please hold still.")
                .entry(OutcomeCodes.EYES_OBSTRUCTED,         50, "Please keep your eyes open and uncovered.")
                .entry(OutcomeCodes.REFLECTION_DETECTED,     51, "There is glare on your eyes or glasses. Please tilt your glasses or remove them.")
                .entry(OutcomeCodes.NON_NEUTRAL_EXPRESSION,  60, "Please keep a neutral expression.")
                .entry(OutcomeCodes.MOUTH_OPEN,              61, "Please close your mouth.")
                .entry(OutcomeCodes.BACKGROUND_NOT_UNIFORM,  70, "Please make sure nothing is behind you.")
                .entry(OutcomeCodes.BACKGROUND_TOO_DARK,     71, "The background is too dark.")
                .entry(OutcomeCodes.HEADWEAR_DETECTED,       72, "Please remove any hat or cap.")
                .entry(OutcomeCodes.LANDMARK_COUNT_MISMATCH, 90, "Please hold still while we check again.")
                .entry(OutcomeCodes.VALIDATOR_INTERNAL_ERROR, 95, "Please hold still while we check again.")
                .build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.messages.putAll(messages);
        b.priorities.putAll(priorities);
        return b;
    }

    public static final class Builder {
        private final Map<String, String>  messages   = new LinkedHashMap<>();
        private final Map<String, Integer> priorities = new LinkedHashMap<>();

        public Builder entry(String code, int priority, String message) {
            priorities.put(code, priority);
            messages.put(code, message);
            return this;
        }

        public Builder priority(String code, int priority) {
            priorities.put(code, priority);
            return this;
        }

        public Builder message(String code, String message) {
            messages.put(code, message);
            return this;
        }

        public GuidanceCatalog build() { return new GuidanceCatalog(this); }
    }
}
