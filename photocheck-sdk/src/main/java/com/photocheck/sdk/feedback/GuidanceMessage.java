package com.photocheck.sdk.feedback;

import com.photocheck.sdk.quality.Severity;

/** One instruction shown to the subject for one failing check. */
public final class GuidanceMessage {

    public final String   validatorName;
    public final String   code;
    public final Severity severity;
    public final int      priority;
    public final String   text;

    public GuidanceMessage(String validatorName, String code, Severity severity, int priority, String text) {
        this.validatorName = validatorName;
        this.code          = code;
        this.severity      = severity;
        this.priority      = priority;
        this.text          = text;
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof GuidanceMessage)) return false;
        GuidanceMessage g = (GuidanceMessage) o;
        return priority == g.priority && severity == g.severity
                && validatorName.equals(g.validatorName) && code.equals(g.code) && text.equals(g.text);
    }

    @Override public int hashCode() {
        return 31 * (31 * validatorName.hashCode() + code.hashCode()) + priority;
    }

    @Override public String toString() {
        return "[" + severity + "] " + text + " (" + validatorName + "/" + code + ")";
    }
}
