package com.photocheck.sdk.feedback;

import com.photocheck.sdk.quality.ValidationOutcome;
import com.photocheck.sdk.quality.ValidationReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns a report into ordered guidance for the subject. Pure.
 * <p>
 * One message per failing required outcome; advisory outcomes are not shown.
 * Order: severity (CRITICAL first), then catalog priority (lower first), then registry order.
 */
public final class FeedbackTranslator {

    private final GuidanceCatalog catalog;

    public FeedbackTranslator(GuidanceCatalog catalog) {
        this.catalog = catalog;
    }

    public List<GuidanceMessage> translate(ValidationReport report) {
        List<ValidationOutcome> failed = report.failedRequired();
        if (failed.isEmpty()) return Collections.emptyList();

        List<GuidanceMessage> messages = new ArrayList<>(failed.size());
        for (ValidationOutcome o : failed) {
            messages.add(new GuidanceMessage(o.validatorName, o.code, o.severity,
                    catalog.priorityFor(o.code), catalog.messageFor(o.code)));
        }
        // stable sort keeps registry order for equal keys
        messages.sort((a, b) -> {
            int bySeverity = b.severity.compareTo(a.severity);
            if (bySeverity != 0) return bySeverity;
            return Integer.compare(a.priority, b.priority);
        });
        return Collections.unmodifiableList(messages);
    }

    /** Highest ranked message, null when the report has no failing required outcome. */
    public GuidanceMessage primary(ValidationReport report) {
        List<GuidanceMessage> all = translate(report);
        return all.isEmpty() ? null : all.get(0);
    }
}
