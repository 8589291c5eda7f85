package com.photocheck.sdk.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.photocheck.sdk.api.ErrorCode;
import com.photocheck.sdk.api.PhotoCheckException;
import com.photocheck.sdk.feedback.GuidanceMessage;
import com.photocheck.sdk.quality.ValidationOutcome;
import com.photocheck.sdk.quality.ValidationReport;

import java.util.List;

/**
 * JSON form of a report for the booth UI and audit trail:
 * <pre>
 * {"timestamp":1200,
 *  "perFieldOutcomes":[{"validator":"Brightness","passed":true,"score":1.0,"code":"OK","severity":"INFO"}, ...],
 *  "overallPassed":true,
 *  "overallScore":0.97,
 *  "summary":{"total":9,"passed":9,"failed":0},
 *  "guidance":[{"validator":..,"code":..,"severity":..,"message":..}]}
 * </pre>
 * "guidance" is present only when a guidance list is given. Measurement details stay internal.
 */
public final class ReportJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ReportJson() {}

    public static ObjectNode toTree(ValidationReport report, List<GuidanceMessage> guidance) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("timestamp", report.timestamp);
        ArrayNode outcomes = root.putArray("perFieldOutcomes");
        for (ValidationOutcome o : report.outcomes.values()) {
            ObjectNode n = outcomes.addObject();
            n.put("validator", o.validatorName);
            n.put("passed", o.passed);
            n.put("score", o.score);
            n.put("code", o.code);
            n.put("severity", o.severity.name());
        }
        root.put("overallPassed", report.overallPassed);
        root.put("overallScore", report.overallScore);
        ObjectNode summary = root.putObject("summary");
        summary.put("total", report.outcomes.size());
        summary.put("passed", report.passedCount());
        summary.put("failed", report.failedCount());
        if (guidance != null) {
            root.set("guidance", guidanceTree(guidance));
        }
        return root;
    }

    public static ArrayNode guidanceTree(List<GuidanceMessage> guidance) {
        ArrayNode arr = MAPPER.createArrayNode();
        for (GuidanceMessage g : guidance) {
            ObjectNode n = arr.addObject();
            n.put("validator", g.validatorName);
            n.put("code", g.code);
            n.put("severity", g.severity.name());
            n.put("message", g.text);
        }
        return arr;
    }

    public static String toJson(ValidationReport report) {
        return write(toTree(report, null));
    }

    public static String toJson(ValidationReport report, List<GuidanceMessage> guidance) {
        return write(toTree(report, guidance));
    }

    private static String write(Object tree) {
        try {
            return MAPPER.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new PhotoCheckException(ErrorCode.INTERNAL, "report serialization failed", e);
        }
    }
}
