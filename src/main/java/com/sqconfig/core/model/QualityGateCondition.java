package com.sqconfig.core.model;

import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;

/**
 * A quality gate condition, exported in the compact form {@code "<metric> >= <value>"}
 * ({@code GT}) or {@code "<metric> <= <value>"} ({@code LT}). Rating thresholds are
 * written as letters A to E.
 *
 * @param id     platform id, null for conditions read from an export document
 * @param metric metric key
 * @param op     {@code GT} or {@code LT}
 * @param error  error threshold, numeric
 */
public record QualityGateCondition(String id, String metric, String op, String error) {

    private static final String RATINGS = "ABCDE";

    public static QualityGateCondition decode(String text) {
        var parts = text.trim().split("\\s+");
        if (parts.length != 3) {
            throw new SqConfigException(ErrorCode.ARGS_ERROR, "Malformed quality gate condition: " + text);
        }
        var op = switch (parts[1]) {
            case ">=" -> "GT";
            case "<=" -> "LT";
            default -> throw new SqConfigException(ErrorCode.ARGS_ERROR,
                    "Unknown operator '" + parts[1] + "' in condition: " + text);
        };
        var value = parts[2];
        if (isRating(parts[0]) && value.length() == 1 && RATINGS.indexOf(value.charAt(0)) >= 0) {
            value = String.valueOf(RATINGS.indexOf(value.charAt(0)) + 1);
        }
        return new QualityGateCondition(null, parts[0], op, value);
    }

    public String encode() {
        var value = error;
        if (isRating(metric)) {
            try {
                int rating = (int) Double.parseDouble(error);
                if (rating >= 1 && rating <= RATINGS.length()) {
                    value = String.valueOf(RATINGS.charAt(rating - 1));
                }
            } catch (NumberFormatException e) {
                value = error;
            }
        }
        return metric + " " + ("LT".equals(op) ? "<=" : ">=") + " " + value;
    }

    /**
     * Equality ignoring the platform id.
     */
    public boolean sameAs(QualityGateCondition other) {
        return metric.equals(other.metric) && op.equals(other.op) && numericEquals(error, other.error);
    }

    public double threshold() {
        try {
            return Double.parseDouble(error);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    static boolean isRating(String metric) {
        return metric.endsWith("_rating");
    }

    private static boolean numericEquals(String a, String b) {
        try {
            return Double.parseDouble(a) == Double.parseDouble(b);
        } catch (NumberFormatException e) {
            return a.equals(b);
        }
    }
}
