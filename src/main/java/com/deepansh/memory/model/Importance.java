package com.deepansh.memory.model;

/**
 * Maps the collaborator's importance labels onto the continuous score
 * stored on a record.
 */
public final class Importance {

    public static final double CRITICAL = 1.0;
    public static final double HIGH = 0.8;
    public static final double MEDIUM = 0.5;
    public static final double LOW = 0.3;
    public static final double TRIVIAL = 0.1;

    private Importance() {}

    /** Accepts a label ("high") or a numeric string ("0.7"); anything else is MEDIUM. */
    public static double score(String labelOrScore) {
        if (labelOrScore == null || labelOrScore.isBlank()) return MEDIUM;
        return switch (labelOrScore.trim().toLowerCase()) {
            case "critical" -> CRITICAL;
            case "high" -> HIGH;
            case "medium" -> MEDIUM;
            case "low" -> LOW;
            case "trivial" -> TRIVIAL;
            default -> parseScore(labelOrScore.trim());
        };
    }

    private static double parseScore(String raw) {
        try {
            double value = Double.parseDouble(raw);
            return Math.max(0.0, Math.min(1.0, value));
        } catch (NumberFormatException e) {
            return MEDIUM;
        }
    }
}
