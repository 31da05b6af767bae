package com.example.craftscore.oracle;

/**
 * Text produced by the oracle plus the confidence it reported about itself.
 *
 * @param text                   Reply text with any confidence statement removed
 * @param selfReportedConfidence 0-100
 */
public record OracleReply(String text, int selfReportedConfidence) {

    /** Confidence assumed when the reply does not state one. */
    public static final int DEFAULT_CONFIDENCE = 85;

    /**
     * Parses a run of digits as a percentage, saturating at 100.
     */
    public static int clampPercent(String digits) {
        if (digits.length() > 3) return 100;
        return Math.max(0, Math.min(100, Integer.parseInt(digits)));
    }
}
