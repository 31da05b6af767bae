package com.example.craftscore.agent;

import com.example.craftscore.model.CriterionEvaluation;
import com.example.craftscore.oracle.OracleReply;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code SCORE: n | FEEDBACK: text | CONFIDENCE: n} reply format.
 * <p>
 * Every field is optional in practice, so each has its own default:
 * <ul>
 *   <li>score: {@value CriterionEvaluation#FALLBACK_SCORE}</li>
 *   <li>feedback: the first {@value #FEEDBACK_PREVIEW_CHARS} characters of the reply</li>
 *   <li>confidence: the confidence the oracle reported for the whole reply</li>
 * </ul>
 * Numbers are clamped to 0-100.
 */
public final class CriterionReplyParser {

    static final int FEEDBACK_PREVIEW_CHARS = 200;

    private static final Pattern SCORE = Pattern.compile("SCORE:\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FEEDBACK = Pattern.compile("FEEDBACK:\\s*([^|]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONFIDENCE = Pattern.compile("CONFIDENCE:\\s*(\\d+)", Pattern.CASE_INSENSITIVE);

    private CriterionReplyParser() {
    }

    public static CriterionEvaluation parse(String reply, int defaultConfidence) {
        Matcher score = SCORE.matcher(reply);
        Matcher feedback = FEEDBACK.matcher(reply);
        Matcher confidence = CONFIDENCE.matcher(reply);

        int parsedScore = score.find() ? OracleReply.clampPercent(score.group(1)) : CriterionEvaluation.FALLBACK_SCORE;
        String parsedFeedback = feedback.find() ? feedback.group(1).trim() : "";
        if (parsedFeedback.isEmpty()) {
            parsedFeedback = reply.length() > FEEDBACK_PREVIEW_CHARS ? reply.substring(0, FEEDBACK_PREVIEW_CHARS) : reply;
        }
        int parsedConfidence = confidence.find()
                ? OracleReply.clampPercent(confidence.group(1))
                : Math.max(0, Math.min(100, defaultConfidence));
        return new CriterionEvaluation(parsedScore, parsedFeedback, parsedConfidence);
    }
}
