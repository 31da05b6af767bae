package com.example.craftscore.oracle;

import com.example.craftscore.model.CraftType;
import com.example.craftscore.model.ScoringContext;
import com.example.craftscore.service.ResilientLlmCaller;
import org.springframework.ai.chat.client.ChatClient;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link CraftOracle} backed by a Spring AI {@link ChatClient}.
 * <p>
 * The system prompt frames the model as a multi-craft expert and carries the author's context.
 * A {@code Confidence: NN%} statement in the reply is lifted out into
 * {@link OracleReply#selfReportedConfidence()}.
 */
public class ChatClientCraftOracle implements CraftOracle {

    private static final Pattern CONFIDENCE = Pattern.compile("confidence[:\\s]*(\\d+)%", Pattern.CASE_INSENSITIVE);

    private static final String SYSTEM_PROMPT = """
            You are an expert multi-craft assessor with deep knowledge of traditional and modern crafts:
            woodworking, metalworking, blacksmithing, pottery, leathercraft, weaving, bushcraft,
            stonemasonry, glassblowing and jewelry making.

            Author context:
            - Craft specializations: %s
            - Skill level: %s
            - Bio: %s

            Project context:
            - Craft: %s
            - Estimated difficulty: %s
            - Materials: %s
            - Techniques mentioned: %s

            Guidelines:
            1. Judge the work against the standards of its craft
            2. Be honest but encouraging, and concrete about what to improve
            3. Always consider safety for the tools and materials involved
            4. Follow the reply format requested in the task exactly
            """;

    private final ChatClient chatClient;
    private final String name;
    private final int maxRetries;
    private final Duration backoff;

    public ChatClientCraftOracle(ChatClient chatClient, String name, int maxRetries, Duration backoff) {
        this.chatClient = chatClient;
        this.name = name;
        this.maxRetries = maxRetries;
        this.backoff = backoff;
    }

    @Override
    public OracleReply generate(String prompt, ScoringContext context) {
        String text = ResilientLlmCaller.callText(chatClient, systemPrompt(context), prompt, name, maxRetries, backoff);

        int confidence = OracleReply.DEFAULT_CONFIDENCE;
        Matcher matcher = CONFIDENCE.matcher(text);
        if (matcher.find()) {
            confidence = OracleReply.clampPercent(matcher.group(1));
            text = matcher.replaceAll("").trim();
        }
        return new OracleReply(text, confidence);
    }

    static String systemPrompt(ScoringContext context) {
        var user = context.userProfile();
        var project = context.currentProject();
        String specializations = user.craftSpecializations().stream()
                .map(CraftType::value)
                .collect(Collectors.joining(", "));
        return SYSTEM_PROMPT.formatted(
                specializations.isEmpty() ? "general crafts" : specializations,
                user.skillLevel().value(),
                user.bio() != null && !user.bio().isBlank() ? user.bio() : "Not provided",
                project.craftType().value(),
                project.difficulty(),
                project.materials().isEmpty() ? "Not specified" : String.join(", ", project.materials()),
                project.techniques().isEmpty() ? "None detected" : String.join(", ", project.techniques()));
    }
}
