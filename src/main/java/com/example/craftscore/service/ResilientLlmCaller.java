package com.example.craftscore.service;

import com.example.craftscore.exception.OracleUnavailableException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;

import java.time.Duration;
import java.util.Optional;

/**
 * Utility for LLM calls with linear back-off retry and lenient JSON reading of replies.
 * <p>
 * Model replies that are meant to be JSON often are not quite JSON:
 * <ul>
 *   <li>Trailing commas ({@code [{"a":1},]})</li>
 *   <li>Java-style comments</li>
 *   <li>Single quotes or unquoted field names</li>
 *   <li>Markdown code fences or prose around the object</li>
 * </ul>
 * {@link #parseLenient(String, Class)} tolerates all of these.
 */
public final class ResilientLlmCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientLlmCaller.class);

    /** Lenient ObjectMapper that tolerates trailing commas, comments, and single quotes. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ResilientLlmCaller() {
    }

    /**
     * Calls the LLM and returns the reply text, retrying on errors and blank replies.
     *
     * @param chatClient   the LLM client to use
     * @param systemPrompt the system prompt
     * @param userPrompt   the user prompt
     * @param callerName   name used in log lines
     * @param maxRetries   retries after the first attempt
     * @param backoff      delay before the first retry; the n-th retry waits n times as long
     * @return non-blank reply text
     * @throws OracleUnavailableException if every attempt fails
     */
    public static String callText(ChatClient chatClient, String systemPrompt, String userPrompt,
                                  String callerName, int maxRetries, Duration backoff) {
        Exception lastError = null;
        int attempts = maxRetries + 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                ChatResponse chatResponse = chatClient.prompt()
                        .system(systemPrompt)
                        .user(userPrompt)
                        .call()
                        .chatResponse();

                logTokenUsage(chatResponse, callerName);

                String content = (chatResponse != null && chatResponse.getResult() != null)
                        ? chatResponse.getResult().getOutput().getText()
                        : null;
                if (content == null || content.isBlank()) {
                    throw new OracleUnavailableException("Empty or null content in LLM response");
                }
                return content;
            } catch (Exception e) {
                lastError = e;
                if (attempt < attempts) {
                    long delay = backoff.toMillis() * attempt;
                    log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms...",
                            callerName, attempt, attempts, rootCauseMessage(e), delay);
                    try {
                        Thread.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
        throw new OracleUnavailableException("Error in " + callerName + " after " + attempts
                + " attempts: " + (lastError != null ? lastError.getMessage() : "interrupted"), lastError);
    }

    /**
     * Reads the first JSON object found in {@code content}, empty when there is none or it does not bind.
     */
    public static <T> Optional<T> parseLenient(String content, Class<T> type) {
        if (content == null) return Optional.empty();
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) return Optional.empty();
        try {
            return Optional.ofNullable(LENIENT_MAPPER.readValue(content.substring(start, end + 1), type));
        } catch (Exception e) {
            log.debug("Lenient JSON parsing into {} failed: {}", type.getSimpleName(), rootCauseMessage(e));
            return Optional.empty();
        }
    }

    private static void logTokenUsage(ChatResponse chatResponse, String callerName) {
        if (chatResponse == null || !log.isDebugEnabled()) return;
        var metadata = chatResponse.getMetadata();
        if (metadata == null || metadata.getUsage() == null) return;
        var usage = metadata.getUsage();
        log.debug("{}: {} prompt + {} completion tokens (model={})", callerName,
                usage.getPromptTokens(), usage.getCompletionTokens(), metadata.getModel());
    }

    private static String rootCauseMessage(Exception e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage();
        return msg != null && msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
