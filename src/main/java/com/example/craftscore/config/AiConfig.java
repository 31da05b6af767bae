package com.example.craftscore.config;

import com.example.craftscore.oracle.ChatClientCraftOracle;
import com.example.craftscore.oracle.CraftOracle;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Oracle clients, the evaluation executor and shared infrastructure beans.
 * <p>
 * - criterionOracle (OpenAI): scores the five criteria
 * - feedbackOracle (Anthropic): writes the narrative feedback
 */
@Configuration
public class AiConfig {

    @Bean("criterionChatClient")
    public ChatClient criterionChatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    @Bean("feedbackChatClient")
    public ChatClient feedbackChatClient(AnthropicChatModel anthropicChatModel) {
        return ChatClient.builder(anthropicChatModel).build();
    }

    @Bean("criterionOracle")
    public CraftOracle criterionOracle(@Qualifier("criterionChatClient") ChatClient criterionChatClient,
                                       ScoringProperties properties) {
        return new ChatClientCraftOracle(criterionChatClient, "CriterionOracle",
                properties.oracle().maxRetries(), properties.oracle().backoff());
    }

    @Bean("feedbackOracle")
    public CraftOracle feedbackOracle(@Qualifier("feedbackChatClient") ChatClient feedbackChatClient,
                                      ScoringProperties properties) {
        return new ChatClientCraftOracle(feedbackChatClient, "FeedbackOracle",
                properties.oracle().maxRetries(), properties.oracle().backoff());
    }

    /**
     * Criterion evaluations block on oracle I/O, so every submitted evaluation gets its own thread
     * straight away. Idle threads are reclaimed after a minute.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService evaluationExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "criterion-eval-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threads);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared mapper for the REST layer: ISO-8601 instants, Optional support.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new Jdk8Module())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
