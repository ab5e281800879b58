package com.adlanda.phoneadvisor.config;

import com.adlanda.phoneadvisor.generation.AnswerRenderer;
import com.adlanda.phoneadvisor.generation.ChatModelGenerationStrategy;
import com.adlanda.phoneadvisor.generation.GenerationStrategy;
import com.adlanda.phoneadvisor.generation.PromptContextBuilder;
import com.adlanda.phoneadvisor.generation.TemplateAnswerRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the answer renderer with its ordered generation strategies:
 * primary model, then secondary model, then templates.
 */
@Configuration
public class GenerationConfig {

    private static final Logger log = LoggerFactory.getLogger(GenerationConfig.class);

    /**
     * Value application.properties falls back to when OPENAI_API_KEY is unset.
     */
    static final String UNCONFIGURED_API_KEY = "not-configured";

    /**
     * Model calls run here. The pool is bounded because a call that timed out keeps its
     * thread until the HTTP client gives up; once threads and queue are full, further
     * calls are rejected and the question is answered from templates.
     */
    @Bean
    public ThreadPoolTaskExecutor generationExecutor(AdvisorProperties properties) {
        AdvisorProperties.Generation generation = properties.getGeneration();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(generation.getMaxConcurrentCalls());
        executor.setMaxPoolSize(generation.getMaxConcurrentCalls());
        executor.setQueueCapacity(generation.getQueueCapacity());
        executor.setThreadNamePrefix("generation-");
        return executor;
    }

    @Bean
    public AnswerRenderer answerRenderer(AdvisorProperties properties,
                                         ObjectProvider<ChatModel> chatModel,
                                         @Value("${spring.ai.openai.api-key:}") String apiKey,
                                         ThreadPoolTaskExecutor generationExecutor,
                                         TemplateAnswerRenderer templates) {
        AdvisorProperties.Generation generation = properties.getGeneration();
        List<GenerationStrategy> strategies = new ArrayList<>();

        if (!generation.isEnabled()) {
            log.info("Answer generation disabled, using template answers only");
        } else if (!isConfigured(apiKey)) {
            log.warn("No OpenAI API key configured, using template answers only");
        } else {
            ChatModel model = chatModel.getIfAvailable();
            if (model == null) {
                log.warn("No chat model configured, using template answers only");
            } else {
                addStrategy(strategies, "primary", generation.getPrimaryModel(), model, generation, generationExecutor);
                addStrategy(strategies, "secondary", generation.getSecondaryModel(), model, generation, generationExecutor);
            }
        }

        return new AnswerRenderer(strategies, new PromptContextBuilder(generation.getMaxPromptRecords()), templates);
    }

    static boolean isConfigured(String apiKey) {
        return apiKey != null && !apiKey.isBlank() && !UNCONFIGURED_API_KEY.equals(apiKey.trim());
    }

    private void addStrategy(List<GenerationStrategy> strategies, String role, String modelName, ChatModel model,
                             AdvisorProperties.Generation generation, Executor executor) {
        if (modelName == null || modelName.isBlank()) {
            return;
        }
        OpenAiChatOptions options = OpenAiChatOptions.builder().model(modelName).build();
        strategies.add(new ChatModelGenerationStrategy(
                role + ":" + modelName, model, options, generation.getTimeout(), executor));
        log.info("Registered {} generation model {}", role, modelName);
    }
}
