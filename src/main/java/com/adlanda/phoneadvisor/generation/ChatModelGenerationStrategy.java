package com.adlanda.phoneadvisor.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Generates answers with a Spring AI {@link ChatModel}, bounded by a timeout.
 *
 * The call runs on the supplied executor so a slow backend cannot hold the request
 * thread past the timeout. A call that timed out is not interrupted and keeps its
 * executor thread until the HTTP client read timeout ends it.
 */
public class ChatModelGenerationStrategy implements GenerationStrategy {

    private static final Logger log = LoggerFactory.getLogger(ChatModelGenerationStrategy.class);

    private final String name;
    private final ChatModel chatModel;
    private final ChatOptions options;
    private final Duration timeout;
    private final Executor executor;

    public ChatModelGenerationStrategy(String name, ChatModel chatModel, ChatOptions options,
                                       Duration timeout, Executor executor) {
        this.name = name;
        this.chatModel = chatModel;
        this.options = options;
        this.timeout = timeout;
        this.executor = executor;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public GenerationOutcome generate(String prompt) {
        long startTime = System.currentTimeMillis();
        CompletableFuture<ChatResponse> call;
        try {
            call = CompletableFuture.supplyAsync(() -> chatModel.call(new Prompt(prompt, options)), executor);
        } catch (RejectedExecutionException e) {
            return GenerationOutcome.failure(GenerationFailureReason.REJECTED, "no capacity for another model call");
        }
        try {
            ChatResponse response = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            String text = textOf(response);
            if (text == null || text.isBlank()) {
                return GenerationOutcome.failure(GenerationFailureReason.EMPTY_RESPONSE, "model returned no text");
            }
            log.debug("{} answered in {}ms", name, System.currentTimeMillis() - startTime);
            return GenerationOutcome.success(text.trim());
        } catch (TimeoutException e) {
            call.cancel(true);
            return GenerationOutcome.failure(GenerationFailureReason.TIMEOUT,
                    "no answer within " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return GenerationOutcome.failure(classify(cause), String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return GenerationOutcome.failure(GenerationFailureReason.INTERRUPTED, "interrupted while waiting");
        }
    }

    /**
     * Rate-limit and quota errors are reported separately so operators can tell them
     * from outages.
     */
    static GenerationFailureReason classify(Throwable error) {
        String message = String.valueOf(error.getMessage()).toLowerCase(Locale.ROOT);
        if (message.contains("429") || message.contains("quota") || message.contains("rate limit")) {
            return GenerationFailureReason.QUOTA_EXCEEDED;
        }
        return GenerationFailureReason.TRANSPORT_ERROR;
    }

    private static String textOf(ChatResponse response) {
        if (response == null) {
            return null;
        }
        Generation result = response.getResult();
        if (result == null || result.getOutput() == null) {
            return null;
        }
        return result.getOutput().getText();
    }
}
