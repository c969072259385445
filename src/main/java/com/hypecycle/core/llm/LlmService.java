package com.hypecycle.core.llm;

import com.hypecycle.core.engine.EngineConfig;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Thin wrapper over Spring AI's {@link ChatClient} that sends one system + user prompt
 * and returns the raw text reply.
 * <p>
 * Every call runs with the configured temperature and is bounded by
 * {@code hypecycle.llm.request-timeout-seconds}. Provider errors propagate unchanged
 * so callers can classify them; parsing is left to {@link StructuredReplyParser}.
 * <p>
 * Calls run on a fixed pool of {@code hypecycle.llm.max-concurrent-calls} daemon threads
 * named {@code llm-N}. A timed-out call is cancelled with an interrupt; further calls queue
 * behind a worker still stuck in a non-interruptible read and time out on their own.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ExecutorService callExecutor;

    @Autowired
    public LlmService(ChatClient.Builder builder, LlmProperties properties,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.properties = properties;
        this.callExecutor = Executors.newFixedThreadPool(properties.getMaxConcurrentCalls(),
                EngineConfig.namedDaemonThreads("llm"));
        log.info("LlmService initialized, base-url: {}, model: {}, max concurrent calls: {}",
                baseUrl, properties.getModel(), properties.getMaxConcurrentCalls());
    }

    /**
     * Sends the prompts and waits for the reply.
     *
     * @return the non-blank reply text
     * @throws LlmTimeoutException       if the call exceeds the per-call timeout
     * @throws LlmEmptyResponseException if the model returned no content
     */
    public String complete(String systemPrompt, String userPrompt) {
        long start = System.currentTimeMillis();
        ChatOptions options = buildOptions();
        Future<String> call = callExecutor.submit(() -> chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .options(options)
                .call()
                .content());

        String response;
        int timeoutSeconds = properties.getRequestTimeoutSeconds();
        try {
            response = call.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new LlmTimeoutException("LLM call timed out after " + timeoutSeconds + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new LlmTimeoutException("LLM call interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("LLM call failed: " + cause.getMessage(), cause);
        }

        long elapsed = System.currentTimeMillis() - start;
        log.debug("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content");
        }
        return response;
    }

    private ChatOptions buildOptions() {
        var builder = ChatOptions.builder().temperature(properties.getTemperature());
        if (properties.getModel() != null && !properties.getModel().isBlank()) {
            builder.model(properties.getModel());
        }
        return builder.build();
    }

    @PreDestroy
    void shutdown() {
        callExecutor.shutdownNow();
    }
}
