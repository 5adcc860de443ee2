package com.jreinhal.hragent.gateway;

import com.jreinhal.hragent.model.TokenUsage;
import com.jreinhal.hragent.util.GatewayCircuitBreaker;
import com.jreinhal.hragent.util.LogSanitizer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * {@link LanguageModelGateway} backed by Spring AI's {@link ChatClient}.
 *
 * <p>Every call runs on {@code llmCallExecutor} while the caller waits, so a per-call timeout
 * or an interrupt of the caller cancels the in-flight request. A circuit breaker fails calls
 * fast while the model is unavailable.</p>
 */
@Component
public class ChatClientLanguageModelGateway implements LanguageModelGateway {

    private static final Logger log = LoggerFactory.getLogger(ChatClientLanguageModelGateway.class);

    private final ChatClient chatClient;
    private final ExecutorService llmCallExecutor;
    private final GatewayCircuitBreaker circuitBreaker;

    public ChatClientLanguageModelGateway(ChatClient.Builder chatClientBuilder,
                                          @Qualifier("llmCallExecutor") ExecutorService llmCallExecutor,
                                          @Value("${hragent.gateway.breaker.failure-threshold:5}") int failureThreshold,
                                          @Value("${hragent.gateway.breaker.open-seconds:30}") long openSeconds,
                                          @Value("${hragent.gateway.breaker.half-open-calls:1}") int halfOpenCalls) {
        this(chatClientBuilder.build(), llmCallExecutor,
                new GatewayCircuitBreaker(failureThreshold, Duration.ofSeconds(openSeconds), halfOpenCalls));
    }

    ChatClientLanguageModelGateway(ChatClient chatClient, ExecutorService llmCallExecutor,
                                   GatewayCircuitBreaker circuitBreaker) {
        this.chatClient = chatClient;
        this.llmCallExecutor = llmCallExecutor;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public LlmReply complete(LlmRequest request) {
        if (!this.circuitBreaker.allowRequest()) {
            throw new LanguageModelException("Language model unavailable (circuit open, retry in "
                    + this.circuitBreaker.remainingOpenMs() + "ms)");
        }
        CompletableFuture<LlmReply> future;
        try {
            future = CompletableFuture.supplyAsync(() -> this.call(request), this.llmCallExecutor);
        } catch (RejectedExecutionException e) {
            throw new LanguageModelException("Language model call rejected: " + e.getMessage(), e);
        }
        try {
            Duration timeout = request.timeout();
            LlmReply reply = timeout == null
                    ? future.get()
                    : future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            this.circuitBreaker.recordSuccess();
            return reply;
        } catch (TimeoutException e) {
            future.cancel(true);
            this.circuitBreaker.recordFailure();
            log.warn("Language model call timed out after {}ms", request.timeout().toMillis());
            throw new LanguageModelTimeoutException(request.timeout());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LanguageModelException("Language model call interrupted", e);
        } catch (ExecutionException e) {
            this.circuitBreaker.recordFailure();
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Language model call failed: {}", LogSanitizer.sanitize(cause.getMessage()));
            throw new LanguageModelException("Language model call failed: " + cause.getMessage(), cause);
        }
    }

    private LlmReply call(LlmRequest request) {
        ChatClient.ChatClientRequestSpec spec = this.chatClient.prompt();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            spec = spec.system(request.systemPrompt());
        }
        spec = spec.user(request.userPrompt());
        ChatOptions options = toChatOptions(request.options());
        if (options != null) {
            spec = spec.options(options);
        }
        ChatResponse response = spec.call().chatResponse();
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new LanguageModelException("Language model returned no output");
        }
        return new LlmReply(response.getResult().getOutput().getText(), usageOf(response));
    }

    static ChatOptions toChatOptions(LlmCallOptions options) {
        if (options == null) {
            return null;
        }
        return ChatOptions.builder()
                .model(options.model())
                .temperature(options.temperature())
                .maxTokens(options.maxTokens())
                .topP(options.topP())
                .frequencyPenalty(options.frequencyPenalty())
                .presencePenalty(options.presencePenalty())
                .build();
    }

    private static TokenUsage usageOf(ChatResponse response) {
        if (response.getMetadata() == null || response.getMetadata().getUsage() == null) {
            return TokenUsage.NONE;
        }
        Usage usage = response.getMetadata().getUsage();
        int prompt = usage.getPromptTokens() == null ? 0 : usage.getPromptTokens();
        int completion = usage.getCompletionTokens() == null ? 0 : usage.getCompletionTokens();
        int total = usage.getTotalTokens() == null ? prompt + completion : usage.getTotalTokens();
        return new TokenUsage(prompt, completion, total);
    }
}
