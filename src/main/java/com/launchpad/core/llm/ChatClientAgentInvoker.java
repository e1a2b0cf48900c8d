package com.launchpad.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link AgentInvoker} backed by Spring AI's {@link ChatClient}.
 * <p>
 * The blocking chat call runs on a dedicated executor so the caller can bound it with a
 * timeout. A call that times out is interrupted and has ended by the time {@link #invoke}
 * throws. Failures are classified into {@link InvocationFailure} kinds; a null or blank reply
 * counts as a malformed response.
 */
@Service
public class ChatClientAgentInvoker implements AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(ChatClientAgentInvoker.class);

    private final ChatClient chatClient;
    private final ExecutorService executor;

    @Autowired
    public ChatClientAgentInvoker(ChatClient.Builder builder,
                                  @Qualifier("agentInvocationExecutor") ExecutorService executor,
                                  @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this(builder.build(), executor);
        log.info("ChatClientAgentInvoker initialized, OpenAI base-url: {}", baseUrl);
    }

    ChatClientAgentInvoker(ChatClient chatClient, ExecutorService executor) {
        this.chatClient = chatClient;
        this.executor = executor;
    }

    @Override
    public String invoke(AgentPrompt prompt, Duration timeout) throws AgentInvocationException {
        log.info("LLM call started ({} chars of user prompt)", prompt.user().length());
        long start = System.currentTimeMillis();

        var finished = new CountDownLatch(1);
        Future<String> call = executor.submit(() -> {
            try {
                return chatClient.prompt()
                        .system(prompt.system())
                        .user(prompt.user())
                        .call()
                        .content();
            } finally {
                finished.countDown();
            }
        });

        String content;
        try {
            content = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancelAndAwait(call, finished);
            throw new AgentInvocationException(InvocationFailure.TIMEOUT,
                    "LLM call timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new AgentInvocationException(InvocationFailure.TRANSPORT, "LLM call interrupted", e);
        } catch (ExecutionException e) {
            throw classify(e.getCause() != null ? e.getCause() : e);
        }

        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));

        if (content == null || content.isBlank()) {
            throw new AgentInvocationException(InvocationFailure.MALFORMED_RESPONSE,
                    "LLM returned empty content. Check that the model is reachable and the API key is valid.");
        }
        return content;
    }

    /**
     * Interrupts a timed-out call and blocks until its worker has left the chat client, so the
     * next attempt never overlaps it. The HTTP read timeout bounds the wait when the client
     * does not react to the interrupt.
     */
    private void cancelAndAwait(Future<String> call, CountDownLatch finished) {
        call.cancel(true);
        try {
            finished.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.warn("Timed-out LLM call cancelled");
    }

    static AgentInvocationException classify(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (cause instanceof ResourceAccessException || cause instanceof IOException) {
            return new AgentInvocationException(InvocationFailure.TRANSPORT, "Transport failure: " + message, cause);
        }
        return new AgentInvocationException(InvocationFailure.PROVIDER_ERROR, "Provider error: " + message, cause);
    }
}
