package com.smartroute.core.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

import java.time.Duration;

/**
 * {@link ExecutionBackend} over a Spring AI {@link ChatClient}. One instance is
 * configured per venue, pointing at either a local OpenAI-compatible server or
 * a remote provider.
 * <p>
 * Chat models report no quality of their own, so a configured nominal score is
 * returned for any non-blank answer.
 */
public class ChatClientBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(ChatClientBackend.class);

    static final String SYSTEM_PROMPT = """
            You are a coding assistant. Perform the requested task on the content provided.
            Task type: %s
            Preserve any token of the form __ph_<hex>_<n>__ exactly as written.""";

    private final String name;
    private final ChatClient chatClient;
    private final double nominalQuality;

    public ChatClientBackend(String name, ChatClient chatClient, double nominalQuality) {
        this.name = name;
        this.chatClient = chatClient;
        this.nominalQuality = nominalQuality;
    }

    @Override
    public BackendResponse execute(String content, String taskType, Duration timeout)
            throws ExecutionBackendException {
        log.info("Chat call started on {} ({})", name, taskType);
        long start = System.currentTimeMillis();
        String response;
        try {
            response = chatClient.prompt()
                    .system(String.format(SYSTEM_PROMPT, taskType))
                    .user(content)
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw new ExecutionBackendException(name + " call failed: " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("Chat call complete on {} ({}s)", name, String.format("%.1f", elapsed / 1000.0));
        if (elapsed > timeout.toMillis()) {
            throw new ExecutionTimeoutException(name, timeout);
        }
        if (response == null || response.isBlank()) {
            throw new ExecutionBackendException(name + " returned empty content");
        }
        return new BackendResponse(response, nominalQuality);
    }

    @Override
    public String name() {
        return name;
    }
}
