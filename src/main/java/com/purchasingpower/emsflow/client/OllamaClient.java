package com.purchasingpower.emsflow.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.emsflow.exception.LlmCallException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Ollama LLM provider using the {@code /api/chat} endpoint.
 */
@Slf4j
@Component
public class OllamaClient implements LLMProvider {

    private static final String SYSTEM_PROMPT =
            "You are an assistant for RF spectrum automation rules. Follow the output format exactly.";

    private final WebClient ollamaWebClient;
    private final String chatModel;
    private final int numCtx;

    public OllamaClient(WebClient.Builder webClientBuilder,
                        @Value("${app.ollama.base-url:http://localhost:11434}") String baseUrl,
                        @Value("${app.ollama.chat-model:qwen2.5:14b}") String chatModel,
                        @Value("${app.ollama.num-ctx:16384}") int numCtx,
                        @Value("${app.ollama.response-timeout:5m}") Duration responseTimeout) {
        this.chatModel = chatModel;
        this.numCtx = numCtx;

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000)
                .responseTimeout(responseTimeout)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(responseTimeout.toSeconds(), TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(60, TimeUnit.SECONDS)));

        this.ollamaWebClient = webClientBuilder
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
        log.info("Ollama client configured: baseUrl={}, model={}", baseUrl, chatModel);
    }

    @Override
    public String getProviderName() {
        return "Ollama (" + chatModel + ")";
    }

    @Override
    public String chat(String prompt, String agentName, ChatOptions options) {
        log.info("🔵 [LLM REQUEST] Provider=Ollama, Agent={}, Model={}", agentName, chatModel);
        log.debug("🔵 [LLM REQUEST] Prompt length={}, First 200 chars: {}",
                prompt.length(),
                prompt.substring(0, Math.min(200, prompt.length())));

        long startTime = System.currentTimeMillis();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", chatModel);
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)
        ));
        body.put("stream", false);
        if (options.isJsonFormat()) {
            body.put("format", "json");
        }
        body.put("options", Map.of(
                "num_ctx", numCtx,
                "temperature", options.getTemperature()
        ));

        JsonNode response;
        try {
            response = ollamaWebClient.post()
                    .uri("/api/chat")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
        } catch (Exception e) {
            log.error("🔴 Ollama call failed for model {}: {}", chatModel, e.getMessage());
            throw new LlmCallException(getProviderName(),
                    "Ollama call failed. Ensure Ollama is running and " + chatModel + " is downloaded.", e);
        }

        if (response == null || !response.path("message").has("content")) {
            throw new LlmCallException(getProviderName(), "Ollama response has no message content", null);
        }

        String content = response.path("message").path("content").asText();
        long latency = System.currentTimeMillis() - startTime;

        log.info("🟢 [LLM RESPONSE] Provider=Ollama, Latency={}ms, ResponseLength={}", latency, content.length());
        log.debug("🟢 [LLM RESPONSE] Content: {}", content.substring(0, Math.min(500, content.length())));
        return content;
    }
}
