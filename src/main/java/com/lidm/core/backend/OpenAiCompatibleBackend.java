package com.lidm.core.backend;

import com.lidm.core.consistency.ConsistencyScorer;
import com.lidm.core.llm.LlmEmptyResponseException;
import com.lidm.core.model.ConsistencyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Backend speaking the OpenAI chat-completions protocol, which covers hosted
 * OpenAI models as well as llama.cpp and vLLM servers. Calls go through Spring AI's
 * {@link ChatClient}; liveness is a {@code GET /v1/models}.
 */
public class OpenAiCompatibleBackend implements InferenceBackend {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleBackend.class);
    private static final Duration PING_TIMEOUT = Duration.ofSeconds(3);

    private final String name;
    private final String endpoint;
    private final String model;
    private final ChatClient chatClient;
    private final ExecutorService executor;
    private final int sampleConcurrency;
    private final HttpClient httpClient;

    public OpenAiCompatibleBackend(String name, String endpoint, String apiKey, String model,
                                   ExecutorService executor, int sampleConcurrency) {
        this(name, endpoint, model, ChatClient.create(chatModel(endpoint, apiKey, model)),
                executor, sampleConcurrency);
    }

    OpenAiCompatibleBackend(String name, String endpoint, String model, ChatClient chatClient,
                            ExecutorService executor, int sampleConcurrency) {
        if (sampleConcurrency < 1) {
            throw new IllegalArgumentException("sampleConcurrency must be >= 1, got " + sampleConcurrency);
        }
        this.name = name;
        this.endpoint = stripTrailingSlash(endpoint);
        this.model = model;
        this.chatClient = chatClient;
        this.executor = executor;
        this.sampleConcurrency = sampleConcurrency;
        this.httpClient = HttpClient.newBuilder().connectTimeout(PING_TIMEOUT).build();
    }

    private static OpenAiChatModel chatModel(String endpoint, String apiKey, String model) {
        var api = OpenAiApi.builder()
                .baseUrl(stripTrailingSlash(endpoint))
                .apiKey(apiKey == null || apiKey.isBlank() ? "not-needed" : apiKey)
                .build();
        var options = OpenAiChatOptions.builder();
        if (model != null && !model.isBlank()) {
            options.model(model);
        }
        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(options.build())
                .build();
    }

    @Override
    public String generate(String prompt, GenerationOptions options) {
        long start = System.currentTimeMillis();
        var callOptions = OpenAiChatOptions.builder()
                .temperature(options.temperature())
                .maxTokens(options.maxTokens());
        if (model != null && !model.isBlank()) {
            callOptions.model(model);
        }
        String content = chatClient.prompt()
                .user(prompt)
                .options(callOptions.build())
                .call()
                .content();
        log.debug("Backend '{}' responded in {}ms", name, System.currentTimeMillis() - start);
        if (content == null || content.isBlank()) {
            throw new LlmEmptyResponseException("Backend '" + name + "' returned empty content");
        }
        return content;
    }

    /**
     * Samples concurrently, at most {@code sampleConcurrency} at a time. Failed
     * samples are dropped; the batch fails only if every sample failed.
     */
    @Override
    public BatchGeneration generateBatch(String prompt, int numSamples, GenerationOptions options) {
        if (numSamples < 1) {
            throw new IllegalArgumentException("numSamples must be >= 1, got " + numSamples);
        }
        var permits = new Semaphore(sampleConcurrency);
        var futures = new ArrayList<CompletableFuture<String>>(numSamples);
        for (int i = 0; i < numSamples; i++) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                permits.acquireUninterruptibly();
                try {
                    return generate(prompt, options);
                } finally {
                    permits.release();
                }
            }, executor));
        }

        var responses = new ArrayList<String>(numSamples);
        RuntimeException firstFailure = null;
        for (CompletableFuture<String> future : futures) {
            try {
                responses.add(future.join());
            } catch (CompletionException e) {
                RuntimeException cause = e.getCause() instanceof RuntimeException re ? re : e;
                if (firstFailure == null) {
                    firstFailure = cause;
                }
                log.warn("Backend '{}' sample failed: {}", name, cause.getMessage());
            }
        }
        if (responses.isEmpty()) {
            throw firstFailure != null ? firstFailure
                    : new LlmEmptyResponseException("Backend '" + name + "' produced no samples");
        }
        ConsistencyResult scored = ConsistencyScorer.compute(responses);
        return new BatchGeneration(List.copyOf(responses), scored.majorityAnswer(), scored.agreementCount());
    }

    @Override
    public boolean ping() {
        try {
            var request = HttpRequest.newBuilder(URI.create(endpoint + "/v1/models"))
                    .timeout(PING_TIMEOUT)
                    .GET()
                    .build();
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            boolean alive = response.statusCode() >= 200 && response.statusCode() < 300;
            if (!alive) {
                log.warn("Backend '{}' ping returned HTTP {}", name, response.statusCode());
            }
            return alive;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.warn("Backend '{}' ping failed: {}", name, e.getMessage());
            return false;
        }
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            throw new IllegalArgumentException("endpoint is required");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
