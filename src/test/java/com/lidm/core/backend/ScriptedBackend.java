package com.lidm.core.backend;

import com.lidm.core.consistency.ConsistencyScorer;
import com.lidm.core.model.ConsistencyResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory backend whose answers are computed from the prompt by a test-supplied function.
 * A function that throws simulates a failing call.
 */
public class ScriptedBackend implements InferenceBackend {

    private final String name;
    private volatile Function<String, String> responder;
    private volatile Duration delay = Duration.ZERO;
    private volatile boolean alive = true;
    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private final List<GenerationOptions> options = new CopyOnWriteArrayList<>();
    private final AtomicInteger batchCalls = new AtomicInteger();

    public ScriptedBackend(String name, Function<String, String> responder) {
        this.name = name;
        this.responder = responder;
    }

    public static ScriptedBackend answering(String name, String answer) {
        return new ScriptedBackend(name, prompt -> answer);
    }

    public static ScriptedBackend failing(String name, String message) {
        return new ScriptedBackend(name, prompt -> {
            throw new IllegalStateException(message);
        });
    }

    /** Answers with each of {@code answers} in turn, repeating the last one. */
    public static ScriptedBackend sequence(String name, String... answers) {
        var next = new AtomicInteger();
        return new ScriptedBackend(name, prompt -> answers[Math.min(next.getAndIncrement(), answers.length - 1)]);
    }

    public ScriptedBackend respondWith(Function<String, String> newResponder) {
        this.responder = newResponder;
        return this;
    }

    public ScriptedBackend withDelay(Duration newDelay) {
        this.delay = newDelay;
        return this;
    }

    public ScriptedBackend alive(boolean isAlive) {
        this.alive = isAlive;
        return this;
    }

    public String name() {
        return name;
    }

    public int calls() {
        return prompts.size();
    }

    public int batchCalls() {
        return batchCalls.get();
    }

    public List<String> prompts() {
        return List.copyOf(prompts);
    }

    public List<GenerationOptions> options() {
        return List.copyOf(options);
    }

    @Override
    public String generate(String prompt, GenerationOptions generationOptions) {
        prompts.add(prompt);
        options.add(generationOptions);
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
        }
        return responder.apply(prompt);
    }

    @Override
    public BatchGeneration generateBatch(String prompt, int numSamples, GenerationOptions generationOptions) {
        batchCalls.incrementAndGet();
        var responses = new ArrayList<String>();
        for (int i = 0; i < numSamples; i++) {
            responses.add(generate(prompt, generationOptions));
        }
        ConsistencyResult scored = ConsistencyScorer.compute(responses);
        return new BatchGeneration(responses, scored.majorityAnswer(), scored.agreementCount());
    }

    @Override
    public boolean ping() {
        return alive;
    }
}
