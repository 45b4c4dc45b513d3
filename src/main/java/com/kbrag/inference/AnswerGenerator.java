package com.kbrag.inference;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbrag.inference.GenerationProviderException.Kind;
import com.kbrag.retrieval.RetrievedChunk;
import com.kbrag.runtime.ConfigurationException;
import com.kbrag.runtime.Deadline;

/**
 * Tries each provider in order until one returns text. Never throws for provider failures:
 * when the chain is exhausted the caller gets an {@link Answer.Status#ALL_PROVIDERS_FAILED}
 * answer listing what went wrong.
 */
public class AnswerGenerator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AnswerGenerator.class);
    public static final String NO_CONTEXT_ANSWER = "I couldn't find any relevant information to answer your question.";
    public static final String NO_PROVIDER = "none";
    static final Duration DEFAULT_PROVIDER_TIMEOUT = Duration.ofSeconds(60);

    private final List<TextCompletionProvider> providers;
    private final long providerTimeoutMs;
    private final ExecutorService executor;

    public AnswerGenerator(List<TextCompletionProvider> providers) {
        this(providers, DEFAULT_PROVIDER_TIMEOUT);
    }

    public AnswerGenerator(List<TextCompletionProvider> providers, Duration providerTimeout) {
        if (providers.isEmpty()) {
            throw new ConfigurationException("At least one generation provider is required");
        }
        this.providers = List.copyOf(providers);
        this.providerTimeoutMs = providerTimeout.toMillis();
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "generation-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public List<String> providerNames() {
        return providers.stream().map(TextCompletionProvider::name).toList();
    }

    public Answer generate(String question, List<RetrievedChunk> chunks) {
        return generate(question, chunks, Deadline.none());
    }

    public Answer generate(String question, List<RetrievedChunk> chunks, Deadline deadline) {
        if (chunks.isEmpty()) {
            log.info("generation.skipped reason=no-context");
            return new Answer(NO_CONTEXT_ANSWER, List.of(), NO_PROVIDER, Answer.Status.NO_CONTEXT, List.of());
        }
        return runChain("answer", PromptBuilder.buildAnswerPrompt(question, chunks), chunks, deadline);
    }

    public Answer summarize(String topic, List<RetrievedChunk> chunks, int maxWords) {
        return summarize(topic, chunks, maxWords, Deadline.none());
    }

    public Answer summarize(String topic, List<RetrievedChunk> chunks, int maxWords, Deadline deadline) {
        if (maxWords <= 0) {
            throw new ConfigurationException("maxWords must be > 0 but was " + maxWords);
        }
        if (chunks.isEmpty()) {
            log.info("summary.skipped reason=no-context topic={}", topic);
            return new Answer(NO_CONTEXT_ANSWER, List.of(), NO_PROVIDER, Answer.Status.NO_CONTEXT, List.of());
        }
        return runChain("summary", PromptBuilder.buildSummaryPrompt(topic, chunks, maxWords), chunks, deadline);
    }

    /**
     * Once {@code deadline} has passed, the remaining providers are recorded as
     * {@link Kind#TIMEOUT} failures without being called.
     */
    private Answer runChain(String purpose, String prompt, List<RetrievedChunk> chunks, Deadline deadline) {
        List<ProviderFailure> failures = new ArrayList<>();
        for (int i = 0; i < providers.size(); i++) {
            TextCompletionProvider provider = providers.get(i);
            if (deadline.isExpired()) {
                failures.add(new ProviderFailure(provider.name(), Kind.TIMEOUT, "Caller deadline exceeded before this provider was tried"));
                log.warn("generation.skipped purpose={} provider={} reason=deadline", purpose, provider.name());
                continue;
            }
            log.info("generation.attempt purpose={} provider={} tier={}", purpose, provider.name(), i + 1);
            try {
                String text = invoke(provider, prompt, Math.min(providerTimeoutMs, deadline.remainingMillis()));
                log.info("generation.ok purpose={} provider={} failovers={}", purpose, provider.name(), failures.size());
                return new Answer(text, chunks, provider.name(), Answer.Status.ANSWERED, failures);
            } catch (GenerationProviderException e) {
                failures.add(new ProviderFailure(provider.name(), e.kind(), e.getMessage()));
                log.warn("generation.failover purpose={} provider={} kind={} reason={}",
                        purpose, provider.name(), e.kind(), e.getMessage());
            }
        }
        log.error("generation.exhausted purpose={} providers={}", purpose, providers.size());
        return new Answer(errorText(failures), chunks, NO_PROVIDER, Answer.Status.ALL_PROVIDERS_FAILED, failures);
    }

    private String invoke(TextCompletionProvider provider, String prompt, long timeoutMs) throws GenerationProviderException {
        Future<String> future = executor.submit(() -> provider.complete(prompt));
        try {
            String text = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (text == null || text.isBlank()) {
                throw new GenerationProviderException(provider.name(), Kind.INVALID_RESPONSE, "Empty completion");
            }
            return text;
        } catch (TimeoutException e) {
            throw new GenerationProviderException(provider.name(), Kind.TIMEOUT,
                    "No completion within " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationProviderException(provider.name(), Kind.TIMEOUT, "Interrupted while waiting for completion", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GenerationProviderException providerException) {
                throw providerException;
            }
            throw new GenerationProviderException(provider.name(), Kind.INVALID_RESPONSE, String.valueOf(cause), cause);
        } finally {
            future.cancel(true);
        }
    }

    static String errorText(List<ProviderFailure> failures) {
        return "I couldn't generate an answer because every generation provider failed ("
                + failures.stream()
                        .map(failure -> failure.provider() + ": " + failure.kind())
                        .collect(Collectors.joining(", "))
                + "). Please try again later.";
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
