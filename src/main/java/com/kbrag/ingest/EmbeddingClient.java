package com.kbrag.ingest;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbrag.runtime.ConfigurationException;
import com.kbrag.runtime.Deadline;
import com.kbrag.runtime.RetryPolicy;

public class EmbeddingClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingClient.class);
    public static final int DEFAULT_MAX_BATCH_SIZE = 1000;

    private final EmbeddingProvider provider;
    private final int maxBatchSize;
    private final RetryPolicy retryPolicy;
    private final ExecutorService executor;

    public EmbeddingClient(EmbeddingProvider provider, int maxBatchSize, int maxConcurrency, RetryPolicy retryPolicy) {
        if (maxBatchSize <= 0) {
            throw new ConfigurationException("embedding maxBatchSize must be > 0 but was " + maxBatchSize);
        }
        if (maxConcurrency <= 0) {
            throw new ConfigurationException("embedding maxConcurrency must be > 0 but was " + maxConcurrency);
        }
        this.provider = provider;
        this.maxBatchSize = maxBatchSize;
        this.retryPolicy = retryPolicy;
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(maxConcurrency, runnable -> {
            Thread thread = new Thread(runnable, "embedding-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public int dimension() {
        return provider.dimension();
    }

    public String providerName() {
        return provider.name();
    }

    public float[] embed(String text) throws EmbeddingProviderException, InterruptedIOException {
        return embed(text, Deadline.none());
    }

    public float[] embed(String text, Deadline deadline) throws EmbeddingProviderException, InterruptedIOException {
        return embedAll(List.of(text), deadline).get(0);
    }

    public List<float[]> embedAll(List<String> texts) throws EmbeddingProviderException, InterruptedIOException {
        return embedAll(texts, Deadline.none());
    }

    public List<float[]> embedAll(List<String> texts, Deadline deadline) throws EmbeddingProviderException, InterruptedIOException {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<List<String>> batches = partition(texts);
        log.debug("embedding.start provider={} texts={} batches={}", provider.name(), texts.size(), batches.size());

        List<float[]> vectors = new ArrayList<>(texts.size());
        // a bounded deadline always goes through the pool so a hung call can be abandoned
        if (batches.size() == 1 && deadline.isUnbounded()) {
            vectors.addAll(embedBatchWithRetries(batches.get(0), 1, deadline));
        } else {
            List<Future<List<float[]>>> futures = new ArrayList<>(batches.size());
            for (int i = 0; i < batches.size(); i++) {
                List<String> batch = batches.get(i);
                int batchNumber = i + 1;
                futures.add(executor.submit(() -> embedBatchWithRetries(batch, batchNumber, deadline)));
            }
            try {
                for (Future<List<float[]>> future : futures) {
                    vectors.addAll(await(future, deadline));
                }
            } finally {
                futures.forEach(future -> future.cancel(true));
            }
        }
        log.debug("embedding.complete provider={} vectors={}", provider.name(), vectors.size());
        return vectors;
    }

    private List<float[]> embedBatchWithRetries(List<String> batch, int batchNumber, Deadline deadline)
            throws EmbeddingProviderException, InterruptedIOException {
        AtomicInteger attempts = new AtomicInteger();
        List<float[]> vectors;
        try {
            vectors = retryPolicy.execute("embed.batch-" + batchNumber, deadline, attempt -> {
                attempts.set(attempt);
                return provider.embedBatch(batch);
            });
        } catch (EmbeddingProviderException e) {
            log.error("embedding.batch.failed provider={} batch={} attempts={} reason={}",
                    provider.name(), batchNumber, attempts.get(), e.getMessage());
            throw EmbeddingProviderException.exhausted(provider.name(), attempts.get(), e);
        } catch (InterruptedIOException e) {
            throw e;
        } catch (IOException e) {
            throw new EmbeddingProviderException(provider.name(), e.getMessage(), false, attempts.get(), e);
        }
        if (vectors.size() != batch.size()) {
            throw new EmbeddingProviderException(provider.name(),
                    "Expected " + batch.size() + " embeddings but received " + vectors.size(), false, null);
        }
        for (float[] vector : vectors) {
            if (vector.length != provider.dimension()) {
                throw new ConfigurationException("Embedding provider " + provider.name() + " returned dimension "
                        + vector.length + " but " + provider.dimension() + " is configured");
            }
        }
        return vectors;
    }

    private List<float[]> await(Future<List<float[]>> future, Deadline deadline)
            throws EmbeddingProviderException, InterruptedIOException {
        try {
            if (deadline.isUnbounded()) {
                return future.get();
            }
            return future.get(deadline.remainingMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("embedding.deadline.exceeded provider={}", provider.name());
            throw new EmbeddingProviderException(provider.name(), "Embedding deadline exceeded", true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for embeddings");
        } catch (CancellationException e) {
            throw new EmbeddingProviderException(provider.name(), "Embedding batch cancelled", true, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EmbeddingProviderException providerException) {
                throw providerException;
            }
            if (cause instanceof InterruptedIOException interrupted) {
                throw interrupted;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new EmbeddingProviderException(provider.name(), String.valueOf(cause), false, cause);
        }
    }

    private List<List<String>> partition(List<String> texts) {
        List<List<String>> batches = new ArrayList<>();
        for (int start = 0; start < texts.size(); start += maxBatchSize) {
            batches.add(texts.subList(start, Math.min(texts.size(), start + maxBatchSize)));
        }
        return batches;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
