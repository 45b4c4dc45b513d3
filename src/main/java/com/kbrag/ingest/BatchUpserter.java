package com.kbrag.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbrag.runtime.ConfigurationException;
import com.kbrag.runtime.Deadline;
import com.kbrag.runtime.RetryPolicy;
import com.kbrag.store.IndexHandle;
import com.kbrag.store.VectorItem;

public class BatchUpserter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchUpserter.class);
    public static final int DEFAULT_MAX_BATCH_SIZE = 1000;

    private final int maxBatchSize;
    private final int concurrency;
    private final RetryPolicy retryPolicy;
    private final ExecutorService executor;

    public BatchUpserter(int maxBatchSize, RetryPolicy retryPolicy) {
        this(maxBatchSize, 1, retryPolicy);
    }

    public BatchUpserter(int maxBatchSize, int concurrency, RetryPolicy retryPolicy) {
        if (maxBatchSize <= 0) {
            throw new ConfigurationException("upsert batch size must be > 0 but was " + maxBatchSize);
        }
        if (concurrency <= 0) {
            throw new ConfigurationException("upsert concurrency must be > 0 but was " + concurrency);
        }
        this.maxBatchSize = maxBatchSize;
        this.concurrency = concurrency;
        this.retryPolicy = retryPolicy;
        if (concurrency > 1) {
            AtomicInteger threadCounter = new AtomicInteger();
            this.executor = Executors.newFixedThreadPool(concurrency, runnable -> {
                Thread thread = new Thread(runnable, "upsert-" + threadCounter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        } else {
            this.executor = null;
        }
    }

    public UpsertReport upsert(IndexHandle index, List<EmbeddedChunk> chunks) throws PartialUpsertException {
        return upsert(index, chunks, Deadline.none());
    }

    /**
     * Writes every chunk or throws {@link PartialUpsertException} describing which batches
     * made it. Once a batch exhausts its retries, batches that have not started are skipped.
     */
    public UpsertReport upsert(IndexHandle index, List<EmbeddedChunk> chunks, Deadline deadline) throws PartialUpsertException {
        for (EmbeddedChunk chunk : chunks) {
            if (chunk.dimension() != index.dimension()) {
                throw new ConfigurationException("Chunk " + chunk.id() + " has dimension " + chunk.dimension()
                        + " but index '" + index.name() + "' expects " + index.dimension());
            }
        }
        List<List<EmbeddedChunk>> batches = partition(chunks);
        AtomicReferenceArray<UpsertReport.BatchOutcome> outcomes = new AtomicReferenceArray<>(batches.size());
        AtomicBoolean aborted = new AtomicBoolean(false);
        AtomicReference<IOException> firstFailure = new AtomicReference<>();
        log.info("upsert.start index={} chunks={} batches={} batchSize={} concurrency={}",
                index.name(), chunks.size(), batches.size(), maxBatchSize, concurrency);

        if (executor == null || batches.size() == 1) {
            for (int i = 0; i < batches.size(); i++) {
                outcomes.set(i, writeBatch(index, batches.get(i), i + 1, deadline, aborted, firstFailure));
            }
        } else {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < batches.size(); i++) {
                int slot = i;
                futures.add(executor.submit(() -> outcomes.set(slot,
                        writeBatch(index, batches.get(slot), slot + 1, deadline, aborted, firstFailure))));
            }
            awaitAll(futures, deadline, aborted);
        }

        List<UpsertReport.BatchOutcome> results = new ArrayList<>(batches.size());
        for (int i = 0; i < batches.size(); i++) {
            UpsertReport.BatchOutcome outcome = outcomes.get(i);
            results.add(outcome != null ? outcome : outcome(batches.get(i), i + 1, UpsertReport.Status.FAILED, 0, "cancelled"));
        }
        UpsertReport report = new UpsertReport(results);
        if (!report.isComplete()) {
            log.error("upsert.incomplete index={} written={} unwritten={}", index.name(), report.chunksWritten(), report.chunksFailed());
            throw new PartialUpsertException(index.name(), report, firstFailure.get());
        }
        log.info("upsert.complete index={} written={}", index.name(), report.chunksWritten());
        return report;
    }

    private UpsertReport.BatchOutcome writeBatch(
            IndexHandle index,
            List<EmbeddedChunk> batch,
            int batchNumber,
            Deadline deadline,
            AtomicBoolean aborted,
            AtomicReference<IOException> firstFailure) {
        if (aborted.get()) {
            return outcome(batch, batchNumber, UpsertReport.Status.SKIPPED, 0, "skipped after earlier failure");
        }
        if (deadline.isExpired() || Thread.currentThread().isInterrupted()) {
            aborted.set(true);
            return outcome(batch, batchNumber, UpsertReport.Status.SKIPPED, 0, "deadline exceeded");
        }
        List<VectorItem> items = batch.stream().map(EmbeddedChunk::toVectorItem).toList();
        AtomicInteger attempts = new AtomicInteger();
        try {
            retryPolicy.execute("upsert.batch-" + batchNumber, deadline, attempt -> {
                attempts.set(attempt);
                index.upsert(items);
                return null;
            });
            log.info("upsert.batch.ok index={} batch={} size={} attempts={}", index.name(), batchNumber, items.size(), attempts.get());
            return outcome(batch, batchNumber, UpsertReport.Status.SUCCEEDED, attempts.get(), null);
        } catch (IOException e) {
            aborted.set(true);
            firstFailure.compareAndSet(null, e);
            log.error("upsert.batch.failed index={} batch={} first={} last={} attempts={} reason={}",
                    index.name(), batchNumber, batch.get(0).id(), batch.get(batch.size() - 1).id(), attempts.get(), e.getMessage());
            return outcome(batch, batchNumber, UpsertReport.Status.FAILED, attempts.get(), e.getMessage());
        }
    }

    private void awaitAll(List<Future<?>> futures, Deadline deadline, AtomicBoolean aborted) {
        try {
            for (Future<?> future : futures) {
                if (deadline.isUnbounded()) {
                    future.get();
                } else {
                    future.get(deadline.remainingMillis(), TimeUnit.MILLISECONDS);
                }
            }
        } catch (TimeoutException e) {
            log.warn("upsert.deadline.exceeded pending={}", futures.stream().filter(f -> !f.isDone()).count());
            aborted.set(true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            aborted.set(true);
        } catch (ExecutionException e) {
            aborted.set(true);
            log.error("upsert.worker.failed reason={}", String.valueOf(e.getCause()), e.getCause());
        } finally {
            futures.forEach(future -> future.cancel(true));
        }
    }

    private static UpsertReport.BatchOutcome outcome(
            List<EmbeddedChunk> batch,
            int batchNumber,
            UpsertReport.Status status,
            int attempts,
            String error) {
        List<String> ids = batch.stream().map(EmbeddedChunk::id).toList();
        return new UpsertReport.BatchOutcome(batchNumber, ids.get(0), ids.get(ids.size() - 1), ids, status, attempts, error);
    }

    private List<List<EmbeddedChunk>> partition(List<EmbeddedChunk> chunks) {
        List<List<EmbeddedChunk>> batches = new ArrayList<>();
        for (int start = 0; start < chunks.size(); start += maxBatchSize) {
            batches.add(chunks.subList(start, Math.min(chunks.size(), start + maxBatchSize)));
        }
        return batches;
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
