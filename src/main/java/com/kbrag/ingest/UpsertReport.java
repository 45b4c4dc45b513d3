package com.kbrag.ingest;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record UpsertReport(List<BatchOutcome> batches) {

    public UpsertReport {
        batches = List.copyOf(batches);
    }

    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    public record BatchOutcome(
            int batchNumber,
            String firstChunkId,
            String lastChunkId,
            List<String> chunkIds,
            Status status,
            int attempts,
            String error) {

        public int size() {
            return chunkIds.size();
        }
    }

    public boolean isComplete() {
        return batches.stream().allMatch(batch -> batch.status() == Status.SUCCEEDED);
    }

    public int chunksWritten() {
        return batches.stream()
                .filter(batch -> batch.status() == Status.SUCCEEDED)
                .mapToInt(BatchOutcome::size)
                .sum();
    }

    public int chunksFailed() {
        return batches.stream()
                .filter(batch -> batch.status() != Status.SUCCEEDED)
                .mapToInt(BatchOutcome::size)
                .sum();
    }

    public List<BatchOutcome> succeededBatches() {
        return batches.stream().filter(batch -> batch.status() == Status.SUCCEEDED).toList();
    }

    public List<BatchOutcome> unwrittenBatches() {
        return batches.stream().filter(batch -> batch.status() != Status.SUCCEEDED).toList();
    }

    public Set<String> unwrittenChunkIds() {
        Set<String> ids = new HashSet<>();
        unwrittenBatches().forEach(batch -> ids.addAll(batch.chunkIds()));
        return ids;
    }

    /**
     * The subset of {@code chunks} that still has to be written, in original order.
     */
    public List<EmbeddedChunk> remaining(List<EmbeddedChunk> chunks) {
        Set<String> pending = unwrittenChunkIds();
        return chunks.stream().filter(chunk -> pending.contains(chunk.id())).toList();
    }
}
