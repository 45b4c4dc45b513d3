package com.kbrag.ingest;

import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbrag.runtime.Deadline;
import com.kbrag.store.IndexHandle;

/**
 * Chunks, embeds and upserts documents. A document whose embedding fails is reported and
 * skipped; the remaining documents are still written. Upsert failures are mapped back to
 * the documents whose chunks were not written.
 */
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final Chunker chunker;
    private final EmbeddingClient embeddingClient;
    private final BatchUpserter upserter;

    public IngestionService(Chunker chunker, EmbeddingClient embeddingClient, BatchUpserter upserter) {
        this.chunker = chunker;
        this.embeddingClient = embeddingClient;
        this.upserter = upserter;
    }

    public IngestionReport ingest(IndexHandle index, List<Document> documents) throws InterruptedIOException {
        return ingest(index, documents, Deadline.none());
    }

    public IngestionReport ingest(IndexHandle index, List<Document> documents, Deadline deadline) throws InterruptedIOException {
        Map<String, Integer> chunkCounts = new LinkedHashMap<>();
        Map<String, String> embeddingErrors = new HashMap<>();
        Map<String, String> sourceByChunkId = new HashMap<>();
        List<EmbeddedChunk> embedded = new ArrayList<>();

        for (Document document : documents) {
            List<Chunk> chunks = chunker.chunkAll(document);
            chunkCounts.merge(document.source(), chunks.size(), Integer::sum);
            if (chunks.isEmpty()) {
                log.info("ingest.document.empty source={}", document.source());
                continue;
            }
            List<float[]> vectors;
            try {
                vectors = embeddingClient.embedAll(chunks.stream().map(Chunk::text).toList(), deadline);
            } catch (EmbeddingProviderException e) {
                log.error("ingest.document.embedding.failed source={} chunks={} attempts={} reason={}",
                        document.source(), chunks.size(), e.attempts(), e.getMessage());
                embeddingErrors.put(document.source(), e.getMessage());
                continue;
            }
            for (int i = 0; i < chunks.size(); i++) {
                Chunk chunk = chunks.get(i);
                embedded.add(new EmbeddedChunk(chunk, vectors.get(i)));
                sourceByChunkId.put(chunk.id(), chunk.source());
            }
            log.debug("ingest.document.embedded source={} chunks={}", document.source(), chunks.size());
        }

        UpsertReport upsertReport;
        String upsertError = null;
        try {
            upsertReport = upserter.upsert(index, embedded, deadline);
        } catch (PartialUpsertException e) {
            upsertReport = e.report();
            upsertError = e.getMessage();
        }

        Map<String, Integer> unwrittenBySource = new HashMap<>();
        Set<String> unwritten = upsertReport.unwrittenChunkIds();
        for (String chunkId : unwritten) {
            unwrittenBySource.merge(sourceByChunkId.get(chunkId), 1, Integer::sum);
        }

        List<IngestionReport.DocumentReport> reports = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : chunkCounts.entrySet()) {
            String source = entry.getKey();
            int total = entry.getValue();
            if (embeddingErrors.containsKey(source)) {
                reports.add(new IngestionReport.DocumentReport(source, total, 0, total, embeddingErrors.get(source)));
                continue;
            }
            int failed = unwrittenBySource.getOrDefault(source, 0);
            reports.add(new IngestionReport.DocumentReport(source, total, total - failed, failed, failed > 0 ? upsertError : null));
        }

        IngestionReport report = new IngestionReport(index.name(), reports, upsertReport);
        log.info("ingest.complete index={} documents={} chunksWritten={} chunksFailed={}",
                index.name(), reports.size(), report.chunksWritten(), report.chunksFailed());
        return report;
    }
}
