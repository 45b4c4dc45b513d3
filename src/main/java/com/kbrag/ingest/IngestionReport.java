package com.kbrag.ingest;

import java.util.List;

public record IngestionReport(String indexName, List<DocumentReport> documents, UpsertReport upsert) {

    public IngestionReport {
        documents = List.copyOf(documents);
    }

    public record DocumentReport(String source, int chunks, int chunksWritten, int chunksFailed, String error) {
        public boolean isComplete() {
            return chunksFailed == 0;
        }
    }

    public int chunksWritten() {
        return documents.stream().mapToInt(DocumentReport::chunksWritten).sum();
    }

    public int chunksFailed() {
        return documents.stream().mapToInt(DocumentReport::chunksFailed).sum();
    }

    public boolean isComplete() {
        return chunksFailed() == 0;
    }

    public List<DocumentReport> failedDocuments() {
        return documents.stream().filter(document -> !document.isComplete()).toList();
    }
}
