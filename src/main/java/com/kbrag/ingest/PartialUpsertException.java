package com.kbrag.ingest;

import java.io.IOException;

public class PartialUpsertException extends IOException {
    private final String indexName;
    private final UpsertReport report;

    public PartialUpsertException(String indexName, UpsertReport report, Throwable cause) {
        super(describe(indexName, report), cause);
        this.indexName = indexName;
        this.report = report;
    }

    public String indexName() {
        return indexName;
    }

    public UpsertReport report() {
        return report;
    }

    private static String describe(String indexName, UpsertReport report) {
        StringBuilder builder = new StringBuilder("Upsert into '")
                .append(indexName)
                .append("' incomplete: ")
                .append(report.chunksWritten())
                .append(" chunk(s) written, ")
                .append(report.chunksFailed())
                .append(" not written");
        report.unwrittenBatches().stream().findFirst().ifPresent(batch -> builder
                .append("; first unwritten batch #")
                .append(batch.batchNumber())
                .append(" [")
                .append(batch.firstChunkId())
                .append(" .. ")
                .append(batch.lastChunkId())
                .append("]"));
        return builder.toString();
    }
}
