package com.kbrag.ingest;

/**
 * A source present in an index and the number of its chunks seen by the listing query.
 */
public record IngestedDocument(String source, int chunkCount) {
}
