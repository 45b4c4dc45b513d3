package com.kbrag.ingest;

import java.util.LinkedHashMap;
import java.util.Map;

import com.kbrag.store.VectorItem;

public record EmbeddedChunk(Chunk chunk, float[] vector) {

    public String id() {
        return chunk.id();
    }

    public int dimension() {
        return vector.length;
    }

    public VectorItem toVectorItem() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(VectorItem.META_TEXT, chunk.text());
        meta.put(VectorItem.META_SOURCE, chunk.source());
        meta.put(VectorItem.META_CHUNK_INDEX, chunk.chunkIndex());
        meta.put(VectorItem.META_TOTAL_CHUNKS, chunk.totalChunks());
        meta.put(VectorItem.META_START, chunk.start());
        meta.put(VectorItem.META_END, chunk.end());
        return new VectorItem(chunk.id(), vector, meta);
    }
}
