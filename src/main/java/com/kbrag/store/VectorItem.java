package com.kbrag.store;

import java.util.Map;

public record VectorItem(String id, float[] vector, Map<String, Object> meta) {
    public static final String META_TEXT = "text";
    public static final String META_SOURCE = "source";
    public static final String META_CHUNK_INDEX = "chunk_index";
    public static final String META_TOTAL_CHUNKS = "total_chunks";
    public static final String META_START = "start";
    public static final String META_END = "end";

    public VectorItem {
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }
}
