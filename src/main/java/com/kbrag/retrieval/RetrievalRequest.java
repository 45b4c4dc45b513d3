package com.kbrag.retrieval;

import com.kbrag.runtime.ConfigurationException;

public record RetrievalRequest(String query, int topK, int ef, double minScore, String source) {
    public static final int DEFAULT_TOP_K = 5;
    public static final int DEFAULT_EF = 128;
    public static final int MAX_EF = 1024;

    public RetrievalRequest {
        if (topK <= 0) {
            throw new ConfigurationException("topK must be > 0 but was " + topK);
        }
        if (ef <= 0 || ef > MAX_EF) {
            throw new ConfigurationException("ef must be between 1 and " + MAX_EF + " but was " + ef);
        }
        query = query == null ? "" : query;
        source = source == null || source.isBlank() ? null : source;
    }

    public static RetrievalRequest of(String query, int topK) {
        return new RetrievalRequest(query, topK, DEFAULT_EF, Double.NEGATIVE_INFINITY, null);
    }

    public RetrievalRequest withEf(int otherEf) {
        return new RetrievalRequest(query, topK, otherEf, minScore, source);
    }

    public RetrievalRequest withMinScore(double threshold) {
        return new RetrievalRequest(query, topK, ef, threshold, source);
    }

    public RetrievalRequest withSource(String otherSource) {
        return new RetrievalRequest(query, topK, ef, minScore, otherSource);
    }
}
