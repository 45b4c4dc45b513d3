package com.kbrag.retrieval;

public record RetrievedChunk(String id, String text, String source, int chunkIndex, double score) {

    public String excerpt(int maxLength) {
        String trimmed = text.strip().replaceAll("\\s+", " ");
        if (trimmed.length() > maxLength) {
            return trimmed.substring(0, maxLength) + "...";
        }
        return trimmed;
    }
}
