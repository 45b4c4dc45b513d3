package com.kbrag.store;

public class IndexConflictException extends VectorStoreException {
    private final String indexName;

    public IndexConflictException(String indexName, String message) {
        super(message, false, null);
        this.indexName = indexName;
    }

    public String indexName() {
        return indexName;
    }
}
