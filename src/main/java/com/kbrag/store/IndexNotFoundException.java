package com.kbrag.store;

public class IndexNotFoundException extends VectorStoreException {
    private final String indexName;

    public IndexNotFoundException(String indexName) {
        super("Index '" + indexName + "' does not exist", false, null);
        this.indexName = indexName;
    }

    public String indexName() {
        return indexName;
    }
}
