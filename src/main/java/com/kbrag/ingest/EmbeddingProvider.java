package com.kbrag.ingest;

import java.util.List;

public interface EmbeddingProvider {
    /**
     * Embeds one request's worth of texts. The returned list has the same size and order as
     * {@code texts}. Implementations do not split or retry; {@link EmbeddingClient} does.
     */
    List<float[]> embedBatch(List<String> texts) throws EmbeddingProviderException;

    int dimension();

    String name();
}
