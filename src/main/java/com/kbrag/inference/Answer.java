package com.kbrag.inference;

import java.util.List;

import com.kbrag.retrieval.RetrievedChunk;

public record Answer(
        String text,
        List<RetrievedChunk> sources,
        String provider,
        Status status,
        List<ProviderFailure> failures) {

    public enum Status {
        ANSWERED,
        NO_CONTEXT,
        ALL_PROVIDERS_FAILED
    }

    public Answer {
        sources = sources == null ? List.of() : List.copyOf(sources);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean answered() {
        return status == Status.ANSWERED;
    }
}
