package com.kbrag.ingest;

import java.time.Instant;
import java.util.Objects;

public record Document(String source, String text, Instant discoveredAt) {
    public Document {
        Objects.requireNonNull(source, "source");
        text = text == null ? "" : text;
        discoveredAt = discoveredAt == null ? Instant.now() : discoveredAt;
    }

    public static Document of(String source, String text) {
        return new Document(source, text, Instant.now());
    }
}
