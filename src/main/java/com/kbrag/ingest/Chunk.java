package com.kbrag.ingest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public record Chunk(String id, String source, int chunkIndex, int totalChunks, int start, int end, String text) {

    public static String idFor(String source, int chunkIndex) {
        return source + "_chunk" + chunkIndex + "_" + shortSha256(source + "_" + chunkIndex);
    }

    private static String shortSha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
