package com.kbrag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.kbrag.runtime.ConfigurationException;

class ChunkerTest {

    @Test
    void shouldSplitThousandCharactersIntoThreeOverlappingChunks() {
        Chunker chunker = new Chunker(512, 50);
        Document document = Document.of("guide.txt", text(1000));

        List<Chunk> chunks = chunker.chunkAll(document);

        assertEquals(3, chunks.size());
        assertEquals(0, chunks.get(0).start());
        assertEquals(512, chunks.get(0).end());
        assertEquals(462, chunks.get(1).start());
        assertEquals(974, chunks.get(1).end());
        assertEquals(924, chunks.get(2).start());
        assertEquals(1000, chunks.get(2).end());
        chunks.forEach(chunk -> assertEquals(3, chunk.totalChunks()));
    }

    @Test
    void shouldCoverWholeDocumentWithExactOverlap() {
        for (int length : new int[] { 1, 7, 99, 100, 101, 250, 1003 }) {
            Chunker chunker = new Chunker(100, 30);
            String text = text(length);

            List<Chunk> chunks = chunker.chunkAll(Document.of("doc", text));

            assertEquals(0, chunks.get(0).start());
            assertEquals(length, chunks.get(chunks.size() - 1).end());
            for (int i = 0; i + 1 < chunks.size(); i++) {
                Chunk current = chunks.get(i);
                Chunk next = chunks.get(i + 1);
                assertTrue(next.start() < current.end(), "gap after chunk " + i + " for length " + length);
                assertEquals(current.text().substring(current.text().length() - 30), next.text().substring(0, 30));
                assertEquals(100, current.text().length());
            }
            for (Chunk chunk : chunks) {
                assertEquals(text.substring(chunk.start(), chunk.end()), chunk.text());
            }
        }
    }

    @Test
    void shouldYieldSingleChunkForShortDocumentAndNoneForEmptyDocument() {
        Chunker chunker = new Chunker(512, 50);

        assertEquals(1, chunker.chunkAll(Document.of("short", "tiny text")).size());
        assertEquals(1, chunker.chunkAll(Document.of("exact", text(512))).size());
        assertEquals(0, chunker.chunkAll(Document.of("empty", "")).size());
    }

    @Test
    void shouldProduceStableIdsAcrossRuns() {
        Chunker chunker = new Chunker(64, 8);
        Document document = Document.of("notes/ops.md", text(500));

        List<String> first = chunker.chunkAll(document).stream().map(Chunk::id).toList();
        List<String> second = new ArrayList<>();
        for (Chunk chunk : chunker.chunk(document)) {
            second.add(chunk.id());
        }

        assertEquals(first, second);
        Set<String> unique = new HashSet<>(first);
        assertEquals(first.size(), unique.size());
        assertTrue(first.get(0).matches("notes/ops\\.md_chunk0_[0-9a-f]{8}"));
        assertEquals(Chunk.idFor("notes/ops.md", 3), first.get(3));
    }

    @Test
    void shouldBeRestartable() {
        Chunker chunker = new Chunker(10, 2);
        Iterable<Chunk> chunks = chunker.chunk(Document.of("doc", text(45)));

        int firstPass = 0;
        for (Chunk ignored : chunks) {
            firstPass++;
        }
        int secondPass = 0;
        for (Chunk ignored : chunks) {
            secondPass++;
        }

        assertEquals(firstPass, secondPass);
        assertEquals(chunker.countChunks(45), firstPass);
    }

    @Test
    void shouldRejectInvalidSizes() {
        assertThrows(ConfigurationException.class, () -> new Chunker(0, 0));
        assertThrows(ConfigurationException.class, () -> new Chunker(100, 100));
        assertThrows(ConfigurationException.class, () -> new Chunker(100, -1));
    }

    private static String text(int length) {
        StringBuilder builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append((char) ('a' + (i * 7 + i / 26) % 26));
        }
        return builder.toString();
    }
}
