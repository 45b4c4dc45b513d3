package com.kbrag.ingest;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.kbrag.runtime.ConfigurationException;

/**
 * Fixed-size character windows. Window {@code i} starts at {@code i * (size - overlap)}
 * and the last window ends at the end of the text, so consecutive chunks share exactly
 * {@code overlap} characters and the whole text is covered.
 */
public class Chunker {
    private final int chunkSize;
    private final int overlap;

    public Chunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new ConfigurationException("chunk size must be > 0 but was " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new ConfigurationException("overlap must be >= 0 and < chunk size (" + chunkSize + ") but was " + overlap);
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int overlap() {
        return overlap;
    }

    public Iterable<Chunk> chunk(Document document) {
        String text = document.text();
        int total = countChunks(text.length());
        return () -> new ChunkIterator(document.source(), text, total);
    }

    public List<Chunk> chunkAll(Document document) {
        List<Chunk> chunks = new ArrayList<>();
        for (Chunk chunk : chunk(document)) {
            chunks.add(chunk);
        }
        return chunks;
    }

    int countChunks(int length) {
        if (length == 0) {
            return 0;
        }
        if (length <= chunkSize) {
            return 1;
        }
        int step = chunkSize - overlap;
        return 1 + (length - chunkSize + step - 1) / step;
    }

    private final class ChunkIterator implements Iterator<Chunk> {
        private final String source;
        private final String text;
        private final int total;
        private int chunkIndex;

        private ChunkIterator(String source, String text, int total) {
            this.source = source;
            this.text = text;
            this.total = total;
        }

        @Override
        public boolean hasNext() {
            return chunkIndex < total;
        }

        @Override
        public Chunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int start = chunkIndex * (chunkSize - overlap);
            int end = chunkIndex == total - 1 ? text.length() : Math.min(text.length(), start + chunkSize);
            Chunk chunk = new Chunk(
                    Chunk.idFor(source, chunkIndex),
                    source,
                    chunkIndex,
                    total,
                    start,
                    end,
                    text.substring(start, end));
            chunkIndex++;
            return chunk;
        }
    }
}
