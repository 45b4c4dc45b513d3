package com.kbrag.ingest;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads plain-text files as UTF-8. Sources are named by their path relative to the
 * directory being loaded, with forward slashes.
 */
public class DocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);
    static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".txt", ".md", ".markdown");

    public List<Document> load(Path path) throws IOException {
        if (Files.isRegularFile(path)) {
            return isSupported(path) ? List.of(read(path, path.getFileName().toString())) : List.of();
        }
        if (!Files.isDirectory(path)) {
            throw new IOException("Document path does not exist: " + path);
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(path)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(DocumentLoader::isSupported)
                    .sorted()
                    .toList();
        }
        List<Document> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            String source = path.relativize(file).toString().replace('\\', '/');
            try {
                documents.add(read(file, source));
            } catch (CharacterCodingException e) {
                log.warn("document.skipped source={} reason=not-utf8", source);
            }
        }
        log.info("documents.loaded path={} files={} documents={}", path, files.size(), documents.size());
        return documents;
    }

    private static Document read(Path file, String source) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        return new Document(source, text, Instant.now());
    }

    static boolean isSupported(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return SUPPORTED_EXTENSIONS.stream().anyMatch(name::endsWith);
    }
}
