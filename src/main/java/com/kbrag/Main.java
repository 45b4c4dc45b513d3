package com.kbrag;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbrag.inference.Answer;
import com.kbrag.ingest.IngestedDocument;
import com.kbrag.ingest.IngestionReport;
import com.kbrag.retrieval.RetrievedChunk;
import com.kbrag.runtime.AppConfig;
import com.kbrag.runtime.AppConfigLoader;
import com.kbrag.runtime.ConfigurationException;
import com.kbrag.runtime.Deadline;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "kb-rag",
        mixinStandardHelpOptions = true,
        version = "kb-rag 0.1.0",
        description = "Ingest documents into a vector index and answer questions from them.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_PARTIAL_INGEST = 3;
    private static final Set<String> EXIT_WORDS = Set.of("quit", "exit", "q");

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "interactive")
    Mode mode;

    @Option(names = "--docs-dir", description = "Directory (or single file) of .txt/.md documents to ingest", defaultValue = "data/documents")
    Path docsDir;

    @Option(names = "--query", description = "Question, search text or summary topic")
    String query;

    @Option(names = "--top-k", description = "Number of chunks to retrieve (defaults to retrieval.topK)")
    Integer topK;

    @Option(names = "--threshold", description = "Minimum similarity for search results", defaultValue = "0.0")
    double threshold;

    @Option(names = "--source", description = "Restrict search to one source, or the source to delete in delete_document mode")
    String source;

    @Option(names = "--index", description = "Index name (overrides store.indexName)")
    String indexName;

    @Option(names = "--max-words", description = "Maximum summary length in words", defaultValue = "500")
    int maxWords;

    @Option(names = "--limit", description = "Maximum number of documents in list_documents mode", defaultValue = "100")
    int limit;

    @Option(names = "--timeout-seconds", description = "Give up on each operation after this many seconds (default: no limit)")
    Long timeoutSeconds;

    enum Mode {
        interactive,
        ingest,
        query,
        search,
        summarize,
        list,
        list_documents,
        delete,
        delete_document
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config;
        try {
            config = new AppConfigLoader().load(Path.of(configPath));
            if (indexName != null && !indexName.isBlank()) {
                config.getStore().setIndexName(indexName);
            }
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }
        int resolvedTopK = topK == null ? config.getRetrieval().getTopK() : topK;

        log.info("Starting kb-rag in {} mode", mode);
        log.info("Using config file: {} store={} index={} embedding={}",
                configPath,
                config.getStore().getType(),
                config.getStore().getIndexName(),
                config.getEmbedding().getProvider());

        try (KnowledgeBase knowledgeBase = openKnowledgeBase(config)) {
            switch (mode) {
                case interactive:
                    runInteractive(knowledgeBase, resolvedTopK);
                    return EXIT_OK;
                case ingest:
                    return runIngest(knowledgeBase);
                case query:
                    if (!requireQuery()) {
                        return EXIT_USAGE;
                    }
                    printAnswer(knowledgeBase.query(query, resolvedTopK, deadline()));
                    return EXIT_OK;
                case search:
                    if (!requireQuery()) {
                        return EXIT_USAGE;
                    }
                    printResults(knowledgeBase.search(query, resolvedTopK, threshold, source, deadline()));
                    return EXIT_OK;
                case summarize:
                    if (!requireQuery()) {
                        return EXIT_USAGE;
                    }
                    int summaryTopK = topK == null ? KnowledgeBase.DEFAULT_SUMMARY_TOP_K : topK;
                    printAnswer(knowledgeBase.summarize(query, summaryTopK, maxWords, deadline()));
                    return EXIT_OK;
                case list:
                    List<String> names = knowledgeBase.listKnowledgeBases();
                    names.forEach(System.out::println);
                    log.info("Listed {} knowledge base(s)", names.size());
                    return EXIT_OK;
                case list_documents:
                    List<IngestedDocument> documents = knowledgeBase.listDocuments(limit);
                    documents.forEach(document -> System.out.printf("%s chunks=%d%n", document.source(), document.chunkCount()));
                    log.info("Listed {} document(s) in {}", documents.size(), knowledgeBase.indexName());
                    return EXIT_OK;
                case delete:
                    boolean deleted = knowledgeBase.deleteKnowledgeBase(knowledgeBase.indexName());
                    System.out.println(deleted
                            ? "Deleted knowledge base " + knowledgeBase.indexName()
                            : "Knowledge base " + knowledgeBase.indexName() + " does not exist");
                    return EXIT_OK;
                case delete_document:
                    if (source == null || source.isBlank()) {
                        log.error("--source is required in delete_document mode");
                        return EXIT_USAGE;
                    }
                    boolean removed = knowledgeBase.deleteDocument(source);
                    System.out.println(removed
                            ? "Deleted chunks of " + source + " from " + knowledgeBase.indexName()
                            : "Knowledge base " + knowledgeBase.indexName() + " does not exist");
                    return EXIT_OK;
                default:
                    throw new IllegalStateException("Unhandled mode " + mode);
            }
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }
    }

    KnowledgeBase openKnowledgeBase(AppConfig config) throws IOException {
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        return KnowledgeBase.fromConfig(config, httpClient);
    }

    private void runInteractive(KnowledgeBase knowledgeBase, int resolvedTopK) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.out.println("kb-rag interactive mode on " + knowledgeBase.indexName() + ". Type 'quit' or 'exit' to stop.");
        while (true) {
            System.out.print("question> ");
            System.out.flush();
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            String question = line.strip();
            if (EXIT_WORDS.contains(question.toLowerCase(Locale.ROOT))) {
                break;
            }
            if (question.isEmpty()) {
                continue;
            }
            try {
                printAnswer(knowledgeBase.query(question, resolvedTopK, deadline()));
            } catch (InterruptedIOException e) {
                throw e;
            } catch (IOException e) {
                log.error("interactive.query.failed reason={}", e.getMessage(), e);
                System.out.println("Error: " + e.getMessage());
            }
        }
        System.out.println("Goodbye!");
    }

    private Deadline deadline() {
        return timeoutSeconds == null ? Deadline.none() : Deadline.after(Duration.ofSeconds(timeoutSeconds));
    }

    private int runIngest(KnowledgeBase knowledgeBase) throws IOException {
        IngestionReport report = knowledgeBase.ingestDirectory(docsDir, deadline());
        log.info("Ingested {} document(s) into {}: chunksWritten={} chunksFailed={}",
                report.documents().size(),
                report.indexName(),
                report.chunksWritten(),
                report.chunksFailed());
        for (IngestionReport.DocumentReport document : report.failedDocuments()) {
            log.warn("Document {} incomplete: written={} failed={} reason={}",
                    document.source(),
                    document.chunksWritten(),
                    document.chunksFailed(),
                    document.error());
        }
        System.out.printf("chunksWritten=%d chunksFailed=%d%n", report.chunksWritten(), report.chunksFailed());
        return report.isComplete() ? EXIT_OK : EXIT_PARTIAL_INGEST;
    }

    private boolean requireQuery() {
        if (query == null || query.isBlank()) {
            log.error("--query is required in {} mode", mode);
            return false;
        }
        return true;
    }

    private static void printAnswer(Answer answer) {
        System.out.println(answer.text());
        if (!answer.sources().isEmpty()) {
            System.out.println();
            System.out.println("Sources:");
            for (int i = 0; i < answer.sources().size(); i++) {
                RetrievedChunk chunk = answer.sources().get(i);
                System.out.printf(Locale.ROOT, "[%d] %s (chunk %d, similarity %.4f) %s%n",
                        i + 1, chunk.source(), chunk.chunkIndex(), chunk.score(), chunk.excerpt(150));
            }
        }
        log.info("Answer status={} provider={} sources={} failovers={}",
                answer.status(), answer.provider(), answer.sources().size(), answer.failures().size());
    }

    private static void printResults(List<RetrievedChunk> results) {
        for (int i = 0; i < results.size(); i++) {
            RetrievedChunk result = results.get(i);
            System.out.printf(Locale.ROOT, "#%d score=%.4f source=%s chunk=%d %s%n",
                    i + 1, result.score(), result.source(), result.chunkIndex(), result.excerpt(240));
        }
        log.info("Search returned {} result(s)", results.size());
    }
}
