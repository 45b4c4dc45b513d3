package com.kbrag.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.kbrag.retrieval.RetrievedChunk;

class LocalCompletionProviderTest {

    private static final List<RetrievedChunk> CHUNKS = List.of(
            new RetrievedChunk("a", "Rivers carve stone. Satellites follow orbital paths.", "a.txt", 0, 0.9),
            new RetrievedChunk("b", "Orbital speed depends on altitude. Forests grow slowly.", "b.txt", 1, 0.8));

    private final LocalCompletionProvider provider = new LocalCompletionProvider();

    @Test
    void shouldExtractSentencesSharingKeywordsInContextOrder() throws Exception {
        String answer = provider.complete(PromptBuilder.buildAnswerPrompt("How do orbital satellites move?", CHUNKS));

        assertEquals("Satellites follow orbital paths. Orbital speed depends on altitude.", answer);
    }

    @Test
    void shouldAdmitMissingContext() throws Exception {
        String answer = provider.complete(PromptBuilder.buildAnswerPrompt("Who painted the ceiling?", CHUNKS));

        assertEquals(PromptBuilder.INSUFFICIENT_CONTEXT, answer);
    }

    @Test
    void shouldTruncateSummaryToWordLimit() throws Exception {
        String summary = provider.complete(PromptBuilder.buildSummaryPrompt("nature", CHUNKS, 5));

        assertEquals("Rivers carve stone. Satellites follow", summary);
    }

    @Test
    void shouldStripSourceLabelsFromContext() {
        String prompt = PromptBuilder.buildAnswerPrompt("q", CHUNKS);

        assertEquals("Rivers carve stone. Satellites follow orbital paths.\n\nOrbital speed depends on altitude. Forests grow slowly.",
                LocalCompletionProvider.extractContext(prompt));
        assertEquals("q", LocalCompletionProvider.extractQuestion(prompt));
    }

    @Test
    void shouldRejectBlankPrompt() {
        GenerationProviderException error = assertThrows(GenerationProviderException.class, () -> provider.complete(" "));
        assertEquals(GenerationProviderException.Kind.INVALID_RESPONSE, error.kind());
    }

    @Test
    void shouldKeepContextAfterMarkdownRuleInsideChunk() throws Exception {
        List<RetrievedChunk> markdown = List.of(
                new RetrievedChunk("a", "# Notes\n---\nOrbital mechanics governs satellite trajectories.", "notes.md", 0, 0.9),
                new RetrievedChunk("b", "title: rivers\n---\n\nRivers carve stone.", "rivers.md", 0, 0.8));

        String answer = provider.complete(PromptBuilder.buildAnswerPrompt("What governs satellite trajectories?", markdown));

        assertTrue(answer.contains("Orbital mechanics governs satellite trajectories."), answer);
        assertTrue(LocalCompletionProvider.extractContext(PromptBuilder.buildAnswerPrompt("q", markdown)).endsWith("Rivers carve stone."));
        assertTrue(provider.complete(PromptBuilder.buildSummaryPrompt("rivers", markdown, 100)).endsWith("Rivers carve stone."));
    }
}
