package com.kbrag.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.kbrag.inference.GenerationProviderException.Kind;
import com.kbrag.retrieval.RetrievedChunk;
import com.kbrag.runtime.ConfigurationException;
import com.kbrag.runtime.Deadline;

class AnswerGeneratorTest {

    private static final List<RetrievedChunk> CONTEXT = List.of(
            new RetrievedChunk("a_chunk0_0000", "Satellites follow orbital mechanics.", "a.txt", 0, 0.91));

    @Test
    void shouldFailOverToNextProviderAfterTimeout() {
        ScriptedProvider primary = ScriptedProvider.failing("openai", Kind.TIMEOUT);
        ScriptedProvider secondary = ScriptedProvider.answering("groq", "Orbital mechanics.");

        try (AnswerGenerator generator = new AnswerGenerator(List.of(primary, secondary))) {
            Answer answer = generator.generate("What governs satellites?", CONTEXT);

            assertEquals(Answer.Status.ANSWERED, answer.status());
            assertEquals("groq", answer.provider());
            assertEquals("Orbital mechanics.", answer.text());
            assertEquals(CONTEXT, answer.sources());
            assertEquals(1, answer.failures().size());
            assertEquals(new ProviderFailure("openai", Kind.TIMEOUT, "openai timeout: scripted"), answer.failures().get(0));
        }
        assertEquals(1, primary.calls.get());
        assertEquals(1, secondary.calls.get());
    }

    @Test
    void shouldReturnDegradedAnswerWhenEveryProviderFails() {
        try (AnswerGenerator generator = new AnswerGenerator(List.of(
                ScriptedProvider.failing("openai", Kind.AUTHENTICATION),
                ScriptedProvider.failing("groq", Kind.RATE_LIMIT)))) {
            Answer answer = generator.generate("What governs satellites?", CONTEXT);

            assertEquals(Answer.Status.ALL_PROVIDERS_FAILED, answer.status());
            assertFalse(answer.answered());
            assertEquals(AnswerGenerator.NO_PROVIDER, answer.provider());
            assertEquals(2, answer.failures().size());
            assertTrue(answer.text().contains("openai: AUTHENTICATION"));
            assertTrue(answer.text().contains("groq: RATE_LIMIT"));
        }
    }

    @Test
    void shouldNotCallProvidersWithoutContext() {
        ScriptedProvider provider = ScriptedProvider.answering("openai", "made up");

        try (AnswerGenerator generator = new AnswerGenerator(List.of(provider))) {
            Answer answer = generator.generate("Anything?", List.of());

            assertEquals(Answer.Status.NO_CONTEXT, answer.status());
            assertEquals(AnswerGenerator.NO_CONTEXT_ANSWER, answer.text());
            assertTrue(answer.sources().isEmpty());
        }
        assertEquals(0, provider.calls.get());
    }

    @Test
    void shouldTreatUnexpectedErrorsAndBlankTextAsFailover() {
        TextCompletionProvider broken = new TextCompletionProvider() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public String complete(String prompt) {
                throw new IllegalStateException("boom");
            }
        };
        ScriptedProvider blank = ScriptedProvider.answering("blank", "   ");
        ScriptedProvider local = ScriptedProvider.answering("local", "fallback text");

        try (AnswerGenerator generator = new AnswerGenerator(List.of(broken, blank, local))) {
            Answer answer = generator.generate("q", CONTEXT);

            assertEquals("local", answer.provider());
            assertEquals(List.of(Kind.INVALID_RESPONSE, Kind.INVALID_RESPONSE),
                    answer.failures().stream().map(ProviderFailure::kind).toList());
        }
    }

    @Test
    void shouldAbandonProviderThatExceedsTimeout() {
        try (AnswerGenerator generator = new AnswerGenerator(
                List.of(slow("slow"), ScriptedProvider.answering("local", "in time")), Duration.ofMillis(100))) {
            Answer answer = generator.generate("q", CONTEXT);

            assertEquals("local", answer.provider());
            assertEquals(Kind.TIMEOUT, answer.failures().get(0).kind());
        }
    }

    @Test
    void shouldSkipEveryProviderOnceCallerDeadlineHasPassed() {
        ScriptedProvider primary = ScriptedProvider.answering("openai", "never sent");
        ScriptedProvider secondary = ScriptedProvider.answering("local", "never sent");

        try (AnswerGenerator generator = new AnswerGenerator(List.of(primary, secondary))) {
            Answer answer = generator.generate("q", CONTEXT, Deadline.after(Duration.ZERO));

            assertEquals(Answer.Status.ALL_PROVIDERS_FAILED, answer.status());
            assertEquals(List.of(Kind.TIMEOUT, Kind.TIMEOUT), answer.failures().stream().map(ProviderFailure::kind).toList());
            assertEquals(CONTEXT, answer.sources());
        }
        assertEquals(0, primary.calls.get());
        assertEquals(0, secondary.calls.get());
    }

    @Test
    void shouldCapProviderWaitAtCallerDeadline() {
        try (AnswerGenerator generator = new AnswerGenerator(List.of(slow("openai"), slow("groq")), Duration.ofSeconds(30))) {
            long started = System.nanoTime();
            Answer answer = generator.summarize("satellites", CONTEXT, 50, Deadline.after(Duration.ofMillis(150)));
            long waitedMillis = (System.nanoTime() - started) / 1_000_000L;

            assertEquals(Answer.Status.ALL_PROVIDERS_FAILED, answer.status());
            assertEquals(List.of(Kind.TIMEOUT, Kind.TIMEOUT), answer.failures().stream().map(ProviderFailure::kind).toList());
            assertTrue(waitedMillis < 5_000, "waited " + waitedMillis + "ms");
        }
    }

    @Test
    void shouldAcceptWellFormedInsufficientContextAnswer() {
        try (AnswerGenerator generator = new AnswerGenerator(List.of(
                ScriptedProvider.answering("openai", PromptBuilder.INSUFFICIENT_CONTEXT),
                ScriptedProvider.answering("groq", "should not be reached")))) {
            Answer answer = generator.generate("Who won the match?", CONTEXT);

            assertEquals(Answer.Status.ANSWERED, answer.status());
            assertEquals("openai", answer.provider());
            assertEquals(PromptBuilder.INSUFFICIENT_CONTEXT, answer.text());
        }
    }

    @Test
    void shouldSendSummaryPromptWithWordLimit() {
        ScriptedProvider provider = ScriptedProvider.answering("openai", "A summary.");

        try (AnswerGenerator generator = new AnswerGenerator(List.of(provider))) {
            Answer answer = generator.summarize("satellites", CONTEXT, 120);

            assertEquals("A summary.", answer.text());
            assertTrue(provider.lastPrompt.contains("Maximum length: 120 words."));
            assertThrows(ConfigurationException.class, () -> generator.summarize("satellites", CONTEXT, 0));
        }
    }

    @Test
    void shouldRejectEmptyProviderChain() {
        assertThrows(ConfigurationException.class, () -> new AnswerGenerator(List.of()));
    }

    private static TextCompletionProvider slow(String name) {
        return new TextCompletionProvider() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String complete(String prompt) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "too late";
            }
        };
    }

    private static final class ScriptedProvider implements TextCompletionProvider {
        private final String name;
        private final String text;
        private final Kind failure;
        private final AtomicInteger calls = new AtomicInteger();
        private volatile String lastPrompt;

        private ScriptedProvider(String name, String text, Kind failure) {
            this.name = name;
            this.text = text;
            this.failure = failure;
        }

        static ScriptedProvider answering(String name, String text) {
            return new ScriptedProvider(name, text, null);
        }

        static ScriptedProvider failing(String name, Kind kind) {
            return new ScriptedProvider(name, null, kind);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String complete(String prompt) throws GenerationProviderException {
            calls.incrementAndGet();
            lastPrompt = prompt;
            if (failure != null) {
                throw new GenerationProviderException(name, failure, "scripted");
            }
            return text;
        }
    }
}
