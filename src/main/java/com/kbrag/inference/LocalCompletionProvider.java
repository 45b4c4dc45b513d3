package com.kbrag.inference;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extractive fallback that needs no network: picks the context sentences sharing the most
 * keywords with the question. Always available as the last tier of the chain.
 */
public class LocalCompletionProvider implements TextCompletionProvider {
    private static final Pattern SOURCE_LABEL = Pattern.compile("^\\[\\d+\\] From .*:$");
    private static final Pattern HORIZONTAL_RULE = Pattern.compile("^\\s*([-*_=])\\1{2,}\\s*$");
    private static final Pattern MAX_WORDS = Pattern.compile("Maximum length: (\\d+) words");
    private static final int MAX_SENTENCES = 3;

    private final String name;
    private final int maxTokens;

    public LocalCompletionProvider() {
        this("local", 500);
    }

    public LocalCompletionProvider(String name, int maxTokens) {
        this.name = name;
        this.maxTokens = maxTokens;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String complete(String prompt) throws GenerationProviderException {
        if (prompt == null || prompt.isBlank()) {
            throw new GenerationProviderException(name, GenerationProviderException.Kind.INVALID_RESPONSE, "Prompt must not be blank");
        }
        List<String> sentences = sentences(extractContext(prompt));
        if (prompt.stripTrailing().endsWith(PromptBuilder.SUMMARY_MARKER)) {
            return summarize(sentences, maxWords(prompt));
        }
        return answer(sentences, keywords(extractQuestion(prompt)));
    }

    private String answer(List<String> sentences, Set<String> keywords) {
        if (keywords.isEmpty()) {
            return PromptBuilder.INSUFFICIENT_CONTEXT;
        }
        List<ScoredSentence> scored = new ArrayList<>();
        for (int i = 0; i < sentences.size(); i++) {
            String sentence = sentences.get(i);
            Set<String> words = keywords(sentence);
            long overlap = keywords.stream().filter(words::contains).count();
            if (overlap > 0) {
                scored.add(new ScoredSentence(i, sentence, overlap));
            }
        }
        if (scored.isEmpty()) {
            return PromptBuilder.INSUFFICIENT_CONTEXT;
        }
        String selected = scored.stream()
                .sorted(Comparator.comparingLong(ScoredSentence::overlap).reversed()
                        .thenComparingInt(ScoredSentence::position))
                .limit(MAX_SENTENCES)
                .sorted(Comparator.comparingInt(ScoredSentence::position))
                .map(ScoredSentence::text)
                .collect(Collectors.joining(" "));
        return truncateByWords(selected, maxTokens);
    }

    private String summarize(List<String> sentences, int maxWords) {
        if (sentences.isEmpty()) {
            return PromptBuilder.INSUFFICIENT_CONTEXT;
        }
        return truncateByWords(String.join(" ", new LinkedHashSet<>(sentences)), Math.min(maxWords, maxTokens));
    }

    /**
     * Returns the text between the context header and the closing delimiter that directly
     * precedes the instruction, so a {@code ---} line inside a chunk does not end the context.
     * Such rule lines carry no text and are dropped.
     */
    static String extractContext(String prompt) {
        int open = prompt.indexOf(PromptBuilder.CONTEXT_OPEN);
        if (open < 0) {
            return "";
        }
        int start = open + PromptBuilder.CONTEXT_OPEN.length();
        int end = prompt.lastIndexOf(PromptBuilder.CONTEXT_CLOSE + PromptBuilder.ANSWER_INSTRUCTION);
        if (end < start) {
            end = prompt.lastIndexOf(PromptBuilder.CONTEXT_CLOSE + PromptBuilder.SUMMARY_MARKER);
        }
        if (end < start) {
            return "";
        }
        return Arrays.stream(prompt.substring(start, end).split("\n"))
                .filter(line -> !SOURCE_LABEL.matcher(line.strip()).matches())
                .filter(line -> !HORIZONTAL_RULE.matcher(line).matches())
                .collect(Collectors.joining("\n"));
    }

    static String extractQuestion(String prompt) {
        int marker = prompt.lastIndexOf(PromptBuilder.QUESTION_MARKER);
        if (marker < 0) {
            return prompt.strip();
        }
        String question = prompt.substring(marker + PromptBuilder.QUESTION_MARKER.length());
        int answerMarker = question.lastIndexOf("Answer:");
        return (answerMarker < 0 ? question : question.substring(0, answerMarker)).strip();
    }

    private static int maxWords(String prompt) {
        Matcher matcher = MAX_WORDS.matcher(prompt);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : Integer.MAX_VALUE;
    }

    private static List<String> sentences(String context) {
        return Arrays.stream(context.split("(?<=[.!?])\\s+|\\n{2,}"))
                .map(sentence -> sentence.strip().replaceAll("\\s+", " "))
                .filter(sentence -> !sentence.isBlank())
                .toList();
    }

    private static Set<String> keywords(String input) {
        return Arrays.stream(input.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(token -> token.length() > 2)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String truncateByWords(String text, int maxWords) {
        if (maxWords <= 0) {
            return text;
        }
        String[] words = text.split("\\s+");
        if (words.length <= maxWords) {
            return text;
        }
        return String.join(" ", Arrays.copyOf(words, maxWords));
    }

    private record ScoredSentence(int position, String text, long overlap) {
    }
}
