package com.kbrag.inference;

import java.util.List;

import com.kbrag.retrieval.RetrievedChunk;

public final class PromptBuilder {
    public static final String INSUFFICIENT_CONTEXT =
            "I don't have enough information in the provided context to answer this question.";
    static final String CONTEXT_HEADER = "Context information is below:";
    static final String QUESTION_MARKER = "Question:";
    static final String SUMMARY_MARKER = "Summary:";
    static final String CONTEXT_OPEN = CONTEXT_HEADER + "\n---\n";
    static final String CONTEXT_CLOSE = "\n---\n\n";
    static final String ANSWER_INSTRUCTION = "Given the context above, answer the following question. ";

    private PromptBuilder() {
    }

    public static String buildAnswerPrompt(String question, List<RetrievedChunk> chunks) {
        StringBuilder builder = new StringBuilder();
        builder.append(CONTEXT_OPEN)
                .append(formatContext(chunks))
                .append(CONTEXT_CLOSE)
                .append(ANSWER_INSTRUCTION)
                .append("Answer only from the context. ")
                .append("If the context doesn't contain relevant information to answer the question, say \"")
                .append(INSUFFICIENT_CONTEXT)
                .append("\"\n\n")
                .append(QUESTION_MARKER).append(' ').append(question.strip())
                .append("\n\nAnswer:");
        return builder.toString();
    }

    public static String buildSummaryPrompt(String topic, List<RetrievedChunk> chunks, int maxWords) {
        StringBuilder builder = new StringBuilder();
        builder.append("Based on the following information, provide a comprehensive summary about \"")
                .append(topic.strip())
                .append("\".\n")
                .append("Maximum length: ").append(maxWords).append(" words.\n\n")
                .append(CONTEXT_OPEN)
                .append(formatContext(chunks))
                .append(CONTEXT_CLOSE)
                .append(SUMMARY_MARKER);
        return builder.toString();
    }

    static String formatContext(List<RetrievedChunk> chunks) {
        StringBuilder context = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            RetrievedChunk chunk = chunks.get(i);
            if (i > 0) {
                context.append("\n\n");
            }
            context.append('[').append(i + 1).append("] From ").append(chunk.source()).append(":\n")
                    .append(chunk.text().strip());
        }
        return context.toString();
    }
}
