package com.kbrag.inference;

public interface TextCompletionProvider {
    String name();

    String complete(String prompt) throws GenerationProviderException;
}
