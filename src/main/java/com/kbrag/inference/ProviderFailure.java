package com.kbrag.inference;

public record ProviderFailure(String provider, GenerationProviderException.Kind kind, String message) {
}
