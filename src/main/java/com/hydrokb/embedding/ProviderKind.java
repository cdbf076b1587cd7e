package com.hydrokb.embedding;

public enum ProviderKind {
    OPENAI,
    OLLAMA,
    FALLBACK
}
