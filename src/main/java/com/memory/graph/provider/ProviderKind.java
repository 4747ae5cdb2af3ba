package com.memory.graph.provider;

import java.util.Locale;

/**
 * Extraction backends that can be selected through configuration.
 */
public enum ProviderKind {
    LOCAL("local"),
    OLLAMA("ollama"),
    OPENAI("openai"),
    ANTHROPIC("anthropic");

    private final String configName;

    ProviderKind(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Resolves a configured provider name.
     *
     * @throws IllegalArgumentException if the name is not a known provider
     */
    public static ProviderKind parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        String candidate = name.trim().toLowerCase(Locale.ROOT);
        for (ProviderKind kind : values()) {
            if (kind.configName.equals(candidate)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown extraction provider: '" + name
                + "' (expected one of local, ollama, openai, anthropic)");
    }
}
