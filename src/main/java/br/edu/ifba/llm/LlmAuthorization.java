package br.edu.ifba.llm;

import org.eclipse.microprofile.config.ConfigProvider;

/**
 * Bearer header values for the model endpoints. A blank or missing key sends no header,
 * which is what local OpenAI-compatible servers expect.
 */
public final class LlmAuthorization {

    private LlmAuthorization() {
    }

    public static String chat() {
        return bearer("llm-chat.api-key");
    }

    public static String embedding() {
        return bearer("llm-embedding.api-key");
    }

    static String bearer(final String property) {
        return ConfigProvider.getConfig()
            .getOptionalValue(property, String.class)
            .filter(key -> !key.isBlank())
            .map(key -> "Bearer " + key)
            .orElse(null);
    }
}
