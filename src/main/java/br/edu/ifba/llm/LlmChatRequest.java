package br.edu.ifba.llm;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OpenAI-compatible chat completion request. Answers are never streamed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmChatRequest(
    String model,
    List<ChatMessage> messages,
    Boolean stream,

    @JsonProperty("max_tokens")
    Integer maxTokens,

    Double temperature,

    @JsonProperty("top_p")
    Double topP,

    // OpenRouter extension; ignored by other providers
    Map<String, Object> reasoning
) {
    private static final Map<String, Object> NO_REASONING_TOKENS = Map.of("effort", "none");

    public static LlmChatRequest completion(
            final String model,
            final List<ChatMessage> messages,
            final Integer maxTokens,
            final Double temperature,
            final Double topP) {
        return new LlmChatRequest(model, List.copyOf(messages), Boolean.FALSE, maxTokens, temperature, topP,
            NO_REASONING_TOKENS);
    }
}
