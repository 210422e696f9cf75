package br.edu.ifba.llm;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OpenAI-compatible chat completion response. Only the first choice is read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmChatResponse(
    String id,
    String model,
    List<Choice> choices,
    Usage usage
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Choice(
        Integer index,
        ChatMessage message,

        @JsonProperty("finish_reason")
        String finishReason
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Usage(
        @JsonProperty("prompt_tokens")
        Integer promptTokens,

        @JsonProperty("completion_tokens")
        Integer completionTokens,

        @JsonProperty("total_tokens")
        Integer totalTokens
    ) {}

    /**
     * Content of the first choice, empty when the model sent no choice or no message.
     */
    public Optional<String> firstContent() {
        if (choices == null || choices.isEmpty()) {
            return Optional.empty();
        }
        final ChatMessage message = choices.get(0).message();
        return message == null ? Optional.empty() : Optional.ofNullable(message.content());
    }

    public String totalTokensOrUnknown() {
        return usage != null && usage.totalTokens() != null ? String.valueOf(usage.totalTokens()) : "unknown";
    }
}
