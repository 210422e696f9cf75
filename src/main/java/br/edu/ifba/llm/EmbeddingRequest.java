package br.edu.ifba.llm;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * OpenAI-compatible embedding request; {@code input} is always sent as a list so one call
 * embeds a whole batch.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(
    String model,
    List<String> input
) {
}
