package br.edu.ifba.llm;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessage(
    String role,
    String content
) {
    public static ChatMessage system(final String content) {
        return new ChatMessage("system", content);
    }

    public static ChatMessage user(final String content) {
        return new ChatMessage("user", content);
    }
}
