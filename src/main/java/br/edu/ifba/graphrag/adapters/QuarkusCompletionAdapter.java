package br.edu.ifba.graphrag.adapters;

import br.edu.ifba.graphrag.llm.CompletionFunction;
import br.edu.ifba.llm.ChatMessage;
import br.edu.ifba.llm.LlmChatClient;
import br.edu.ifba.llm.LlmChatRequest;
import br.edu.ifba.llm.LlmChatResponse;
import io.quarkus.arc.Arc;
import io.quarkus.arc.ManagedContext;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Bridges the {@link LlmChatClient} REST client to {@link CompletionFunction}.
 * The evidence block is placed in the user turn ahead of the question.
 */
@ApplicationScoped
public class QuarkusCompletionAdapter implements CompletionFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusCompletionAdapter.class);

    private final ExecutorService executor = AdapterThreads.newPool("llm-chat");

    @Inject
    @RestClient
    LlmChatClient chatClient;

    @ConfigProperty(name = "chat.model")
    String model;

    @ConfigProperty(name = "chat.temperature", defaultValue = "0.2")
    Double temperature;

    @ConfigProperty(name = "chat.max.tokens", defaultValue = "1024")
    Integer maxTokens;

    @ConfigProperty(name = "chat.top.p", defaultValue = "0.9")
    Double topP;

    @ConfigProperty(name = "chat.system.prompt", defaultValue =
        "You answer questions using only the evidence provided. Cite evidence with its bracketed number, "
            + "for example [1]. If the evidence does not contain the answer, say so.")
    String systemPrompt;

    @Override
    public CompletableFuture<String> complete(@NotNull final String prompt, @NotNull final String evidence) {
        return CompletableFuture.supplyAsync(() -> {
            final ManagedContext requestContext = Arc.container().requestContext();
            final boolean activated = !requestContext.isActive();
            if (activated) {
                requestContext.activate();
            }
            try {
                final List<ChatMessage> messages = buildMessages(prompt, evidence);
                LOG.debugf("Completion request - prompt length: %d, evidence length: %d, model: %s",
                        Integer.valueOf(prompt.length()), Integer.valueOf(evidence.length()), model);

                final LlmChatResponse response = chatClient.chat(
                        LlmChatRequest.completion(model, messages, maxTokens, temperature, topP));
                if (response == null) {
                    throw new IllegalStateException("LLM returned an empty response");
                }
                final String content = response.firstContent()
                        .orElseThrow(() -> new IllegalStateException("LLM returned no message content"));

                LOG.debugf("Completion received - length: %d, tokens: %s",
                        Integer.valueOf(content.length()), response.totalTokensOrUnknown());
                return content;
            } finally {
                if (activated) {
                    requestContext.deactivate();
                }
            }
        }, executor);
    }

    private List<ChatMessage> buildMessages(final String prompt, final String evidence) {
        final List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(systemPrompt));
        if (evidence.isBlank()) {
            messages.add(ChatMessage.user(prompt));
        } else {
            messages.add(ChatMessage.user("Evidence:\n" + evidence + "\n\n" + prompt));
        }
        return messages;
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
