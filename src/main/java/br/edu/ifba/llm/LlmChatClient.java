package br.edu.ifba.llm;

import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * Chat completions used for answer synthesis, query decomposition and mention extraction.
 */
@RegisterRestClient(configKey = "llm-chat")
@RegisterProvider(LlmClientExceptionMapper.class)
@ClientHeaderParam(name = "Authorization", value = "{br.edu.ifba.llm.LlmAuthorization.chat}", required = false)
public interface LlmChatClient {

    @POST
    @Path("/chat/completions")
    LlmChatResponse chat(LlmChatRequest request);
}
