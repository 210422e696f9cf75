package br.edu.ifba.llm;

import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

@RegisterRestClient(configKey = "llm-embedding")
@RegisterProvider(LlmClientExceptionMapper.class)
@ClientHeaderParam(name = "Authorization", value = "{br.edu.ifba.llm.LlmAuthorization.embedding}", required = false)
public interface LlmEmbeddingClient {

    @POST
    @Path("/embeddings")
    EmbeddingResponse embed(EmbeddingRequest request);
}
