package io.agentwarden.completion;

import io.agentwarden.error.ExternalServiceException;

/** Boundary to the language-model service. Implementations must be safe for concurrent use. */
public interface CompletionClient {

    CompletionResponse complete(CompletionRequest request) throws ExternalServiceException;
}
