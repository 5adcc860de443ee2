package com.jreinhal.hragent.gateway;

/**
 * Text-in, text-out access to the hosted language model.
 */
public interface LanguageModelGateway {

    /**
     * @throws LanguageModelTimeoutException when the request's timeout elapses first
     * @throws LanguageModelException        on any other failure, including an open circuit
     */
    LlmReply complete(LlmRequest request);
}
