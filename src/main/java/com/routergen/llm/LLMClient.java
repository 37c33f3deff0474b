package com.routergen.llm;

/**
 * LLMClient - one outbound completion request against one model.
 *
 * Contract:
 *   - exactly one request per call; implementations never retry internally,
 *     failover is the BackendPool's job
 *   - returns the raw model text, never null
 *   - every failure surfaces as a {@link BackendException} with a classified kind
 */
public interface LLMClient {

    /**
     * @param prompt      full generation prompt
     * @param temperature sampling temperature
     * @return raw model output text
     * @throws BackendException on transport, protocol or provider failure
     */
    String generate(String prompt, double temperature);

    /** Model identifier, for logs. */
    String getModel();
}
