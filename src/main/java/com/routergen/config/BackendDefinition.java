package com.routergen.config;

import com.routergen.core.backend.BackendTag;
import com.routergen.llm.LLMProvider;

import java.time.Duration;
import java.util.Set;

/**
 * One configured generation backend, as declared under routergen.backend.&lt;id&gt;.*.
 * Credentials arrive as plain properties; loading them is the environment's job.
 */
public final class BackendDefinition {

    private final String          id;
    private final LLMProvider     provider;
    private final String          model;
    private final String          baseUrl;
    private final String          apiKey;
    private final double          weight;
    private final Set<BackendTag> tags;
    private final Duration        requestTimeout;

    public BackendDefinition(
            String          id,
            LLMProvider     provider,
            String          model,
            String          baseUrl,
            String          apiKey,
            double          weight,
            Set<BackendTag> tags,
            Duration        requestTimeout
    ) {
        if (weight <= 0) {
            throw new IllegalArgumentException("Backend '" + id + "' weight must be positive, got " + weight);
        }
        this.id             = id;
        this.provider       = provider;
        this.model          = model;
        this.baseUrl        = baseUrl;
        this.apiKey         = apiKey;
        this.weight         = weight;
        this.tags           = Set.copyOf(tags);
        this.requestTimeout = requestTimeout;
    }

    public String          getId()             { return id; }
    public LLMProvider     getProvider()       { return provider; }
    public String          getModel()          { return model; }
    public String          getBaseUrl()        { return baseUrl; }
    public String          getApiKey()         { return apiKey; }
    public double          getWeight()         { return weight; }
    public Set<BackendTag> getTags()           { return tags; }
    public Duration        getRequestTimeout() { return requestTimeout; }

    @Override
    public String toString() {
        // never print the key
        return id + "[" + provider.getKey() + ":" + model + ", w=" + weight + ", tags=" + tags + "]";
    }
}
