package com.routergen.core.backend;

import com.routergen.llm.LLMClient;

import java.util.Set;

/**
 * Immutable handle on one generation backend. Health state lives in the
 * {@link BackendPool}, not here.
 */
public final class Backend {

    private final String          id;
    private final LLMClient       client;
    private final double          weight;
    private final Set<BackendTag> tags;

    public Backend(String id, LLMClient client, double weight, Set<BackendTag> tags) {
        this.id     = id;
        this.client = client;
        this.weight = weight;
        this.tags   = Set.copyOf(tags);
    }

    public String          getId()     { return id; }
    public LLMClient       getClient() { return client; }
    public double          getWeight() { return weight; }
    public Set<BackendTag> getTags()   { return tags; }

    public boolean hasTag(BackendTag tag) {
        return tags.contains(tag);
    }

    @Override
    public String toString() {
        return id;
    }
}
