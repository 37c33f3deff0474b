package com.routergen.core.example;

import com.routergen.core.schema.ToolCall;

import java.util.Objects;

/**
 * One labeled training example: query, reasoning trace, tool call, plus the
 * domain and persona of the task that produced it.
 *
 * Domain and persona always come from the task, never from model output.
 */
public final class Example {

    private final String   query;
    private final String   reasoning;
    private final ToolCall toolCall;
    private final String   domain;
    private final String   persona;

    public Example(String query, String reasoning, ToolCall toolCall, String domain, String persona) {
        this.query     = Objects.requireNonNull(query, "query");
        this.reasoning = Objects.requireNonNull(reasoning, "reasoning");
        this.toolCall  = Objects.requireNonNull(toolCall, "toolCall");
        this.domain    = domain;
        this.persona   = persona;
    }

    public String   getQuery()     { return query; }
    public String   getReasoning() { return reasoning; }
    public ToolCall getToolCall()  { return toolCall; }
    public String   getDomain()    { return domain; }
    public String   getPersona()   { return persona; }

    public Example withToolCall(ToolCall replacement) {
        return new Example(query, reasoning, replacement, domain, persona);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Example)) return false;
        Example other = (Example) o;
        return query.equals(other.query)
                && reasoning.equals(other.reasoning)
                && toolCall.equals(other.toolCall)
                && Objects.equals(domain, other.domain)
                && Objects.equals(persona, other.persona);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, reasoning, toolCall, domain, persona);
    }

    @Override
    public String toString() {
        return "Example{query='" + query + "', toolCall=" + toolCall + ", domain='" + domain + "'}";
    }
}
