package com.routergen.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routergen.llm.BackendErrorKind;
import com.routergen.llm.BackendException;
import com.routergen.llm.LLMClient;
import com.routergen.llm.MockLLMClient;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Test backend: replays a script of responses and failures, then behaves like
 * its fallback. Every call is appended to a shared log as the client id.
 */
final class ScriptedLLMClient implements LLMClient {

    private final String       id;
    private final List<String> callLog;
    private final Deque<Object> script = new ArrayDeque<>();
    private final LLMClient    fallback;
    private final BackendErrorKind alwaysFail;
    private final String       constant;

    private ScriptedLLMClient(String id, List<String> callLog, LLMClient fallback,
                              BackendErrorKind alwaysFail, String constant) {
        this.id         = id;
        this.callLog    = callLog;
        this.fallback   = fallback;
        this.alwaysFail = alwaysFail;
        this.constant   = constant;
    }

    /** Valid record for the requested tool on every call. */
    static ScriptedLLMClient healthy(String id, List<String> callLog) {
        return new ScriptedLLMClient(id, callLog, new MockLLMClient(id, new ObjectMapper()), null, null);
    }

    static ScriptedLLMClient failing(String id, List<String> callLog, BackendErrorKind kind) {
        return new ScriptedLLMClient(id, callLog, null, kind, null);
    }

    /** Same text on every call. */
    static ScriptedLLMClient constant(String id, List<String> callLog, String text) {
        return new ScriptedLLMClient(id, callLog, null, null, text);
    }

    ScriptedLLMClient then(Object step) {
        script.add(step);
        return this;
    }

    @Override
    public String generate(String prompt, double temperature) {
        callLog.add(id);

        Object step;
        synchronized (script) {
            step = script.poll();
        }
        if (step instanceof BackendErrorKind) {
            throw new BackendException((BackendErrorKind) step, id + " scripted " + step);
        }
        if (step instanceof String) {
            return (String) step;
        }

        if (alwaysFail != null) {
            throw new BackendException(alwaysFail, id + " always " + alwaysFail);
        }
        if (constant != null) {
            return constant;
        }
        return fallback.generate(prompt, temperature);
    }

    @Override
    public String getModel() {
        return id;
    }
}
