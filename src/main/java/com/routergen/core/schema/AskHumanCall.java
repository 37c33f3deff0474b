package com.routergen.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class AskHumanCall extends ToolCall {

    public static final String FIELD_QUESTION = "question";
    public static final String FIELD_CONTEXT  = "context";

    private final String question;
    private final String context;

    public AskHumanCall(String question, String context) {
        this.question = question;
        this.context  = context;
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.ASK_HUMAN;
    }

    public String getQuestion() { return question; }
    public String getContext()  { return context; }

    @Override
    public Map<String, Object> arguments() {
        LinkedHashMap<String, Object> args = new LinkedHashMap<>();
        putIfPresent(args, FIELD_QUESTION, question);
        putIfPresent(args, FIELD_CONTEXT, context);
        return Collections.unmodifiableMap(args);
    }

    @Override
    public AskHumanCall withoutFields(Set<String> fieldNames) {
        return new AskHumanCall(question, fieldNames.contains(FIELD_CONTEXT) ? null : context);
    }
}
