package com.routergen.core.format;

/**
 * The three turns of a rendered chat-template training string.
 */
public final class ChatTurns {

    private final String system;
    private final String user;
    private final String assistant;

    public ChatTurns(String system, String user, String assistant) {
        this.system    = system;
        this.user      = user;
        this.assistant = assistant;
    }

    public String getSystem()    { return system; }
    public String getUser()      { return user; }
    public String getAssistant() { return assistant; }
}
