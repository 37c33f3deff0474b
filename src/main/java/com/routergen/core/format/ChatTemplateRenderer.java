package com.routergen.core.format;

import com.routergen.core.example.Example;

/**
 * Renders a validated, stripped Example into one chat-template training string.
 * Implementations are pure.
 */
public interface ChatTemplateRenderer {

    /**
     * @throws IllegalStateException when the example breaks the renderer's contract
     *         (missing parts, un-stripped null sentinels, template tokens in the content)
     */
    String render(Example example);

    /**
     * Recover the turns of a string produced by {@link #render}.
     *
     * @throws IllegalArgumentException when the text is not in this template's layout
     */
    ChatTurns parse(String rendered);

    /** True when {@code text} carries chat-template control-token delimiters. */
    static boolean hasControlTokens(String text) {
        return text != null && text.contains("<|") && text.contains("|>");
    }
}
