package com.engagesphere.booster.domain.model;

/**
 * Result of resolving a chat query: either an account action to perform or
 * a conversational answer to echo back.
 */
public sealed interface ChatIntent permits ChatIntent.Action, ChatIntent.Conversational {

    /**
     * @param action    raw action name, e.g. {@code register}; unknown names are kept so the dispatcher can reject them
     * @param eventName event the action refers to, may be null
     */
    record Action(String action, String eventName) implements ChatIntent {}

    record Conversational(String text) implements ChatIntent {}
}
