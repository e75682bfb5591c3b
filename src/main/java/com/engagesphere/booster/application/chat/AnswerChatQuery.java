package com.engagesphere.booster.application.chat;

import com.engagesphere.booster.domain.model.User;
import java.util.Optional;

public interface AnswerChatQuery {

    /**
     * Resolves the query into an intent and carries it out.
     *
     * @param context     free-text background for the extractor; a summary of upcoming events is used when blank
     * @param currentUser authenticated caller, empty for anonymous chat
     * @return reply text for the user, never null
     */
    String answer(String query, String context, Optional<User> currentUser);
}
