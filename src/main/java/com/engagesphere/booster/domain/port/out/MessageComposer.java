package com.engagesphere.booster.domain.port.out;

import com.engagesphere.booster.domain.model.Event;
import com.engagesphere.booster.domain.model.MessageType;
import com.engagesphere.booster.domain.model.User;

/**
 * Produces the text of an outbound message.
 * Implementations must always return text, falling back to a template when
 * generation fails; callers never handle composition errors.
 */
public interface MessageComposer {

    /**
     * @return content whose first line is {@code Subject: ...}, followed by a blank line and the body
     */
    String compose(User user, Event event, MessageType messageType);
}
