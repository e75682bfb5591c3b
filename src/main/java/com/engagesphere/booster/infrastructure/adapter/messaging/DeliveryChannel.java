package com.engagesphere.booster.infrastructure.adapter.messaging;

import com.engagesphere.booster.domain.model.ContactMethod;
import com.engagesphere.booster.domain.model.User;

/**
 * One outbound transport. Implementations may throw; the router logs failures.
 */
public interface DeliveryChannel {

    ContactMethod method();

    void deliver(User recipient, OutboundMessage message);
}
