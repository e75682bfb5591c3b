package com.engagesphere.booster.domain.port.out;

/**
 * Delivers composed content to a user over their preferred channel.
 * Failures are logged by the implementation and never thrown.
 */
public interface MessageSender {

    void send(long userId, String content);
}
