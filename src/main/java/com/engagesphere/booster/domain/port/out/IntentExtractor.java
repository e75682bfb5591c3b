package com.engagesphere.booster.domain.port.out;

/**
 * Turns a free-text chat query into raw structured output. The result is
 * expected to be a JSON object carrying either an {@code action} or a
 * {@code response} key but is validated by the caller.
 */
public interface IntentExtractor {

    String extract(String query, String context);
}
