package com.engagesphere.booster.infrastructure.adapter;

import com.engagesphere.booster.domain.port.out.DeliveryLedger;
import com.engagesphere.booster.infrastructure.config.LedgerProperties;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Delivery ledger on Redis {@code SET NX}. When Redis is unreachable the
 * claim succeeds, so delivery degrades to at-least-once.
 */
@Repository
public class RedisDeliveryLedger implements DeliveryLedger {

    private static final Logger logger = LoggerFactory.getLogger(RedisDeliveryLedger.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final LedgerProperties properties;

    public RedisDeliveryLedger(RedisTemplate<String, String> redisTemplate, LedgerProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    @Override
    public boolean claim(String jobId, Instant dueTime) {
        String key = generateKey(jobId, dueTime);
        try {
            Boolean claimed = redisTemplate.opsForValue()
                    .setIfAbsent(key, Instant.now().toString(), properties.getTtlHours(), TimeUnit.HOURS);
            if (Boolean.FALSE.equals(claimed)) {
                logger.debug("Delivery key {} already claimed", key);
                return false;
            }
            return true;
        } catch (Exception e) {
            logger.warn("Failed to claim delivery key {}, delivering anyway: {}", key, e.getMessage());
            return true;
        }
    }

    /**
     * e.g. {@code engagesphere:delivery:reminder_1h:7:42:1767225600}
     */
    private String generateKey(String jobId, Instant dueTime) {
        return properties.getKeyPrefix() + jobId + ":" + dueTime.getEpochSecond();
    }
}
