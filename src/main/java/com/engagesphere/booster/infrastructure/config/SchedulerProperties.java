package com.engagesphere.booster.infrastructure.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for the in-memory job scheduler and its dispatch pool
 */
@Component
@ConfigurationProperties(prefix = "engagesphere.scheduler")
public class SchedulerProperties {

    private int dispatchPoolSize = 4;
    private int dispatchQueueCapacity = 500;
    private Duration pollInterval = Duration.ofSeconds(1);
    private String threadNamePrefix = "job-dispatch-";

    public int getDispatchPoolSize() {
        return dispatchPoolSize;
    }

    public void setDispatchPoolSize(int dispatchPoolSize) {
        this.dispatchPoolSize = dispatchPoolSize;
    }

    public int getDispatchQueueCapacity() {
        return dispatchQueueCapacity;
    }

    public void setDispatchQueueCapacity(int dispatchQueueCapacity) {
        this.dispatchQueueCapacity = dispatchQueueCapacity;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }
}
