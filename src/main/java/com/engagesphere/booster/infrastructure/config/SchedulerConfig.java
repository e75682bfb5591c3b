package com.engagesphere.booster.infrastructure.config;

import com.engagesphere.booster.infrastructure.scheduler.InMemoryJobScheduler;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskExecutor jobDispatchExecutor(SchedulerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getDispatchPoolSize());
        executor.setMaxPoolSize(properties.getDispatchPoolSize());
        executor.setQueueCapacity(properties.getDispatchQueueCapacity());
        executor.setThreadNamePrefix(properties.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public InMemoryJobScheduler jobScheduler(
            Clock clock,
            @Qualifier("jobDispatchExecutor") ThreadPoolTaskExecutor jobDispatchExecutor,
            SchedulerProperties properties) {
        return new InMemoryJobScheduler(clock, jobDispatchExecutor, properties.getPollInterval(),
                "job-scheduler");
    }
}
