package com.al.graphsubscriptions.config;

import com.al.graphsubscriptions.interceptor.MdcTaskDecorator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Bounded pool for per-team subscription creation. Shared by all provisioning calls, so the cap also
     * limits the overall create rate against the provider.
     */
    @Bean(name = "teamProvisioningExecutor")
    public ThreadPoolTaskExecutor teamProvisioningExecutor(SubscriptionProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getTeamConcurrency());
        executor.setMaxPoolSize(properties.getTeamConcurrency());
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("team-provision-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
