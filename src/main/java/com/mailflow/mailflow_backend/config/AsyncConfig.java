package com.mailflow.mailflow_backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Slf4j
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    public static final String WORKFLOW_EXECUTOR = "workflowTaskExecutor";

    // Top-level runs block until their branches finish, so they never share the branch pool
    public static final String DISPATCH_EXECUTOR = "executionDispatchExecutor";

    @Bean(name = WORKFLOW_EXECUTOR)
    public ThreadPoolTaskExecutor workflowTaskExecutor(MailflowProperties properties) {
        MailflowProperties.ExecutorConfig cfg = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getPoolSize());
        executor.setMaxPoolSize(cfg.getPoolSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("workflow-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        log.info("[AsyncConfig] Workflow executor: poolSize={}, queueCapacity={}", cfg.getPoolSize(), cfg.getQueueCapacity());
        return executor;
    }

    @Bean(name = DISPATCH_EXECUTOR)
    public ThreadPoolTaskExecutor executionDispatchExecutor(MailflowProperties properties) {
        MailflowProperties.ExecutorConfig cfg = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getDispatchPoolSize());
        executor.setMaxPoolSize(cfg.getDispatchPoolSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("execution-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
