package com.purchasingpower.hybridquery.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used by the query engine.
 *
 * <p>{@code queryExecutor} runs whole executions when a timeout is configured.
 * {@code clauseExecutor} evaluates sibling clauses; it hands tasks off directly
 * (no queue) and runs them on the calling thread when saturated, so a parent
 * waiting on its children can never starve them.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean(name = "queryExecutor")
    public ThreadPoolTaskExecutor queryExecutor(QueryEngineProperties properties) {
        ExecutorProperties config = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getQueryPoolSize());
        executor.setMaxPoolSize(config.getQueryPoolSize());
        executor.setQueueCapacity(config.getQueryQueueCapacity());
        executor.setThreadNamePrefix("query-exec-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("✅ Query executor configured: pool={}, queue={}",
            executor.getCorePoolSize(), config.getQueryQueueCapacity());
        return executor;
    }

    @Bean(name = "clauseExecutor")
    public ThreadPoolTaskExecutor clauseExecutor(QueryEngineProperties properties) {
        ExecutorProperties config = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getClausePoolSize());
        executor.setMaxPoolSize(config.getClausePoolSize());
        executor.setQueueCapacity(0);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("clause-exec-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("✅ Clause executor configured: pool={}, parallel siblings={}",
            executor.getCorePoolSize(), config.isParallelSiblings());
        return executor;
    }
}
