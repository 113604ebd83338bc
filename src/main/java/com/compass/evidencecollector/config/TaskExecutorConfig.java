package com.compass.evidencecollector.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Configures the managed thread pool that runs job pipelines. Each message of a batch is an
 * independent unit of work, so the core pool processes a full batch in parallel.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Creates the worker pool. A pipeline that outlives its worker timeout keeps its thread
     * until the STS and AWS Config call timeouts end it, so the pool can grow to twice a batch
     * before new work is rejected; a rejected message is left on the queue for redelivery.
     *
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("jobWorkerExecutor")
    public AsyncTaskExecutor jobWorkerExecutor(EvidenceCollectionProperties properties) {
        int workers = Math.max(properties.getQueue().getMaxConcurrentMessages(), properties.getQueue().getMaxMessagesPerPoll());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers * 2);
        // No queue: work beyond the core pool starts a new thread instead of waiting behind a hung job.
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("job-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getQueue().getWorkerTimeout().toSeconds());
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
