package com.legalreview.extraction.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pools for extraction jobs. Jobs and the documents inside a job use separate
 * pools so a running job never waits on a queue it is itself occupying.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Bean(name = "jobExecutor")
    public ThreadPoolTaskExecutor jobExecutor(ReviewProperties properties) {
        return pool("extraction-job-", properties.getExecutor().getJobPoolSize(),
                properties.getExecutor().getAwaitTerminationSeconds());
    }

    @Bean(name = "documentExecutor")
    public ThreadPoolTaskExecutor documentExecutor(ReviewProperties properties) {
        return pool("extraction-doc-", properties.getExecutor().getDocumentPoolSize(),
                properties.getExecutor().getAwaitTerminationSeconds());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private ThreadPoolTaskExecutor pool(String prefix, int size, int awaitTerminationSeconds) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        log.info("Executor {}* initialized poolSize={}", prefix, size);
        return executor;
    }
}
