package com.motaz.triage.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableScheduling
public class PipelineExecutorConfig {

    @Bean
    ThreadPoolTaskExecutor analysisExecutor(@Value("${anomaly.analysis.pool-size:2}") int poolSize,
                                            @Value("${anomaly.analysis.queue-capacity:50}") int queueCapacity) {
        return pool("analysis-", poolSize, queueCapacity);
    }

    /** Runs whole triage runs, one thread per run. */
    @Bean
    ThreadPoolTaskExecutor triageExecutor(@Value("${anomaly.triage.max-concurrent-runs:2}") int maxRuns,
                                          @Value("${anomaly.triage.queue-capacity:20}") int queueCapacity) {
        return pool("triage-", Math.max(1, maxRuns), queueCapacity);
    }

    /**
     * Reasoning calls of all runs. Sized so every concurrent run can keep its
     * full parallelism in flight; anything beyond that queues and is bounded
     * by the queue timeout.
     */
    @Bean
    ThreadPoolTaskExecutor reasoningCallExecutor(@Value("${anomaly.triage.max-concurrent-runs:2}") int maxRuns,
                                                 @Value("${anomaly.triage.parallelism:1}") int parallelism) {
        int poolSize = Math.max(1, maxRuns) * Math.max(1, parallelism);
        return pool("reasoning-", poolSize, poolSize * 4);
    }

    private static ThreadPoolTaskExecutor pool(String prefix, int poolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
