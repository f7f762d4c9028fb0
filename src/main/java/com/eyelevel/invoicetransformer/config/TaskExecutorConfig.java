package com.eyelevel.invoicetransformer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Configures the threads and the clock shared by the file pipeline.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * A single-threaded pool that drains outbound notification events in order. Its queue is the
     * channel between the file pipeline and the notifier, so a slow or failing notifier never holds up
     * a file.
     *
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("notificationTaskExecutor")
    public AsyncTaskExecutor notificationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("notify-");
        executor.setAcceptTasksAfterContextClose(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    /**
     * The single source of "now" for processing dates, file name timestamps and the summary schedule.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
