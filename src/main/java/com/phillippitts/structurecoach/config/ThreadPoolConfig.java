package com.phillippitts.structurecoach.config;

import com.phillippitts.structurecoach.config.properties.ThreadPoolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools used in asynchronous processing.
 * Provides the executor for concurrent analysis dimensions and one for event offload.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the thread pool that runs one task per requested analysis kind.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Running a rejected
     * dimension on the request thread would put it outside its timeout, so the aggregator
     * records a rejection as a failed dimension instead.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext from the request thread to the worker
     * so dimension logs carry the request and practice ids.
     *
     * @return configured executor for analysis dimensions
     */
    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor() {
        return build(threadPoolProperties.getAnalysis(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Creates a bounded thread pool for application event listeners.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}, so the publisher
     * runs the listener itself instead of dropping the event.
     *
     * @return configured executor for event listener offload
     */
    @Bean(name = "eventExecutor")
    public Executor eventExecutor() {
        return build(threadPoolProperties.getEvent(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(new ThreadContextTaskDecorator());
        executor.initialize();
        return executor;
    }
}
