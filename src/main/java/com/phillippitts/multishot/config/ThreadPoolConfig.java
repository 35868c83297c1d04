package com.phillippitts.multishot.config;

import com.phillippitts.multishot.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by concurrent runs.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and the number of engines per run.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for engine dispatches (permit wait, attempt loop, backoff sleeps).
     *
     * <p>With the default queue capacity of 0 each dispatch is handed straight to a thread, so
     * waiting dispatches block on the run's gate rather than in the executor queue.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool is
     * exhausted the submitting thread runs the dispatch, which still goes through the gate.
     *
     * @return Configured executor for dispatches
     */
    @Bean(name = "dispatchExecutor")
    public Executor dispatchExecutor() {
        return build(threadPoolProperties.getDispatch(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Executor for the backend calls themselves.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Running a call on the
     * dispatch thread would defeat the per-attempt timeout, so a rejected call becomes an error
     * response for that attempt instead.
     *
     * @return Configured executor for engine calls
     */
    @Bean(name = "engineCallExecutor")
    public Executor engineCallExecutor() {
        return build(threadPoolProperties.getEngineCall(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static Executor build(ThreadPoolProperties.PoolProperties props, RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext (runId, engine) from the submitting thread to the worker
     * and restores the worker's own context afterwards.
     */
    static TaskDecorator threadContextDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
