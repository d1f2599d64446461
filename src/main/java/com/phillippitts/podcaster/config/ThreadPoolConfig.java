package com.phillippitts.podcaster.config;

import com.phillippitts.podcaster.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for detached pipeline runs and per-line speech synthesis.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and provider rate limits.
 *
 * <p>The pipeline pool uses {@link ThreadPoolExecutor.AbortPolicy}: a run that cannot be queued,
 * or that arrives after shutdown, is rejected back to the submitter, which records the podcast as
 * failed. Submitting threads never run a pipeline themselves.
 *
 * <p>The synthesis pool uses {@link ThreadPoolExecutor.CallerRunsPolicy}: when pool and queue are
 * full the pipeline thread makes the speech call itself, which slows the fan-out down.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for generation and regeneration jobs ({@code threadpool.pipeline.*}).
     *
     * @return configured executor for pipeline runs
     */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor() {
        return buildExecutor(threadPoolProperties.getPipeline(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Executor for speech provider calls ({@code threadpool.synthesis.*}). The number of calls
     * in flight per dialogue is further capped by {@code podcaster.synthesis.concurrency}.
     *
     * @return configured executor for segment synthesis
     */
    @Bean(name = "synthesisExecutor")
    public ThreadPoolTaskExecutor synthesisExecutor() {
        return buildExecutor(threadPoolProperties.getSynthesis(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
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
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext from the submitting thread to the worker so that
     * {@code podcastId} stays on every log line of a run.
     */
    static TaskDecorator mdcPropagatingDecorator() {
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
