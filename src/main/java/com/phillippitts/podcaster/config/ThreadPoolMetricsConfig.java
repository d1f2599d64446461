package com.phillippitts.podcaster.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes pipeline and synthesis pool gauges via Micrometer:
 * {@code podcaster.pool.size}, {@code .active}, {@code .queued} and {@code .completed},
 * each tagged with {@code pool=pipeline|synthesis}.
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> synthesisExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("pipelineExecutor") ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider,
            @Qualifier("synthesisExecutor") ObjectProvider<ThreadPoolTaskExecutor> synthesisExecutorProvider) {
        this.pipelineExecutorProvider = pipelineExecutorProvider;
        this.synthesisExecutorProvider = synthesisExecutorProvider;
    }

    @Bean
    public MeterBinder podcasterExecutorMetrics() {
        return registry -> {
            bind(registry, "pipeline", pipelineExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "synthesis", synthesisExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: podcaster.pool.*");
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("podcaster.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("podcaster.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("podcaster.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("podcaster.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        logPool("Pipeline", pipelineExecutorProvider.getObject().getThreadPoolExecutor());
        logPool("Synthesis", synthesisExecutorProvider.getObject().getThreadPoolExecutor());
    }

    private static void logPool(String name, ThreadPoolExecutor executor) {
        LOG.info("{} Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                name,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
