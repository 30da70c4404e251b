package com.vncalign.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools used by the orchestrator.
 *
 *   taskScheduler        progress polls, delayed admission and process
 *                        timeouts. Two threads, so a slow admission check
 *                        never starves a poll.
 *   preparationExecutor  completion callbacks of the preparation steps.
 *   processIoExecutor    drains child stdout/stderr and runs exit callbacks.
 *                        Cached: each running child holds two readers.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(AlignmentProperties.class)
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "taskScheduler", destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("align-sched-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = "preparationExecutor", destroyMethod = "shutdown")
    public ExecutorService preparationExecutor(AlignmentProperties props) {
        return Executors.newFixedThreadPool(props.preparation().threads(), namedThreads("prepare-"));
    }

    @Bean(name = "processIoExecutor", destroyMethod = "shutdownNow")
    public ExecutorService processIoExecutor() {
        return Executors.newCachedThreadPool(namedThreads("proc-io-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r);
            thread.setName(prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
