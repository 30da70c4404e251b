package com.vncalign.orchestrator.config;

import com.vncalign.orchestrator.service.AdoptedJobMonitor;
import com.vncalign.orchestrator.service.ProcessSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Duration;

/**
 * Fixed-delay polls for running alignments.
 *
 * Registered here rather than with {@code @Scheduled(fixedDelay = ...)} so
 * the interval comes from {@link AlignmentProperties} as a typed Duration.
 *
 * fixed delay: the next poll starts one interval after the previous one
 * finished, so a slow filesystem never stacks polls up.
 */
@Configuration
public class PollingConfig implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(PollingConfig.class);

    private final ProcessSupervisor supervisor;
    private final AdoptedJobMonitor adoptedJobs;
    private final TaskScheduler     taskScheduler;
    private final Duration          pollInterval;

    public PollingConfig(ProcessSupervisor supervisor,
                         AdoptedJobMonitor adoptedJobs,
                         TaskScheduler taskScheduler,
                         AlignmentProperties props) {
        this.supervisor    = supervisor;
        this.adoptedJobs   = adoptedJobs;
        this.taskScheduler = taskScheduler;
        this.pollInterval  = props.executor().pollInterval();
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.setTaskScheduler(taskScheduler);
        registrar.addFixedDelayTask(supervisor::pollProgress, pollInterval);
        registrar.addFixedDelayTask(adoptedJobs::check, pollInterval);
        log.info("Progress polling every {} ms", pollInterval.toMillis());
    }
}
