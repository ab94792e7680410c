package fr.imt.launchpad.launchpad.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfiguration {

    public static final String STAGE_EXECUTOR = "stageTaskExecutor";
    public static final String RUN_EXECUTOR = "runTaskExecutor";

    /**
     * Worker threads for stage work. The orchestrator thread blocks on them with a timeout.
     */
    @Bean(name = STAGE_EXECUTOR)
    public ThreadPoolTaskExecutor stageTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("stage-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /**
     * Control threads for runs started through the API.
     */
    @Bean(name = RUN_EXECUTOR)
    public ThreadPoolTaskExecutor runTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(16);
        executor.setThreadNamePrefix("run-");
        return executor;
    }
}
