package org.learningjava.flowc.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class AsyncConfig {

    // sandbox work: g++ and the compiled binary
    @Bean(name = "compileExecutor")
    public ThreadPoolTaskExecutor compileExecutor(@Value("${flowc.compile.core-pool-size:2}") int core,
                                                  @Value("${flowc.compile.max-pool-size:4}") int max,
                                                  @Value("${flowc.compile.queue-capacity:32}") int queue) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(core);
        ex.setMaxPoolSize(max);
        ex.setQueueCapacity(queue);
        ex.setThreadNamePrefix("compile-");
        ex.initialize();
        return ex;
    }

    @Bean(name = "driverScheduler")
    public TaskScheduler driverScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("driver-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
