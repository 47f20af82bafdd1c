package io.localaid.backend.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class JobSchedulingConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  /** Timer threads for the pollers. One per poller so a slow tick never delays the other. */
  @Bean(destroyMethod = "shutdown")
  ThreadPoolTaskScheduler jobPollingScheduler() {
    var scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("job-poller-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(30);
    scheduler.initialize();
    return scheduler;
  }

  /**
   * Bounded pool that runs scheduled-job handlers. Sized to the configured worker count with no
   * queue, so a tick can never have more handlers in flight than there are workers.
   */
  @Bean(destroyMethod = "shutdown")
  ThreadPoolTaskExecutor jobHandlerExecutor(JobProperties properties) {
    int workers = Math.max(1, properties.scheduler().workerCount());
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("job-handler-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
