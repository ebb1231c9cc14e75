/*
 * Where: jobs infrastructure configuration
 * What: the bounded worker pool that runs event handlers and the default retry backoff
 * Why: pool size equals the pipeline concurrency so one round never oversubscribes it
 */
package com.example.jobs.config;

import com.example.jobs.service.BackoffPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class JobPipelineConfig {

  public static final String JOB_WORKER_EXECUTOR = "jobWorkerExecutor";

  private static final int AWAIT_TERMINATION_SECONDS = 10;

  @Bean(name = JOB_WORKER_EXECUTOR)
  public ThreadPoolTaskExecutor jobWorkerExecutor(JobPipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.concurrency());
    executor.setMaxPoolSize(properties.concurrency());
    // a round submits at most `concurrency` jobs and waits for them before claiming again
    executor.setQueueCapacity(properties.concurrency());
    executor.setThreadNamePrefix("job-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(AWAIT_TERMINATION_SECONDS);
    executor.initialize();
    return executor;
  }

  @Bean
  public BackoffPolicy defaultBackoffPolicy(JobPipelineProperties properties) {
    return new BackoffPolicy(properties.backoff());
  }
}
