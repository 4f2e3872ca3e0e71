package com.scholary.docjobs.config;

import com.scholary.docjobs.logging.MdcTaskDecorator;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Two bounded pools: {@code jobExecutor} runs one task per job, {@code llmCallExecutor} runs the
 * item calls of all jobs. When the LLM queue is full the submitting job thread runs the call
 * itself, which slows that job down instead of failing it.
 */
@Configuration
public class AsyncConfig {

  public static final String JOB_EXECUTOR = "jobExecutor";
  public static final String LLM_CALL_EXECUTOR = "llmCallExecutor";

  @Bean(name = JOB_EXECUTOR)
  public ThreadPoolTaskExecutor jobExecutor(JobsProperties properties) {
    JobsProperties.Executor config = properties.executor();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(config.jobThreads());
    executor.setMaxPoolSize(config.jobThreads());
    executor.setQueueCapacity(config.jobQueueSize());
    executor.setThreadNamePrefix("job-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }

  @Bean(name = LLM_CALL_EXECUTOR)
  public ThreadPoolTaskExecutor llmCallExecutor(JobsProperties properties) {
    JobsProperties.Executor config = properties.executor();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(config.llmThreads());
    executor.setMaxPoolSize(config.llmThreads());
    executor.setQueueCapacity(config.llmQueueSize());
    executor.setThreadNamePrefix("llm-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }
}
