package com.scholary.docjobs.worker;

import com.scholary.docjobs.config.AsyncConfig;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Hands jobs to the bounded job executor.
 *
 * <p>A separate bean so the {@code @Async} proxy applies. When the executor queue is full the
 * call throws {@link org.springframework.core.task.TaskRejectedException} to the caller.
 */
@Component
public class JobDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobDispatcher.class);

  private final JobWorker worker;

  public JobDispatcher(JobWorker worker) {
    this.worker = worker;
  }

  @Async(AsyncConfig.JOB_EXECUTOR)
  public void dispatch(UUID jobId) {
    LOGGER.debug("Running job: jobId={}", jobId);
    worker.run(jobId);
  }
}
