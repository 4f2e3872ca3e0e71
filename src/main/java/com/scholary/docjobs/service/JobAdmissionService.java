package com.scholary.docjobs.service;

import com.scholary.docjobs.history.HistoryIndex;
import com.scholary.docjobs.job.Job;
import com.scholary.docjobs.job.JobStore;
import com.scholary.docjobs.usage.QuotaDecision;
import com.scholary.docjobs.usage.QuotaService;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Quota check, job row and history entry of one submission, in one transaction. */
@Service
public class JobAdmissionService {

  private final QuotaService quotaService;
  private final JobStore jobStore;
  private final HistoryIndex historyIndex;

  public JobAdmissionService(
      QuotaService quotaService, JobStore jobStore, HistoryIndex historyIndex) {
    this.quotaService = quotaService;
    this.jobStore = jobStore;
    this.historyIndex = historyIndex;
  }

  /**
   * Admit a validated submission.
   *
   * @throws QuotaExceededException if the user's usage group does not allow it; nothing is
   *     written in that case
   */
  @Transactional
  public Job admit(UUID userId, String moduleKey, long projectedUnits, String payloadJson) {
    QuotaDecision decision = quotaService.checkQuota(userId, moduleKey, projectedUnits);
    if (!decision.admitted()) {
      throw new QuotaExceededException(decision);
    }
    Job job = jobStore.create(userId, moduleKey, payloadJson);
    historyIndex.recordJobStart(userId, moduleKey, job.getId());
    return job;
  }
}
