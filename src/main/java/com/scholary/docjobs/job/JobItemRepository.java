package com.scholary.docjobs.job;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface JobItemRepository extends JpaRepository<JobItem, Long> {

  List<JobItem> findByJobIdOrderByRoundAscItemIndexAsc(UUID jobId);

  Optional<JobItem> findByJobIdAndRoundAndItemIndex(UUID jobId, int round, int itemIndex);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "update JobItem i set i.status = :next, i.updatedAt = :now "
          + "where i.id = :id and i.status in :from")
  int transition(
      @Param("id") Long id,
      @Param("from") Collection<JobItemStatus> from,
      @Param("next") JobItemStatus next,
      @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "update JobItem i set i.attemptCount = i.attemptCount + 1, i.updatedAt = :now "
          + "where i.id = :id")
  int incrementAttempts(@Param("id") Long id, @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "update JobItem i set i.status = com.scholary.docjobs.job.JobItemStatus.COMPLETED, "
          + "i.outputText = :text, i.outputPath = :path, i.units = :units, "
          + "i.tokensUsed = :tokens, i.errorMessage = null, i.updatedAt = :now "
          + "where i.id = :id and i.status = com.scholary.docjobs.job.JobItemStatus.PROCESSING")
  int complete(
      @Param("id") Long id,
      @Param("text") String text,
      @Param("path") String path,
      @Param("units") long units,
      @Param("tokens") long tokens,
      @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "update JobItem i set i.status = com.scholary.docjobs.job.JobItemStatus.FAILED, "
          + "i.errorMessage = :error, i.updatedAt = :now "
          + "where i.id = :id and i.status in :from")
  int fail(
      @Param("id") Long id,
      @Param("from") Collection<JobItemStatus> from,
      @Param("error") String error,
      @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "update JobItem i set i.outputPath = null, i.outputText = null where i.jobId = :jobId")
  int clearOutputPaths(@Param("jobId") UUID jobId);
}
