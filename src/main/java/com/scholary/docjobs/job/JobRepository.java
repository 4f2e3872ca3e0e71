package com.scholary.docjobs.job;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Persistence for {@link Job} rows.
 *
 * <p>Every state change is a single conditional UPDATE guarded by the allowed predecessor states,
 * so two writers can never both win a transition.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "update Job j set j.status = :next, j.statusDetail = :detail, j.updatedAt = :now "
          + "where j.id = :id and j.status in :from")
  int transition(
      @Param("id") UUID id,
      @Param("from") Collection<JobStatus> from,
      @Param("next") JobStatus next,
      @Param("detail") String detail,
      @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "update Job j set j.status = com.scholary.docjobs.job.JobStatus.FAILED, "
          + "j.statusDetail = :detail, j.errorMessage = :error, j.updatedAt = :now "
          + "where j.id = :id and j.status in :from")
  int fail(
      @Param("id") UUID id,
      @Param("from") Collection<JobStatus> from,
      @Param("detail") String detail,
      @Param("error") String error,
      @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "update Job j set j.statusDetail = :detail, j.updatedAt = :now "
          + "where j.id = :id and j.status = com.scholary.docjobs.job.JobStatus.PROCESSING")
  int updateDetail(
      @Param("id") UUID id, @Param("detail") String detail, @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "update Job j set j.usageDelta = j.usageDelta + :units, "
          + "j.tokensUsed = j.tokensUsed + :tokens, j.updatedAt = :now where j.id = :id")
  int addUsage(
      @Param("id") UUID id,
      @Param("units") long units,
      @Param("tokens") long tokens,
      @Param("now") Instant now);

  @Query(
      "select j from Job j where j.status in :terminal and j.filesPurgedAt is null "
          + "and j.createdAt < :cutoff order by j.createdAt, j.id")
  List<Job> findPurgeCandidates(
      @Param("terminal") Collection<JobStatus> terminal,
      @Param("cutoff") Instant cutoff,
      Pageable page);

  @Query(
      "select j from Job j where j.status in :terminal and j.filesPurgedAt is null "
          + "and j.createdAt < :cutoff and (j.createdAt > :afterCreatedAt "
          + "or (j.createdAt = :afterCreatedAt and j.id > :afterId)) "
          + "order by j.createdAt, j.id")
  List<Job> findPurgeCandidatesAfter(
      @Param("terminal") Collection<JobStatus> terminal,
      @Param("cutoff") Instant cutoff,
      @Param("afterCreatedAt") Instant afterCreatedAt,
      @Param("afterId") UUID afterId,
      Pageable page);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "update Job j set j.filesPurgedAt = :now, j.payloadJson = null "
          + "where j.id = :id and j.filesPurgedAt is null and j.status in :terminal")
  int markPurged(
      @Param("id") UUID id,
      @Param("terminal") Collection<JobStatus> terminal,
      @Param("now") Instant now);
}
