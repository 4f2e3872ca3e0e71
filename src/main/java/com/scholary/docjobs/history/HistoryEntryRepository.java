package com.scholary.docjobs.history;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HistoryEntryRepository extends JpaRepository<HistoryEntry, Long> {

  /** Inserts the entry unless one exists for the same module and job. Returns rows inserted. */
  @Modifying
  @Query(
      value =
          "insert into user_job_history (user_id, module_key, job_key, created_at)"
              + " values (:userId, :moduleKey, :jobKey, :createdAt)"
              + " on conflict (module_key, job_key) do nothing",
      nativeQuery = true)
  int insertIfAbsent(
      @Param("userId") UUID userId,
      @Param("moduleKey") String moduleKey,
      @Param("jobKey") String jobKey,
      @Param("createdAt") Instant createdAt);

  /** Drops the user's entries for a module beyond the newest {@code keep}. */
  @Modifying
  @Query(
      value =
          "delete from user_job_history where id in ("
              + " select id from user_job_history"
              + " where user_id = :userId and module_key = :moduleKey"
              + " order by created_at desc, id desc offset :keep)",
      nativeQuery = true)
  int pruneBeyond(
      @Param("userId") UUID userId, @Param("moduleKey") String moduleKey, @Param("keep") int keep);

  @Query(
      "select h from HistoryEntry h where h.userId = :userId and h.createdAt >= :since"
          + " order by h.createdAt desc, h.id desc")
  List<HistoryEntry> findRecent(
      @Param("userId") UUID userId, @Param("since") Instant since, Pageable page);

  @Query(
      "select h from HistoryEntry h where h.userId = :userId and h.moduleKey = :moduleKey"
          + " and h.createdAt >= :since order by h.createdAt desc, h.id desc")
  List<HistoryEntry> findRecentForModule(
      @Param("userId") UUID userId,
      @Param("moduleKey") String moduleKey,
      @Param("since") Instant since,
      Pageable page);

  @Modifying
  @Query("delete from HistoryEntry h where h.createdAt < :cutoff")
  int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
