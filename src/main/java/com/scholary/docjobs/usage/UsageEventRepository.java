package com.scholary.docjobs.usage;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UsageEventRepository extends JpaRepository<UsageEvent, Long> {

  @Query(
      "select coalesce(sum(e.tokens), 0) from UsageEvent e "
          + "where e.userId = :userId and e.occurredAt >= :since")
  long sumTokensSince(@Param("userId") UUID userId, @Param("since") Instant since);

  @Query(
      "select coalesce(sum(e.units), 0) from UsageEvent e "
          + "where e.userId = :userId and e.moduleKey = :moduleKey and e.occurredAt >= :since")
  long sumUnitsSince(
      @Param("userId") UUID userId,
      @Param("moduleKey") String moduleKey,
      @Param("since") Instant since);

  @Query(
      "select coalesce(sum(e.units), 0) from UsageEvent e "
          + "where e.userId = :userId and e.moduleKey = :moduleKey")
  long sumUnitsLifetime(@Param("userId") UUID userId, @Param("moduleKey") String moduleKey);

  @Query(
      "select e.userId as userId, e.moduleKey as moduleKey, "
          + "sum(e.tokens) as tokens, sum(e.units) as units from UsageEvent e "
          + "where e.userId in :userIds and e.occurredAt >= :since "
          + "group by e.userId, e.moduleKey")
  List<ModuleUsageRow> sumByUserAndModuleSince(
      @Param("userIds") Collection<UUID> userIds, @Param("since") Instant since);

  /** Projection of one (user, module) aggregate. */
  interface ModuleUsageRow {
    UUID getUserId();

    String getModuleKey();

    Long getTokens();

    Long getUnits();
  }
}
