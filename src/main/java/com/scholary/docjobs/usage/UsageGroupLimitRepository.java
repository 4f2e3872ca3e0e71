package com.scholary.docjobs.usage;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UsageGroupLimitRepository extends JpaRepository<UsageGroupLimit, Long> {

  Optional<UsageGroupLimit> findByGroupIdAndModuleKey(Long groupId, String moduleKey);

  List<UsageGroupLimit> findByGroupIdOrderByModuleKeyAsc(Long groupId);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("delete from UsageGroupLimit l where l.groupId = :groupId")
  int deleteByGroupId(@Param("groupId") Long groupId);
}
