package com.scholary.docjobs.job;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface JobArtifactRepository extends JpaRepository<JobArtifact, Long> {

  List<JobArtifact> findByJobIdOrderByIdAsc(UUID jobId);

  Optional<JobArtifact> findByJobIdAndName(UUID jobId, String name);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("update JobArtifact a set a.path = null where a.jobId = :jobId")
  int clearPaths(@Param("jobId") UUID jobId);
}
