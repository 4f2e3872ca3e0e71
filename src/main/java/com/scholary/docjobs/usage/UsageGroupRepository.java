package com.scholary.docjobs.usage;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UsageGroupRepository extends JpaRepository<UsageGroup, Long> {

  Optional<UsageGroup> findByName(String name);
}
