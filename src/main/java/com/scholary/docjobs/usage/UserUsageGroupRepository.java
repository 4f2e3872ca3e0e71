package com.scholary.docjobs.usage;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserUsageGroupRepository extends JpaRepository<UserUsageGroup, UUID> {}
