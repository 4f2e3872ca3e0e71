package com.scholary.docjobs.module;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ModuleConfigRepository extends JpaRepository<ModuleConfig, String> {}
