package com.scholary.docjobs.config;

import com.scholary.docjobs.module.ModuleProcessor;
import com.scholary.docjobs.module.ModuleRegistry;
import com.scholary.docjobs.module.extract.ExtractionProcessor;
import com.scholary.docjobs.module.grader.GraderProcessor;
import com.scholary.docjobs.module.reviewer.ReviewerProcessor;
import com.scholary.docjobs.module.summarizer.SummarizerProcessor;
import com.scholary.docjobs.module.translation.TranslationProcessor;
import com.scholary.docjobs.retry.Sleeper;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the job engine.
 *
 * <p>Enables the JobsProperties to be loaded from application.yml and registers the modules in a
 * fixed order, which is also the order they are listed in.
 */
@Configuration
@EnableConfigurationProperties(JobsProperties.class)
public class JobsConfig {

  @Bean
  public ModuleRegistry moduleRegistry(
      SummarizerProcessor summarizer,
      TranslationProcessor translation,
      GraderProcessor grader,
      ExtractionProcessor extraction,
      ReviewerProcessor reviewer,
      JobsProperties properties) {
    List<ModuleProcessor<?>> processors =
        List.of(summarizer, translation, grader, extraction, reviewer);
    return new ModuleRegistry(processors, properties.modules());
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Sleeper sleeper() {
    return Sleeper.THREAD;
  }
}
