package com.scholary.docjobs.module.summarizer;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.docjobs.artifact.ReportWriter;
import com.scholary.docjobs.job.JobItemStatus;
import com.scholary.docjobs.module.ArtifactContent;
import com.scholary.docjobs.module.GlossaryTerm;
import com.scholary.docjobs.module.ItemResult;
import com.scholary.docjobs.module.PlannedItem;
import com.scholary.docjobs.module.RoundContext;
import com.scholary.docjobs.module.RoundPlan;
import com.scholary.docjobs.module.RoundResult;
import com.scholary.docjobs.module.SourceDocument;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class SummarizerProcessorTest {

  private final SummarizerProcessor processor =
      new SummarizerProcessor(new ReportWriter(new ObjectMapper()));

  private static final List<SourceDocument> DOCS =
      List.of(
          new SourceDocument("papers/alpha.pdf", "Alpha text"),
          new SourceDocument("beta.docx", "Beta text"));

  private Optional<RoundPlan> plan(
      SummarizerPayload payload, int round, List<RoundResult> previous) {
    return processor.planRound(
        new RoundContext<>(
            UUID.randomUUID(),
            round,
            payload,
            processor.defaultSettings(),
            processor.defaultPolicy(),
            previous));
  }

  private static RoundResult summaries(boolean secondFails) {
    return new RoundResult(
        1,
        List.of(
            new ItemResult(
                0, "Summary: papers/alpha.pdf", JobItemStatus.COMPLETED, 1, "alpha sum", null),
            secondFails
                ? new ItemResult(1, "Summary: beta.docx", JobItemStatus.FAILED, 3, null, "HTTP 500")
                : new ItemResult(
                    1, "Summary: beta.docx", JobItemStatus.COMPLETED, 1, "beta sum", null)));
  }

  @Test
  void planRound_shouldSummarizeEachDocument() {
    RoundPlan plan = plan(new SummarizerPayload(DOCS, null, null, null), 1, List.of()).get();

    assertThat(plan.items())
        .extracting(PlannedItem::outputName)
        .containsExactly("alpha_summary.txt", "beta_summary.txt");
    assertThat(plan.items()).extracting(PlannedItem::units).containsOnly(1L);
    assertThat(plan.threshold().toString()).isEqualTo("all");
    assertThat(plan.items().get(0).request().messages().get(0).text())
        .contains("research paper");
  }

  @Test
  void planRound_shouldUseGeneralPromptForOtherDocuments() {
    SummarizerPayload payload =
        new SummarizerPayload(DOCS, SummarizerPayload.DocumentType.OTHER, false, null);

    RoundPlan plan = plan(payload, 1, List.of()).get();

    assertThat(plan.items().get(0).request().messages().get(0).text())
        .contains("summarizing documents");
  }

  @Test
  void planRound_shouldTranslateSuccessfulSummariesWithoutCharging() {
    SummarizerPayload payload =
        new SummarizerPayload(DOCS, null, true, List.of(new GlossaryTerm("soundscape", "声景")));

    RoundPlan plan = plan(payload, 2, List.of(summaries(true))).get();

    assertThat(plan.items()).hasSize(1);
    assertThat(plan.threshold().toString()).isEqualTo("none");
    PlannedItem item = plan.items().get(0);
    assertThat(item.units()).isZero();
    assertThat(item.outputName()).isEqualTo("alpha_translation.txt");
    assertThat(item.request().messages().get(0).text()).contains("- EN: soundscape -> CN: 声景");
    assertThat(item.request().messages().get(1).text()).endsWith("\n\nalpha sum");
  }

  @Test
  void planRound_shouldStopAfterSummariesWhenTranslationDisabled() {
    SummarizerPayload payload = new SummarizerPayload(DOCS, null, false, null);

    assertThat(plan(payload, 2, List.of(summaries(false)))).isEmpty();
  }

  @Test
  void buildTranslationPrompt_shouldAppendGlossaryWithoutPlaceholder() {
    assertThat(SummarizerProcessor.buildTranslationPrompt("Translate.  ", List.of()))
        .isEqualTo("Translate.\n- (no glossary terms configured)");
  }

  @Test
  void assemble_shouldCombineSummariesAndTranslations() {
    SummarizerPayload payload = new SummarizerPayload(DOCS, null, true, null);
    RoundResult translations =
        new RoundResult(
            2,
            List.of(
                new ItemResult(
                    0, "Translation: beta.docx", JobItemStatus.FAILED, 3, null, "timeout"),
                new ItemResult(
                    1, "Translation: beta.docx", JobItemStatus.COMPLETED, 1, "贝塔摘要", null)));

    List<ArtifactContent> artifacts =
        processor.assemble(
            payload, processor.defaultSettings(), List.of(summaries(false), translations));

    assertThat(artifacts)
        .extracting(ArtifactContent::name)
        .containsExactly("combined_summary.md", "combined_translation.md");
    String summary = new String(artifacts.get(0).bytes(), StandardCharsets.UTF_8);
    assertThat(summary)
        .contains("# Document 1: papers/alpha.pdf\n\nalpha sum")
        .contains("# Document 2: beta.docx\n\nbeta sum");
    String translation = new String(artifacts.get(1).bytes(), StandardCharsets.UTF_8);
    assertThat(translation).isEqualTo("# Document 2: beta.docx\n\n贝塔摘要\n\n");
  }
}
