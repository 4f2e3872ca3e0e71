package com.scholary.docjobs.module.grader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.docjobs.artifact.ReportWriter;
import com.scholary.docjobs.job.JobItemStatus;
import com.scholary.docjobs.llm.LlmParseException;
import com.scholary.docjobs.module.ArtifactContent;
import com.scholary.docjobs.module.ItemResult;
import com.scholary.docjobs.module.RoundContext;
import com.scholary.docjobs.module.RoundPlan;
import com.scholary.docjobs.module.RoundResult;
import com.scholary.docjobs.module.SourceDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class GraderProcessorTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final GraderProcessor processor =
      new GraderProcessor(objectMapper, new ReportWriter(objectMapper));

  private static String answer(int... levels) {
    StringBuilder json = new StringBuilder("{");
    for (int i = 0; i < levels.length; i++) {
      json.append("\"Level ").append(i + 1).append("\": ").append(levels[i]).append(", ");
    }
    return json.append("\"justification\": \"Solid methods.\"}").toString();
  }

  @Test
  void planRound_shouldScheduleTwelveSequentialRuns() {
    GraderPayload payload = new GraderPayload(new SourceDocument("paper.pdf", "Manuscript body"));

    RoundPlan plan =
        processor
            .planRound(
                new RoundContext<>(
                    UUID.randomUUID(),
                    1,
                    payload,
                    processor.defaultSettings(),
                    processor.defaultPolicy(),
                    List.of()))
            .orElseThrow();

    assertThat(plan.items()).hasSize(12);
    assertThat(plan.threshold().toString()).isEqualTo("8");
    assertThat(processor.defaultPolicy().concurrencyCap()).isEqualTo(1);
    assertThat(processor.defaultPolicy().attemptBudget()).isEqualTo(30);
  }

  @Test
  void interpret_shouldNormalizeValidAnswer() throws Exception {
    String run = processor.interpret(answer(5, 10, 20, 40, 60, 120));

    JsonNode node = objectMapper.readTree(run);
    assertThat(node.get("levels").get(5).asDouble()).isEqualTo(100.0);
    assertThat(node.get("justification").asText()).isEqualTo("Solid methods.");
  }

  @Test
  void interpret_shouldRejectDecreasingLevels() {
    assertThatThrownBy(() -> processor.interpret(answer(50, 40, 30, 20, 10, 5)))
        .isInstanceOf(LlmParseException.class)
        .hasMessageContaining("decrease");
  }

  @Test
  void interpret_shouldRejectMissingLevel() {
    assertThatThrownBy(() -> processor.interpret(answer(5, 10, 20, 40, 60)))
        .isInstanceOf(LlmParseException.class)
        .hasMessageContaining("Level 6");
  }

  @Test
  void interpret_shouldRejectProse() {
    assertThatThrownBy(() -> processor.interpret("I think it is a good paper."))
        .isInstanceOf(LlmParseException.class);
  }

  @Test
  void aggregate_shouldTakeInterquartileMeanOfWeightedScores() {
    List<GradingRun> runs = new ArrayList<>();
    for (int score : new int[] {10, 20, 30, 40, 50, 60}) {
      double[] levels = {score, score, score, score, score, score};
      runs.add(new GradingRun(levels, null));
    }

    GradingReport report = GraderProcessor.aggregate(runs, 9);

    assertThat(report.iqmScore()).isCloseTo(35.0, within(1e-9));
    assertThat(report.keptRuns()).isEqualTo(2);
    assertThat(report.validRuns()).isEqualTo(6);
    assertThat(report.attempts()).isEqualTo(9);
    assertThat(report.perLevel()).allSatisfy(v -> assertThat(v).isCloseTo(35.0, within(1e-9)));
  }

  @Test
  void assemble_shouldWriteJsonReport() throws Exception {
    List<ItemResult> items = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      items.add(
          new ItemResult(
              i,
              "Grading run " + (i + 1),
              JobItemStatus.COMPLETED,
              1,
              processor.interpret(answer(5, 10, 20, 40, 60, 80)),
              null));
    }
    items.add(new ItemResult(8, "Grading run 9", JobItemStatus.FAILED, 3, null, "bad JSON"));

    List<ArtifactContent> artifacts =
        processor.assemble(
            new GraderPayload(new SourceDocument("paper.pdf", "x")),
            processor.defaultSettings(),
            List.of(new RoundResult(1, items)));

    assertThat(artifacts).hasSize(1);
    assertThat(artifacts.get(0).name()).isEqualTo("grader_report.json");
    JsonNode report = objectMapper.readTree(artifacts.get(0).bytes());
    assertThat(report.get("validRuns").asInt()).isEqualTo(8);
    assertThat(report.get("attempts").asInt()).isEqualTo(11);
    assertThat(report.get("justification").asText()).isEqualTo("Solid methods.");
  }
}
