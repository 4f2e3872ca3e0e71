package com.scholary.docjobs.module.grader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.docjobs.artifact.ReportWriter;
import com.scholary.docjobs.job.SuccessThreshold;
import com.scholary.docjobs.llm.LlmParseException;
import com.scholary.docjobs.llm.LlmRequest;
import com.scholary.docjobs.module.ArtifactContent;
import com.scholary.docjobs.module.ItemResult;
import com.scholary.docjobs.module.ModulePolicy;
import com.scholary.docjobs.module.ModuleProcessor;
import com.scholary.docjobs.module.ModuleSettings;
import com.scholary.docjobs.module.PlannedItem;
import com.scholary.docjobs.module.RoundContext;
import com.scholary.docjobs.module.RoundPlan;
import com.scholary.docjobs.module.RoundResult;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Estimates a manuscript's chance of being sent to review at six journal prestige levels.
 *
 * <p>The same prompt is run {@value #TARGET_RUNS} times. A run is valid only if all six levels
 * parse and never decrease from level 1 to level 6; invalid answers are retried within a job-wide
 * budget of LLM calls. The score is the interquartile mean of the weighted run scores.
 */
@Component
public class GraderProcessor implements ModuleProcessor<GraderPayload> {

  public static final String KEY = "grader";

  static final int TARGET_RUNS = 12;
  static final int MIN_VALID_RUNS = 8;
  static final int MAX_CALLS = 30;

  static final String REPORT_NAME = "grader_report.json";

  private static final ModulePolicy DEFAULT_POLICY =
      new ModulePolicy(
          MAX_CALLS,
          1,
          Duration.ofMillis(500),
          Duration.ZERO,
          SuccessThreshold.atLeast(MIN_VALID_RUNS),
          MAX_CALLS,
          120_000);

  private static final ModuleSettings DEFAULT_SETTINGS =
      new ModuleSettings(
          Map.of("grading", "openrouter/openai/gpt-4o-mini"),
          Map.of(
              "grading_instructions",
              "You evaluate manuscripts in the domains of urban soundscape, architectural"
                  + " acoustics, healthy habitat, and related multidisciplinary topics. Estimate"
                  + " the chance (in integer percentages) that the manuscript would be sent for"
                  + " external review at each prestige level listed below. Ensure percentages do"
                  + " not decrease as the prestige level decreases (Level 6 should be the largest"
                  + " value). Consider methodological strength, novelty, relevance to readership,"
                  + " clarity of writing, workload for reviewers, and whether conclusions are"
                  + " supported by results.\n\n"
                  + "Levels of reference (higher to lower prestige):\n"
                  + "Level 1: Nature Sustainability; Nature Human Behaviour; Nature Communications;"
                  + " Science Advances; PNAS\n"
                  + "Level 2: Sustainable Cities and Society; Environment International; Cities;"
                  + " Landscape and Urban Planning; Building and Environment\n"
                  + "Level 3: Building Simulation; Environment and Behavior; Ecological Indicators;"
                  + " Urban Forestry & Urban Greening; Applied Acoustics\n"
                  + "Level 4: Indoor Air; Building Research & Information; Journal of the"
                  + " Acoustical Society of America; Indoor and Built Environment\n"
                  + "Level 5: Forests; Land; Buildings; Frontiers in Psychology; Noise & Health;"
                  + " Acta Acustica\n"
                  + "Level 6: Scientific Reports; PLOS ONE; Heliyon; Applied Sciences;"
                  + " Sustainability; PeerJ\n\n"
                  + "Respond with a strict JSON object:\n"
                  + "{\n"
                  + "  \"Level 1\": <int>,\n"
                  + "  \"Level 2\": <int>,\n"
                  + "  \"Level 3\": <int>,\n"
                  + "  \"Level 4\": <int>,\n"
                  + "  \"Level 5\": <int>,\n"
                  + "  \"Level 6\": <int>,\n"
                  + "  \"justification\": \"Single sentence explanation\"\n"
                  + "}\n"
                  + "Do not include extra keys or commentary."));

  private final ObjectMapper objectMapper;
  private final ReportWriter reportWriter;

  public GraderProcessor(ObjectMapper objectMapper, ReportWriter reportWriter) {
    this.objectMapper = objectMapper;
    this.reportWriter = reportWriter;
  }

  @Override
  public String key() {
    return KEY;
  }

  @Override
  public String displayName() {
    return "Manuscript Grader";
  }

  @Override
  public String description() {
    return "Estimates the chance of external review at six journal prestige levels";
  }

  @Override
  public Class<GraderPayload> payloadType() {
    return GraderPayload.class;
  }

  @Override
  public ModulePolicy defaultPolicy() {
    return DEFAULT_POLICY;
  }

  @Override
  public ModuleSettings defaultSettings() {
    return DEFAULT_SETTINGS;
  }

  @Override
  public long projectedUnits(GraderPayload payload) {
    return 1;
  }

  @Override
  public long completionUnits(GraderPayload payload, List<RoundResult> rounds) {
    return 1;
  }

  @Override
  public Optional<RoundPlan> planRound(RoundContext<GraderPayload> context) {
    if (context.round() != 1) {
      return Optional.empty();
    }
    ModuleSettings settings = context.settings();
    LlmRequest request =
        LlmRequest.of(
            settings.model("grading"),
            settings.prompt("grading_instructions"),
            "Manuscript to grade:\n\n" + context.payload().manuscript().text());
    List<PlannedItem> items = new ArrayList<>();
    for (int run = 1; run <= TARGET_RUNS; run++) {
      items.add(
          new PlannedItem(
              "Grading run " + run,
              request,
              0,
              "grading_run_" + run + ".json",
              ReportWriter.JSON,
              response -> interpret(response.text())));
    }
    return Optional.of(new RoundPlan(items, context.policy().successThreshold()));
  }

  /** Parses and checks one answer, returning the normalized run as JSON. */
  String interpret(String text) throws LlmParseException {
    JsonNode root;
    try {
      root = objectMapper.readTree(text == null ? "" : text.trim());
    } catch (JsonProcessingException e) {
      throw new LlmParseException("Invalid grading JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new LlmParseException("Grading response is not a JSON object");
    }
    double[] levels = new double[GradingMath.LEVELS];
    for (int i = 0; i < GradingMath.LEVELS; i++) {
      JsonNode value = root.get("Level " + (i + 1));
      if (value == null || !value.isNumber()) {
        throw new LlmParseException("Missing numeric value for Level " + (i + 1));
      }
      levels[i] = value.asDouble();
    }
    levels = GradingMath.normalize(levels);
    if (!GradingMath.isNonDecreasing(levels)) {
      throw new LlmParseException("Level scores decrease with prestige level");
    }
    JsonNode justification = root.get("justification");
    GradingRun run =
        new GradingRun(
            levels,
            justification != null && justification.isTextual() ? justification.asText() : null);
    try {
      return objectMapper.writeValueAsString(run);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize grading run", e);
    }
  }

  @Override
  public List<ArtifactContent> assemble(
      GraderPayload payload, ModuleSettings settings, List<RoundResult> rounds)
      throws IOException {
    RoundResult round = rounds.get(0);
    List<GradingRun> runs = new ArrayList<>();
    for (ItemResult item : round.succeeded()) {
      runs.add(objectMapper.readValue(item.outputText(), GradingRun.class));
    }
    int attempts = round.items().stream().mapToInt(ItemResult::attempts).sum();
    GradingReport report = aggregate(runs, attempts);
    return List.of(
        new ArtifactContent(REPORT_NAME, ReportWriter.JSON, reportWriter.writeJson(report)));
  }

  static GradingReport aggregate(List<GradingRun> runs, int attempts) {
    List<Double> weighted = runs.stream().map(r -> GradingMath.weightedMean(r.levels())).toList();
    GradingMath.Iqm iqm = GradingMath.interquartileMean(weighted);

    List<Double> perLevel = new ArrayList<>();
    for (int level = 0; level < GradingMath.LEVELS; level++) {
      double sum = 0;
      for (int index : iqm.keptIndices()) {
        sum += runs.get(index).levels()[level];
      }
      perLevel.add(iqm.keptIndices().isEmpty() ? 0 : sum / iqm.keptIndices().size());
    }

    String justification =
        runs.stream()
            .map(GradingRun::justification)
            .filter(j -> j != null && !j.isBlank())
            .findFirst()
            .orElse(null);
    String decisionReason =
        String.format(
            "Interquartile mean of the weighted scores of %d of %d valid runs",
            iqm.keptIndices().size(), runs.size());
    return new GradingReport(
        iqm.mean(),
        perLevel,
        runs.size(),
        iqm.keptIndices().size(),
        attempts,
        justification,
        decisionReason);
  }
}
