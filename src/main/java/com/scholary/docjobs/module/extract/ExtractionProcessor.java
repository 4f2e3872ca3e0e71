package com.scholary.docjobs.module.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.docjobs.artifact.ReportWriter;
import com.scholary.docjobs.job.SuccessThreshold;
import com.scholary.docjobs.llm.LlmParseException;
import com.scholary.docjobs.llm.LlmRequest;
import com.scholary.docjobs.module.ArtifactContent;
import com.scholary.docjobs.module.InvalidPayloadException;
import com.scholary.docjobs.module.ItemResult;
import com.scholary.docjobs.module.ModulePolicy;
import com.scholary.docjobs.module.ModuleProcessor;
import com.scholary.docjobs.module.ModuleSettings;
import com.scholary.docjobs.module.PlannedItem;
import com.scholary.docjobs.module.RoundContext;
import com.scholary.docjobs.module.RoundPlan;
import com.scholary.docjobs.module.RoundResult;
import com.scholary.docjobs.module.SourceDocument;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Extracts user-defined fields from each document into one CSV table.
 *
 * <p>One row per document, in submission order; documents whose extraction failed keep their row
 * with the error in the last column. The job fails only if no document succeeds.
 */
@Component
public class ExtractionProcessor implements ModuleProcessor<ExtractionPayload> {

  public static final String KEY = "infoextract";

  static final int MAX_DOCUMENTS = 100;
  static final int MAX_TEXT_CHARS = 20_000;
  static final String RESULT_NAME = "extraction_result.csv";

  private static final String LIST_JOINER = "；";

  private static final ModulePolicy DEFAULT_POLICY =
      new ModulePolicy(
          3,
          5,
          Duration.ofMillis(1500),
          Duration.ofMillis(1500),
          SuccessThreshold.atLeast(1),
          null,
          8_000);

  private static final ModuleSettings DEFAULT_SETTINGS =
      new ModuleSettings(
          Map.of("extraction", "openrouter/openai/gpt-4o-mini"),
          Map.of(
              "system",
              "You extract structured information from academic papers. Read the paper and fill"
                  + " in every requested field. Answer with a single JSON object whose keys are"
                  + " exactly the field names. Use an empty string when the paper does not state"
                  + " a value. When allowed values are listed, use only those values. Do not add"
                  + " commentary outside the JSON object."));

  private final ObjectMapper objectMapper;
  private final ReportWriter reportWriter;

  public ExtractionProcessor(ObjectMapper objectMapper, ReportWriter reportWriter) {
    this.objectMapper = objectMapper;
    this.reportWriter = reportWriter;
  }

  @Override
  public String key() {
    return KEY;
  }

  @Override
  public String displayName() {
    return "Information Extraction";
  }

  @Override
  public String description() {
    return "Extracts user-defined fields from each document into a CSV table";
  }

  @Override
  public Class<ExtractionPayload> payloadType() {
    return ExtractionPayload.class;
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
  public void validate(ExtractionPayload payload) {
    Set<String> names = new HashSet<>();
    for (ExtractionField field : payload.fields()) {
      if (field.description() == null
          && field.examples().isEmpty()
          && field.allowedValues().isEmpty()) {
        throw new InvalidPayloadException(
            "Field '" + field.name() + "' needs a description, examples or allowed values");
      }
      if (!field.examples().isEmpty() && !field.allowedValues().isEmpty()) {
        throw new InvalidPayloadException(
            "Field '" + field.name() + "' cannot have both examples and allowed values");
      }
      if (!names.add(field.name())) {
        throw new InvalidPayloadException("Duplicate field name: " + field.name());
      }
    }
  }

  @Override
  public long projectedUnits(ExtractionPayload payload) {
    return payload.documents().size();
  }

  @Override
  public Optional<RoundPlan> planRound(RoundContext<ExtractionPayload> context) {
    if (context.round() != 1) {
      return Optional.empty();
    }
    ExtractionPayload payload = context.payload();
    ModuleSettings settings = context.settings();
    List<PlannedItem> items = new ArrayList<>();
    for (SourceDocument document : payload.documents()) {
      items.add(
          new PlannedItem(
              document.filename(),
              LlmRequest.of(
                  settings.model("extraction"),
                  settings.prompt("system"),
                  buildUserPrompt(document, payload.fields(), payload.guidance())),
              1,
              document.stem() + "_extraction.json",
              ReportWriter.JSON,
              response -> interpret(response.text(), payload.fields())));
    }
    return Optional.of(new RoundPlan(items, context.policy().successThreshold()));
  }

  static String buildUserPrompt(
      SourceDocument document, List<ExtractionField> fields, String guidance) {
    String text = document.text();
    boolean truncated = text.codePointCount(0, text.length()) > MAX_TEXT_CHARS;
    if (truncated) {
      text = text.substring(0, text.offsetByCodePoints(0, MAX_TEXT_CHARS));
    }

    StringBuilder prompt = new StringBuilder();
    prompt.append("File name: ").append(document.filename()).append("\n\n");
    prompt.append("Extract the following fields from the paper:\n");
    for (int i = 0; i < fields.size(); i++) {
      ExtractionField field = fields.get(i);
      prompt.append(i + 1).append(". ").append(field.name()).append('\n');
      if (field.description() != null) {
        prompt.append("   Description: ").append(field.description()).append('\n');
      }
      if (!field.examples().isEmpty()) {
        prompt.append("   Examples: ").append(String.join(LIST_JOINER, field.examples()));
        prompt.append('\n');
      }
      if (!field.allowedValues().isEmpty()) {
        prompt.append("   Allowed values: ");
        prompt.append(String.join(LIST_JOINER, field.allowedValues())).append('\n');
      }
      prompt.append('\n');
    }
    if (guidance != null && !guidance.isBlank()) {
      prompt.append("Output requirements:\n").append(guidance.trim()).append("\n\n");
    }
    if (truncated) {
      prompt.append(
          String.format(
              "Note: the text was truncated to its first %d characters; reason carefully from"
                  + " the available context.\n\n",
              MAX_TEXT_CHARS));
    }
    prompt.append("Paper text:\n\n").append(text);
    return prompt.toString();
  }

  /** Keeps only the requested fields, in field order, as a JSON object. */
  String interpret(String text, List<ExtractionField> fields) throws LlmParseException {
    ObjectNode extracted = extractObject(text == null ? "" : text.trim());
    ObjectNode result = objectMapper.createObjectNode();
    for (ExtractionField field : fields) {
      JsonNode value = extracted.get(field.name());
      result.set(field.name(), value == null ? objectMapper.nullNode() : value);
    }
    return result.toString();
  }

  private ObjectNode extractObject(String text) throws LlmParseException {
    ObjectNode direct = readObject(text);
    if (direct != null) {
      return direct;
    }
    int start = text.indexOf('{');
    int end = text.lastIndexOf('}');
    if (start >= 0 && end > start) {
      ObjectNode embedded = readObject(text.substring(start, end + 1));
      if (embedded != null) {
        return embedded;
      }
    }
    throw new LlmParseException("Model output is not a parseable JSON object");
  }

  private ObjectNode readObject(String text) {
    try {
      JsonNode node = objectMapper.readTree(text);
      return node != null && node.isObject() ? (ObjectNode) node : null;
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  @Override
  public List<ArtifactContent> assemble(
      ExtractionPayload payload, ModuleSettings settings, List<RoundResult> rounds)
      throws IOException {
    List<String> header = new ArrayList<>();
    header.add("Document");
    payload.fields().forEach(field -> header.add(field.name()));
    header.add("Error");

    List<List<String>> rows = new ArrayList<>();
    for (ItemResult item : rounds.get(0).items()) {
      List<String> row = new ArrayList<>();
      row.add(payload.documents().get(item.index()).filename());
      JsonNode values = item.succeeded() ? objectMapper.readTree(item.outputText()) : null;
      for (ExtractionField field : payload.fields()) {
        row.add(values == null ? "" : valueToString(values.get(field.name())));
      }
      row.add(item.succeeded() || item.errorMessage() == null ? "" : item.errorMessage());
      rows.add(row);
    }
    return List.of(
        new ArtifactContent(RESULT_NAME, ReportWriter.CSV, reportWriter.writeCsv(header, rows)));
  }

  /** Cell text of an extracted value; arrays are joined, objects kept as JSON. */
  static String valueToString(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return "";
    }
    if (value.isArray()) {
      List<String> parts = new ArrayList<>();
      for (Iterator<JsonNode> it = value.elements(); it.hasNext(); ) {
        String part = valueToString(it.next());
        if (!part.isEmpty()) {
          parts.add(part);
        }
      }
      return String.join(LIST_JOINER, parts);
    }
    if (value.isObject()) {
      return value.toString();
    }
    return value.asText();
  }
}
