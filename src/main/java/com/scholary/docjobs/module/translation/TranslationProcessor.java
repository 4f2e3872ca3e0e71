package com.scholary.docjobs.module.translation;

import com.scholary.docjobs.job.SuccessThreshold;
import com.scholary.docjobs.llm.LlmParseException;
import com.scholary.docjobs.llm.LlmRequest;
import com.scholary.docjobs.module.ArtifactContent;
import com.scholary.docjobs.module.GlossaryTerm;
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
import com.scholary.docjobs.module.translation.ChunkPlanner.Chunk;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Translates documents paragraph by paragraph between English and Chinese.
 *
 * <p>Each document is cut into chunks (see {@link ChunkPlanner}); every chunk is one item. The
 * model must return the same number of paragraph separators it was given, otherwise the answer is
 * rejected and retried. A document is only written once all its chunks are translated.
 */
@Component
public class TranslationProcessor implements ModuleProcessor<TranslationPayload> {

  public static final String KEY = "translatedocx";

  private static final String CONTENT_TYPE = "text/plain; charset=utf-8";

  private static final ModulePolicy DEFAULT_POLICY =
      new ModulePolicy(
          3,
          4,
          Duration.ofMillis(1500),
          Duration.ofMillis(1500),
          SuccessThreshold.all(),
          null,
          20_000);

  private static final String MARKER_RULES =
      "The user's input contains multiple paragraphs separated by the exact marker"
          + " {{PARAGRAPH_SEPARATOR}}. Return the translated paragraphs with the same marker"
          + " preserved between them.\n"
          + "If a paragraph is only a URL or citation, return it unchanged.";

  private static final ModuleSettings DEFAULT_SETTINGS =
      new ModuleSettings(
          Map.of("translation", "openrouter/openai/gpt-4o-mini"),
          Map.of(
              "en_to_cn",
              "You are an expert translator for academic manuscripts from English (EN) to Chinese"
                  + " (CN). Maintain formal academic tone and style in CN.\n"
                  + "Use the glossary consistently, each entry is EN -> CN:\n"
                  + "{{GLOSSARY}}\n"
                  + MARKER_RULES,
              "cn_to_en",
              "You are an expert translator for academic manuscripts from Chinese (CN) to English"
                  + " (EN). Maintain formal academic tone and style in EN (British academic"
                  + " English preferred).\n"
                  + "Use the glossary consistently, each entry is CN -> EN:\n"
                  + "{{GLOSSARY}}\n"
                  + MARKER_RULES));

  @Override
  public String key() {
    return KEY;
  }

  @Override
  public String displayName() {
    return "Document Translation";
  }

  @Override
  public String description() {
    return "Translates documents between English and Chinese, keeping the paragraph layout";
  }

  @Override
  public Class<TranslationPayload> payloadType() {
    return TranslationPayload.class;
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
  public void validate(TranslationPayload payload) {
    for (SourceDocument document : payload.documents()) {
      if (ChunkPlanner.plan(ChunkPlanner.paragraphs(document.text())).isEmpty()) {
        throw new InvalidPayloadException(
            "Document has no text to translate: " + document.filename());
      }
    }
  }

  @Override
  public long projectedUnits(TranslationPayload payload) {
    return payload.documents().size();
  }

  @Override
  public long completionUnits(TranslationPayload payload, List<RoundResult> rounds) {
    return payload.documents().size();
  }

  @Override
  public Optional<RoundPlan> planRound(RoundContext<TranslationPayload> context) {
    if (context.round() != 1) {
      return Optional.empty();
    }
    TranslationPayload payload = context.payload();
    ModuleSettings settings = context.settings();
    String model = settings.model("translation");
    String systemPrompt = buildSystemPrompt(settings, payload);

    List<PlannedItem> items = new ArrayList<>();
    for (SourceDocument document : payload.documents()) {
      List<Chunk> chunks = ChunkPlanner.plan(ChunkPlanner.paragraphs(document.text()));
      for (int c = 0; c < chunks.size(); c++) {
        Chunk chunk = chunks.get(c);
        items.add(
            new PlannedItem(
                String.format("%s, chunk %d of %d", document.filename(), c + 1, chunks.size()),
                LlmRequest.of(
                    model, systemPrompt, userInstruction(payload.direction(), chunk.sourceText())),
                0,
                String.format("%s_chunk_%03d.txt", document.stem(), c + 1),
                CONTENT_TYPE,
                chunkInterpreter(chunk)));
      }
    }
    return Optional.of(new RoundPlan(items, context.policy().successThreshold()));
  }

  @Override
  public List<ArtifactContent> assemble(
      TranslationPayload payload, ModuleSettings settings, List<RoundResult> rounds) {
    List<ItemResult> results = rounds.get(0).items();
    List<ArtifactContent> artifacts = new ArrayList<>();
    Set<String> usedNames = new HashSet<>();
    int next = 0;
    for (SourceDocument document : payload.documents()) {
      List<String> paragraphs = new ArrayList<>(ChunkPlanner.paragraphs(document.text()));
      List<Chunk> chunks = ChunkPlanner.plan(paragraphs);
      boolean complete = true;
      for (Chunk chunk : chunks) {
        ItemResult result = results.get(next++);
        if (!result.succeeded()) {
          complete = false;
          continue;
        }
        List<String> segments =
            ChunkPlanner.split(result.outputText(), chunk.size())
                .orElseThrow(
                    () -> new IllegalStateException("Stored chunk lost its separators"));
        for (int i = 0; i < chunk.size(); i++) {
          paragraphs.set(chunk.paragraphIndices().get(i), segments.get(i));
        }
      }
      if (complete) {
        String name = document.stem() + "_translated.txt";
        if (!usedNames.add(name)) {
          name = document.stem() + "_" + usedNames.size() + "_translated.txt";
          usedNames.add(name);
        }
        artifacts.add(
            new ArtifactContent(
                name,
                CONTENT_TYPE,
                String.join("\n", paragraphs).getBytes(StandardCharsets.UTF_8)));
      }
    }
    return artifacts;
  }

  static PlannedItem.ResponseInterpreter chunkInterpreter(Chunk chunk) {
    return response -> {
      String text = response.text() == null ? "" : response.text();
      List<String> segments =
          ChunkPlanner.split(text, chunk.size())
              .orElseThrow(
                  () ->
                      new LlmParseException(
                          String.format(
                              "Translation returned %d segments but %d were expected",
                              countSeparators(text) + 1, chunk.size())));
      return String.join(ChunkPlanner.SEPARATOR, segments);
    };
  }

  static String buildSystemPrompt(ModuleSettings settings, TranslationPayload payload) {
    boolean toChinese = payload.direction() == TranslationDirection.EN_TO_CN;
    String template = settings.prompt(toChinese ? "en_to_cn" : "cn_to_en");
    return template
        .replace("{{GLOSSARY}}", glossaryBlock(payload.glossary(), toChinese))
        .replace("{{PARAGRAPH_SEPARATOR}}", ChunkPlanner.SEPARATOR);
  }

  static String glossaryBlock(List<GlossaryTerm> glossary, boolean toChinese) {
    if (glossary.isEmpty()) {
      return "No glossary entries configured.";
    }
    return glossary.stream()
        .map(
            term ->
                toChinese
                    ? String.format("EN: %s -> CN: %s", term.source(), term.target())
                    : String.format("CN: %s -> EN: %s", term.target(), term.source()))
        .collect(Collectors.joining("\n"));
  }

  static String userInstruction(TranslationDirection direction, String chunkText) {
    int separators = countSeparators(chunkText);
    String from = direction == TranslationDirection.EN_TO_CN ? "EN" : "CN";
    String to = direction == TranslationDirection.EN_TO_CN ? "CN" : "EN";
    return String.format(
        "Translate the following %s paragraphs into %s. CRITICAL: You must preserve EXACTLY %d"
            + " occurrences of the separator %s in your output. Each %s separator marks a"
            + " paragraph boundary and must appear in the exact same positions in your"
            + " translation.\n\nInput text:\n%s",
        from, to, separators, ChunkPlanner.SEPARATOR, ChunkPlanner.SEPARATOR, chunkText);
  }

  private static int countSeparators(String text) {
    int count = 0;
    int from = text.indexOf(ChunkPlanner.SEPARATOR);
    while (from >= 0) {
      count++;
      from = text.indexOf(ChunkPlanner.SEPARATOR, from + ChunkPlanner.SEPARATOR.length());
    }
    return count;
  }
}
