package com.scholary.docjobs.module.summarizer;

import com.scholary.docjobs.artifact.ReportWriter;
import com.scholary.docjobs.job.SuccessThreshold;
import com.scholary.docjobs.llm.LlmRequest;
import com.scholary.docjobs.module.ArtifactContent;
import com.scholary.docjobs.module.GlossaryTerm;
import com.scholary.docjobs.module.ItemResult;
import com.scholary.docjobs.module.ModulePolicy;
import com.scholary.docjobs.module.ModuleProcessor;
import com.scholary.docjobs.module.ModuleSettings;
import com.scholary.docjobs.module.PlannedItem;
import com.scholary.docjobs.module.RoundContext;
import com.scholary.docjobs.module.RoundPlan;
import com.scholary.docjobs.module.RoundResult;
import com.scholary.docjobs.module.SourceDocument;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Summarizes each document; optionally translates every summary in a second round.
 *
 * <p>Every summary must succeed. Translation failures never fail the job: the summary stays
 * available and the job completes with the error noted.
 */
@Component
public class SummarizerProcessor implements ModuleProcessor<SummarizerPayload> {

  public static final String KEY = "summarizer";

  static final String GLOSSARY_PLACEHOLDER = "{{GLOSSARY}}";

  private static final ModulePolicy DEFAULT_POLICY =
      new ModulePolicy(
          3, 5, Duration.ofSeconds(1), Duration.ofSeconds(1), SuccessThreshold.all(), null, 6_000);

  private static final ModuleSettings DEFAULT_SETTINGS =
      new ModuleSettings(
          Map.of(
              "summary", "openrouter/anthropic/claude-3-haiku",
              "translation", "openrouter/openai/gpt-4o-mini"),
          Map.of(
              "research_summary",
              "You are an academic assistant. Write a detailed summary of the following research"
                  + " paper text. The summary should be approximately 800 words and cover these"
                  + " sections clearly:\n"
                  + "1. Research Question/Objective: State the main question or goal (~75 words).\n"
                  + "2. Methodology: Describe the methods, data collection, analysis techniques,"
                  + " tools, and participant/sample information (~400 words).\n"
                  + "3. Findings/Results: Present the key findings and results, including"
                  + " significant data points and statistical outcomes (~400 words).\n"
                  + "4. Discussion/Conclusion: Briefly discuss the implications of the findings and"
                  + " the main conclusion (~75 words).\n"
                  + "Do not use markdown formatting. Base the summary only on the provided text.",
              "general_summary",
              "You are an assistant tasked with summarizing documents. Provide a concise yet"
                  + " comprehensive summary of the following text, aiming for approximately 600"
                  + " words. Highlight the main points, key arguments, significant data or figures"
                  + " mentioned, and any conclusions drawn. Do not use markdown formatting. Base"
                  + " the summary only on the provided text.",
              "translation",
              "You are an expert translator for academic manuscripts from English (EN) to Chinese"
                  + " (CN). Maintain academic tone and style. Use the following EN -> CN glossary"
                  + " entries for consistent terminology (each line is EN -> CN):\n"
                  + GLOSSARY_PLACEHOLDER
                  + "\nPreserve citations, references, and technical terms."));

  private final ReportWriter reportWriter;

  public SummarizerProcessor(ReportWriter reportWriter) {
    this.reportWriter = reportWriter;
  }

  @Override
  public String key() {
    return KEY;
  }

  @Override
  public String displayName() {
    return "Summarizer";
  }

  @Override
  public String description() {
    return "Summarizes research articles or general documents, with optional Chinese translation";
  }

  @Override
  public Class<SummarizerPayload> payloadType() {
    return SummarizerPayload.class;
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
  public long projectedUnits(SummarizerPayload payload) {
    return payload.documents().size();
  }

  @Override
  public Optional<RoundPlan> planRound(RoundContext<SummarizerPayload> context) {
    SummarizerPayload payload = context.payload();
    ModuleSettings settings = context.settings();

    if (context.round() == 1) {
      String prompt =
          settings.prompt(
              payload.documentType() == SummarizerPayload.DocumentType.OTHER
                  ? "general_summary"
                  : "research_summary");
      List<PlannedItem> items = new ArrayList<>();
      for (SourceDocument document : payload.documents()) {
        items.add(
            PlannedItem.text(
                "Summary: " + document.filename(),
                LlmRequest.of(settings.model("summary"), prompt, document.text()),
                1,
                document.stem() + "_summary.txt"));
      }
      return Optional.of(new RoundPlan(items, context.policy().successThreshold()));
    }

    if (context.round() == 2 && payload.translationEnabled()) {
      String prompt = buildTranslationPrompt(settings.prompt("translation"), payload.glossary());
      List<PlannedItem> items = new ArrayList<>();
      for (ItemResult summary : context.previousRounds().get(0).succeeded()) {
        SourceDocument document = payload.documents().get(summary.index());
        items.add(
            PlannedItem.text(
                "Translation: " + document.filename(),
                LlmRequest.of(
                    settings.model("translation"),
                    prompt,
                    "Translate the following text to Chinese while adhering to the glossary:\n\n"
                        + summary.outputText()),
                0,
                document.stem() + "_translation.txt"));
      }
      if (items.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(new RoundPlan(items, SuccessThreshold.none()));
    }

    return Optional.empty();
  }

  @Override
  public List<ArtifactContent> assemble(
      SummarizerPayload payload, ModuleSettings settings, List<RoundResult> rounds) {
    List<ArtifactContent> artifacts = new ArrayList<>();
    artifacts.add(
        new ArtifactContent(
            "combined_summary.md",
            ReportWriter.MARKDOWN,
            reportWriter.writeMarkdown(sections(payload, rounds.get(0).succeeded()))));

    if (rounds.size() > 1) {
      RoundResult translations = rounds.get(1);
      List<ItemResult> translated = new ArrayList<>();
      List<ItemResult> summaries = rounds.get(0).succeeded();
      for (ItemResult item : translations.succeeded()) {
        // translation item i belongs to the i-th successful summary
        ItemResult summary = summaries.get(item.index());
        translated.add(
            new ItemResult(
                summary.index(),
                item.label(),
                item.status(),
                item.attempts(),
                item.outputText(),
                null));
      }
      if (!translated.isEmpty()) {
        artifacts.add(
            new ArtifactContent(
                "combined_translation.md",
                ReportWriter.MARKDOWN,
                reportWriter.writeMarkdown(sections(payload, translated))));
      }
    }
    return artifacts;
  }

  private static List<ReportWriter.Section> sections(
      SummarizerPayload payload, List<ItemResult> items) {
    List<ReportWriter.Section> sections = new ArrayList<>();
    for (ItemResult item : items) {
      SourceDocument document = payload.documents().get(item.index());
      sections.add(
          new ReportWriter.Section(
              String.format("Document %d: %s", item.index() + 1, document.filename()),
              item.outputText()));
    }
    return sections;
  }

  static String buildTranslationPrompt(String template, List<GlossaryTerm> glossary) {
    String block =
        glossary.isEmpty()
            ? "- (no glossary terms configured)"
            : glossary.stream()
                .map(t -> String.format("- EN: %s -> CN: %s", t.source().trim(), t.target().trim()))
                .collect(Collectors.joining("\n"));
    if (template.contains(GLOSSARY_PLACEHOLDER)) {
      return template.replace(GLOSSARY_PLACEHOLDER, block);
    }
    return template.stripTrailing() + "\n" + block;
  }
}
