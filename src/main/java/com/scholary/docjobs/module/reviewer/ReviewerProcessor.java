package com.scholary.docjobs.module.reviewer;

import com.scholary.docjobs.artifact.ReportWriter;
import com.scholary.docjobs.job.SuccessThreshold;
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
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Three-round peer review.
 *
 * <ol>
 *   <li>Independent reviews, one per configured model; at least four must succeed.
 *   <li>A meta-review over all successful reviews.
 *   <li>The final report, written from the meta-review.
 * </ol>
 */
@Component
public class ReviewerProcessor implements ModuleProcessor<ReviewerPayload> {

  public static final String KEY = "reviewer";

  static final String FINAL_REPORT = "final_report.md";

  private static final ModulePolicy DEFAULT_POLICY =
      new ModulePolicy(
          3, 8, Duration.ofSeconds(2), Duration.ZERO, SuccessThreshold.atLeast(4), null, 150_000);

  private static final ModuleSettings DEFAULT_SETTINGS =
      new ModuleSettings(
          Map.of(
              "round1",
              String.join(
                  ",",
                  "openrouter/openai/gpt-4o",
                  "openrouter/anthropic/claude-3.5-sonnet",
                  "openrouter/google/gemini-pro-1.5",
                  "openrouter/meta-llama/llama-3.1-70b-instruct",
                  "openrouter/openai/gpt-4o-mini",
                  "openrouter/anthropic/claude-3-haiku",
                  "openrouter/mistralai/mistral-large",
                  "openrouter/deepseek/deepseek-chat"),
              "round2",
              "openrouter/openai/gpt-4o",
              "round3",
              "openrouter/openai/gpt-4o"),
          Map.of(
              "initial_prompt",
              "You are an expert peer reviewer. Review the manuscript below as you would for a"
                  + " leading journal in its field. Summarize its contribution, then list major"
                  + " and minor concerns about methodology, analysis, presentation and whether"
                  + " the conclusions follow from the results. End with a recommendation.",
              "initial_prompt_zh",
              "你是一名资深审稿专家。请按照本领域高水平期刊的标准审阅下列稿件：先概述其贡献，"
                  + "再分别列出关于研究方法、分析、写作呈现以及结论是否由结果支持的主要问题与次要问题，"
                  + "最后给出审稿建议。",
              "secondary_prompt",
              "You are the handling editor. Several independent reviews of the manuscript below"
                  + " follow. Consolidate them into one meta-review: merge overlapping points,"
                  + " resolve contradictions against the manuscript itself and drop claims the"
                  + " manuscript does not support.",
              "secondary_prompt_zh",
              "你是负责该稿件的编辑。以下是若干份独立审稿意见。请将其整合为一份综合评审："
                  + "合并重复意见，对照稿件本身澄清相互矛盾之处，并删除稿件不支持的论断。",
              "final_prompt",
              "Write the final review report for the authors from the consolidated review"
                  + " below. Use clear sections for summary, major issues, minor issues and"
                  + " recommendation, in a constructive and professional tone.",
              "final_prompt_zh",
              "请根据下面的综合评审意见为作者撰写最终审稿报告，分为概述、主要问题、次要问题和"
                  + "审稿建议几个部分，语气应专业且具有建设性。"));

  @Override
  public String key() {
    return KEY;
  }

  @Override
  public String displayName() {
    return "Manuscript Reviewer";
  }

  @Override
  public String description() {
    return "Multi-model peer review consolidated into a final report";
  }

  @Override
  public Class<ReviewerPayload> payloadType() {
    return ReviewerPayload.class;
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
  public long projectedUnits(ReviewerPayload payload) {
    return 1;
  }

  @Override
  public long completionUnits(ReviewerPayload payload, List<RoundResult> rounds) {
    return 1;
  }

  @Override
  public Optional<RoundPlan> planRound(RoundContext<ReviewerPayload> context) {
    ReviewerPayload payload = context.payload();
    ModuleSettings settings = context.settings();
    ReviewLanguage language = payload.language();
    String manuscript = payload.manuscript().text();

    switch (context.round()) {
      case 1:
        {
          String prompt = settings.prompt(language.promptName("initial_prompt"));
          List<String> models = settings.modelList("round1");
          List<PlannedItem> items = new ArrayList<>();
          for (int i = 0; i < models.size(); i++) {
            items.add(
                PlannedItem.text(
                    String.format("Review %d (%s)", i + 1, models.get(i)),
                    LlmRequest.of(models.get(i), null, withManuscript(prompt, manuscript)),
                    0,
                    String.format("round1_review_%d.md", i + 1)));
          }
          return Optional.of(new RoundPlan(items, context.policy().successThreshold()));
        }
      case 2:
        {
          String prompt =
              settings.prompt(language.promptName("secondary_prompt"))
                  + "\n\n"
                  + combineReviews(context.previousRounds().get(0).succeeded());
          return Optional.of(
              new RoundPlan(
                  List.of(
                      PlannedItem.text(
                          "Meta-review",
                          LlmRequest.of(
                              settings.model("round2"), null, withManuscript(prompt, manuscript)),
                          0,
                          "round2_meta_review.md")),
                  SuccessThreshold.all()));
        }
      case 3:
        {
          String prompt =
              settings.prompt(language.promptName("final_prompt"))
                  + "\n\n=== Review Report ===\n\n"
                  + context.previousRounds().get(1).succeeded().get(0).outputText();
          return Optional.of(
              new RoundPlan(
                  List.of(
                      PlannedItem.text(
                          "Final report",
                          LlmRequest.of(
                              settings.model("round3"), null, withManuscript(prompt, manuscript)),
                          0,
                          "round3_final_report.md")),
                  SuccessThreshold.all()));
        }
      default:
        return Optional.empty();
    }
  }

  /** Successful reviews, numbered by their review slot. */
  static String combineReviews(List<ItemResult> reviews) {
    StringBuilder combined = new StringBuilder();
    for (ItemResult review : reviews) {
      if (combined.length() > 0) {
        combined.append("\n\n");
      }
      combined.append(String.format("=== Review %d ===\n\n", review.index() + 1));
      combined.append(review.outputText());
    }
    return combined.toString();
  }

  private static String withManuscript(String prompt, String manuscript) {
    return prompt + "\n\n=== Manuscript ===\n\n" + manuscript;
  }

  @Override
  public List<ArtifactContent> assemble(
      ReviewerPayload payload, ModuleSettings settings, List<RoundResult> rounds) {
    String report = rounds.get(2).succeeded().get(0).outputText().trim() + "\n";
    return List.of(
        new ArtifactContent(
            FINAL_REPORT, ReportWriter.MARKDOWN, report.getBytes(StandardCharsets.UTF_8)));
  }
}
