package com.scholary.docjobs.module.translation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Groups paragraphs into translation chunks.
 *
 * <p>A chunk holds at most {@value #MAX_PARAGRAPHS} paragraphs and about {@value
 * #MAX_EQUIVALENT_WORDS} equivalent words; a blank paragraph always closes the current chunk and
 * is never sent for translation. A single paragraph larger than the word limit gets a chunk of
 * its own.
 */
public final class ChunkPlanner {

  public static final String SEPARATOR = "[[__PARAGRAPH_BREAK__]]";

  static final int MAX_PARAGRAPHS = 20;
  static final double MAX_EQUIVALENT_WORDS = 700.0;

  private static final double CJK_WEIGHT = 0.7;

  private ChunkPlanner() {}

  /** Paragraph indices of one chunk and the text sent for it. */
  public record Chunk(List<Integer> paragraphIndices, String sourceText) {

    public Chunk {
      paragraphIndices = List.copyOf(paragraphIndices);
    }

    public int size() {
      return paragraphIndices.size();
    }
  }

  public static List<String> paragraphs(String text) {
    List<String> paragraphs = new ArrayList<>();
    for (String line : text.split("\\r?\\n", -1)) {
      paragraphs.add(line.stripTrailing());
    }
    return paragraphs;
  }

  public static List<Chunk> plan(List<String> paragraphs) {
    List<Chunk> chunks = new ArrayList<>();
    List<Integer> current = new ArrayList<>();
    double currentWords = 0;

    for (int i = 0; i < paragraphs.size(); i++) {
      String paragraph = paragraphs.get(i).trim();
      if (paragraph.isEmpty()) {
        flush(chunks, current, paragraphs);
        currentWords = 0;
        continue;
      }
      double words = equivalentWords(paragraph);
      if (!current.isEmpty()
          && (current.size() >= MAX_PARAGRAPHS || currentWords + words > MAX_EQUIVALENT_WORDS)) {
        flush(chunks, current, paragraphs);
        currentWords = 0;
      }
      current.add(i);
      currentWords += words;
    }
    flush(chunks, current, paragraphs);
    return chunks;
  }

  private static void flush(List<Chunk> chunks, List<Integer> current, List<String> paragraphs) {
    if (current.isEmpty()) {
      return;
    }
    List<String> parts = new ArrayList<>();
    for (int index : current) {
      parts.add(paragraphs.get(index).trim());
    }
    chunks.add(new Chunk(current, String.join(SEPARATOR, parts)));
    current.clear();
  }

  /**
   * Whitespace separated tokens count one word each; every CJK ideograph counts {@value
   * #CJK_WEIGHT} and ends the token before it.
   */
  static double equivalentWords(String text) {
    double count = 0;
    boolean inToken = false;
    for (int i = 0; i < text.length(); i++) {
      char ch = text.charAt(i);
      if (Character.isWhitespace(ch)) {
        if (inToken) {
          count += 1;
          inToken = false;
        }
      } else if (ch >= '\u4E00' && ch <= '\u9FFF') {
        if (inToken) {
          count += 1;
          inToken = false;
        }
        count += CJK_WEIGHT;
      } else {
        inToken = true;
      }
    }
    if (inToken) {
      count += 1;
    }
    return count;
  }

  /** Splits a translated chunk back into paragraphs; empty if the segment count differs. */
  static Optional<List<String>> split(String translated, int expectedSegments) {
    String[] parts = translated.split(Pattern.quote(SEPARATOR), -1);
    if (parts.length != expectedSegments) {
      return Optional.empty();
    }
    List<String> segments = new ArrayList<>(parts.length);
    for (String part : parts) {
      segments.add(part.trim());
    }
    return Optional.of(segments);
  }
}
