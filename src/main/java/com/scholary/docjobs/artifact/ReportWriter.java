package com.scholary.docjobs.artifact;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Renders aggregate outputs.
 *
 * <p>Supports JSON (machine-readable), Markdown (combined documents) and CSV (one row per
 * document, opened by spreadsheet tools).
 */
@Component
public class ReportWriter {

  public static final String JSON = "application/json";
  public static final String MARKDOWN = "text/markdown; charset=utf-8";
  public static final String CSV = "text/csv; charset=utf-8";

  private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

  private final ObjectMapper objectMapper;

  public ReportWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public byte[] writeJson(Object report) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(report);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize report", e);
    }
  }

  /** A heading and its body text. */
  public record Section(String heading, String body) {}

  /**
   * Write sections as Markdown.
   *
   * <pre>
   * # Document 1: paper.pdf
   *
   * body...
   *
   * </pre>
   */
  public byte[] writeMarkdown(List<Section> sections) {
    StringBuilder md = new StringBuilder();
    for (Section section : sections) {
      md.append("# ").append(section.heading()).append("\n\n");
      md.append(section.body().trim()).append("\n\n");
    }
    return md.toString().getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Write a CSV table (RFC 4180 quoting, CRLF line ends).
   *
   * <p>Prefixed with a UTF-8 byte order mark so spreadsheet tools detect the encoding of non-ASCII
   * text.
   */
  public byte[] writeCsv(List<String> header, List<List<String>> rows) {
    StringBuilder csv = new StringBuilder();
    appendRow(csv, header);
    for (List<String> row : rows) {
      appendRow(csv, row);
    }
    byte[] body = csv.toString().getBytes(StandardCharsets.UTF_8);
    byte[] result = new byte[UTF8_BOM.length + body.length];
    System.arraycopy(UTF8_BOM, 0, result, 0, UTF8_BOM.length);
    System.arraycopy(body, 0, result, UTF8_BOM.length, body.length);
    return result;
  }

  private static void appendRow(StringBuilder csv, List<String> cells) {
    for (int i = 0; i < cells.size(); i++) {
      if (i > 0) {
        csv.append(',');
      }
      csv.append(escapeCsv(cells.get(i)));
    }
    csv.append("\r\n");
  }

  static String escapeCsv(String value) {
    if (value == null) {
      return "";
    }
    boolean quote =
        value.indexOf(',') >= 0
            || value.indexOf('"') >= 0
            || value.indexOf('\n') >= 0
            || value.indexOf('\r') >= 0;
    if (!quote) {
      return value;
    }
    return "\"" + value.replace("\"", "\"\"") + "\"";
  }
}
