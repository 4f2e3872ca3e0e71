package com.scholary.docjobs.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for an OpenAI-compatible chat-completions API.
 *
 * <p>Builds the JSON body, sends it with the JDK {@link HttpClient} and extracts the completion
 * text and the total token count. One call per invocation; the worker decides whether to retry.
 */
@Component
public class OpenAiCompatibleLlmClient implements LlmService {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiCompatibleLlmClient.class);

  private final HttpClient httpClient;
  private final LlmProperties properties;
  private final ObjectMapper objectMapper;

  public OpenAiCompatibleLlmClient(LlmProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized LLM client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public LlmResponse execute(LlmRequest request) {
    String body = buildBody(request);

    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/chat/completions"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body));
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.apiKey());
    }

    LOGGER.debug(
        "Sending chat request: model={}, messages={}, attachments={}",
        request.model(),
        request.messages().size(),
        request.attachments().size());

    HttpResponse<String> response;
    try {
      response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new LlmProviderException("LLM request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LlmProviderException("LLM request interrupted", e);
    }

    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new LlmProviderException(
          String.format(
              "LLM provider returned status %d: %s",
              response.statusCode(), abbreviate(response.body())),
          response.statusCode());
    }

    return parseResponse(response.body());
  }

  /**
   * Build the request body.
   *
   * <pre>
   * {
   *   "model": "...",
   *   "messages": [
   *     {"role": "system", "content": "..."},
   *     {"role": "user", "content": [{"type": "text", "text": "..."}, {"type": "file", ...}]}
   *   ]
   * }
   * </pre>
   *
   * <p>Attachments ride on the last user message as data URLs.
   */
  String buildBody(LlmRequest request) {
    ObjectNode root = objectMapper.createObjectNode();
    root.put("model", request.model());
    ArrayNode messages = root.putArray("messages");

    int lastUser = -1;
    for (int i = 0; i < request.messages().size(); i++) {
      if (request.messages().get(i).role() == ChatMessage.Role.USER) {
        lastUser = i;
      }
    }

    for (int i = 0; i < request.messages().size(); i++) {
      ChatMessage message = request.messages().get(i);
      ObjectNode node = messages.addObject();
      node.put("role", message.role().wireName());
      if (i == lastUser && !request.attachments().isEmpty()) {
        ArrayNode parts = node.putArray("content");
        parts.addObject().put("type", "text").put("text", message.text());
        for (LlmRequest.Attachment attachment : request.attachments()) {
          appendAttachment(parts, attachment);
        }
      } else {
        node.put("content", message.text());
      }
    }

    try {
      return objectMapper.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize LLM request", e);
    }
  }

  private void appendAttachment(ArrayNode parts, LlmRequest.Attachment attachment) {
    String dataUrl =
        "data:"
            + attachment.contentType()
            + ";base64,"
            + Base64.getEncoder().encodeToString(attachment.bytes());
    if (attachment.contentType().startsWith("image/")) {
      ObjectNode part = parts.addObject();
      part.put("type", "image_url");
      part.putObject("image_url").put("url", dataUrl);
    } else {
      ObjectNode part = parts.addObject();
      part.put("type", "file");
      part.putObject("file").put("filename", attachment.filename()).put("file_data", dataUrl);
    }
  }

  LlmResponse parseResponse(String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new LlmParseException("LLM provider returned invalid JSON", e);
    }

    JsonNode content = root.path("choices").path(0).path("message").path("content");
    if (!content.isTextual() || content.asText().isBlank()) {
      throw new LlmParseException("LLM provider returned an empty completion");
    }

    long tokens = root.path("usage").path("total_tokens").asLong(0);
    return new LlmResponse(content.asText(), tokens, body);
  }

  private static String abbreviate(String text) {
    if (text == null) {
      return "";
    }
    return text.length() <= 500 ? text : text.substring(0, 500) + "...";
  }
}
