package com.scholary.docjobs.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatibleLlmClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private HttpServer server;

  @AfterEach
  void tearDown() {
    if (server != null) {
      server.stop(0);
    }
  }

  private OpenAiCompatibleLlmClient client(String baseUrl) {
    return new OpenAiCompatibleLlmClient(new LlmProperties(baseUrl, "secret", 2, 5), objectMapper);
  }

  /** Serves one canned answer on /v1/chat/completions and captures the request. */
  private String serve(int status, String body, AtomicReference<String> captured)
      throws Exception {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/v1/chat/completions",
        exchange -> {
          captured.set(
              exchange.getRequestHeaders().getFirst("Authorization")
                  + "\n"
                  + new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(status, bytes.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
          }
        });
    server.start();
    return "http://127.0.0.1:" + server.getAddress().getPort() + "/v1";
  }

  @Test
  void buildBody_shouldSendSystemAndUserMessages() throws Exception {
    String body =
        client("http://localhost/v1")
            .buildBody(LlmRequest.of("openrouter/openai/gpt-4o-mini", "Be brief.", "Summarize"));

    JsonNode root = objectMapper.readTree(body);
    assertThat(root.get("model").asText()).isEqualTo("openrouter/openai/gpt-4o-mini");
    assertThat(root.get("messages")).hasSize(2);
    assertThat(root.get("messages").get(0).get("role").asText()).isEqualTo("system");
    assertThat(root.get("messages").get(1).get("content").asText()).isEqualTo("Summarize");
  }

  @Test
  void buildBody_shouldAttachFilesToLastUserMessage() throws Exception {
    LlmRequest request =
        new LlmRequest(
            "model",
            List.of(ChatMessage.user("Review this")),
            List.of(
                new LlmRequest.Attachment(
                    "paper.pdf", "application/pdf", "%PDF".getBytes(StandardCharsets.UTF_8))));

    JsonNode content =
        objectMapper.readTree(client("http://localhost/v1").buildBody(request))
            .get("messages")
            .get(0)
            .get("content");

    assertThat(content.get(0).get("text").asText()).isEqualTo("Review this");
    assertThat(content.get(1).get("type").asText()).isEqualTo("file");
    assertThat(content.get(1).get("file").get("file_data").asText())
        .startsWith("data:application/pdf;base64,");
  }

  @Test
  void parseResponse_shouldReadCompletionAndTokens() {
    LlmResponse response =
        client("http://localhost/v1")
            .parseResponse(
                "{\"choices\":[{\"message\":{\"content\":\"Done.\"}}],"
                    + "\"usage\":{\"total_tokens\":1234}}");

    assertThat(response.text()).isEqualTo("Done.");
    assertThat(response.tokensUsed()).isEqualTo(1234);
  }

  @Test
  void parseResponse_shouldRejectEmptyCompletion() {
    assertThatThrownBy(
            () ->
                client("http://localhost/v1")
                    .parseResponse("{\"choices\":[{\"message\":{\"content\":\"  \"}}]}"))
        .isInstanceOf(LlmParseException.class);
    assertThatThrownBy(() -> client("http://localhost/v1").parseResponse("<html>"))
        .isInstanceOf(LlmParseException.class);
  }

  @Test
  void execute_shouldPostToChatCompletions() throws Exception {
    AtomicReference<String> captured = new AtomicReference<>();
    String baseUrl =
        serve(
            200,
            "{\"choices\":[{\"message\":{\"content\":\"ok\"}}],\"usage\":{\"total_tokens\":7}}",
            captured);

    LlmResponse response = client(baseUrl).execute(LlmRequest.of("m", null, "hi"));

    assertThat(response.text()).isEqualTo("ok");
    assertThat(response.tokensUsed()).isEqualTo(7);
    assertThat(captured.get()).startsWith("Bearer secret\n").contains("\"content\":\"hi\"");
  }

  @Test
  void execute_shouldReportProviderStatus() throws Exception {
    String baseUrl = serve(503, "{\"error\":\"overloaded\"}", new AtomicReference<>());

    assertThatThrownBy(() -> client(baseUrl).execute(LlmRequest.of("m", null, "hi")))
        .isInstanceOf(LlmProviderException.class)
        .hasMessageContaining("503")
        .satisfies(e -> assertThat(((LlmProviderException) e).getStatusCode()).isEqualTo(503));
  }
}
