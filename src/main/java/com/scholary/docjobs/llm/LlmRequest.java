package com.scholary.docjobs.llm;

import java.util.ArrayList;
import java.util.List;

/** A chat-style request to an LLM provider. */
public record LlmRequest(String model, List<ChatMessage> messages, List<Attachment> attachments) {

  public LlmRequest {
    messages = List.copyOf(messages);
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
  }

  public static LlmRequest of(String model, String systemPrompt, String userText) {
    List<ChatMessage> messages = new ArrayList<>();
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      messages.add(ChatMessage.system(systemPrompt));
    }
    messages.add(ChatMessage.user(userText));
    return new LlmRequest(model, messages, List.of());
  }

  /** A binary attachment sent alongside the messages (base64 on the wire). */
  public record Attachment(String filename, String contentType, byte[] bytes) {}
}
