package com.flamingo.ai.chatstream.api.dto.request;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One conversation message sent by the client. Either content or text parts must be present. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageInput {

  /** user, assistant or system. */
  private String role;

  private String content;

  private List<Part> parts;

  /** Message part. Only {@code text} parts are forwarded upstream. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Part {
    private String type;
    private String text;
  }

  /** Text sent upstream: the content, or the text parts joined when content is blank. */
  public String resolveText() {
    if (content != null && !content.isBlank()) {
      return content;
    }
    if (parts == null) {
      return "";
    }
    StringBuilder text = new StringBuilder();
    for (Part part : parts) {
      if (part != null && "text".equals(part.getType()) && part.getText() != null) {
        text.append(part.getText());
      }
    }
    return text.toString();
  }
}
