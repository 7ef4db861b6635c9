package com.flamingo.ai.chatstream.api.dto.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.chatstream.buffer.StreamEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one SSE stream event. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamEventResponse {

  public static final String TEXT = "text";
  public static final String REASONING = "reasoning";
  public static final String DONE = "done";
  public static final String ERROR = "error";

  /** Event type: text, reasoning, done, error. */
  private String type;

  /** Delta text, or the error description for error events. */
  private String text;

  /** Buffer offset of this event; a reconnecting client sends the last one back as lastId. */
  @JsonFormat(shape = JsonFormat.Shape.STRING)
  private Long id;

  /** Creates a text event. */
  public static StreamEventResponse text(String text, long offset) {
    return StreamEventResponse.builder().type(TEXT).text(text).id(offset).build();
  }

  /** Creates a reasoning event. */
  public static StreamEventResponse reasoning(String text, long offset) {
    return StreamEventResponse.builder().type(REASONING).text(text).id(offset).build();
  }

  /** Creates a done event. The offset is null when no terminal entry was buffered. */
  public static StreamEventResponse done(Long offset) {
    return StreamEventResponse.builder().type(DONE).id(offset).build();
  }

  /** Creates an error event. */
  public static StreamEventResponse error(String message, Long offset) {
    return StreamEventResponse.builder().type(ERROR).text(message).id(offset).build();
  }

  /** Converts a buffered entry into the event the live client received for it. */
  public static StreamEventResponse fromEntry(StreamEntry entry) {
    return switch (entry.kind()) {
      case TEXT -> text(entry.payload(), entry.offset());
      case REASONING -> reasoning(entry.payload(), entry.offset());
      case DONE -> done(entry.offset());
      case ERROR -> error(entry.payload(), entry.offset());
    };
  }
}
