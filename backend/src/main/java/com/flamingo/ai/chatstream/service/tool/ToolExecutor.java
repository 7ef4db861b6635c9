package com.flamingo.ai.chatstream.service.tool;

import java.util.Map;

/** A tool the model may call during a multi-step generation. */
public interface ToolExecutor {

  /** Function name the model uses. */
  String name();

  /** OpenAI-compatible {@code {"type":"function", ...}} definition. */
  Map<String, Object> definition();

  /** Whether the tool is configured and usable. */
  boolean isAvailable();

  /**
   * Runs the tool.
   *
   * @param argumentsJson arguments as produced by the model
   * @return text result fed back to the model
   */
  String execute(String argumentsJson);
}
