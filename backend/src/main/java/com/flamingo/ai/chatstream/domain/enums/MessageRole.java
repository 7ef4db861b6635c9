package com.flamingo.ai.chatstream.domain.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Author of a message in a stream request or a stored chat. The lower-case wire name is what
 * clients send and what the provider's chat completions API expects.
 */
public enum MessageRole {
  USER,
  ASSISTANT,
  SYSTEM;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Looks up a role by its exact wire name; case matters. */
  public static Optional<MessageRole> fromWireName(String value) {
    return Arrays.stream(values()).filter(role -> role.wireName().equals(value)).findFirst();
  }
}
