package com.flamingo.ai.chatstream.exception;

/** Exception thrown for a provider frame that cannot be decoded. Never leaves the relay. */
public class FrameParseException extends RuntimeException {

  private final String frame;

  public FrameParseException(String frame, Throwable cause) {
    super("Malformed provider frame", cause);
    this.frame = frame;
  }

  public String getFrame() {
    return frame;
  }
}
