package com.flamingo.ai.chatstream.exception;

/** Exception thrown when a stream request is malformed. */
public class ValidationException extends RuntimeException {

  public ValidationException(String message) {
    super(message);
  }
}
