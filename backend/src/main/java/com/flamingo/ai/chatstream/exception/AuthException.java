package com.flamingo.ai.chatstream.exception;

/** Exception thrown when credentials are missing or rejected by the provider. */
public class AuthException extends RuntimeException {

  public AuthException(String message) {
    super(message);
  }
}
