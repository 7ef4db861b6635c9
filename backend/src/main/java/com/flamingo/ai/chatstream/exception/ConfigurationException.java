package com.flamingo.ai.chatstream.exception;

/** Exception thrown when the server is missing configuration it needs to serve a request. */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }
}
