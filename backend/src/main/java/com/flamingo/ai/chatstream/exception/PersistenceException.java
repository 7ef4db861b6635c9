package com.flamingo.ai.chatstream.exception;

/** Exception thrown when a message or stream write to the datastore fails. */
public class PersistenceException extends RuntimeException {

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
