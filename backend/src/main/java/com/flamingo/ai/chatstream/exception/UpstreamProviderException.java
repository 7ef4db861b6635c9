package com.flamingo.ai.chatstream.exception;

/** Exception thrown when the model provider answers with an error status. */
public class UpstreamProviderException extends RuntimeException {

  private final int status;
  private final String providerMessage;

  public UpstreamProviderException(int status, String providerMessage) {
    super("Provider returned " + status + ": " + providerMessage);
    this.status = status;
    this.providerMessage = providerMessage;
  }

  public UpstreamProviderException(String message, Throwable cause) {
    super(message, cause);
    this.status = 502;
    this.providerMessage = "Upstream provider is unavailable. Please try again later.";
  }

  public int getStatus() {
    return status;
  }

  public String getProviderMessage() {
    return providerMessage;
  }
}
