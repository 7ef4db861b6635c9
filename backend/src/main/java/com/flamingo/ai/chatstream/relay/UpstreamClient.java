package com.flamingo.ai.chatstream.relay;

/** Opens streaming calls to the model provider. */
public interface UpstreamClient {

  /**
   * Sends the request and waits for the response headers. Error statuses are translated before
   * any body is read, so callers can fail the request without side effects.
   *
   * @throws com.flamingo.ai.chatstream.exception.AuthException on 401 or 403
   * @throws com.flamingo.ai.chatstream.exception.RateLimitException on 429
   * @throws com.flamingo.ai.chatstream.exception.UpstreamProviderException on other errors
   */
  UpstreamConnection open(UpstreamRequest request);
}
