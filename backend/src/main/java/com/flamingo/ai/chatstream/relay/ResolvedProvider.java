package com.flamingo.ai.chatstream.relay;

import java.util.Map;

/**
 * Provider endpoint and the credential chosen for one request.
 *
 * @param name provider selector as sent by the client
 * @param baseUrl OpenAI-compatible base URL
 * @param apiKey bearer credential (caller's own or the server's)
 * @param headers extra headers sent with every call
 */
public record ResolvedProvider(
    String name, String baseUrl, String apiKey, Map<String, String> headers) {

  @Override
  public String toString() {
    return "ResolvedProvider[name=" + name + ", baseUrl=" + baseUrl + "]";
  }
}
