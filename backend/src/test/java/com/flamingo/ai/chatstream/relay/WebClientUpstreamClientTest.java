package com.flamingo.ai.chatstream.relay;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.chatstream.config.StreamConfig;
import com.flamingo.ai.chatstream.exception.AuthException;
import com.flamingo.ai.chatstream.exception.RateLimitException;
import com.flamingo.ai.chatstream.exception.UpstreamProviderException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;

class WebClientUpstreamClientTest {

  private final WebClientUpstreamClient client =
      new WebClientUpstreamClient(WebClient.create(), new ObjectMapper(), new StreamConfig());

  @Test
  void shouldBuildCompletionsUri_fromVariousBaseUrls() {
    assertThat(WebClientUpstreamClient.completionsUri("https://openrouter.ai/api/v1"))
        .isEqualTo("https://openrouter.ai/api/v1/chat/completions");
    assertThat(WebClientUpstreamClient.completionsUri("https://example.com/v1/"))
        .isEqualTo("https://example.com/v1/chat/completions");
    assertThat(WebClientUpstreamClient.completionsUri("http://localhost:11434"))
        .isEqualTo("http://localhost:11434/v1/chat/completions");
    assertThat(WebClientUpstreamClient.completionsUri("https://x.test/v1/chat/completions"))
        .isEqualTo("https://x.test/v1/chat/completions");
  }

  @Test
  void shouldTranslate401ToAuthException_withProviderMessage() {
    RuntimeException error =
        client.translateError(
            HttpStatusCode.valueOf(401),
            new HttpHeaders(),
            "{\"error\":{\"message\":\"Invalid API key\"}}");

    assertThat(error).isInstanceOf(AuthException.class).hasMessage("Invalid API key");
  }

  @Test
  void shouldTranslate429ToRateLimitException_usingRetryAfterHeader() {
    HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.RETRY_AFTER, "12");

    RuntimeException error = client.translateError(HttpStatusCode.valueOf(429), headers, "");

    assertThat(error).isInstanceOf(RateLimitException.class);
    assertThat(((RateLimitException) error).getRetryAfterMs()).isEqualTo(12_000L);
  }

  @Test
  void shouldFallBackToDefaultRetryAfter_whenHeaderMissing() {
    RuntimeException error =
        client.translateError(HttpStatusCode.valueOf(429), new HttpHeaders(), "slow down");

    assertThat(((RateLimitException) error).getRetryAfterMs()).isEqualTo(30_000L);
  }

  @Test
  void shouldTranslateOtherStatusToUpstreamProviderException() {
    RuntimeException error =
        client.translateError(HttpStatusCode.valueOf(400), new HttpHeaders(), "bad model name");

    assertThat(error).isInstanceOf(UpstreamProviderException.class);
    UpstreamProviderException upstream = (UpstreamProviderException) error;
    assertThat(upstream.getStatus()).isEqualTo(400);
    assertThat(upstream.getProviderMessage()).isEqualTo("bad model name");
  }
}
