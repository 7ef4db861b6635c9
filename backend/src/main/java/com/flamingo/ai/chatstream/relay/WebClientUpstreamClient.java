package com.flamingo.ai.chatstream.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.chatstream.config.StreamConfig;
import com.flamingo.ai.chatstream.exception.AuthException;
import com.flamingo.ai.chatstream.exception.RateLimitException;
import com.flamingo.ai.chatstream.exception.UpstreamProviderException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

/**
 * Upstream client for OpenAI-compatible providers. Blocks only until response headers arrive; the
 * body is handed back as an unread {@link Flux} of SSE data frames.
 */
@Component
@Slf4j
public class WebClientUpstreamClient implements UpstreamClient {

  private static final int MAX_ERROR_MESSAGE_LENGTH = 500;

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final StreamConfig streamConfig;

  public WebClientUpstreamClient(
      @Qualifier("upstreamWebClient") WebClient webClient,
      ObjectMapper objectMapper,
      StreamConfig streamConfig) {
    this.webClient = webClient;
    this.objectMapper = objectMapper;
    this.streamConfig = streamConfig;
  }

  @Override
  @Timed(value = "stream.upstream.open", description = "Time until provider response headers")
  @Retry(name = "upstream")
  @CircuitBreaker(name = "upstream")
  public UpstreamConnection open(UpstreamRequest request) {
    ResolvedProvider provider = request.provider();
    log.debug("Opening upstream stream: provider={}, model={}", provider.name(), request.model());

    ResponseEntity<Flux<String>> response =
        webClient
            .post()
            .uri(completionsUri(provider.baseUrl()))
            .headers(
                headers -> {
                  headers.setBearerAuth(provider.apiKey());
                  provider.headers().forEach(headers::set);
                })
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .bodyValue(request.toBody())
            .retrieve()
            .onStatus(
                HttpStatusCode::isError,
                clientResponse ->
                    clientResponse
                        .bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(
                            body ->
                                translateError(
                                    clientResponse.statusCode(),
                                    clientResponse.headers().asHttpHeaders(),
                                    body)))
            .toEntityFlux(String.class)
            .block(streamConfig.getUpstream().getResponseTimeout());

    if (response == null || response.getBody() == null) {
      throw new UpstreamProviderException(502, "Provider returned an empty response");
    }
    log.debug("Upstream answered {} for model {}", response.getStatusCode(), request.model());
    return new UpstreamConnection(response.getStatusCode().value(), response.getBody());
  }

  RuntimeException translateError(HttpStatusCode status, HttpHeaders headers, String body) {
    String message = extractProviderMessage(body);
    int code = status.value();
    log.warn("Provider rejected stream request with {}: {}", code, message);

    if (code == 401 || code == 403) {
      return new AuthException(
          message.isBlank() ? "Provider rejected the supplied credentials" : message);
    }
    if (code == 429) {
      return new RateLimitException(
          message.isBlank() ? "Provider rate limit exceeded" : message, retryAfterMs(headers));
    }
    return new UpstreamProviderException(
        code, message.isBlank() ? "Provider returned status " + code : message);
  }

  private String extractProviderMessage(String body) {
    if (body == null || body.isBlank()) {
      return "";
    }
    try {
      JsonNode root = objectMapper.readTree(body);
      JsonNode error = root.path("error");
      if (error.isObject() && error.hasNonNull("message")) {
        return error.get("message").asText();
      }
      if (error.isTextual()) {
        return error.asText();
      }
      if (root.hasNonNull("message")) {
        return root.get("message").asText();
      }
    } catch (Exception e) {
      log.debug("Provider error body is not JSON: {}", e.getMessage());
    }
    return body.length() > MAX_ERROR_MESSAGE_LENGTH
        ? body.substring(0, MAX_ERROR_MESSAGE_LENGTH)
        : body;
  }

  private long retryAfterMs(HttpHeaders headers) {
    String retryAfter = headers.getFirst(HttpHeaders.RETRY_AFTER);
    if (retryAfter != null) {
      try {
        return Duration.ofSeconds(Long.parseLong(retryAfter.trim())).toMillis();
      } catch (NumberFormatException e) {
        log.debug("Ignoring non-numeric Retry-After header: {}", retryAfter);
      }
    }
    return streamConfig.getUpstream().getDefaultRetryAfter().toMillis();
  }

  static String completionsUri(String baseUrl) {
    String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    String normalized = trimmed.toLowerCase(Locale.ROOT);
    if (normalized.endsWith("/chat/completions")) {
      return trimmed;
    }
    if (normalized.endsWith("/v1")) {
      return trimmed + "/chat/completions";
    }
    return trimmed + "/v1/chat/completions";
  }
}
