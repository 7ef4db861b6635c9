package com.flamingo.ai.chatstream.service.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.chatstream.config.StreamConfig;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/** {@code web_search} tool backed by the Valyu search API. */
@Component
@Slf4j
public class WebSearchTool implements ToolExecutor {

  static final String NAME = "web_search";
  private static final double RELEVANCE_THRESHOLD = 0.6;

  private final StreamConfig.WebSearch config;
  private final ObjectMapper objectMapper;
  private final WebClient webClient;

  public WebSearchTool(StreamConfig streamConfig, ObjectMapper objectMapper) {
    this.config = streamConfig.getTools().getWebSearch();
    this.objectMapper = objectMapper;
    this.webClient =
        WebClient.builder()
            .baseUrl(config.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    log.info("Web search tool {}", isAvailable() ? "enabled" : "disabled (no api key)");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Map<String, Object> definition() {
    Map<String, Object> query =
        Map.of("type", "string", "description", "The search query to find relevant information");
    Map<String, Object> parameters = new LinkedHashMap<>();
    parameters.put("type", "object");
    parameters.put("properties", Map.of("query", query));
    parameters.put("required", List.of("query"));

    Map<String, Object> function = new LinkedHashMap<>();
    function.put("name", NAME);
    function.put(
        "description",
        "Search the web for up-to-date information, news, documentation, or any online content. "
            + "Use this for current events, recent information, or to verify facts.");
    function.put("parameters", parameters);
    return Map.of("type", "function", "function", function);
  }

  @Override
  public boolean isAvailable() {
    return StringUtils.hasText(config.getApiKey());
  }

  @Override
  public String execute(String argumentsJson) {
    String query = readQuery(argumentsJson);
    if (!StringUtils.hasText(query)) {
      return toJson(Map.of("results", List.of(), "message", "A search query is required."));
    }
    log.debug("Running web search: {}", query);

    Map<String, Object> request = new LinkedHashMap<>();
    request.put("query", query);
    request.put("search_type", "all");
    request.put("max_num_results", config.getMaxResults());
    request.put("relevance_threshold", RELEVANCE_THRESHOLD);

    JsonNode response =
        webClient
            .post()
            .uri("/deepsearch")
            .header("x-api-key", config.getApiKey())
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(config.getTimeout())
            .block();

    if (response == null || !response.path("success").asBoolean(true)) {
      String error = response != null ? response.path("error").asText("Search failed.") : "";
      return toJson(
          Map.of("results", List.of(), "message", error.isBlank() ? "Search failed." : error));
    }
    List<Map<String, String>> results = toResults(response.path("results"));
    if (results.isEmpty()) {
      return toJson(Map.of("results", List.of(), "message", "No results found for the query."));
    }
    return toJson(Map.of("results", results));
  }

  private String readQuery(String argumentsJson) {
    try {
      return objectMapper.readTree(argumentsJson).path("query").asText("");
    } catch (JsonProcessingException e) {
      log.warn("Invalid web_search arguments: {}", argumentsJson);
      return "";
    }
  }

  private List<Map<String, String>> toResults(JsonNode results) {
    List<Map<String, String>> out = new ArrayList<>();
    Set<String> seenUrls = new LinkedHashSet<>();
    for (JsonNode result : results) {
      String url = result.path("url").asText("");
      if (!url.isEmpty() && !seenUrls.add(url)) {
        continue;
      }
      JsonNode content = result.path("content");
      Map<String, String> item = new LinkedHashMap<>();
      item.put("title", result.path("title").asText("").trim());
      item.put("url", url);
      item.put("content", content.isTextual() ? content.asText() : content.toString());
      out.add(item);
    }
    return out;
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize search result", e);
    }
  }
}
