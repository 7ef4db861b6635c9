package com.flamingo.ai.chatstream.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for stream relay, buffering and resume. */
@Configuration
@ConfigurationProperties(prefix = "stream")
@Getter
@Setter
public class StreamConfig {

  /** What happens to the generation when the originating client goes away. */
  private DisconnectPolicy disconnectPolicy = DisconnectPolicy.INTERRUPT;

  /** A STREAMING session not updated for this long is considered orphaned. */
  private Duration staleAfter = Duration.ofMinutes(5);

  /** How often orphaned STREAMING sessions are looked for. */
  private Duration reaperInterval = Duration.ofMinutes(1);

  private Buffer buffer = new Buffer();
  private Checkpoint checkpoint = new Checkpoint();
  private Resume resume = new Resume();
  private Channel channel = new Channel();
  private Upstream upstream = new Upstream();
  private Tools tools = new Tools();
  private RateLimit rateLimit = new RateLimit();
  private Map<String, Provider> providers = new LinkedHashMap<>();

  /** Behaviour on client disconnect. */
  public enum DisconnectPolicy {
    /** Cancel the upstream generation and mark the message interrupted. */
    INTERRUPT,

    /** Keep generating in the background; the client may resume later. */
    CONTINUE
  }

  @Getter
  @Setter
  public static class Buffer {
    /** jdbc (shared table) or memory (single process only). */
    private String backend = "jdbc";

    private Duration retentionCompleted = Duration.ofHours(1);
    private Duration retentionFailed = Duration.ofMinutes(10);
    private Duration sweepInterval = Duration.ofMinutes(1);
    private int readBatchSize = 200;
  }

  @Getter
  @Setter
  public static class Checkpoint {
    private int everyDeltas = 5;
  }

  @Getter
  @Setter
  public static class Resume {
    private Duration pollInterval = Duration.ofMillis(50);
    private Duration keepalive = Duration.ofSeconds(15);
    private Duration maxDuration = Duration.ofMinutes(5);
  }

  @Getter
  @Setter
  public static class Channel {
    /** Prefetch between the upstream reader and the writer, and the live client buffer. */
    private int capacity = 256;
  }

  @Getter
  @Setter
  public static class Upstream {
    private Duration maxDuration = Duration.ofMinutes(5);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration responseTimeout = Duration.ofSeconds(60);
    private Duration defaultRetryAfter = Duration.ofSeconds(30);
  }

  @Getter
  @Setter
  public static class Tools {
    private int defaultMaxSteps = 5;
    private int maxStepsCeiling = 10;
    private WebSearch webSearch = new WebSearch();
  }

  @Getter
  @Setter
  public static class WebSearch {
    private String baseUrl = "https://api.valyu.network/v1";
    private String apiKey = "";
    private int maxResults = 5;
    private Duration timeout = Duration.ofSeconds(20);
  }

  @Getter
  @Setter
  public static class RateLimit {
    private boolean enabled = true;
    private int limitForPeriod = 20;
    private Duration refreshPeriod = Duration.ofMinutes(1);

    /** Buckets unused for this long are dropped; never shorter than the refresh period. */
    private Duration idleEviction = Duration.ofMinutes(10);

    private long maxBuckets = 100_000;
  }

  @Getter
  @Setter
  public static class Provider {
    private String baseUrl = "https://openrouter.ai/api/v1";

    /** Server-side key used when the caller does not supply one. */
    private String apiKey = "";

    /** Caller must send its own credential material. */
    private boolean requiresCallerCredential = false;

    private Map<String, String> headers = new LinkedHashMap<>();
  }
}
