package com.flamingo.ai.chatstream.service.ratelimit;

import com.flamingo.ai.chatstream.config.StreamConfig;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.internal.AtomicRateLimiter;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Rate-limit gate with one Resilience4j limiter per bucket. Buckets are held in a Caffeine cache
 * and leave the registry once idle, so the number of limiters tracks active callers only.
 */
@Component
@Slf4j
public class Resilience4jRateLimitGate implements RateLimitGate {

  private static final String LIMITER_PREFIX = "stream-start:";

  private final RateLimiterRegistry rateLimiterRegistry;
  private final RateLimiterConfig limiterConfig;
  private final Cache<String, RateLimiter> buckets;
  private final boolean enabled;

  @Autowired
  public Resilience4jRateLimitGate(
      RateLimiterRegistry rateLimiterRegistry, StreamConfig streamConfig) {
    this(rateLimiterRegistry, streamConfig, Ticker.systemTicker());
  }

  Resilience4jRateLimitGate(
      RateLimiterRegistry rateLimiterRegistry, StreamConfig streamConfig, Ticker ticker) {
    StreamConfig.RateLimit rateLimit = streamConfig.getRateLimit();
    this.rateLimiterRegistry = rateLimiterRegistry;
    this.enabled = rateLimit.isEnabled();
    this.limiterConfig =
        RateLimiterConfig.custom()
            .limitForPeriod(rateLimit.getLimitForPeriod())
            .limitRefreshPeriod(rateLimit.getRefreshPeriod())
            .timeoutDuration(Duration.ZERO)
            .build();
    // Dropping a bucket before its window refreshes would hand the caller a fresh quota.
    Duration idle =
        rateLimit.getIdleEviction().compareTo(rateLimit.getRefreshPeriod()) < 0
            ? rateLimit.getRefreshPeriod()
            : rateLimit.getIdleEviction();
    this.buckets =
        Caffeine.newBuilder()
            .expireAfterAccess(idle)
            .maximumSize(rateLimit.getMaxBuckets())
            .ticker(ticker)
            .executor(Runnable::run)
            .<String, RateLimiter>removalListener(
                (name, limiter, cause) -> {
                  if (name != null) {
                    rateLimiterRegistry.remove(name);
                  }
                })
            .build();
  }

  @Override
  public RateLimitDecision checkAndConsume(String bucketKey) {
    if (!enabled) {
      return RateLimitDecision.allow();
    }
    RateLimiter limiter =
        buckets.get(
            LIMITER_PREFIX + bucketKey,
            name -> rateLimiterRegistry.rateLimiter(name, limiterConfig));
    if (limiter.acquirePermission()) {
      return RateLimitDecision.allow();
    }
    long retryAfterMs = retryAfterMs(limiter);
    log.debug("Bucket {} rate limited, retry in {} ms", bucketKey, retryAfterMs);
    return RateLimitDecision.deny(retryAfterMs);
  }

  /** Evicts idle buckets even when no request touches the cache. */
  @Scheduled(fixedDelayString = "${stream.rate-limit.idle-eviction:PT10M}")
  public void evictIdleBuckets() {
    buckets.cleanUp();
  }

  private long retryAfterMs(RateLimiter limiter) {
    if (limiter instanceof AtomicRateLimiter atomic) {
      long nanos = atomic.getDetailedMetrics().getNanosToWait();
      if (nanos > 0) {
        return Duration.ofNanos(nanos).toMillis();
      }
    }
    return limiter.getRateLimiterConfig().getLimitRefreshPeriod().toMillis();
  }
}
