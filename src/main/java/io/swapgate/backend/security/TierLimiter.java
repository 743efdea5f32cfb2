package io.swapgate.backend.security;

import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fixed-window rate limit plus progressive slow-down for one tier. */
public class TierLimiter {
  private static final Logger log = LoggerFactory.getLogger(TierLimiter.class);
  private static final Duration DELAY_STEP = Duration.ofMillis(100);

  private final RateLimitTier tier;
  private final RequestCounterStore store;
  private final SecurityMetrics metrics;

  public TierLimiter(RateLimitTier tier, RequestCounterStore store, SecurityMetrics metrics) {
    this.tier = tier;
    this.store = store;
    this.metrics = metrics;
  }

  public RateLimitTier tier() {
    return tier;
  }

  /** Counts one request from {@code identity}. Blocking when the store is remote. */
  public RateLimitDecision check(String identity) {
    String key = key(identity);
    long count;
    try {
      count = store.increment(key, tier.window());
    } catch (RuntimeException e) {
      log.warn("rate limit store unavailable, letting request through tier={}: {}", tier.name(), e.toString());
      metrics.counterStoreUnavailable();
      return RateLimitDecision.allow(0, Duration.ZERO);
    }
    if (count > tier.maxRequests()) {
      metrics.rateLimited(tier.name());
      return RateLimitDecision.reject(count, retryAfterSeconds(key));
    }
    return RateLimitDecision.allow(count, delayFor(count));
  }

  /** Slow-down applied to the {@code count}-th request of a window. */
  public Duration delayFor(long count) {
    if (count <= tier.delayAfter()) return Duration.ZERO;
    Duration delay = DELAY_STEP.multipliedBy(count - tier.delayAfter());
    return delay.compareTo(tier.maxDelay()) > 0 ? tier.maxDelay() : delay;
  }

  private int retryAfterSeconds(String key) {
    long windowSeconds = Math.max(1, tier.window().toSeconds());
    try {
      return store.remaining(key)
          .map(d -> (int) Math.max(1, (d.toMillis() + 999) / 1000))
          .orElse((int) windowSeconds);
    } catch (RuntimeException e) {
      log.debug("could not read window ttl for {}: {}", key, e.toString());
      return (int) windowSeconds;
    }
  }

  private String key(String identity) {
    return "rl:" + tier.name().toLowerCase(Locale.ROOT) + ":" + normalizeKey(identity);
  }

  private static String normalizeKey(String value) {
    if (value == null || value.isBlank()) return "unknown";
    return value.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_\\-:.]", "_");
  }
}
