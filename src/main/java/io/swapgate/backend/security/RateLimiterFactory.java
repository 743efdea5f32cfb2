package io.swapgate.backend.security;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class RateLimiterFactory {
  private final SecurityProperties properties;
  private final RequestCounterStore store;
  private final SecurityMetrics metrics;
  private final Map<String, TierLimiter> limiters = new ConcurrentHashMap<>();

  public RateLimiterFactory(
      SecurityProperties properties, RequestCounterStore store, SecurityMetrics metrics) {
    this.properties = properties;
    this.store = store;
    this.metrics = metrics;
  }

  /** Limiter for a configured tier; unknown names throw {@link IllegalArgumentException}. */
  public TierLimiter forTier(String tierName) {
    String name = tierName.toUpperCase(Locale.ROOT);
    return limiters.computeIfAbsent(
        name, n -> new TierLimiter(properties.rateLimitTier(n), store, metrics));
  }
}
