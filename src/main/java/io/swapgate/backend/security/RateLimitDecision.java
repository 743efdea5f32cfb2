package io.swapgate.backend.security;

import java.time.Duration;

public record RateLimitDecision(
    boolean allowed, long count, int retryAfterSeconds, Duration delay) {

  public static RateLimitDecision allow(long count, Duration delay) {
    return new RateLimitDecision(true, count, 0, delay);
  }

  public static RateLimitDecision reject(long count, int retryAfterSeconds) {
    return new RateLimitDecision(false, count, retryAfterSeconds, Duration.ZERO);
  }
}
