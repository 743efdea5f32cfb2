package io.swapgate.backend.security;

import java.time.Duration;

public record RateLimitTier(
    String name, Duration window, int maxRequests, int delayAfter, Duration maxDelay) {}
