package io.swapgate.backend.security;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** Single-node counter store with the same window semantics as the Redis store. */
public class InMemoryRequestCounterStore implements RequestCounterStore {
  private static final int PURGE_EVERY = 1024;

  private final Clock clock;
  private final Map<String, Window> windows = new ConcurrentHashMap<>();
  private final AtomicLong increments = new AtomicLong();

  public InMemoryRequestCounterStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public long increment(String key, Duration window) {
    Instant now = clock.instant();
    if (increments.incrementAndGet() % PURGE_EVERY == 0) {
      windows.entrySet().removeIf(e -> e.getValue().expiredAt(now));
    }
    Window updated =
        windows.compute(
            key,
            (k, current) ->
                current == null || current.expiredAt(now)
                    ? new Window(now.plus(window), 1)
                    : new Window(current.expiresAt(), current.count() + 1));
    return updated.count();
  }

  @Override
  public Optional<Duration> remaining(String key) {
    Window window = windows.get(key);
    Instant now = clock.instant();
    if (window == null || window.expiredAt(now)) return Optional.empty();
    return Optional.of(Duration.between(now, window.expiresAt()));
  }

  private record Window(Instant expiresAt, long count) {
    boolean expiredAt(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }
}
