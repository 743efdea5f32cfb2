package io.swapgate.backend.security;

import java.time.Duration;
import java.util.Optional;

/**
 * Atomic fixed-window counters. A window opens on the first increment of a key and the key
 * resets once the window has elapsed.
 */
public interface RequestCounterStore {

  /** Increments the counter for {@code key}, opening a new window when none is active. */
  long increment(String key, Duration window);

  /** Time left in the active window of {@code key}, when the store knows it. */
  Optional<Duration> remaining(String key);
}
