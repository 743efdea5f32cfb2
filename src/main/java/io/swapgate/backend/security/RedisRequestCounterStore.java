package io.swapgate.backend.security;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.springframework.data.redis.core.StringRedisTemplate;

public class RedisRequestCounterStore implements RequestCounterStore {
  private final StringRedisTemplate redis;

  public RedisRequestCounterStore(StringRedisTemplate redis) {
    this.redis = redis;
  }

  @Override
  public long increment(String key, Duration window) {
    Long count = redis.opsForValue().increment(key);
    if (count == null) {
      throw new IllegalStateException("redis INCR returned no value for " + key);
    }
    if (count == 1L) {
      redis.expire(key, window);
    } else {
      // a crash between INCR and EXPIRE leaves a key that never resets
      Long ttl = redis.getExpire(key, TimeUnit.SECONDS);
      if (ttl != null && ttl == -1L) {
        redis.expire(key, window);
      }
    }
    return count;
  }

  @Override
  public Optional<Duration> remaining(String key) {
    Long ttl = redis.getExpire(key, TimeUnit.SECONDS);
    if (ttl == null || ttl < 1) return Optional.empty();
    return Optional.of(Duration.ofSeconds(ttl));
  }
}
