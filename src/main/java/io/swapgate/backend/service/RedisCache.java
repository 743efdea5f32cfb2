package io.swapgate.backend.service;

import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/** Best-effort string cache; a Redis outage degrades to cache misses. */
@Component
public class RedisCache {
  private static final Logger log = LoggerFactory.getLogger(RedisCache.class);
  private final StringRedisTemplate redis;

  public RedisCache(StringRedisTemplate redis) {
    this.redis = redis;
  }

  public Optional<String> get(String key) {
    try {
      String v = redis.opsForValue().get(key);
      return Optional.ofNullable(v);
    } catch (Exception e) {
      log.debug("cache read failed for key={}: {}", key, e.toString());
      return Optional.empty();
    }
  }

  public void set(String key, String value, long ttlSeconds) {
    if (key == null || value == null) return;
    try {
      redis.opsForValue().set(key, value, Duration.ofSeconds(Math.max(1, ttlSeconds)));
    } catch (Exception e) {
      log.debug("cache write failed for key={}: {}", key, e.toString());
    }
  }
}
