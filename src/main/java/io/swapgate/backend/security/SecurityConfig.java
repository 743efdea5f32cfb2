package io.swapgate.backend.security;

import java.time.Clock;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsConfigurationSource;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

@Configuration
public class SecurityConfig {

  @Bean
  @ConditionalOnProperty(
      name = "app.security.counter-store",
      havingValue = "redis",
      matchIfMissing = true)
  public RequestCounterStore redisRequestCounterStore(StringRedisTemplate redis) {
    return new RedisRequestCounterStore(redis);
  }

  @Bean
  @ConditionalOnProperty(name = "app.security.counter-store", havingValue = "memory")
  public RequestCounterStore inMemoryRequestCounterStore(Clock clock) {
    return new InMemoryRequestCounterStore(clock);
  }

  @Bean
  public CorsWebFilter corsWebFilter(OriginPolicy originPolicy) {
    return new OrderedCorsWebFilter(corsConfigurationSource(originPolicy));
  }

  static CorsConfigurationSource corsConfigurationSource(OriginPolicy originPolicy) {
    CorsConfiguration config = new OriginPolicyCorsConfiguration(originPolicy);
    config.setAllowCredentials(true);
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
    config.setAllowedHeaders(
        List.of(
            "Content-Type",
            "Authorization",
            "X-Requested-With",
            SignatureVerifier.SIGNATURE_HEADER,
            SignatureVerifier.TIMESTAMP_HEADER));
    config.setExposedHeaders(List.of("Retry-After", "X-Quote-Source"));
    config.setMaxAge(86400L);

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }

  /** Delegates origin decisions to {@link OriginPolicy} so suffix rules apply. */
  static class OriginPolicyCorsConfiguration extends CorsConfiguration {
    private final OriginPolicy originPolicy;

    OriginPolicyCorsConfiguration(OriginPolicy originPolicy) {
      this.originPolicy = originPolicy;
    }

    @Override
    public String checkOrigin(String origin) {
      if (origin == null || origin.isBlank()) return null;
      return originPolicy.isAllowed(origin) ? origin : null;
    }
  }

  /** Runs after the gateway so rejected origins are still rate limited. */
  static class OrderedCorsWebFilter extends CorsWebFilter implements Ordered {
    OrderedCorsWebFilter(CorsConfigurationSource source) {
      super(source);
    }

    @Override
    public int getOrder() {
      return SecurityGatewayFilter.ORDER + 10;
    }
  }
}
