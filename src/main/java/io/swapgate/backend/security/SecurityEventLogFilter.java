package io.swapgate.backend.security;

import io.swapgate.backend.util.ClientIpResolver;
import java.time.Clock;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/** Logs rejected requests (401, 403, 429) when the response is committed. */
@Component
public class SecurityEventLogFilter implements WebFilter, Ordered {
  private static final Logger log = LoggerFactory.getLogger(SecurityEventLogFilter.class);
  private static final Set<Integer> WATCHED = Set.of(401, 403, 429);

  private final SecurityMetrics metrics;
  private final Clock clock;

  public SecurityEventLogFilter(SecurityMetrics metrics, Clock clock) {
    this.metrics = metrics;
    this.clock = clock;
  }

  @Override
  public int getOrder() {
    return Ordered.HIGHEST_PRECEDENCE;
  }

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    long start = clock.millis();
    exchange
        .getResponse()
        .beforeCommit(
            () -> {
              record(exchange, start);
              return Mono.empty();
            });
    return chain.filter(exchange);
  }

  private void record(ServerWebExchange exchange, long start) {
    HttpStatusCode status = exchange.getResponse().getStatusCode();
    if (status == null || !WATCHED.contains(status.value())) return;
    ServerHttpRequest request = exchange.getRequest();
    SecurityEvent event =
        new SecurityEvent(
            SecurityEvent.reasonFor(status.value()),
            request.getMethod().name(),
            request.getPath().value(),
            status.value(),
            ClientIpResolver.resolve(request),
            request.getHeaders().getFirst(HttpHeaders.USER_AGENT),
            clock.millis() - start);
    log.warn("security event {}", event);
    metrics.securityEvent(status.value());
  }
}
