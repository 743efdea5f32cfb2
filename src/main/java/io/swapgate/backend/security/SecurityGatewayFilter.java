package io.swapgate.backend.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swapgate.backend.error.ApiException;
import io.swapgate.backend.util.ClientIpResolver;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpRequestDecorator;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Request-defense stages for {@code /api/**}: rate limit, slow-down, response headers, input
 * sanitizing and, on routes that ask for it, HMAC signature checks. Origin checks run later in
 * the CORS filter.
 */
@Component
public class SecurityGatewayFilter implements WebFilter, Ordered {
  private static final Logger log = LoggerFactory.getLogger(SecurityGatewayFilter.class);

  public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 10;
  static final String API_PREFIX = "/api/";
  static final int MAX_BODY_BYTES = 10 * 1024 * 1024;
  private static final Set<HttpMethod> BODY_METHODS =
      Set.of(HttpMethod.POST, HttpMethod.PUT, HttpMethod.PATCH, HttpMethod.DELETE);

  private final SecurityProperties properties;
  private final RateLimiterFactory limiters;
  private final InputSanitizer sanitizer;
  private final SignatureVerifier signatureVerifier;
  private final ObjectMapper objectMapper;
  private final SecurityMetrics metrics;
  private final Clock clock;

  public SecurityGatewayFilter(
      SecurityProperties properties,
      RateLimiterFactory limiters,
      InputSanitizer sanitizer,
      SignatureVerifier signatureVerifier,
      ObjectMapper objectMapper,
      SecurityMetrics metrics,
      Clock clock) {
    this.properties = properties;
    this.limiters = limiters;
    this.sanitizer = sanitizer;
    this.signatureVerifier = signatureVerifier;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
    this.clock = clock;
  }

  @Override
  public int getOrder() {
    return ORDER;
  }

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    SecurityHeaders.apply(exchange.getResponse());
    String path = exchange.getRequest().getPath().pathWithinApplication().value();
    if (!path.startsWith(API_PREFIX)) {
      return chain.filter(exchange);
    }
    SecurityProperties.Route route = properties.resolveRoute(path);
    if (route.getTier() == null || route.getTier().isBlank()) {
      return sanitizeAndVerify(exchange, chain, route);
    }
    TierLimiter limiter = limiters.forTier(route.getTier());
    String identity = ClientIpResolver.resolve(exchange.getRequest());
    return Mono.fromCallable(() -> limiter.check(identity))
        .subscribeOn(Schedulers.boundedElastic())
        .flatMap(
            decision -> {
              if (!decision.allowed()) {
                log.debug(
                    "rate limited tier={} identity={} count={}",
                    limiter.tier().name(),
                    identity,
                    decision.count());
                return rateLimited(exchange, decision);
              }
              Mono<Void> next = Mono.defer(() -> sanitizeAndVerify(exchange, chain, route));
              if (decision.delay().isZero()) return next;
              return Mono.delay(decision.delay()).then(next);
            });
  }

  private Mono<Void> sanitizeAndVerify(
      ServerWebExchange exchange, WebFilterChain chain, SecurityProperties.Route route) {
    ServerHttpRequest request = sanitizeQuery(exchange.getRequest());
    if (!hasJsonBody(request)) {
      if (route.isSignatureRequired()) {
        try {
          verifySignature(request, "{}");
        } catch (ApiException e) {
          return unauthorized(exchange, e);
        }
      }
      return chain.filter(exchange.mutate().request(request).build());
    }
    return DataBufferUtils.join(request.getBody(), MAX_BODY_BYTES)
        .map(SecurityGatewayFilter::drain)
        .defaultIfEmpty(new byte[0])
        .flatMap(
            raw -> {
              byte[] body = sanitizeBody(raw);
              if (route.isSignatureRequired()) {
                String serialized = body.length == 0 ? "{}" : new String(body, StandardCharsets.UTF_8);
                try {
                  verifySignature(request, serialized);
                } catch (ApiException e) {
                  return unauthorized(exchange, e);
                }
              }
              ServerHttpRequest decorated = withBody(request, body, exchange);
              return chain.filter(exchange.mutate().request(decorated).build());
            })
        .onErrorResume(
            DataBufferLimitException.class,
            e ->
                writeError(
                    exchange.getResponse(),
                    HttpStatus.PAYLOAD_TOO_LARGE,
                    errorBody("Request entity too large")));
  }

  private void verifySignature(ServerHttpRequest request, String serializedBody) {
    try {
      signatureVerifier.verify(
          serializedBody,
          request.getHeaders().getFirst(SignatureVerifier.SIGNATURE_HEADER),
          request.getHeaders().getFirst(SignatureVerifier.TIMESTAMP_HEADER));
    } catch (ApiException e) {
      metrics.signatureRejected(e.getCode().name());
      throw e;
    }
  }

  ServerHttpRequest sanitizeQuery(ServerHttpRequest request) {
    MultiValueMap<String, String> query = request.getQueryParams();
    if (query.isEmpty()) return request;
    MultiValueMap<String, String> cleaned = sanitizer.sanitize(query);
    if (cleaned.equals(query)) return request;
    MultiValueMap<String, String> encoded = new LinkedMultiValueMap<>();
    cleaned.forEach(
        (key, values) ->
            values.forEach(
                v ->
                    encoded.add(
                        UriUtils.encodeQueryParam(key, StandardCharsets.UTF_8),
                        v == null ? null : UriUtils.encodeQueryParam(v, StandardCharsets.UTF_8))));
    URI uri =
        UriComponentsBuilder.fromUri(request.getURI())
            .replaceQueryParams(encoded)
            .build(true)
            .toUri();
    return request.mutate().uri(uri).build();
  }

  private byte[] sanitizeBody(byte[] raw) {
    if (raw.length == 0) return raw;
    try {
      JsonNode tree = objectMapper.readTree(raw);
      if (tree == null || tree.isMissingNode()) return raw;
      return objectMapper.writeValueAsBytes(sanitizer.sanitize(tree));
    } catch (IOException e) {
      // malformed JSON goes through unchanged and is rejected by the handler's decoder
      log.debug("request body is not valid JSON: {}", e.getMessage());
      return raw;
    }
  }

  private static boolean hasJsonBody(ServerHttpRequest request) {
    if (!BODY_METHODS.contains(request.getMethod())) return false;
    MediaType contentType = request.getHeaders().getContentType();
    if (contentType == null) return false;
    return MediaType.APPLICATION_JSON.isCompatibleWith(contentType)
        || contentType.getSubtype().endsWith("+json");
  }

  private static ServerHttpRequest withBody(
      ServerHttpRequest request, byte[] body, ServerWebExchange exchange) {
    HttpHeaders headers = new HttpHeaders();
    headers.putAll(request.getHeaders());
    headers.remove(HttpHeaders.TRANSFER_ENCODING);
    headers.setContentLength(body.length);
    return new ServerHttpRequestDecorator(request) {
      @Override
      public HttpHeaders getHeaders() {
        return headers;
      }

      @Override
      public Flux<DataBuffer> getBody() {
        if (body.length == 0) return Flux.empty();
        return Flux.defer(
            () -> Flux.just(exchange.getResponse().bufferFactory().wrap(body)));
      }
    };
  }

  private static byte[] drain(DataBuffer buffer) {
    try {
      byte[] bytes = new byte[buffer.readableByteCount()];
      buffer.read(bytes);
      return bytes;
    } finally {
      DataBufferUtils.release(buffer);
    }
  }

  private Mono<Void> rateLimited(ServerWebExchange exchange, RateLimitDecision decision) {
    ServerHttpResponse response = exchange.getResponse();
    response.getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "Rate limit exceeded");
    body.put("retryAfter", decision.retryAfterSeconds());
    body.put("timestamp", clock.instant().toString());
    return writeError(response, HttpStatus.TOO_MANY_REQUESTS, body);
  }

  private Mono<Void> unauthorized(ServerWebExchange exchange, ApiException e) {
    return writeError(exchange.getResponse(), HttpStatus.UNAUTHORIZED, errorBody(e.getMessage()));
  }

  private Map<String, Object> errorBody(String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", message);
    body.put("timestamp", clock.instant().toString());
    return body;
  }

  private Mono<Void> writeError(
      ServerHttpResponse response, HttpStatus status, Map<String, Object> body) {
    response.setStatusCode(status);
    response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
    byte[] bytes;
    try {
      bytes = objectMapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      bytes = ("{\"error\":\"" + status.getReasonPhrase() + "\"}").getBytes(StandardCharsets.UTF_8);
    }
    return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
  }
}
