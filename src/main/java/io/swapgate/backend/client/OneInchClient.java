package io.swapgate.backend.client;

import io.swapgate.backend.config.SwapProperties;
import java.net.URI;
import java.time.Duration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

/** Thin client for a 1inch-compatible swap API ({base}/{chainId}/quote|swap|tokens). */
@Component
public class OneInchClient {
  private final WebClient webClient;
  private final String baseUrl;
  private final String apiKey;
  private final Duration timeout;

  public OneInchClient(WebClient webClient, SwapProperties properties) {
    this.webClient = webClient;
    this.baseUrl = normalizeBaseUrl(properties.getRoutingBaseUrl());
    this.apiKey = properties.getRoutingApiKey() == null ? "" : properties.getRoutingApiKey().trim();
    this.timeout = Duration.ofMillis(Math.max(1000, properties.getRoutingTimeoutMs()));
  }

  private static String normalizeBaseUrl(String value) {
    if (value == null) return "";
    String trimmed = value.trim();
    while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
    return trimmed;
  }

  public boolean isEnabled() {
    return !baseUrl.isBlank();
  }

  public boolean hasCredential() {
    return !apiKey.isBlank();
  }

  private void applyAuth(HttpHeaders headers) {
    if (!apiKey.isBlank()) {
      headers.setBearerAuth(apiKey);
    }
  }

  private URI buildUri(int chainId, String path, MultiValueMap<String, String> query) {
    UriComponentsBuilder b = UriComponentsBuilder.fromUriString(baseUrl + "/" + chainId + path);
    if (query != null && !query.isEmpty()) {
      b.queryParams(query);
    }
    return b.encode().build().toUri();
  }

  private static Mono<ResponseEntity<String>> toResponseEntity(ClientResponse resp) {
    return resp
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(
            body ->
                ResponseEntity.status(resp.statusCode())
                    .contentType(resp.headers().contentType().orElse(MediaType.APPLICATION_JSON))
                    .body(body));
  }

  /**
   * Issues a GET against the routing service. Non-2xx responses are returned as-is; transport
   * failures and timeouts surface as errors on the returned Mono.
   */
  public Mono<ResponseEntity<String>> get(
      int chainId, String path, MultiValueMap<String, String> query) {
    if (!isEnabled()) {
      return Mono.error(new IllegalStateException("routing base url not set"));
    }
    URI uri = buildUri(chainId, path, query);
    return webClient
        .get()
        .uri(uri)
        .headers(this::applyAuth)
        .exchangeToMono(OneInchClient::toResponseEntity)
        .timeout(timeout);
  }
}
