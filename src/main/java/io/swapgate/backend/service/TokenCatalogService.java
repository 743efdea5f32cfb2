package io.swapgate.backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swapgate.backend.client.OneInchClient;
import io.swapgate.backend.config.SwapProperties;
import io.swapgate.backend.model.TokenDescriptor;
import io.swapgate.backend.util.DefaultTokenLists;
import io.swapgate.backend.util.SwapMath;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Service
public class TokenCatalogService {
  private static final Logger log = LoggerFactory.getLogger(TokenCatalogService.class);

  private final OneInchClient routing;
  private final ChainRegistry chains;
  private final RedisCache cache;
  private final ObjectMapper mapper;
  private final long cacheTtlSeconds;

  public TokenCatalogService(
      OneInchClient routing,
      ChainRegistry chains,
      RedisCache cache,
      ObjectMapper mapper,
      SwapProperties properties) {
    this.routing = routing;
    this.chains = chains;
    this.cache = cache;
    this.mapper = mapper;
    this.cacheTtlSeconds = properties.getTokenCacheTtlSeconds();
  }

  /** Tokens the routing service supports on a chain; never fails for a registered chain. */
  public Mono<List<TokenDescriptor>> getSupportedTokens(int chainId) {
    if (!chains.isSupported(chainId)) {
      return Mono.just(List.of());
    }
    String key = "tokens:" + chainId;
    return Mono.fromCallable(() -> cache.get(key).flatMap(this::decode))
        .subscribeOn(Schedulers.boundedElastic())
        .flatMap(cached -> cached.map(Mono::just).orElseGet(() -> fetch(chainId, key)));
  }

  public int decimalsOf(int chainId, String token) {
    return DefaultTokenLists.find(chainId, token)
        .map(TokenDescriptor::decimals)
        .orElse(SwapMath.DEFAULT_DECIMALS);
  }

  private Mono<List<TokenDescriptor>> fetch(int chainId, String key) {
    return routing
        .get(chainId, "/tokens", null)
        .map(resp -> toTokens(chainId, resp))
        .flatMap(
            tokens -> {
              if (tokens.isEmpty()) return Mono.just(DefaultTokenLists.forChain(chainId));
              return Mono.fromCallable(() -> store(key, tokens))
                  .subscribeOn(Schedulers.boundedElastic());
            })
        .onErrorResume(
            e -> {
              log.warn("token list unavailable for chainId={}, using defaults: {}", chainId, e.toString());
              return Mono.just(DefaultTokenLists.forChain(chainId));
            });
  }

  private List<TokenDescriptor> toTokens(int chainId, ResponseEntity<String> resp) {
    if (!resp.getStatusCode().is2xxSuccessful()) {
      log.warn("token list request for chainId={} returned {}", chainId, resp.getStatusCode().value());
      return List.of();
    }
    try {
      JsonNode tokens = mapper.readTree(resp.getBody() == null ? "" : resp.getBody()).path("tokens");
      List<TokenDescriptor> out = new ArrayList<>();
      tokens.forEach(
          t -> {
            String address = t.path("address").asText("");
            if (address.isBlank()) return;
            out.add(
                new TokenDescriptor(
                    t.path("symbol").asText(""),
                    t.path("name").asText(""),
                    address,
                    t.path("decimals").asInt(SwapMath.DEFAULT_DECIMALS)));
          });
      return out;
    } catch (Exception e) {
      log.warn("token list for chainId={} could not be parsed: {}", chainId, e.toString());
      return List.of();
    }
  }

  private List<TokenDescriptor> store(String key, List<TokenDescriptor> tokens) {
    try {
      cache.set(key, mapper.writeValueAsString(tokens), cacheTtlSeconds);
    } catch (Exception e) {
      log.debug("token list not cached: {}", e.toString());
    }
    return tokens;
  }

  private Optional<List<TokenDescriptor>> decode(String json) {
    try {
      return Optional.of(mapper.readValue(json, new TypeReference<List<TokenDescriptor>>() {}));
    } catch (Exception e) {
      return Optional.empty();
    }
  }
}
