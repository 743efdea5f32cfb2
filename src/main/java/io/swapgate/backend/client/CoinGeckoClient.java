package io.swapgate.backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class CoinGeckoClient {
  private static final Logger log = LoggerFactory.getLogger(CoinGeckoClient.class);
  private final WebClient webClient;
  private final String apiKey;
  private final String baseUrl;

  public CoinGeckoClient(
      WebClient webClient,
      @Value("${COINGECKO_PRO_API_KEY:}") String apiKey,
      @Value("${COINGECKO_ALLOW_PUBLIC:true}") boolean allowPublic) {
    this.webClient = webClient;
    this.apiKey = apiKey == null ? "" : apiKey.trim();
    // Prefer Pro API when key is provided; optionally fall back to the public API (rate-limited).
    if (!this.apiKey.isBlank()) {
      this.baseUrl = "https://pro-api.coingecko.com/api/v3";
    } else if (allowPublic) {
      this.baseUrl = "https://api.coingecko.com/api/v3";
    } else {
      this.baseUrl = "";
    }
  }

  public boolean isEnabled() {
    return !baseUrl.isBlank();
  }

  /**
   * USD prices for a batch of CoinGecko ids.
   *
   * Returns: map(coinId -> usdPrice); ids without a positive price are absent.
   */
  public Map<String, BigDecimal> fetchSimplePricesUsd(Collection<String> coinIds) {
    Map<String, BigDecimal> out = new HashMap<>();
    if (!isEnabled() || coinIds == null || coinIds.isEmpty()) {
      if (log.isDebugEnabled()) {
        log.debug("CoinGecko simple price skipped: enabled={} ids={}", isEnabled(), coinIds);
      }
      return out;
    }
    String ids = String.join(",", coinIds);

    URI uri =
        UriComponentsBuilder.fromUriString(baseUrl + "/simple/price")
            .queryParam("ids", ids)
            .queryParam("vs_currencies", "usd")
            .build(true)
            .toUri();

    try {
      JsonNode root =
          webClient
              .get()
              .uri(uri)
              .headers(h -> {
                if (!apiKey.isBlank()) h.set("x-cg-pro-api-key", apiKey);
              })
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(Duration.ofSeconds(10))
              .block();
      if (root == null || !root.isObject()) {
        log.warn("CoinGecko simple price returned invalid body for ids='{}' body={}", ids, root);
        return out;
      }
      for (String id : coinIds) {
        JsonNode usd = root.path(id).path("usd");
        if (usd.isNumber() && usd.decimalValue().signum() > 0) {
          out.put(id, usd.decimalValue());
        }
      }
      return out;
    } catch (Exception e) {
      log.warn("CoinGecko simple price request failed for ids='{}' uri={}", ids, uri, e);
      return out;
    }
  }
}
