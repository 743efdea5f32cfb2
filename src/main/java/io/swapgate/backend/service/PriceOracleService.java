package io.swapgate.backend.service;

import io.swapgate.backend.client.CoinGeckoClient;
import io.swapgate.backend.model.ChainProfile;
import io.swapgate.backend.model.TokenDescriptor;
import io.swapgate.backend.util.DefaultTokenLists;
import io.swapgate.backend.util.PriceMappings;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** USD spot prices for asset identifiers (token address or symbol) on a chain. */
@Service
public class PriceOracleService {
  private final CoinGeckoClient coinGecko;
  private final RedisCache cache;
  private final ChainRegistry chains;
  private final long priceTtlSeconds;

  public PriceOracleService(
      CoinGeckoClient coinGecko,
      RedisCache cache,
      ChainRegistry chains,
      @Value("${app.cache.priceTtlSeconds:300}") long priceTtlSeconds) {
    this.coinGecko = coinGecko;
    this.cache = cache;
    this.chains = chains;
    this.priceTtlSeconds = priceTtlSeconds;
  }

  public Optional<BigDecimal> getUsdPrice(int chainId, String asset) {
    return Optional.ofNullable(getUsdPrices(chainId, List.of(asset)).get(asset));
  }

  /** Prices keyed by the identifiers passed in; assets without a price are absent. */
  public Map<String, BigDecimal> getUsdPrices(int chainId, Collection<String> assets) {
    Map<String, String> symbols = new LinkedHashMap<>();
    for (String asset : assets) {
      resolveSymbol(chainId, asset).ifPresent(s -> symbols.put(asset, s));
    }

    Map<String, BigDecimal> bySymbol = new HashMap<>();
    List<String> missingIds = new ArrayList<>();
    for (String symbol : symbols.values()) {
      String id = PriceMappings.COINGECKO_IDS.get(symbol);
      if (id == null || bySymbol.containsKey(symbol)) continue;
      Optional<BigDecimal> cached = cache.get(cacheKey(id)).flatMap(PriceOracleService::parsePrice);
      if (cached.isPresent()) {
        bySymbol.put(symbol, cached.get());
      } else if (!missingIds.contains(id)) {
        missingIds.add(id);
      }
    }

    if (!missingIds.isEmpty()) {
      Map<String, BigDecimal> fetched = coinGecko.fetchSimplePricesUsd(missingIds);
      fetched.forEach((id, price) -> cache.set(cacheKey(id), price.toPlainString(), priceTtlSeconds));
      for (String symbol : symbols.values()) {
        String id = PriceMappings.COINGECKO_IDS.get(symbol);
        if (id != null && fetched.containsKey(id)) bySymbol.put(symbol, fetched.get(id));
      }
    }

    // Stablecoin fallback
    for (String symbol : symbols.values()) {
      if (!bySymbol.containsKey(symbol) && PriceMappings.STABLECOINS.contains(symbol)) {
        bySymbol.put(symbol, BigDecimal.ONE);
      }
    }

    Map<String, BigDecimal> out = new LinkedHashMap<>();
    symbols.forEach(
        (asset, symbol) -> {
          BigDecimal price = bySymbol.get(symbol);
          if (price != null) out.put(asset, price);
        });
    return out;
  }

  Optional<String> resolveSymbol(int chainId, String asset) {
    if (asset == null || asset.isBlank()) return Optional.empty();
    String a = asset.trim();
    if (PriceMappings.NATIVE_TOKEN_ADDRESS.equalsIgnoreCase(a)) {
      return chains.find(chainId).map(ChainProfile::nativeSymbol);
    }
    Optional<String> listed = DefaultTokenLists.find(chainId, a).map(TokenDescriptor::symbol);
    if (listed.isPresent()) return listed;
    String symbol = a.toUpperCase(Locale.ROOT);
    return PriceMappings.COINGECKO_IDS.containsKey(symbol) ? Optional.of(symbol) : Optional.empty();
  }

  private static String cacheKey(String coinId) {
    return "price:usd:" + coinId;
  }

  private static Optional<BigDecimal> parsePrice(String value) {
    try {
      BigDecimal p = new BigDecimal(value);
      return p.signum() > 0 ? Optional.of(p) : Optional.empty();
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
