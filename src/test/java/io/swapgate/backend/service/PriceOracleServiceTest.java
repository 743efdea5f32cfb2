package io.swapgate.backend.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.swapgate.backend.client.CoinGeckoClient;
import io.swapgate.backend.util.PriceMappings;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PriceOracleServiceTest {
  private CoinGeckoClient coinGecko;
  private RedisCache cache;
  private PriceOracleService oracle;

  @BeforeEach
  void setUp() {
    coinGecko = mock(CoinGeckoClient.class);
    cache = mock(RedisCache.class);
    when(cache.get(anyString())).thenReturn(Optional.empty());
    oracle = new PriceOracleService(coinGecko, cache, new ChainRegistry(), 300);
  }

  @Test
  void resolvesAddressesSymbolsAndNativeToken() {
    when(coinGecko.fetchSimplePricesUsd(anyCollection()))
        .thenReturn(Map.of("ethereum", new BigDecimal("2500"), "binancecoin", new BigDecimal("600")));

    Map<String, BigDecimal> prices =
        oracle.getUsdPrices(56, List.of(PriceMappings.NATIVE_TOKEN_ADDRESS, "eth"));

    assertEquals(new BigDecimal("600"), prices.get(PriceMappings.NATIVE_TOKEN_ADDRESS));
    assertEquals(new BigDecimal("2500"), prices.get("eth"));
  }

  @Test
  void cachedPricesSkipTheNetwork() {
    when(cache.get("price:usd:ethereum")).thenReturn(Optional.of("2400.5"));

    assertEquals(Optional.of(new BigDecimal("2400.5")), oracle.getUsdPrice(1, "ETH"));
    verify(coinGecko, never()).fetchSimplePricesUsd(anyCollection());
  }

  @Test
  void stablecoinsFallBackToOneDollar() {
    when(coinGecko.fetchSimplePricesUsd(anyCollection())).thenReturn(Map.of());

    assertEquals(Optional.of(BigDecimal.ONE), oracle.getUsdPrice(1, "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48"));
    assertTrue(oracle.getUsdPrice(1, "ETH").isEmpty());
  }

  @Test
  void unknownAssetsHaveNoPrice() {
    assertFalse(oracle.getUsdPrices(1, List.of("0x0000000000000000000000000000000000000bad")).containsKey("0x0000000000000000000000000000000000000bad"));
    verify(coinGecko, never()).fetchSimplePricesUsd(anyCollection());
  }
}
