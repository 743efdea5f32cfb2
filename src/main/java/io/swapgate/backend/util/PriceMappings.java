package io.swapgate.backend.util;

import java.util.Map;
import java.util.Set;

public final class PriceMappings {
  private PriceMappings() {}

  /** Placeholder address routing services use for a chain's native asset. */
  public static final String NATIVE_TOKEN_ADDRESS = "0xeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeee";

  public static final Set<String> STABLECOINS = Set.of("USDC", "USDT", "DAI", "BUSD");

  // Symbol -> CoinGecko "id" for every asset in the default token lists.
  public static final Map<String, String> COINGECKO_IDS =
      Map.ofEntries(
          Map.entry("ETH", "ethereum"),
          Map.entry("WETH", "weth"),
          Map.entry("BTC", "bitcoin"),
          Map.entry("WBTC", "wrapped-bitcoin"),
          Map.entry("BNB", "binancecoin"),
          Map.entry("MATIC", "matic-network"),
          Map.entry("AVAX", "avalanche-2"),
          Map.entry("FTM", "fantom"),
          Map.entry("SOL", "solana"),
          Map.entry("LTC", "litecoin"),
          Map.entry("DOGE", "dogecoin"),
          Map.entry("USDC", "usd-coin"),
          Map.entry("USDT", "tether"),
          Map.entry("DAI", "dai"),
          Map.entry("BUSD", "binance-usd"));
}
