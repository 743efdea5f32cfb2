package io.swapgate.backend.service;

import io.swapgate.backend.error.ApiException;
import io.swapgate.backend.model.ChainProfile;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

@Component
public class ChainRegistry {
  private static final String SOURCE = "1inch";

  private final Map<Integer, ChainProfile> profiles =
      Stream.of(
              new ChainProfile(1, "Ethereum", "ETH", true, SOURCE),
              new ChainProfile(56, "BNB Smart Chain", "BNB", true, SOURCE),
              new ChainProfile(137, "Polygon", "MATIC", true, SOURCE),
              new ChainProfile(42161, "Arbitrum One", "ETH", true, SOURCE),
              new ChainProfile(10, "Optimism", "ETH", true, SOURCE),
              new ChainProfile(8453, "Base", "ETH", true, SOURCE),
              new ChainProfile(43114, "Avalanche C-Chain", "AVAX", true, SOURCE),
              new ChainProfile(250, "Fantom", "FTM", true, SOURCE))
          .collect(Collectors.toUnmodifiableMap(ChainProfile::chainId, Function.identity()));

  public Optional<ChainProfile> find(int chainId) {
    return Optional.ofNullable(profiles.get(chainId));
  }

  public boolean isSupported(int chainId) {
    return find(chainId).map(ChainProfile::supported).orElse(false);
  }

  public ChainProfile require(int chainId) {
    return find(chainId)
        .filter(ChainProfile::supported)
        .orElseThrow(() -> ApiException.unsupportedChain(chainId));
  }

  public List<ChainProfile> all() {
    return profiles.values().stream().sorted(Comparator.comparingInt(ChainProfile::chainId)).toList();
  }
}
