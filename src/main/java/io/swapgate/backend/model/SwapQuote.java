package io.swapgate.backend.model;

import java.util.List;

/** Amounts are decimal integer strings in base units of the asset they refer to. */
public record SwapQuote(
    String fromToken,
    String toToken,
    String fromAmount,
    String toAmount,
    double rate,
    double priceImpact,
    String fee,
    String minReceived,
    List<String> route,
    String gas,
    List<String> protocols) {
  public SwapQuote {
    route = route == null ? List.of() : List.copyOf(route);
    protocols = protocols == null ? List.of() : List.copyOf(protocols);
  }
}
