package io.swapgate.backend.model;

public record SwapQuoteRequest(
    int chainId, String fromToken, String toToken, String amount, double slippagePercent) {
  public static final double DEFAULT_SLIPPAGE_PERCENT = 0.5;

  public SwapQuoteRequest(int chainId, String fromToken, String toToken, String amount) {
    this(chainId, fromToken, toToken, amount, DEFAULT_SLIPPAGE_PERCENT);
  }
}
