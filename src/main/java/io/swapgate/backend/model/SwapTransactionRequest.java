package io.swapgate.backend.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record SwapTransactionRequest(
    int chainId,
    @NotBlank String fromToken,
    @NotBlank String toToken,
    @NotBlank @Pattern(regexp = "^[0-9]+$", message = "amount must be a base-unit integer string")
        String amount,
    @NotBlank String fromAddress,
    @DecimalMin("0") @DecimalMax("100") Double slippagePercent) {

  public double slippageOrDefault() {
    return slippagePercent == null ? SwapQuoteRequest.DEFAULT_SLIPPAGE_PERCENT : slippagePercent;
  }
}
