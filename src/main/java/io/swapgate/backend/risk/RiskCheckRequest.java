package io.swapgate.backend.risk;

import jakarta.validation.constraints.NotBlank;

public record RiskCheckRequest(
    @NotBlank String fromAddress,
    @NotBlank String toAddress,
    @NotBlank String amount,
    String gasPrice) {}
