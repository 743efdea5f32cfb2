package io.swapgate.backend.model;

public record ChainProfile(
    int chainId,
    String name,
    String nativeSymbol,
    boolean supported,
    String sourceId) {}
