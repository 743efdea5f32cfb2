package io.swapgate.backend.model;

public record TokenDescriptor(String symbol, String name, String address, int decimals) {}
