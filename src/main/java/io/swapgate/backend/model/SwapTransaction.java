package io.swapgate.backend.model;

public record SwapTransaction(
    String from, String to, String data, String value, String gas, String gasPrice) {}
