package io.swapgate.backend.risk;

public enum RiskFlag {
  LARGE_AMOUNT(30),
  LOW_GAS_PRICE(20),
  SELF_TRANSFER(15),
  BLACKLISTED_ADDRESS(50);

  private final int weight;

  RiskFlag(int weight) {
    this.weight = weight;
  }

  public int weight() {
    return weight;
  }
}
