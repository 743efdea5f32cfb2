package io.swapgate.backend.risk;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Recommendation {
  APPROVE,
  REVIEW,
  REJECT;

  static Recommendation forScore(int score) {
    if (score >= 70) return REJECT;
    if (score >= 40) return REVIEW;
    return APPROVE;
  }

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
