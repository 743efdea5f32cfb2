package io.swapgate.backend.risk;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** Flags iterate in declaration order of {@link RiskFlag}. */
public record RiskAssessment(int score, Set<RiskFlag> flags, Recommendation recommendation) {
  public RiskAssessment {
    flags =
        flags == null || flags.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(RiskFlag.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(flags));
  }
}
