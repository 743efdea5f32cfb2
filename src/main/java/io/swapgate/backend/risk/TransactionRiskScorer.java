package io.swapgate.backend.risk;

import io.swapgate.backend.error.ApiException;
import io.swapgate.backend.security.SecurityProperties;
import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/** Additive heuristic score for an outgoing transfer. Pure apart from the configured blacklist. */
@Service
public class TransactionRiskScorer {
  static final BigDecimal LARGE_AMOUNT_THRESHOLD = new BigDecimal("1000000");
  static final BigDecimal LOW_GAS_PRICE_THRESHOLD = new BigDecimal("1000000000");

  private final Set<String> blacklist;

  public TransactionRiskScorer(SecurityProperties properties) {
    this.blacklist =
        properties.addressBlacklistList().stream()
            .map(a -> a.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
  }

  public RiskAssessment score(RiskCheckRequest request) {
    return score(request.fromAddress(), request.toAddress(), request.amount(), request.gasPrice());
  }

  public RiskAssessment score(String fromAddress, String toAddress, String amount, String gasPrice) {
    BigDecimal value = parse("amount", amount);
    EnumSet<RiskFlag> flags = EnumSet.noneOf(RiskFlag.class);
    if (value.compareTo(LARGE_AMOUNT_THRESHOLD) > 0) {
      flags.add(RiskFlag.LARGE_AMOUNT);
    }
    if (gasPrice != null && !gasPrice.isBlank()
        && parse("gasPrice", gasPrice).compareTo(LOW_GAS_PRICE_THRESHOLD) < 0) {
      flags.add(RiskFlag.LOW_GAS_PRICE);
    }
    if (fromAddress != null && fromAddress.equalsIgnoreCase(toAddress)) {
      flags.add(RiskFlag.SELF_TRANSFER);
    }
    if (isBlacklisted(fromAddress) || isBlacklisted(toAddress)) {
      flags.add(RiskFlag.BLACKLISTED_ADDRESS);
    }
    int score = flags.stream().mapToInt(RiskFlag::weight).sum();
    return new RiskAssessment(score, flags, Recommendation.forScore(score));
  }

  private boolean isBlacklisted(String address) {
    return address != null && blacklist.contains(address.trim().toLowerCase(Locale.ROOT));
  }

  private static BigDecimal parse(String field, String value) {
    if (value == null || value.isBlank()) {
      throw ApiException.badRequest(field + " is required");
    }
    try {
      return new BigDecimal(value.trim());
    } catch (NumberFormatException e) {
      throw ApiException.badRequest(field + " must be numeric");
    }
  }
}
