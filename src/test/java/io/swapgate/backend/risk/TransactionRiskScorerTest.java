package io.swapgate.backend.risk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.swapgate.backend.error.ApiException;
import io.swapgate.backend.security.SecurityProperties;
import java.util.List;
import org.junit.jupiter.api.Test;

class TransactionRiskScorerTest {
  private static final String ALICE = "0xd8dA6BF26964aF9D7eEd9e03E53415D37aA96045";
  private static final String BOB = "0x71C7656EC7ab88b098defB751B7401B5f6d8976F";
  private static final String ZERO = "0x0000000000000000000000000000000000000000";

  private final TransactionRiskScorer scorer = new TransactionRiskScorer(new SecurityProperties());

  @Test
  void largeCheapSelfTransferNeedsReview() {
    RiskAssessment a = scorer.score(ALICE, ALICE.toLowerCase(), "2000000", "500000000");

    assertEquals(
        List.of(RiskFlag.LARGE_AMOUNT, RiskFlag.LOW_GAS_PRICE, RiskFlag.SELF_TRANSFER),
        List.copyOf(a.flags()));
    assertEquals(65, a.score());
    assertEquals(Recommendation.REVIEW, a.recommendation());
  }

  @Test
  void ordinaryTransferIsApproved() {
    RiskAssessment a = scorer.score(ALICE, BOB, "250.5", "30000000000");

    assertTrue(a.flags().isEmpty());
    assertEquals(0, a.score());
    assertEquals(Recommendation.APPROVE, a.recommendation());
  }

  @Test
  void thresholdsAreStrict() {
    assertTrue(scorer.score(ALICE, BOB, "1000000", "1000000000").flags().isEmpty());
  }

  @Test
  void blacklistedCounterpartyIsFlagged() {
    RiskAssessment a = scorer.score(ALICE, ZERO, "10", null);
    assertEquals(50, a.score());
    assertEquals(Recommendation.REVIEW, a.recommendation());

    RiskAssessment b = scorer.score(ZERO, BOB, "5000000", null);
    assertEquals(80, b.score());
    assertEquals(Recommendation.REJECT, b.recommendation());
  }

  @Test
  void scoreIsNotCapped() {
    RiskAssessment a = scorer.score(ZERO, ZERO, "5000000", "1");
    assertEquals(115, a.score());
    assertEquals(4, a.flags().size());
    assertEquals(Recommendation.REJECT, a.recommendation());
  }

  @Test
  void configuredBlacklistIsCaseInsensitive() {
    SecurityProperties properties = new SecurityProperties();
    properties.setAddressBlacklist(BOB.toUpperCase().replace("0X", "0x"));
    TransactionRiskScorer custom = new TransactionRiskScorer(properties);

    assertTrue(custom.score(ALICE, BOB, "1", null).flags().contains(RiskFlag.BLACKLISTED_ADDRESS));
    assertTrue(custom.score(ALICE, ZERO, "1", null).flags().isEmpty());
  }

  @Test
  void nonNumericInputIsRejected() {
    assertThrows(ApiException.class, () -> scorer.score(ALICE, BOB, "lots", null));
    assertThrows(ApiException.class, () -> scorer.score(ALICE, BOB, "1", "fast"));
  }
}
