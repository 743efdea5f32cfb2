package io.swapgate.backend.security;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class OriginPolicyTest {

  private static OriginPolicy policy(String origins, String suffixes) {
    SecurityProperties properties = new SecurityProperties();
    properties.setAllowedOrigins(origins);
    properties.setAllowedOriginSuffixes(suffixes);
    return new OriginPolicy(properties);
  }

  @Test
  void requestsWithoutOriginAreAllowed() {
    OriginPolicy policy = policy("http://localhost:5000", "");
    assertTrue(policy.isAllowed(null));
    assertTrue(policy.isAllowed(""));
  }

  @Test
  void exactOriginMatches() {
    OriginPolicy policy = policy("http://localhost:5000, https://app.swapgate.io", "");
    assertTrue(policy.isAllowed("https://app.swapgate.io"));
    assertFalse(policy.isAllowed("https://app.swapgate.io.evil.com"));
    assertFalse(policy.isAllowed("http://localhost:5001"));
  }

  @Test
  void suffixRulesMatchPreviewDomains() {
    OriginPolicy policy = policy("http://localhost:5000", ".preview.swapgate.dev");
    assertTrue(policy.isAllowed("https://pr-42.preview.swapgate.dev"));
    assertFalse(policy.isAllowed("https://preview.swapgate.dev.attacker.io"));
  }
}
