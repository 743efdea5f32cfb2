package io.swapgate.backend.security;

import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class OriginPolicy {
  private final List<String> exact;
  private final List<String> suffixes;

  public OriginPolicy(SecurityProperties properties) {
    this.exact = properties.allowedOriginList();
    this.suffixes = properties.allowedOriginSuffixList();
  }

  /** Requests without an Origin (same-origin, curl, mobile apps) are always allowed. */
  public boolean isAllowed(String origin) {
    if (origin == null || origin.isBlank()) return true;
    String o = origin.trim();
    if (exact.contains(o)) return true;
    return suffixes.stream().anyMatch(o::endsWith);
  }
}
