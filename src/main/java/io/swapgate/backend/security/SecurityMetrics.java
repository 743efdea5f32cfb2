package io.swapgate.backend.security;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class SecurityMetrics {
  private final MeterRegistry meterRegistry;
  private final SecurityProperties securityProperties;

  public SecurityMetrics(MeterRegistry meterRegistry, SecurityProperties securityProperties) {
    this.meterRegistry = meterRegistry;
    this.securityProperties = securityProperties;
  }

  public void securityEvent(int status) {
    if (!securityProperties.isMetricsEnabled()) return;
    meterRegistry.counter("security.events", "status", String.valueOf(status)).increment();
  }

  public void rateLimited(String tier) {
    if (!securityProperties.isMetricsEnabled()) return;
    meterRegistry.counter("security.rate_limited", "tier", tier).increment();
  }

  public void counterStoreUnavailable() {
    if (!securityProperties.isMetricsEnabled()) return;
    meterRegistry.counter("security.counter_store.unavailable").increment();
  }

  public void signatureRejected(String reason) {
    if (!securityProperties.isMetricsEnabled()) return;
    meterRegistry.counter("security.signature.rejected", "reason", reason).increment();
  }
}
