package io.swapgate.backend.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Validated
@ConfigurationProperties(prefix = "app.swap")
public class SwapProperties {
  private String routingBaseUrl = "https://api.1inch.dev/swap/v6.0";
  private String routingApiKey = "";
  private long routingTimeoutMs = 12000;

  @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "fee recipient must be an EVM address")
  private String feeRecipient = "0x742d35Cc6634C0532925a3b844Bc9e7595f0bEb0";

  @Min(0)
  @Max(10000)
  private int feeBps = 30;

  private long tokenCacheTtlSeconds = 3600;

  public String getRoutingBaseUrl() {
    return routingBaseUrl;
  }

  public void setRoutingBaseUrl(String routingBaseUrl) {
    this.routingBaseUrl = routingBaseUrl;
  }

  public String getRoutingApiKey() {
    return routingApiKey;
  }

  public void setRoutingApiKey(String routingApiKey) {
    this.routingApiKey = routingApiKey;
  }

  public long getRoutingTimeoutMs() {
    return routingTimeoutMs;
  }

  public void setRoutingTimeoutMs(long routingTimeoutMs) {
    this.routingTimeoutMs = routingTimeoutMs;
  }

  public String getFeeRecipient() {
    return feeRecipient;
  }

  public void setFeeRecipient(String feeRecipient) {
    this.feeRecipient = feeRecipient;
  }

  public int getFeeBps() {
    return feeBps;
  }

  public void setFeeBps(int feeBps) {
    this.feeBps = feeBps;
  }

  public long getTokenCacheTtlSeconds() {
    return tokenCacheTtlSeconds;
  }

  public void setTokenCacheTtlSeconds(long tokenCacheTtlSeconds) {
    this.tokenCacheTtlSeconds = tokenCacheTtlSeconds;
  }
}
