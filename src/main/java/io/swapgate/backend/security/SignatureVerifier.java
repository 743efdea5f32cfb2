package io.swapgate.backend.security;

import io.swapgate.backend.error.ApiErrorCode;
import io.swapgate.backend.error.ApiException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * Checks {@code X-Signature} against {@code hex(HMAC-SHA256(secret, body + timestamp))} where
 * the timestamp is the {@code X-Timestamp} header in epoch milliseconds.
 */
@Component
public class SignatureVerifier {
  public static final String SIGNATURE_HEADER = "X-Signature";
  public static final String TIMESTAMP_HEADER = "X-Timestamp";

  private final SecurityProperties properties;
  private final Clock clock;

  public SignatureVerifier(SecurityProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  public void verify(String serializedBody, String signature, String timestamp) {
    if (signature == null || signature.isBlank() || timestamp == null || timestamp.isBlank()) {
      throw new ApiException(ApiErrorCode.INVALID_SIGNATURE, "Missing security headers", 401);
    }
    String secret = properties.getHmacSecret();
    if (secret == null || secret.isBlank()) {
      throw new IllegalStateException("request signing secret not configured");
    }
    long sentAt;
    try {
      sentAt = Long.parseLong(timestamp.trim());
    } catch (NumberFormatException e) {
      throw new ApiException(ApiErrorCode.INVALID_SIGNATURE, "Invalid signature", 401);
    }
    long maxAgeMs = Math.max(1, properties.getSignatureMaxAgeSeconds()) * 1000L;
    if (Math.abs(clock.millis() - sentAt) > maxAgeMs) {
      throw new ApiException(ApiErrorCode.TIMESTAMP_EXPIRED, "Request timestamp expired", 401);
    }
    String body = serializedBody == null ? "{}" : serializedBody;
    String expected = sign(secret, body, timestamp.trim());
    if (!MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8),
        signature.trim().getBytes(StandardCharsets.UTF_8))) {
      throw new ApiException(ApiErrorCode.INVALID_SIGNATURE, "Invalid signature", 401);
    }
  }

  public static String sign(String secret, String serializedBody, String timestamp) {
    try {
      Mac mac = Mac.getInstance("HmacSHA256");
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
      byte[] out = mac.doFinal((serializedBody + timestamp).getBytes(StandardCharsets.UTF_8));
      StringBuilder sb = new StringBuilder(out.length * 2);
      for (byte b : out) sb.append(String.format("%02x", b));
      return sb.toString();
    } catch (Exception e) {
      throw new IllegalStateException("hmac error", e);
    }
  }
}
