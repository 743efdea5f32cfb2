package io.swapgate.backend.error;

public enum ApiErrorCode {
  BAD_REQUEST,
  UNSUPPORTED_CHAIN,
  CREDENTIAL_REQUIRED,
  UPSTREAM_UNAVAILABLE,
  PRICE_UNAVAILABLE,
  INVALID_SIGNATURE,
  TIMESTAMP_EXPIRED,
  RATE_LIMITED,
  ORIGIN_FORBIDDEN
}
