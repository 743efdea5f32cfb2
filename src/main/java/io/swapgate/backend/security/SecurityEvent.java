package io.swapgate.backend.security;

import io.swapgate.backend.error.ApiErrorCode;

public record SecurityEvent(
    ApiErrorCode reason,
    String method,
    String path,
    int status,
    String ip,
    String userAgent,
    long durationMs) {

  static ApiErrorCode reasonFor(int status) {
    if (status == 429) return ApiErrorCode.RATE_LIMITED;
    if (status == 403) return ApiErrorCode.ORIGIN_FORBIDDEN;
    return ApiErrorCode.INVALID_SIGNATURE;
  }
}
