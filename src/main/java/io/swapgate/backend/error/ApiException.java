package io.swapgate.backend.error;

import java.util.Map;

public class ApiException extends RuntimeException {
  private final ApiErrorCode code;
  private final int httpStatus;
  private final Map<String, Object> details;

  public ApiException(ApiErrorCode code, String message, int httpStatus) {
    this(code, message, httpStatus, Map.of(), null);
  }

  public ApiException(ApiErrorCode code, String message, int httpStatus, Throwable cause) {
    this(code, message, httpStatus, Map.of(), cause);
  }

  public ApiException(
      ApiErrorCode code, String message, int httpStatus, Map<String, Object> details) {
    this(code, message, httpStatus, details, null);
  }

  public ApiException(
      ApiErrorCode code,
      String message,
      int httpStatus,
      Map<String, Object> details,
      Throwable cause) {
    super(message, cause);
    this.code = code;
    this.httpStatus = httpStatus;
    this.details = details == null ? Map.of() : details;
  }

  public static ApiException unsupportedChain(int chainId) {
    return new ApiException(
        ApiErrorCode.UNSUPPORTED_CHAIN,
        "Chain " + chainId + " not supported by DEX aggregator",
        400,
        Map.of("chainId", chainId));
  }

  public static ApiException badRequest(String message) {
    return new ApiException(ApiErrorCode.BAD_REQUEST, message, 400);
  }

  public ApiErrorCode getCode() {
    return code;
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  public Map<String, Object> getDetails() {
    return details;
  }
}
