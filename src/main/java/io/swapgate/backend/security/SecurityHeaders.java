package io.swapgate.backend.security;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpResponse;
import reactor.core.publisher.Mono;

public final class SecurityHeaders {
  public static final Map<String, String> HEADERS;

  static {
    Map<String, String> h = new LinkedHashMap<>();
    h.put("X-Content-Type-Options", "nosniff");
    h.put("X-Frame-Options", "DENY");
    h.put("X-XSS-Protection", "1; mode=block");
    h.put("Strict-Transport-Security", "max-age=31536000; includeSubDomains");
    h.put(
        "Content-Security-Policy",
        "default-src 'self'; script-src 'self' 'unsafe-inline' 'unsafe-eval'; "
            + "style-src 'self' 'unsafe-inline' https://fonts.googleapis.com; "
            + "font-src 'self' https://fonts.gstatic.com; img-src 'self' data: https:; "
            + "connect-src 'self' https: wss: data:; object-src 'none'; base-uri 'self'; "
            + "form-action 'self'");
    h.put("Referrer-Policy", "strict-origin-when-cross-origin");
    h.put("Permissions-Policy", "camera=(), microphone=(), geolocation=()");
    HEADERS = Map.copyOf(h);
  }

  private static final String[] FINGERPRINT_HEADERS = {"Server", "X-Powered-By"};

  private SecurityHeaders() {}

  public static void apply(ServerHttpResponse response) {
    HttpHeaders headers = response.getHeaders();
    HEADERS.forEach(headers::set);
    response.beforeCommit(
        () -> {
          for (String name : FINGERPRINT_HEADERS) response.getHeaders().remove(name);
          return Mono.empty();
        });
  }
}
