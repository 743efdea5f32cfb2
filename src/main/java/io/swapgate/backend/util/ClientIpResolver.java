package io.swapgate.backend.util;

import java.net.InetSocketAddress;
import org.springframework.http.server.reactive.ServerHttpRequest;

/**
 * Caller identity for limiting and audit logs: the peer address of the connection. Forwarded
 * headers are only honoured once {@code server.forward-headers-strategy=framework} lets Spring's
 * {@code ForwardedHeaderTransformer} rewrite the remote address behind a trusted proxy.
 */
public final class ClientIpResolver {
  private ClientIpResolver() {}

  public static String resolve(ServerHttpRequest request) {
    InetSocketAddress remote = request.getRemoteAddress();
    if (remote == null) return "";
    if (remote.getAddress() == null) return remote.getHostString();
    return remote.getAddress().getHostAddress();
  }
}
