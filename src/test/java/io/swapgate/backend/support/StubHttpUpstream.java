package io.swapgate.backend.support;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** WebClient whose exchanges are answered in-process and recorded. */
public class StubHttpUpstream {
  private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
  private volatile Function<ClientRequest, Mono<ClientResponse>> handler =
      req -> Mono.error(new IllegalStateException("no stubbed response"));

  public WebClient webClient() {
    return WebClient.builder()
        .exchangeFunction(
            req -> {
              requests.add(req);
              return handler.apply(req);
            })
        .build();
  }

  public void respond(HttpStatus status, String json) {
    handler =
        req ->
            Mono.just(
                ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(json)
                    .build());
  }

  public void fail(Throwable error) {
    handler = req -> Mono.error(error);
  }

  public List<ClientRequest> requests() {
    return requests;
  }

  public ClientRequest lastRequest() {
    return requests.get(requests.size() - 1);
  }
}
