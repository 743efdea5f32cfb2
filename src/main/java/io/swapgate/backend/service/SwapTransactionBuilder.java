package io.swapgate.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swapgate.backend.client.OneInchClient;
import io.swapgate.backend.config.SwapProperties;
import io.swapgate.backend.error.ApiErrorCode;
import io.swapgate.backend.error.ApiException;
import io.swapgate.backend.model.SwapTransaction;
import io.swapgate.backend.model.SwapTransactionRequest;
import io.swapgate.backend.util.SwapMath;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.web3j.crypto.Keys;
import org.web3j.crypto.WalletUtils;
import reactor.core.publisher.Mono;

/**
 * Builds executable swap call data through the routing service. The platform fee travels inside
 * the routed call, so there is no synthetic path here: upstream failures are surfaced as-is.
 */
@Service
public class SwapTransactionBuilder {
  private static final Logger log = LoggerFactory.getLogger(SwapTransactionBuilder.class);

  private final OneInchClient routing;
  private final ChainRegistry chains;
  private final ObjectMapper mapper;
  private final String feeRecipient;
  private final int feeBps;

  public SwapTransactionBuilder(
      OneInchClient routing, ChainRegistry chains, ObjectMapper mapper, SwapProperties properties) {
    this.routing = routing;
    this.chains = chains;
    this.mapper = mapper;
    String recipient = properties.getFeeRecipient() == null ? "" : properties.getFeeRecipient().trim();
    if (!WalletUtils.isValidAddress(recipient) || !recipient.startsWith("0x")) {
      throw new IllegalStateException("app.swap.fee-recipient is not a valid EVM address");
    }
    if (properties.getFeeBps() < 0 || properties.getFeeBps() > 10_000) {
      throw new IllegalStateException("app.swap.fee-bps must be between 0 and 10000");
    }
    this.feeRecipient = Keys.toChecksumAddress(recipient);
    this.feeBps = properties.getFeeBps();
  }

  public String feeRecipient() {
    return feeRecipient;
  }

  public Mono<SwapTransaction> buildSwapTransaction(SwapTransactionRequest request) {
    BigInteger amount;
    try {
      chains.require(request.chainId());
      if (!routing.hasCredential()) {
        throw new ApiException(
            ApiErrorCode.CREDENTIAL_REQUIRED,
            "Routing service API key required for swaps; set app.swap.routing-api-key",
            503);
      }
      amount = SwapMath.parseAmount(request.amount());
      SwapMath.requireSlippage(request.slippageOrDefault());
      if (!isEvmAddress(request.fromAddress())) {
        throw ApiException.badRequest("fromAddress must be a valid EVM address");
      }
    } catch (ApiException e) {
      return Mono.error(e);
    }

    MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
    query.add("src", request.fromToken().trim());
    query.add("dst", request.toToken().trim());
    query.add("amount", amount.toString());
    query.add("from", request.fromAddress().trim());
    query.add("slippage", BigDecimal.valueOf(request.slippageOrDefault()).toPlainString());
    query.add("fee", String.valueOf(feeBps));
    query.add("referrer", feeRecipient);

    return routing
        .get(request.chainId(), "/swap", query)
        .onErrorMap(
            e -> !(e instanceof ApiException),
            e ->
                new ApiException(
                    ApiErrorCode.UPSTREAM_UNAVAILABLE,
                    "routing service unreachable: " + e.getMessage(),
                    504,
                    e))
        .map(resp -> toTransaction(request.chainId(), resp));
  }

  private SwapTransaction toTransaction(int chainId, ResponseEntity<String> resp) {
    int status = resp.getStatusCode().value();
    String body = resp.getBody() == null ? "" : resp.getBody();
    if (!resp.getStatusCode().is2xxSuccessful()) {
      log.error("routing swap error for chainId={}: {} - {}", chainId, status, body);
      throw new ApiException(
          ApiErrorCode.UPSTREAM_UNAVAILABLE,
          "routing service error: " + status + " - " + body,
          502,
          Map.of("upstreamStatus", status));
    }
    JsonNode tx;
    try {
      tx = mapper.readTree(body).path("tx");
    } catch (Exception e) {
      throw new ApiException(
          ApiErrorCode.UPSTREAM_UNAVAILABLE, "routing service returned an unreadable body", 502, e);
    }
    if (!tx.isObject() || tx.path("to").asText("").isBlank()) {
      throw new ApiException(
          ApiErrorCode.UPSTREAM_UNAVAILABLE,
          "routing service response has no transaction",
          502,
          Map.of("upstreamStatus", status));
    }
    return new SwapTransaction(
        tx.path("from").asText(""),
        tx.path("to").asText(""),
        tx.path("data").asText(""),
        tx.path("value").asText("0"),
        tx.path("gas").asText(""),
        tx.path("gasPrice").asText(""));
  }

  static boolean isEvmAddress(String value) {
    return value != null && value.trim().startsWith("0x") && WalletUtils.isValidAddress(value.trim());
  }
}
