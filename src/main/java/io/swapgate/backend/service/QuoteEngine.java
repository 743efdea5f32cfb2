package io.swapgate.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swapgate.backend.client.OneInchClient;
import io.swapgate.backend.error.ApiErrorCode;
import io.swapgate.backend.error.ApiException;
import io.swapgate.backend.model.QuoteOutcome;
import io.swapgate.backend.model.SwapQuote;
import io.swapgate.backend.model.SwapQuoteRequest;
import io.swapgate.backend.util.SwapMath;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Prices swaps through the routing service and, when it cannot answer, through independent USD
 * spot prices. Which path produced a quote is reported in the returned {@link QuoteOutcome}.
 */
@Service
public class QuoteEngine {
  private static final Logger log = LoggerFactory.getLogger(QuoteEngine.class);

  static final String DEFAULT_GAS = "150000";
  static final List<String> DEFAULT_PROTOCOLS = List.of("Uniswap V3");
  static final List<String> FALLBACK_ROUTE = List.of("Direct");
  static final List<String> FALLBACK_PROTOCOLS = List.of("Fallback Pricing");
  static final double FALLBACK_PRICE_IMPACT = 0.1;

  private static final int DECIMAL_SCALE = 36;

  private final OneInchClient routing;
  private final ChainRegistry chains;
  private final PriceOracleService prices;
  private final TokenCatalogService tokens;
  private final ObjectMapper mapper;

  public QuoteEngine(
      OneInchClient routing,
      ChainRegistry chains,
      PriceOracleService prices,
      TokenCatalogService tokens,
      ObjectMapper mapper) {
    this.routing = routing;
    this.chains = chains;
    this.prices = prices;
    this.tokens = tokens;
    this.mapper = mapper;
  }

  public Mono<QuoteOutcome> getQuote(SwapQuoteRequest request) {
    BigInteger amount;
    int slippageBps;
    try {
      chains.require(request.chainId());
      requireToken(request.fromToken(), "fromToken");
      requireToken(request.toToken(), "toToken");
      amount = SwapMath.parseAmount(request.amount());
      slippageBps = SwapMath.slippageBps(request.slippagePercent());
    } catch (ApiException e) {
      return Mono.just(QuoteOutcome.failed(e));
    }
    return primary(request, amount, slippageBps)
        .switchIfEmpty(Mono.defer(() -> fallback(request, amount, slippageBps)));
  }

  private static void requireToken(String token, String name) {
    if (token == null || token.isBlank()) {
      throw ApiException.badRequest(name + " is required");
    }
  }

  private Mono<QuoteOutcome> primary(SwapQuoteRequest request, BigInteger amount, int slippageBps) {
    MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
    query.add("src", request.fromToken().trim());
    query.add("dst", request.toToken().trim());
    query.add("amount", amount.toString());
    query.add("includeProtocols", "true");
    query.add("includeGas", "true");

    return routing
        .get(request.chainId(), "/quote", query)
        .flatMap(
            resp -> {
              if (!resp.getStatusCode().is2xxSuccessful()) {
                log.warn(
                    "routing quote unavailable (status={}) for chainId={}, using fallback pricing",
                    resp.getStatusCode().value(),
                    request.chainId());
                return Mono.<QuoteOutcome>empty();
              }
              return Mono.just(
                  QuoteOutcome.primary(toPrimaryQuote(request, amount, slippageBps, resp)));
            })
        .onErrorResume(
            e -> {
              log.warn(
                  "routing quote failed for chainId={}, using fallback pricing: {}",
                  request.chainId(),
                  e.toString());
              return Mono.empty();
            });
  }

  private SwapQuote toPrimaryQuote(
      SwapQuoteRequest request, BigInteger amount, int slippageBps, ResponseEntity<String> resp) {
    JsonNode root;
    try {
      root = mapper.readTree(resp.getBody() == null ? "" : resp.getBody());
    } catch (Exception e) {
      throw new IllegalStateException("unreadable quote response", e);
    }
    String dst = root.path("dstAmount").asText("");
    if (!dst.matches("^[0-9]+$")) {
      throw new IllegalStateException("quote response missing dstAmount");
    }
    BigInteger rawOutput = new BigInteger(dst);
    BigInteger fee = SwapMath.platformFee(rawOutput);
    BigInteger toAmount = rawOutput.subtract(fee);
    BigInteger minReceived = SwapMath.minReceived(toAmount, slippageBps);

    List<String> names = protocolNames(root.path("protocols"));
    String gas = root.hasNonNull("gas") ? root.path("gas").asText() : DEFAULT_GAS;
    double rate =
        new BigDecimal(rawOutput).divide(new BigDecimal(amount), MathContext.DECIMAL64).doubleValue();

    return new SwapQuote(
        request.fromToken(),
        request.toToken(),
        amount.toString(),
        toAmount.toString(),
        rate,
        root.path("priceImpact").asDouble(0.0),
        fee.toString(),
        minReceived.toString(),
        names,
        gas,
        names.isEmpty() ? DEFAULT_PROTOCOLS : names);
  }

  /** Protocol names of the first route, in hop order, without repeats. */
  static List<String> protocolNames(JsonNode protocols) {
    if (!protocols.isArray() || protocols.isEmpty()) return List.of();
    List<String> out = new ArrayList<>();
    collectNames(protocols.get(0), out);
    return out;
  }

  private static void collectNames(JsonNode node, List<String> out) {
    if (node.isArray()) {
      node.forEach(n -> collectNames(n, out));
    } else if (node.isObject()) {
      String name = node.path("name").asText("");
      if (!name.isBlank() && !out.contains(name)) out.add(name);
    }
  }

  private Mono<QuoteOutcome> fallback(SwapQuoteRequest request, BigInteger amount, int slippageBps) {
    return Mono.fromCallable(() -> fallbackQuote(request, amount, slippageBps))
        .subscribeOn(Schedulers.boundedElastic());
  }

  QuoteOutcome fallbackQuote(SwapQuoteRequest request, BigInteger amount, int slippageBps) {
    int chainId = request.chainId();
    String from = request.fromToken().trim();
    String to = request.toToken().trim();

    Map<String, BigDecimal> px = prices.getUsdPrices(chainId, List.of(from, to));
    BigDecimal priceFrom = px.get(from);
    BigDecimal priceTo = px.get(to);
    if (priceFrom == null || priceTo == null) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("fromPriceAvailable", priceFrom != null);
      details.put("toPriceAvailable", priceTo != null);
      return QuoteOutcome.failed(
          new ApiException(
              ApiErrorCode.PRICE_UNAVAILABLE, "Unable to fetch token prices", 503, details));
    }

    int fromDecimals = tokens.decimalsOf(chainId, from);
    int toDecimals = tokens.decimalsOf(chainId, to);

    BigDecimal amountDecimal = SwapMath.toDecimal(amount, fromDecimals);
    BigDecimal rawDecimal =
        amountDecimal.multiply(priceFrom).divide(priceTo, DECIMAL_SCALE, RoundingMode.DOWN);
    BigDecimal feeDecimal = SwapMath.platformFee(rawDecimal);
    BigDecimal afterFeeDecimal = rawDecimal.subtract(feeDecimal);

    BigInteger toAmount = SwapMath.toBaseUnits(afterFeeDecimal, toDecimals);
    BigInteger fee = SwapMath.toBaseUnits(feeDecimal, toDecimals);
    BigInteger minReceived =
        SwapMath.toBaseUnits(SwapMath.minReceived(afterFeeDecimal, slippageBps), toDecimals);
    double rate = priceFrom.divide(priceTo, MathContext.DECIMAL64).doubleValue();

    return QuoteOutcome.fallback(
        new SwapQuote(
            request.fromToken(),
            request.toToken(),
            amount.toString(),
            toAmount.toString(),
            rate,
            FALLBACK_PRICE_IMPACT,
            fee.toString(),
            minReceived.toString(),
            FALLBACK_ROUTE,
            DEFAULT_GAS,
            FALLBACK_PROTOCOLS));
  }
}
