package io.swapgate.backend.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.swapgate.backend.error.ApiErrorCode;
import io.swapgate.backend.error.ApiException;
import io.swapgate.backend.model.ChainProfile;
import io.swapgate.backend.model.QuoteOutcome;
import io.swapgate.backend.model.SwapQuote;
import io.swapgate.backend.model.SwapQuoteRequest;
import io.swapgate.backend.model.SwapTransaction;
import io.swapgate.backend.model.TokenDescriptor;
import io.swapgate.backend.security.SecurityConfig;
import io.swapgate.backend.security.SecurityEventLogFilter;
import io.swapgate.backend.security.SecurityGatewayFilter;
import io.swapgate.backend.service.ChainRegistry;
import io.swapgate.backend.service.QuoteEngine;
import io.swapgate.backend.service.SwapTransactionBuilder;
import io.swapgate.backend.service.TokenCatalogService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

@WebFluxTest(
    controllers = SwapController.class,
    excludeFilters =
        @ComponentScan.Filter(
            type = FilterType.ASSIGNABLE_TYPE,
            classes = {SecurityGatewayFilter.class, SecurityEventLogFilter.class, SecurityConfig.class}))
class SwapControllerTest {
  private static final String WALLET = "0xd8dA6BF26964aF9D7eEd9e03E53415D37aA96045";

  @Autowired private WebTestClient webTestClient;

  @MockBean private QuoteEngine quotes;
  @MockBean private SwapTransactionBuilder transactions;
  @MockBean private TokenCatalogService tokens;
  @MockBean private ChainRegistry chains;

  private static SwapQuote quote() {
    return new SwapQuote(
        "ETH", "USDC", "1000000000000000000", "997000000", 1e-9, 0.0, "3000000", "992015000",
        List.of("UNISWAP_V3"), "150000", List.of("UNISWAP_V3"));
  }

  @Test
  void quoteReportsItsSource() {
    given(quotes.getQuote(new SwapQuoteRequest(1, "ETH", "USDC", "1000000000000000000", 0.5)))
        .willReturn(Mono.just(QuoteOutcome.fallback(quote())));

    webTestClient
        .get()
        .uri("/api/v1/swap/quote?chainId=1&fromToken=ETH&toToken=USDC&amount=1000000000000000000")
        .exchange()
        .expectStatus()
        .isOk()
        .expectHeader()
        .valueEquals(SwapController.QUOTE_SOURCE_HEADER, "fallback")
        .expectBody()
        .jsonPath("$.toAmount")
        .isEqualTo("997000000")
        .jsonPath("$.minReceived")
        .isEqualTo("992015000");
  }

  @Test
  void failedQuoteMapsToErrorBody() {
    given(quotes.getQuote(any()))
        .willReturn(
            Mono.just(
                QuoteOutcome.failed(
                    new ApiException(
                        ApiErrorCode.PRICE_UNAVAILABLE,
                        "Unable to fetch token prices",
                        503,
                        Map.of("fromPriceAvailable", false)))));

    webTestClient
        .get()
        .uri("/api/v1/swap/quote?chainId=1&fromToken=ETH&toToken=XYZ&amount=1&slippage=1")
        .exchange()
        .expectStatus()
        .isEqualTo(503)
        .expectHeader()
        .doesNotExist(HttpHeaders.RETRY_AFTER)
        .expectBody()
        .jsonPath("$.ok")
        .isEqualTo(false)
        .jsonPath("$.code")
        .isEqualTo("PRICE_UNAVAILABLE")
        .jsonPath("$.details.fromPriceAvailable")
        .isEqualTo(false);
  }

  @Test
  void quoteWithoutAmountIsBadRequest() {
    webTestClient
        .get()
        .uri("/api/v1/swap/quote?chainId=1&fromToken=ETH&toToken=USDC")
        .exchange()
        .expectStatus()
        .isBadRequest();
    verify(quotes, never()).getQuote(any());
  }

  @Test
  void transactionReturnsRoutedCallData() {
    given(transactions.buildSwapTransaction(any()))
        .willReturn(
            Mono.just(
                new SwapTransaction(
                    WALLET, "0x111111125421cA6dc452d289314280a0f8842A65", "0x12aa", "0", "201000",
                    "23000000000")));

    webTestClient
        .post()
        .uri("/api/v1/swap/transaction")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(
            "{\"chainId\":1,\"fromToken\":\"ETH\",\"toToken\":\"USDC\",\"amount\":\"1000\","
                + "\"fromAddress\":\"" + WALLET + "\",\"slippagePercent\":1}")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.data")
        .isEqualTo("0x12aa");
  }

  @Test
  void transactionWithoutCredentialIsServiceUnavailable() {
    given(transactions.buildSwapTransaction(any()))
        .willReturn(
            Mono.error(
                new ApiException(ApiErrorCode.CREDENTIAL_REQUIRED, "Routing service API key required", 503)));

    webTestClient
        .post()
        .uri("/api/v1/swap/transaction")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(
            "{\"chainId\":1,\"fromToken\":\"ETH\",\"toToken\":\"USDC\",\"amount\":\"1000\","
                + "\"fromAddress\":\"" + WALLET + "\"}")
        .exchange()
        .expectStatus()
        .isEqualTo(503)
        .expectBody()
        .jsonPath("$.code")
        .isEqualTo("CREDENTIAL_REQUIRED");
  }

  @Test
  void transactionRejectsNonIntegerAmount() {
    webTestClient
        .post()
        .uri("/api/v1/swap/transaction")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(
            "{\"chainId\":1,\"fromToken\":\"ETH\",\"toToken\":\"USDC\",\"amount\":\"1.5\","
                + "\"fromAddress\":\"" + WALLET + "\"}")
        .exchange()
        .expectStatus()
        .isBadRequest()
        .expectBody()
        .jsonPath("$.code")
        .isEqualTo("BAD_REQUEST");
    verify(transactions, never()).buildSwapTransaction(any());
  }

  @Test
  void listsTokensAndChains() {
    given(tokens.getSupportedTokens(56))
        .willReturn(Mono.just(List.of(new TokenDescriptor("BNB", "BNB", "0xeeee", 18))));
    given(chains.all())
        .willReturn(List.of(new ChainProfile(1, "Ethereum", "ETH", true, "1inch")));

    webTestClient
        .get()
        .uri("/api/v1/swap/tokens?chainId=56")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$[0].symbol")
        .isEqualTo("BNB");

    webTestClient
        .get()
        .uri("/api/v1/swap/chains")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$[0].chainId")
        .isEqualTo(1)
        .jsonPath("$[0].sourceId")
        .isEqualTo("1inch")
        .jsonPath("$[0].pricePlatformId")
        .doesNotExist();
  }
}
