package io.swapgate.backend.controller;

import io.swapgate.backend.model.ChainProfile;
import io.swapgate.backend.model.SwapQuote;
import io.swapgate.backend.model.SwapQuoteRequest;
import io.swapgate.backend.model.SwapTransaction;
import io.swapgate.backend.model.SwapTransactionRequest;
import io.swapgate.backend.model.TokenDescriptor;
import io.swapgate.backend.service.ChainRegistry;
import io.swapgate.backend.service.QuoteEngine;
import io.swapgate.backend.service.SwapTransactionBuilder;
import io.swapgate.backend.service.TokenCatalogService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping(path = "/api/v1/swap", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class SwapController {
  public static final String QUOTE_SOURCE_HEADER = "X-Quote-Source";

  private final QuoteEngine quotes;
  private final SwapTransactionBuilder transactions;
  private final TokenCatalogService tokens;
  private final ChainRegistry chains;

  public SwapController(
      QuoteEngine quotes,
      SwapTransactionBuilder transactions,
      TokenCatalogService tokens,
      ChainRegistry chains) {
    this.quotes = quotes;
    this.transactions = transactions;
    this.tokens = tokens;
    this.chains = chains;
  }

  @GetMapping("/quote")
  public Mono<ResponseEntity<SwapQuote>> quote(
      @RequestParam("chainId") int chainId,
      @RequestParam("fromToken") @NotBlank String fromToken,
      @RequestParam("toToken") @NotBlank String toToken,
      @RequestParam("amount") @NotBlank String amount,
      @RequestParam(value = "slippage", required = false) Double slippage) {
    double slippagePercent = slippage == null ? SwapQuoteRequest.DEFAULT_SLIPPAGE_PERCENT : slippage;
    SwapQuoteRequest request =
        new SwapQuoteRequest(chainId, fromToken.trim(), toToken.trim(), amount.trim(), slippagePercent);
    return quotes
        .getQuote(request)
        .map(
            outcome ->
                ResponseEntity.ok()
                    .header(QUOTE_SOURCE_HEADER, outcome.source().label())
                    .body(outcome.quoteOrThrow()));
  }

  @PostMapping(path = "/transaction", consumes = MediaType.APPLICATION_JSON_VALUE)
  public Mono<SwapTransaction> transaction(@Valid @RequestBody SwapTransactionRequest request) {
    return transactions.buildSwapTransaction(request);
  }

  @GetMapping("/tokens")
  public Mono<List<TokenDescriptor>> tokens(@RequestParam("chainId") int chainId) {
    return tokens.getSupportedTokens(chainId);
  }

  @GetMapping("/chains")
  public List<ChainProfile> chains() {
    return chains.all();
  }
}
