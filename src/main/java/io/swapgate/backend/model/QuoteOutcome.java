package io.swapgate.backend.model;

import io.swapgate.backend.error.ApiException;
import java.util.Locale;

public record QuoteOutcome(Source source, SwapQuote quote, ApiException error) {
  public enum Source {
    PRIMARY,
    FALLBACK,
    FAILED;

    public String label() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  public static QuoteOutcome primary(SwapQuote quote) {
    return new QuoteOutcome(Source.PRIMARY, quote, null);
  }

  public static QuoteOutcome fallback(SwapQuote quote) {
    return new QuoteOutcome(Source.FALLBACK, quote, null);
  }

  public static QuoteOutcome failed(ApiException error) {
    return new QuoteOutcome(Source.FAILED, null, error);
  }

  public boolean isFailed() {
    return source == Source.FAILED;
  }

  /** Returns the quote or throws the failure. */
  public SwapQuote quoteOrThrow() {
    if (isFailed()) throw error;
    return quote;
  }
}
