package io.swapgate.backend.util;

import io.swapgate.backend.error.ApiException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/** Fee and slippage arithmetic. Base-unit amounts never pass through floating point. */
public final class SwapMath {
  private SwapMath() {}

  private static final Pattern BASE_UNITS = Pattern.compile("^[0-9]+$");
  private static final BigInteger FEE_NUMERATOR = BigInteger.valueOf(3);
  private static final BigInteger FEE_DENOMINATOR = BigInteger.valueOf(1000);
  private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);
  private static final BigDecimal FEE_RATE = new BigDecimal("0.003");

  public static final int DEFAULT_DECIMALS = 18;

  public static BigInteger parseAmount(String amount) {
    String a = amount == null ? "" : amount.trim();
    if (!BASE_UNITS.matcher(a).matches()) {
      throw ApiException.badRequest("amount must be a decimal integer string in base units");
    }
    BigInteger value = new BigInteger(a);
    if (value.signum() <= 0) {
      throw ApiException.badRequest("amount must be greater than zero");
    }
    return value;
  }

  public static void requireSlippage(double slippagePercent) {
    if (Double.isNaN(slippagePercent) || slippagePercent < 0 || slippagePercent > 100) {
      throw ApiException.badRequest("slippage must be between 0 and 100 percent");
    }
  }

  /** floor(slippagePercent * 100), taken on the decimal value the caller wrote (0.29 -> 29). */
  public static int slippageBps(double slippagePercent) {
    requireSlippage(slippagePercent);
    return BigDecimal.valueOf(slippagePercent)
        .movePointRight(2)
        .setScale(0, RoundingMode.FLOOR)
        .intValueExact();
  }

  /** 0.3% of the routed output, floored. */
  public static BigInteger platformFee(BigInteger rawOutput) {
    return rawOutput.multiply(FEE_NUMERATOR).divide(FEE_DENOMINATOR);
  }

  public static BigDecimal platformFee(BigDecimal rawOutput) {
    return rawOutput.multiply(FEE_RATE);
  }

  public static BigInteger minReceived(BigInteger amountAfterFee, int slippageBps) {
    return amountAfterFee
        .multiply(BigInteger.valueOf(10_000L - slippageBps))
        .divide(BPS_DENOMINATOR);
  }

  public static BigDecimal minReceived(BigDecimal amountAfterFee, int slippageBps) {
    return amountAfterFee.multiply(BigDecimal.valueOf(10_000L - slippageBps)).movePointLeft(4);
  }

  public static BigDecimal toDecimal(BigInteger baseUnits, int decimals) {
    return new BigDecimal(baseUnits, decimals);
  }

  public static BigInteger toBaseUnits(BigDecimal amount, int decimals) {
    return amount.movePointRight(decimals).setScale(0, RoundingMode.FLOOR).toBigInteger();
  }
}
