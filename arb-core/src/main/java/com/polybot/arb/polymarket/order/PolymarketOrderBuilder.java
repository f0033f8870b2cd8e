package com.polybot.arb.polymarket.order;

import com.polybot.arb.polymarket.crypto.Eip712Signer;
import com.polybot.arb.polymarket.model.SignedOrder;
import com.polybot.arb.polymarket.onchain.ContractConfig;
import com.polybot.arb.venue.OrderSide;
import org.web3j.crypto.Credentials;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Turns a (token, side, price, size) limit order into signed exchange amounts. Price decimals follow the
 * market's tick size; sizes keep two decimals and amounts tick decimals + 2.
 */
public final class PolymarketOrderBuilder {

  private final int chainId;
  private final ContractConfig contracts;
  private final Credentials signer;
  private final int signatureType;
  private final String makerAddress;
  private final Clock clock;

  public PolymarketOrderBuilder(int chainId, Credentials signer, int signatureType, String funderAddress, Clock clock) {
    this.chainId = chainId;
    this.contracts = ContractConfig.forChainId(chainId);
    this.signer = Objects.requireNonNull(signer, "signer");
    this.signatureType = signatureType;
    this.makerAddress = (funderAddress == null || funderAddress.isBlank()) ? signer.getAddress() : funderAddress;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public SignedOrder buildLimitOrder(
      String tokenId,
      OrderSide side,
      BigDecimal price,
      BigDecimal size,
      BigDecimal tickSize,
      boolean negRisk,
      int feeRateBps
  ) {
    Objects.requireNonNull(tickSize, "tickSize");
    if (price == null || price.compareTo(tickSize) < 0 || price.compareTo(BigDecimal.ONE.subtract(tickSize)) > 0) {
      throw new IllegalArgumentException("price " + price + " outside [" + tickSize + ", " + BigDecimal.ONE.subtract(tickSize) + "]");
    }

    int priceDecimals = Math.max(0, tickSize.stripTrailingZeros().scale());
    int amountDecimals = priceDecimals + 2;
    BigDecimal roundedPrice = roundIfNeeded(price, priceDecimals, RoundingMode.HALF_UP);
    BigDecimal shares = roundIfNeeded(size, 2, RoundingMode.DOWN);
    BigDecimal notional = clampDecimals(shares.multiply(roundedPrice), amountDecimals);

    // BUY gives collateral for shares; SELL the reverse
    BigDecimal makerAmount = side == OrderSide.BUY ? notional : shares;
    BigDecimal takerAmount = side == OrderSide.BUY ? shares : notional;

    int decimals = contracts.collateralTokenDecimals();
    SignedOrder unsigned = new SignedOrder(
        newSalt(),
        makerAddress,
        signer.getAddress(),
        ContractConfig.ZERO_ADDRESS,
        tokenId,
        toBaseUnits(makerAmount, decimals).toString(),
        toBaseUnits(takerAmount, decimals).toString(),
        "0",
        "0",
        Integer.toString(feeRateBps),
        side,
        signatureType,
        ""
    );
    String exchange = negRisk ? contracts.negRiskExchange() : contracts.exchange();
    return unsigned.withSignature(Eip712Signer.signOrder(signer, chainId, exchange, unsigned));
  }

  private String newSalt() {
    return Long.toString(Math.round(ThreadLocalRandom.current().nextDouble() * clock.millis()));
  }

  private static BigDecimal roundIfNeeded(BigDecimal value, int decimals, RoundingMode mode) {
    if (decimalPlaces(value) <= decimals) {
      return value;
    }
    return value.setScale(decimals, mode);
  }

  private static BigDecimal clampDecimals(BigDecimal amount, int maxDecimals) {
    if (decimalPlaces(amount) <= maxDecimals) {
      return amount;
    }
    BigDecimal roundedUp = amount.setScale(maxDecimals + 4, RoundingMode.UP);
    return decimalPlaces(roundedUp) > maxDecimals ? roundedUp.setScale(maxDecimals, RoundingMode.DOWN) : roundedUp;
  }

  private static int decimalPlaces(BigDecimal value) {
    return Math.max(0, value.stripTrailingZeros().scale());
  }

  private static BigInteger toBaseUnits(BigDecimal amount, int decimals) {
    return amount.movePointRight(decimals).setScale(0, RoundingMode.UNNECESSARY).toBigIntegerExact();
  }
}
