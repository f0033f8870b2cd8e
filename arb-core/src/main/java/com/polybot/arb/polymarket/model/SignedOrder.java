package com.polybot.arb.polymarket.model;

import com.polybot.arb.venue.OrderSide;

/**
 * CTF exchange order as signed under EIP-712. Amounts are base-unit integers rendered as strings.
 */
public record SignedOrder(
    String salt,
    String maker,
    String signer,
    String taker,
    String tokenId,
    String makerAmount,
    String takerAmount,
    String expiration,
    String nonce,
    String feeRateBps,
    OrderSide side,
    int signatureType,
    String signature
) {

  public SignedOrder {
    requireNotBlank("salt", salt);
    requireNotBlank("maker", maker);
    requireNotBlank("signer", signer);
    requireNotBlank("taker", taker);
    requireNotBlank("tokenId", tokenId);
    requireNotBlank("makerAmount", makerAmount);
    requireNotBlank("takerAmount", takerAmount);
    requireNotBlank("expiration", expiration);
    requireNotBlank("nonce", nonce);
    requireNotBlank("feeRateBps", feeRateBps);
    if (side == null) {
      throw new IllegalArgumentException("side must not be null");
    }
    if (signature == null) {
      signature = "";
    }
  }

  public SignedOrder withSignature(String newSignature) {
    return new SignedOrder(salt, maker, signer, taker, tokenId, makerAmount, takerAmount, expiration, nonce,
        feeRateBps, side, signatureType, newSignature);
  }

  public boolean isSigned() {
    return !signature.isBlank();
  }

  private static void requireNotBlank(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
  }
}
