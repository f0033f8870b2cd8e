package com.polybot.arb.polymarket.auth;

/**
 * Live trading was attempted without the signer key or API credentials. Not recoverable by retrying.
 */
public class MissingCredentialsException extends IllegalStateException {

  public MissingCredentialsException(String message) {
    super(message);
  }
}
