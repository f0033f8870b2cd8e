package com.polybot.arb.polymarket.model;

/**
 * L2 API credentials. The secret is url-safe base64.
 */
public record ApiCreds(String key, String secret, String passphrase) {

  public boolean isComplete() {
    return notBlank(key) && notBlank(secret) && notBlank(passphrase);
  }

  @Override
  public String toString() {
    return "ApiCreds[key=..." + (key == null || key.length() < 6 ? "" : key.substring(key.length() - 6)) + "]";
  }

  private static boolean notBlank(String s) {
    return s != null && !s.isBlank();
  }
}
