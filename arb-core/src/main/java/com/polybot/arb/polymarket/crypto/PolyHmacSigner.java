package com.polybot.arb.polymarket.crypto;

import lombok.experimental.UtilityClass;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;

/**
 * L2 request signature: url-safe base64 of HMAC-SHA256(secret, timestamp + method + path + body).
 */
@UtilityClass
public class PolyHmacSigner {

  private static final String HMAC_SHA256 = "HmacSHA256";

  public static String sign(String secret, long timestampSeconds, String method, String requestPath, String body) {
    String message = timestampSeconds + method + requestPath + (body == null ? "" : body);
    byte[] mac = hmac(decodeSecret(secret), message.getBytes(StandardCharsets.UTF_8));
    return Base64.getUrlEncoder().encodeToString(mac);
  }

  static byte[] decodeSecret(String secret) {
    if (secret == null) {
      throw new IllegalArgumentException("secret must not be null");
    }
    // secrets come url-safe and sometimes unpadded
    String standard = secret.replace('-', '+').replace('_', '/').replaceAll("[^A-Za-z0-9+/=]", "");
    int missingPadding = (4 - standard.length() % 4) % 4;
    return Base64.getDecoder().decode(standard + "=".repeat(missingPadding));
  }

  private static byte[] hmac(byte[] key, byte[] message) {
    try {
      Mac mac = Mac.getInstance(HMAC_SHA256);
      mac.init(new SecretKeySpec(key, HMAC_SHA256));
      return mac.doFinal(message);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HMAC-SHA256 unavailable", e);
    }
  }
}
