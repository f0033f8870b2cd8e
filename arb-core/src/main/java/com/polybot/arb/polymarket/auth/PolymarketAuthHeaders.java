package com.polybot.arb.polymarket.auth;

import com.polybot.arb.polymarket.crypto.Eip712Signer;
import com.polybot.arb.polymarket.crypto.PolyHmacSigner;
import com.polybot.arb.polymarket.model.ApiCreds;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import org.springframework.http.HttpMethod;
import org.web3j.crypto.Credentials;

import java.util.Map;

@UtilityClass
public class PolymarketAuthHeaders {

  public static final String POLY_ADDRESS = "POLY_ADDRESS";
  public static final String POLY_SIGNATURE = "POLY_SIGNATURE";
  public static final String POLY_TIMESTAMP = "POLY_TIMESTAMP";
  public static final String POLY_NONCE = "POLY_NONCE";
  public static final String POLY_API_KEY = "POLY_API_KEY";
  public static final String POLY_PASSPHRASE = "POLY_PASSPHRASE";

  /**
   * Wallet-signed headers used to create or derive API credentials.
   */
  public static Map<String, String> l1(@NonNull Credentials signer, int chainId, long timestampSeconds, long nonce) {
    return Map.of(
        POLY_ADDRESS, signer.getAddress(),
        POLY_SIGNATURE, Eip712Signer.signClobAuth(signer, chainId, timestampSeconds, nonce),
        POLY_TIMESTAMP, Long.toString(timestampSeconds),
        POLY_NONCE, Long.toString(nonce)
    );
  }

  /**
   * API-key headers for trading endpoints; the signature covers timestamp, method, path and body.
   */
  public static Map<String, String> l2(
      @NonNull Credentials signer,
      @NonNull ApiCreds creds,
      long timestampSeconds,
      @NonNull HttpMethod method,
      @NonNull String requestPath,
      String body
  ) {
    return Map.of(
        POLY_ADDRESS, signer.getAddress(),
        POLY_SIGNATURE, PolyHmacSigner.sign(creds.secret(), timestampSeconds, method.name(), requestPath, body),
        POLY_TIMESTAMP, Long.toString(timestampSeconds),
        POLY_API_KEY, creds.key(),
        POLY_PASSPHRASE, creds.passphrase()
    );
  }
}
