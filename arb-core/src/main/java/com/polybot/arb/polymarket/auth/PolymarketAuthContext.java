package com.polybot.arb.polymarket.auth;

import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.polymarket.clob.PolymarketClobClient;
import com.polybot.arb.polymarket.model.ApiCreds;
import jakarta.annotation.PostConstruct;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Holds the signer key and L2 API credentials. In live mode, missing API credentials are created or derived
 * from the signer at startup.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PolymarketAuthContext {

  private static final Pattern HEX_32_BYTES = Pattern.compile("0x[0-9a-fA-F]{64}");
  private static final Pattern HEX_20_BYTES = Pattern.compile("0x[0-9a-fA-F]{40}");

  private final @NonNull ArbProperties properties;
  private final @NonNull PolymarketClobClient clobClient;

  private volatile Credentials signerCredentials;
  private volatile ApiCreds apiCreds;
  private volatile String funderAddress;

  @PostConstruct
  void initFromConfig() {
    ArbProperties.Auth auth = properties.polymarket().auth();

    String privateKey = auth.privateKey();
    if (privateKey != null && !privateKey.isBlank()) {
      requireHex("arb.polymarket.auth.private-key", privateKey.trim(), HEX_32_BYTES, 64);
      this.signerCredentials = Credentials.create(privateKey.trim().substring(2));
    }

    String funder = auth.funderAddress();
    if (funder != null && !funder.isBlank()) {
      requireHex("arb.polymarket.auth.funder-address", funder.trim(), HEX_20_BYTES, 40);
      this.funderAddress = funder.trim();
    }

    ApiCreds configured = new ApiCreds(auth.apiKey(), auth.apiSecret(), auth.apiPassphrase());
    if (configured.isComplete()) {
      this.apiCreds = configured;
    }

    log.info("Auth config loaded (mode={}, signatureType={}, signerKeyPresent={}, funderPresent={}, apiKeyPresent={})",
        properties.mode(), auth.signatureType(), signerCredentials != null, funderAddress != null, apiCreds != null);

    if (properties.isLive() && apiCreds == null && signerCredentials != null && auth.autoCreateOrDeriveApiCreds()) {
      createOrDeriveApiCreds(auth.nonce());
    }
  }

  public Optional<Credentials> signerCredentials() {
    return Optional.ofNullable(signerCredentials);
  }

  public Credentials requireSignerCredentials() {
    Credentials creds = signerCredentials;
    if (creds == null) {
      throw new MissingCredentialsException("Polymarket signer private key is not configured (arb.polymarket.auth.private-key)");
    }
    return creds;
  }

  public ApiCreds requireApiCreds() {
    ApiCreds creds = apiCreds;
    if (creds == null) {
      throw new MissingCredentialsException("Polymarket API creds not configured (arb.polymarket.auth.api-key/secret/passphrase)");
    }
    return creds;
  }

  public int signatureType() {
    return properties.polymarket().auth().signatureType();
  }

  /**
   * Wallet that holds positions: the configured funder (proxy/safe), otherwise the signer itself.
   */
  public Optional<String> funderAddress() {
    if (funderAddress != null) {
      return Optional.of(funderAddress);
    }
    return signerCredentials().map(Credentials::getAddress);
  }

  private synchronized void createOrDeriveApiCreds(long nonce) {
    Credentials signer = requireSignerCredentials();
    try {
      ApiCreds created = clobClient.createApiCreds(signer, nonce);
      if (created.isComplete()) {
        this.apiCreds = created;
        log.info("Created Polymarket API creds {}", created);
        return;
      }
    } catch (RuntimeException e) {
      log.info("Creating Polymarket API creds failed, deriving instead: {}", e.toString());
    }
    try {
      ApiCreds derived = clobClient.deriveApiCreds(signer, nonce);
      if (derived.isComplete()) {
        this.apiCreds = derived;
        log.info("Derived Polymarket API creds {}", derived);
      } else {
        log.warn("Deriving Polymarket API creds returned incomplete credentials");
      }
    } catch (RuntimeException e) {
      log.warn("Failed to derive Polymarket API creds: {}", e.toString());
    }
  }

  private static void requireHex(String field, String value, Pattern pattern, int hexChars) {
    if (!pattern.matcher(value).matches()) {
      throw new IllegalArgumentException(field + " must be 0x + " + hexChars + " hex chars");
    }
  }
}
