package com.polybot.arb.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix = "arb")
public record ArbProperties(
    TradingMode mode,
    @Valid Polymarket polymarket,
    @Valid Strategy strategy,
    @Valid Risk risk,
    @Valid Settlement settlement
) {

  public ArbProperties {
    if (mode == null) {
      mode = TradingMode.SIMULATION;
    }
    if (polymarket == null) {
      polymarket = defaultPolymarket();
    }
    if (strategy == null) {
      strategy = defaultStrategy();
    }
    if (risk == null) {
      risk = defaultRisk();
    }
    if (settlement == null) {
      settlement = defaultSettlement();
    }
  }

  public boolean isLive() {
    return mode == TradingMode.LIVE;
  }

  private static List<String> sanitizeSymbols(List<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    return values.stream()
        .filter(Objects::nonNull)
        .map(s -> s.trim().toLowerCase(Locale.ROOT))
        .filter(s -> !s.isEmpty())
        .distinct()
        .toList();
  }

  private static Polymarket defaultPolymarket() {
    return new Polymarket(null, null, null, null, null, null, null, null, null, null, null, null, null);
  }

  private static Rest defaultRest() {
    return new Rest(null, null);
  }

  private static RateLimit defaultRateLimit() {
    return new RateLimit(null, null, null);
  }

  private static Retry defaultRetry() {
    return new Retry(null, null, null, null);
  }

  private static Auth defaultAuth() {
    return new Auth(null, null, null, null, null, null, null, null);
  }

  private static Strategy defaultStrategy() {
    return new Strategy(null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
  }

  private static Risk defaultRisk() {
    return new Risk(null, null, null);
  }

  private static Settlement defaultSettlement() {
    return new Settlement(null, null, null, null, null, null, null);
  }

  public enum TradingMode {
    SIMULATION,
    LIVE
  }

  public record Polymarket(
      String clobRestUrl,
      String clobWsUrl,
      String gammaUrl,
      String dataApiUrl,
      String rtdsWsUrl,
      @Positive Integer chainId,
      Boolean useServerTime,
      @Valid Rest rest,
      @Valid Auth auth,
      @PositiveOrZero Long marketWsStaleTimeoutMillis,
      @PositiveOrZero Long marketWsReconnectDelayMillis,
      @Positive Long rtdsPingMillis,
      @PositiveOrZero Long rtdsReconnectDelayMillis
  ) {
    public Polymarket {
      if (clobRestUrl == null || clobRestUrl.isBlank()) {
        clobRestUrl = "https://clob.polymarket.com";
      }
      if (clobWsUrl == null || clobWsUrl.isBlank()) {
        clobWsUrl = "wss://ws-subscriptions-clob.polymarket.com";
      }
      if (gammaUrl == null || gammaUrl.isBlank()) {
        gammaUrl = "https://gamma-api.polymarket.com";
      }
      if (dataApiUrl == null || dataApiUrl.isBlank()) {
        dataApiUrl = "https://data-api.polymarket.com";
      }
      if (rtdsWsUrl == null || rtdsWsUrl.isBlank()) {
        rtdsWsUrl = "wss://ws-live-data.polymarket.com";
      }
      if (chainId == null) {
        chainId = 137;
      }
      if (useServerTime == null) {
        useServerTime = true;
      }
      if (rest == null) {
        rest = defaultRest();
      }
      if (auth == null) {
        auth = defaultAuth();
      }
      if (marketWsStaleTimeoutMillis == null) {
        marketWsStaleTimeoutMillis = 60_000L;
      }
      if (marketWsReconnectDelayMillis == null) {
        marketWsReconnectDelayMillis = 3_000L;
      }
      if (rtdsPingMillis == null) {
        rtdsPingMillis = 5_000L;
      }
      if (rtdsReconnectDelayMillis == null) {
        rtdsReconnectDelayMillis = 5_000L;
      }
    }
  }

  public record Rest(
      @Valid RateLimit rateLimit,
      @Valid Retry retry
  ) {
    public Rest {
      if (rateLimit == null) {
        rateLimit = defaultRateLimit();
      }
      if (retry == null) {
        retry = defaultRetry();
      }
    }
  }

  public record RateLimit(
      Boolean enabled,
      @Positive Double requestsPerSecond,
      @Positive Integer burst
  ) {
    public RateLimit {
      if (enabled == null) {
        enabled = true;
      }
      if (requestsPerSecond == null) {
        requestsPerSecond = 20.0;
      }
      if (burst == null) {
        burst = 40;
      }
    }
  }

  public record Retry(
      Boolean enabled,
      @Min(1) Integer maxAttempts,
      @PositiveOrZero Long initialBackoffMillis,
      @PositiveOrZero Long maxBackoffMillis
  ) {
    public Retry {
      if (enabled == null) {
        enabled = true;
      }
      if (maxAttempts == null) {
        maxAttempts = 3;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 200L;
      }
      if (maxBackoffMillis == null) {
        maxBackoffMillis = 2_000L;
      }
    }
  }

  /**
   * Signer and API credentials. Signature type 0 is a plain EOA, 1 a Polymarket proxy wallet and 2 a Gnosis Safe.
   */
  public record Auth(
      String privateKey,
      @Min(0) Integer signatureType,
      String funderAddress,
      String apiKey,
      String apiSecret,
      String apiPassphrase,
      @PositiveOrZero Long nonce,
      Boolean autoCreateOrDeriveApiCreds
  ) {
    public Auth {
      if (signatureType == null) {
        signatureType = 0;
      }
      if (nonce == null) {
        nonce = 0L;
      }
      if (autoCreateOrDeriveApiCreds == null) {
        autoCreateOrDeriveApiCreds = true;
      }
    }
  }

  public record Strategy(
      List<String> symbols,
      @DecimalMin("0.0") @DecimalMax("2.0") BigDecimal sumThreshold,
      @Positive BigDecimal shares,
      @PositiveOrZero Long tradeIntervalSeconds,
      Map<String, Double> priceToBeatTolerance,
      @Positive Long referenceCaptureWindowSeconds,
      @Positive Long overlapPollMillis,
      @Positive Long referencePricePollMillis,
      @Positive Long livePricePollMillis,
      @PositiveOrZero Long roundPauseMillis,
      @PositiveOrZero Long startupDelayMillis,
      @PositiveOrZero Long resolutionInitialDelaySeconds,
      @Positive Long resolutionPollIntervalSeconds,
      @Positive Long resolutionMaxWaitSeconds,
      Boolean autoRedeem
  ) {
    private static final Map<String, Double> DEFAULT_TOLERANCES = Map.of(
        "btc", 10.0,
        "eth", 1.0,
        "sol", 0.05,
        "xrp", 0.0003
    );

    public Strategy {
      symbols = sanitizeSymbols(symbols);
      if (symbols.isEmpty()) {
        symbols = List.of("btc", "eth", "sol", "xrp");
      }
      if (sumThreshold == null) {
        sumThreshold = new BigDecimal("0.99");
      }
      if (shares == null) {
        shares = BigDecimal.TEN;
      }
      if (tradeIntervalSeconds == null) {
        tradeIntervalSeconds = 60L;
      }
      Map<String, Double> merged = new LinkedHashMap<>(DEFAULT_TOLERANCES);
      if (priceToBeatTolerance != null) {
        priceToBeatTolerance.forEach((k, v) -> {
          if (k != null && v != null) {
            merged.put(k.trim().toLowerCase(Locale.ROOT), v);
          }
        });
      }
      priceToBeatTolerance = Map.copyOf(merged);
      if (referenceCaptureWindowSeconds == null) {
        referenceCaptureWindowSeconds = 2L;
      }
      if (overlapPollMillis == null) {
        overlapPollMillis = 5_000L;
      }
      if (referencePricePollMillis == null) {
        referencePricePollMillis = 10_000L;
      }
      if (livePricePollMillis == null) {
        livePricePollMillis = 10L;
      }
      if (roundPauseMillis == null) {
        roundPauseMillis = 5_000L;
      }
      if (startupDelayMillis == null) {
        startupDelayMillis = 2_000L;
      }
      if (resolutionInitialDelaySeconds == null) {
        resolutionInitialDelaySeconds = 60L;
      }
      if (resolutionPollIntervalSeconds == null) {
        resolutionPollIntervalSeconds = 30L;
      }
      if (resolutionMaxWaitSeconds == null) {
        resolutionMaxWaitSeconds = 600L;
      }
      if (autoRedeem == null) {
        autoRedeem = true;
      }
    }

    /**
     * Maximum allowed distance between the 15m and 5m reference prices; unknown symbols get 0.0.
     */
    public double toleranceFor(String symbol) {
      if (symbol == null) {
        return 0.0;
      }
      return priceToBeatTolerance.getOrDefault(symbol.trim().toLowerCase(Locale.ROOT), 0.0);
    }
  }

  public record Risk(
      Boolean killSwitch,
      @PositiveOrZero BigDecimal maxOrderNotionalUsd,
      @PositiveOrZero BigDecimal maxOrderSize
  ) {
    public Risk {
      if (killSwitch == null) {
        killSwitch = false;
      }
      if (maxOrderNotionalUsd == null) {
        maxOrderNotionalUsd = BigDecimal.ZERO;
      }
      if (maxOrderSize == null) {
        maxOrderSize = BigDecimal.ZERO;
      }
    }
  }

  public record Settlement(
      String rpcUrl,
      String proxyWalletFactoryAddress,
      @Positive Long fallbackGasLimit,
      @NotNull @DecimalMin("1.0") Double gasLimitMultiplier,
      @NotNull @DecimalMin("1.0") Double gasPriceMultiplier,
      @Positive Long receiptPollIntervalMillis,
      @Positive Integer receiptPollAttempts
  ) {
    public Settlement {
      if (rpcUrl == null || rpcUrl.isBlank()) {
        rpcUrl = "https://polygon-rpc.com";
      }
      if (proxyWalletFactoryAddress == null || proxyWalletFactoryAddress.isBlank()) {
        proxyWalletFactoryAddress = "0xab45c5a4b0c941a2f231c04c3f49182e1a254052";
      }
      if (fallbackGasLimit == null) {
        fallbackGasLimit = 1_000_000L;
      }
      if (gasLimitMultiplier == null) {
        gasLimitMultiplier = 1.25;
      }
      if (gasPriceMultiplier == null) {
        gasPriceMultiplier = 1.10;
      }
      if (receiptPollIntervalMillis == null) {
        receiptPollIntervalMillis = 1_000L;
      }
      if (receiptPollAttempts == null) {
        receiptPollAttempts = 60;
      }
    }
  }
}
