package com.polybot.arb.polymarket.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.polymarket.PolymarketOrderGateway;
import com.polybot.arb.polymarket.PolymarketVenueQuery;
import com.polybot.arb.polymarket.auth.PolymarketAuthContext;
import com.polybot.arb.polymarket.clob.PolymarketClobClient;
import com.polybot.arb.polymarket.data.PolymarketDataApiClient;
import com.polybot.arb.polymarket.gamma.PolymarketGammaClient;
import com.polybot.arb.polymarket.http.PolymarketHttpTransport;
import com.polybot.arb.polymarket.http.RequestRateLimiter;
import com.polybot.arb.polymarket.http.RetryPolicy;
import com.polybot.arb.polymarket.http.TokenBucketRateLimiter;
import com.polybot.arb.polymarket.rtds.RtdsChainlinkStreamClient;
import com.polybot.arb.polymarket.settlement.OnchainSettlementGateway;
import com.polybot.arb.polymarket.settlement.OnchainTxSender;
import com.polybot.arb.polymarket.ws.ClobMarketStreamClient;
import com.polybot.arb.venue.OrderBookStream;
import com.polybot.arb.venue.OrderGateway;
import com.polybot.arb.venue.RedeemablePositions;
import com.polybot.arb.venue.ReferencePriceStream;
import com.polybot.arb.venue.SettlementGateway;
import com.polybot.arb.venue.VenueQuery;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration(proxyBeanMethods = false)
public class PolymarketConfiguration {

  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public HttpClient polymarketHttpClient() {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(5))
        .version(HttpClient.Version.HTTP_1_1)
        .build();
  }

  @Bean
  public PolymarketHttpTransport polymarketHttpTransport(
      ArbProperties properties,
      HttpClient polymarketHttpClient,
      ObjectMapper objectMapper,
      Clock clock
  ) {
    ArbProperties.Rest rest = properties.polymarket().rest();
    ArbProperties.RateLimit rateLimit = rest.rateLimit();
    RequestRateLimiter limiter = rateLimit.enabled()
        ? new TokenBucketRateLimiter(rateLimit.requestsPerSecond(), rateLimit.burst(), clock)
        : RequestRateLimiter.unlimited();
    ArbProperties.Retry retry = rest.retry();
    RetryPolicy retryPolicy = new RetryPolicy(
        retry.enabled(), retry.maxAttempts(), retry.initialBackoffMillis(), retry.maxBackoffMillis());
    return new PolymarketHttpTransport(polymarketHttpClient, objectMapper, limiter, retryPolicy);
  }

  @Bean
  public PolymarketClobClient polymarketClobClient(
      ArbProperties properties,
      PolymarketHttpTransport transport,
      ObjectMapper objectMapper,
      Clock clock
  ) {
    ArbProperties.Polymarket polymarket = properties.polymarket();
    return new PolymarketClobClient(
        URI.create(polymarket.clobRestUrl()),
        transport,
        objectMapper,
        clock,
        polymarket.chainId(),
        polymarket.useServerTime()
    );
  }

  @Bean
  public PolymarketGammaClient polymarketGammaClient(ArbProperties properties, PolymarketHttpTransport transport) {
    return new PolymarketGammaClient(URI.create(properties.polymarket().gammaUrl()), transport);
  }

  @Bean
  public RedeemablePositions polymarketDataApiClient(
      ArbProperties properties,
      PolymarketHttpTransport transport,
      PolymarketAuthContext authContext
  ) {
    return new PolymarketDataApiClient(URI.create(properties.polymarket().dataApiUrl()), transport, authContext);
  }

  @Bean
  public VenueQuery venueQuery(
      PolymarketGammaClient gammaClient,
      PolymarketClobClient clobClient,
      ObjectMapper objectMapper
  ) {
    return new PolymarketVenueQuery(gammaClient, clobClient, objectMapper);
  }

  @Bean
  public OrderGateway orderGateway(
      ArbProperties properties,
      PolymarketClobClient clobClient,
      PolymarketAuthContext authContext,
      Clock clock
  ) {
    return new PolymarketOrderGateway(properties, clobClient, authContext, clock);
  }

  @Bean(destroyMethod = "shutdown")
  public Web3j polygonWeb3j(ArbProperties properties) {
    return Web3j.build(new HttpService(properties.settlement().rpcUrl()));
  }

  @Bean
  public SettlementGateway settlementGateway(
      ArbProperties properties,
      PolymarketAuthContext authContext,
      Web3j polygonWeb3j
  ) {
    OnchainTxSender sender = new OnchainTxSender(polygonWeb3j, properties.settlement(), properties.polymarket().chainId());
    return new OnchainSettlementGateway(properties, authContext, sender);
  }

  @Bean(destroyMethod = "shutdown")
  public OrderBookStream orderBookStream(
      ArbProperties properties,
      HttpClient polymarketHttpClient,
      ObjectMapper objectMapper,
      Clock clock
  ) {
    ArbProperties.Polymarket polymarket = properties.polymarket();
    return new ClobMarketStreamClient(
        polymarketHttpClient,
        objectMapper,
        clock,
        polymarket.clobWsUrl(),
        polymarket.marketWsStaleTimeoutMillis(),
        polymarket.marketWsReconnectDelayMillis()
    );
  }

  @Bean(destroyMethod = "stop")
  public ReferencePriceStream referencePriceStream(
      ArbProperties properties,
      HttpClient polymarketHttpClient,
      ObjectMapper objectMapper
  ) {
    ArbProperties.Polymarket polymarket = properties.polymarket();
    return new RtdsChainlinkStreamClient(
        polymarketHttpClient,
        objectMapper,
        polymarket.rtdsWsUrl(),
        polymarket.rtdsPingMillis(),
        polymarket.rtdsReconnectDelayMillis()
    );
  }
}
