package com.polybot.arb.polymarket.settlement;

import com.polybot.arb.config.ArbProperties;
import com.polybot.arb.domain.Outcome;
import com.polybot.arb.polymarket.auth.PolymarketAuthContext;
import com.polybot.arb.polymarket.onchain.ContractConfig;
import com.polybot.arb.venue.RedemptionResult;
import com.polybot.arb.venue.SettlementGateway;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Redeems winning conditional tokens for USDC. An EOA signer (signature type 0) calls the ConditionalTokens
 * contract directly; a Polymarket proxy wallet (type 1) routes the call through the ProxyWalletFactory.
 * Gnosis Safe wallets (type 2) are not supported.
 */
@Slf4j
@RequiredArgsConstructor
public class OnchainSettlementGateway implements SettlementGateway {

  static final int SIGNATURE_TYPE_EOA = 0;
  static final int SIGNATURE_TYPE_PROXY = 1;
  static final int SIGNATURE_TYPE_GNOSIS_SAFE = 2;

  private final @NonNull ArbProperties properties;
  private final @NonNull PolymarketAuthContext authContext;
  private final @NonNull OnchainTxSender txSender;

  @Override
  public boolean isConfigured() {
    return unavailableReason().isEmpty();
  }

  @Override
  public Optional<String> unavailableReason() {
    if (authContext.signerCredentials().isEmpty()) {
      return Optional.of("signer private key missing");
    }
    int signatureType = authContext.signatureType();
    if (signatureType == SIGNATURE_TYPE_GNOSIS_SAFE) {
      return Optional.of("Gnosis Safe wallets (signature type 2) are not supported for redemption");
    }
    if (signatureType != SIGNATURE_TYPE_EOA && signatureType != SIGNATURE_TYPE_PROXY) {
      return Optional.of("unsupported signature type " + signatureType);
    }
    return Optional.empty();
  }

  @Override
  public RedemptionResult redeem(String conditionId, Outcome outcome) {
    Optional<String> unavailable = unavailableReason();
    if (unavailable.isPresent()) {
      return RedemptionResult.failed("settlement not configured: " + unavailable.get());
    }
    Credentials signer = authContext.requireSignerCredentials();
    ContractConfig contracts = ContractConfig.forChainId(properties.polymarket().chainId());

    String redeemCall = ConditionalTokensCallEncoder.encodeRedeemPositions(
        contracts.collateral(), conditionId, List.of(BigInteger.valueOf(outcome.indexSet())));

    String to;
    String calldata;
    if (authContext.signatureType() == SIGNATURE_TYPE_PROXY) {
      to = properties.settlement().proxyWalletFactoryAddress();
      calldata = ProxyWalletFactoryCallEncoder.encodeProxy(List.of(
          ProxyWalletFactoryCallEncoder.ProxyCall.call(contracts.conditionalTokens(), redeemCall)));
    } else {
      to = contracts.conditionalTokens();
      calldata = redeemCall;
    }

    log.info("Redeeming condition={} outcome={} via {}", conditionId, outcome.label(), to);
    try {
      TransactionReceipt receipt = txSender.send(signer, to, calldata);
      return RedemptionResult.confirmed(receipt.getTransactionHash());
    } catch (IOException e) {
      log.warn("Redemption failed condition={} error={}", conditionId, e.getMessage());
      return RedemptionResult.failed(e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return RedemptionResult.failed("interrupted while waiting for receipt");
    }
  }
}
