package com.polybot.arb.polymarket.settlement;

import com.polybot.arb.config.ArbProperties;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Signs and sends a legacy contract-call transaction, then waits for its receipt.
 * Gas price and estimated gas limit are scaled by the configured multipliers.
 */
@Slf4j
public class OnchainTxSender {

  private static final BigInteger MIN_GAS_LIMIT = BigInteger.valueOf(21_000L);

  private final Web3j web3j;
  private final ArbProperties.Settlement settings;
  private final long chainId;

  public OnchainTxSender(Web3j web3j, ArbProperties.Settlement settings, long chainId) {
    this.web3j = Objects.requireNonNull(web3j, "web3j");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.chainId = chainId;
  }

  public TransactionReceipt send(Credentials signer, String to, String calldataHex) throws IOException, InterruptedException {
    String from = signer.getAddress();
    BigInteger nonce = web3j.ethGetTransactionCount(from, DefaultBlockParameterName.PENDING).send().getTransactionCount();
    BigInteger gasPrice = scale(web3j.ethGasPrice().send().getGasPrice(), settings.gasPriceMultiplier());
    BigInteger gasLimit = estimateGasLimit(from, to, calldataHex);

    RawTransaction tx = RawTransaction.createTransaction(nonce, gasPrice, gasLimit, to, BigInteger.ZERO, calldataHex);
    String signed = Numeric.toHexString(TransactionEncoder.signMessage(tx, chainId, signer));

    EthSendTransaction sent = web3j.ethSendRawTransaction(signed).send();
    if (sent.hasError()) {
      throw new IOException("eth_sendRawTransaction error: " + sent.getError().getMessage());
    }
    String txHash = sent.getTransactionHash();
    log.info("Settlement tx sent (hash={}, to={}, gasPrice={}, gasLimit={})", txHash, to, gasPrice, gasLimit);

    TransactionReceipt receipt = awaitReceipt(txHash);
    if ("0x0".equalsIgnoreCase(receipt.getStatus())) {
      throw new IOException("Settlement tx reverted (hash=" + txHash + ")");
    }
    log.info("Settlement tx confirmed (hash={}, block={})", txHash, receipt.getBlockNumber());
    return receipt;
  }

  private BigInteger estimateGasLimit(String from, String to, String data) {
    BigInteger fallback = BigInteger.valueOf(settings.fallbackGasLimit());
    try {
      Transaction call = Transaction.createFunctionCallTransaction(from, null, null, null, to, BigInteger.ZERO, data);
      EthEstimateGas estimate = web3j.ethEstimateGas(call).send();
      if (estimate.hasError() || estimate.getAmountUsed() == null) {
        log.warn("Gas estimate unavailable, using fallback {}: {}", fallback,
            estimate.hasError() ? estimate.getError().getMessage() : "no amount");
        return fallback;
      }
      return scale(estimate.getAmountUsed(), settings.gasLimitMultiplier()).max(MIN_GAS_LIMIT);
    } catch (IOException e) {
      log.warn("Gas estimate failed, using fallback {}: {}", fallback, e.toString());
      return fallback;
    }
  }

  private TransactionReceipt awaitReceipt(String txHash) throws IOException, InterruptedException {
    long interval = settings.receiptPollIntervalMillis();
    int attempts = settings.receiptPollAttempts();
    for (int i = 0; i < attempts; i++) {
      Optional<TransactionReceipt> receipt = web3j.ethGetTransactionReceipt(txHash).send().getTransactionReceipt();
      if (receipt.isPresent()) {
        return receipt.get();
      }
      Thread.sleep(interval);
    }
    throw new IOException("Timed out waiting for receipt (hash=" + txHash + ", waited="
        + Duration.ofMillis(interval * attempts) + ")");
  }

  private static BigInteger scale(BigInteger value, double multiplier) {
    return new BigDecimal(value)
        .multiply(BigDecimal.valueOf(multiplier))
        .setScale(0, RoundingMode.CEILING)
        .toBigIntegerExact();
  }
}
