package com.polybot.arb.polymarket.crypto;

import com.polybot.arb.polymarket.model.SignedOrder;
import lombok.experimental.UtilityClass;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * EIP-712 signatures for the two structs the CLOB needs: the L1 {@code ClobAuth} attestation and exchange orders.
 */
@UtilityClass
public class Eip712Signer {

  private static final byte[] CLOB_DOMAIN_TYPEHASH =
      keccak("EIP712Domain(string name,string version,uint256 chainId)");
  private static final byte[] EXCHANGE_DOMAIN_TYPEHASH =
      keccak("EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)");
  private static final byte[] CLOB_AUTH_TYPEHASH =
      keccak("ClobAuth(address address,string timestamp,uint256 nonce,string message)");
  private static final byte[] ORDER_TYPEHASH = keccak("Order(uint256 salt,address maker,address signer,address taker,"
      + "uint256 tokenId,uint256 makerAmount,uint256 takerAmount,uint256 expiration,uint256 nonce,"
      + "uint256 feeRateBps,uint8 side,uint8 signatureType)");

  private static final String CLOB_AUTH_MESSAGE = "This message attests that I control the given wallet";

  public static String signClobAuth(Credentials credentials, int chainId, long timestampSeconds, long nonce) {
    byte[] domain = hashStruct(CLOB_DOMAIN_TYPEHASH,
        keccak("ClobAuthDomain"),
        keccak("1"),
        uint256(BigInteger.valueOf(chainId)));
    byte[] message = hashStruct(CLOB_AUTH_TYPEHASH,
        address(credentials.getAddress()),
        keccak(Long.toString(timestampSeconds)),
        uint256(BigInteger.valueOf(nonce)),
        keccak(CLOB_AUTH_MESSAGE));
    return sign(credentials, domain, message);
  }

  /**
   * Signs {@code order} (its own signature field is ignored) for the given exchange contract.
   */
  public static String signOrder(Credentials credentials, int chainId, String exchangeContract, SignedOrder order) {
    byte[] domain = hashStruct(EXCHANGE_DOMAIN_TYPEHASH,
        keccak("Polymarket CTF Exchange"),
        keccak("1"),
        uint256(BigInteger.valueOf(chainId)),
        address(exchangeContract));
    byte[] message = hashStruct(ORDER_TYPEHASH,
        uint256(order.salt()),
        address(order.maker()),
        address(order.signer()),
        address(order.taker()),
        uint256(order.tokenId()),
        uint256(order.makerAmount()),
        uint256(order.takerAmount()),
        uint256(order.expiration()),
        uint256(order.nonce()),
        uint256(order.feeRateBps()),
        uint256(BigInteger.valueOf(order.side().toEip712Value())),
        uint256(BigInteger.valueOf(order.signatureType())));
    return sign(credentials, domain, message);
  }

  private static String sign(Credentials credentials, byte[] domainSeparator, byte[] structHash) {
    ByteBuffer prefixed = ByteBuffer.allocate(66);
    prefixed.put((byte) 0x19).put((byte) 0x01).put(domainSeparator).put(structHash);
    byte[] digest = Hash.sha3(prefixed.array());

    Sign.SignatureData sig = Sign.signMessage(digest, credentials.getEcKeyPair(), false);
    byte v = sig.getV()[0];
    if (v < 27) {
      v += 27;
    }
    ByteBuffer out = ByteBuffer.allocate(65);
    out.put(sig.getR()).put(sig.getS()).put(v);
    return Numeric.toHexString(out.array());
  }

  private static byte[] hashStruct(byte[] typeHash, byte[]... fields) {
    ByteBuffer buf = ByteBuffer.allocate(32 * (fields.length + 1));
    buf.put(typeHash);
    for (byte[] field : fields) {
      buf.put(field);
    }
    return Hash.sha3(buf.array());
  }

  private static byte[] keccak(String value) {
    return Hash.sha3(value.getBytes(StandardCharsets.UTF_8));
  }

  private static byte[] uint256(String decimal) {
    return uint256(new BigInteger(decimal));
  }

  private static byte[] uint256(BigInteger value) {
    if (value.signum() < 0) {
      throw new IllegalArgumentException("uint256 cannot be negative: " + value);
    }
    return Numeric.toBytesPadded(value, 32);
  }

  private static byte[] address(String hex) {
    byte[] raw = Numeric.hexStringToByteArray(hex);
    if (raw.length != 20) {
      throw new IllegalArgumentException("Expected 20-byte address, got " + raw.length + " bytes: " + hex);
    }
    byte[] word = new byte[32];
    System.arraycopy(raw, 0, word, 12, 20);
    return word;
  }
}
