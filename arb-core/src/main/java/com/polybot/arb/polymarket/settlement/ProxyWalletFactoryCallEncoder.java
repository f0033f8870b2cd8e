package com.polybot.arb.polymarket.settlement;

import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * ABI encoding of {@code ProxyWalletFactory.proxy((uint8,address,uint256,bytes)[] calls)}, which forwards each
 * call from the sender's Polymarket proxy wallet. Tuples are encoded by hand since web3j has no struct encoder here.
 */
final class ProxyWalletFactoryCallEncoder {

  static final String PROXY_SELECTOR = "0x34ee9791";
  private static final int CALL_TYPE_CALL = 1;

  private ProxyWalletFactoryCallEncoder() {
  }

  record ProxyCall(int typeCode, String to, BigInteger value, byte[] data) {
    static ProxyCall call(String to, String calldataHex) {
      return new ProxyCall(CALL_TYPE_CALL, to, BigInteger.ZERO, Numeric.hexStringToByteArray(calldataHex));
    }
  }

  static String encodeProxy(List<ProxyCall> calls) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(Numeric.hexStringToByteArray(PROXY_SELECTOR));
    // single dynamic argument: head is the offset of its tail
    out.writeBytes(word(BigInteger.valueOf(32)));
    out.writeBytes(encodeCalls(calls));
    return Numeric.toHexString(out.toByteArray());
  }

  private static byte[] encodeCalls(List<ProxyCall> calls) {
    List<byte[]> tuples = new ArrayList<>(calls.size());
    for (ProxyCall call : calls) {
      tuples.add(encodeTuple(call));
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(word(BigInteger.valueOf(calls.size())));
    // offsets are relative to the first word after the length
    long offset = 32L * tuples.size();
    for (byte[] tuple : tuples) {
      out.writeBytes(word(BigInteger.valueOf(offset)));
      offset += tuple.length;
    }
    tuples.forEach(out::writeBytes);
    return out.toByteArray();
  }

  private static byte[] encodeTuple(ProxyCall call) {
    byte[] data = call.data() == null ? new byte[0] : call.data();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(word(BigInteger.valueOf(call.typeCode())));
    out.writeBytes(address(call.to()));
    out.writeBytes(word(call.value() == null ? BigInteger.ZERO : call.value()));
    out.writeBytes(word(BigInteger.valueOf(32L * 4)));
    out.writeBytes(word(BigInteger.valueOf(data.length)));
    out.writeBytes(data);
    int padding = (32 - data.length % 32) % 32;
    out.writeBytes(new byte[padding]);
    return out.toByteArray();
  }

  private static byte[] word(BigInteger value) {
    return Numeric.toBytesPadded(value, 32);
  }

  private static byte[] address(String hex) {
    byte[] raw = Numeric.hexStringToByteArray(hex);
    if (raw.length != 20) {
      throw new IllegalArgumentException("Expected 20-byte address, got: " + hex);
    }
    byte[] padded = new byte[32];
    System.arraycopy(raw, 0, padded, 12, 20);
    return padded;
  }
}
