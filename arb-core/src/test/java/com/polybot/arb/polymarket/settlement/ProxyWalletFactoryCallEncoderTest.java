package com.polybot.arb.polymarket.settlement;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProxyWalletFactoryCallEncoderTest {

  private static final String CTF = "0x4D97DCd97eC945f40cF65F87097ACe5EA0476045";

  @Test
  void wrapsSingleCallInProxyTupleArray() {
    // 36 bytes of inner calldata: padded to 64
    String inner = "0x" + "11".repeat(36);

    String data = ProxyWalletFactoryCallEncoder.encodeProxy(List.of(ProxyWalletFactoryCallEncoder.ProxyCall.call(CTF, inner)));

    assertThat(data).startsWith(ProxyWalletFactoryCallEncoder.PROXY_SELECTOR);
    String body = data.substring(10);
    assertThat(value(body, 0)).isEqualTo(32);   // offset of the array
    assertThat(value(body, 1)).isEqualTo(1);    // array length
    assertThat(value(body, 2)).isEqualTo(32);   // offset of tuple 0
    assertThat(value(body, 3)).isEqualTo(1);    // call type
    assertThat(word(body, 4)).endsWith(CTF.substring(2).toLowerCase());
    assertThat(value(body, 5)).isZero();        // value
    assertThat(value(body, 6)).isEqualTo(128);  // offset of data inside the tuple
    assertThat(value(body, 7)).isEqualTo(36);   // data length
    assertThat(body.substring(8 * 64)).isEqualTo("11".repeat(36) + "00".repeat(28));
  }

  @Test
  void offsetsAccountForPrecedingTuples() {
    String first = "0x" + "aa".repeat(4);
    String second = "0x" + "bb".repeat(4);

    String body = ProxyWalletFactoryCallEncoder.encodeProxy(List.of(
        ProxyWalletFactoryCallEncoder.ProxyCall.call(CTF, first),
        ProxyWalletFactoryCallEncoder.ProxyCall.call(CTF, second))).substring(10);

    // each tuple: 5 head words plus one padded data word
    assertThat(value(body, 1)).isEqualTo(2);
    assertThat(value(body, 2)).isEqualTo(64);
    assertThat(value(body, 3)).isEqualTo(64 + 6 * 32);
  }

  private static String word(String body, int index) {
    return body.substring(index * 64, (index + 1) * 64);
  }

  private static long value(String body, int index) {
    return new BigInteger(word(body, index), 16).longValueExact();
  }
}
