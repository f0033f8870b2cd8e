package com.polybot.arb.polymarket.settlement;

import lombok.NonNull;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;

final class ConditionalTokensCallEncoder {

  private ConditionalTokensCallEncoder() {
  }

  /**
   * {@code redeemPositions(address collateral, bytes32 parentCollectionId, bytes32 conditionId, uint256[] indexSets)}
   * with a zero parent collection (top-level condition).
   */
  static String encodeRedeemPositions(
      @NonNull String collateralAddress,
      @NonNull String conditionIdHex,
      @NonNull List<BigInteger> indexSets
  ) {
    Function function = new Function(
        "redeemPositions",
        List.of(
            new Address(collateralAddress),
            new Bytes32(new byte[32]),
            conditionId(conditionIdHex),
            new DynamicArray<>(Uint256.class, indexSets.stream().map(Uint256::new).toList())
        ),
        List.of()
    );
    return FunctionEncoder.encode(function);
  }

  private static Bytes32 conditionId(String hex) {
    byte[] bytes = Numeric.hexStringToByteArray(hex);
    if (bytes.length != 32) {
      throw new IllegalArgumentException("conditionId must be 32 bytes, got " + bytes.length + ": " + hex);
    }
    return new Bytes32(bytes);
  }
}
