package com.polybot.arb.polymarket.onchain;

/**
 * Polymarket contract addresses per chain (Polygon mainnet and the Amoy testnet).
 */
public record ContractConfig(
    String exchange,
    String negRiskExchange,
    String collateral,
    String conditionalTokens,
    int collateralTokenDecimals
) {

  public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

  public static ContractConfig forChainId(int chainId) {
    return switch (chainId) {
      case 137 -> new ContractConfig(
          "0x4bFb41d5B3570DeFd03C39a9A4D8dE6Bd8B8982E",
          "0xC5d563A36AE78145C45a50134d48A1215220f80a",
          "0x2791Bca1f2de4661ED88A30C99A7a9449Aa84174",
          "0x4D97DCd97eC945f40cF65F87097ACe5EA0476045",
          6
      );
      case 80002 -> new ContractConfig(
          "0xdFE02Eb6733538f8Ea35D585af8DE5958AD99E40",
          "0xC5d563A36AE78145C45a50134d48A1215220f80a",
          "0x9c4e1703476e875070ee25b56a58b008cfb8fa78",
          "0x69308FB512518e39F9b16112fA8d994F4e2Bf8bB",
          6
      );
      default -> throw new IllegalArgumentException("Unsupported chainId: " + chainId);
    };
  }
}
