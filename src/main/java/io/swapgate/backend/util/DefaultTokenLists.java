package io.swapgate.backend.util;

import io.swapgate.backend.model.TokenDescriptor;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Built-in token lists served when the routing service cannot be reached. */
public final class DefaultTokenLists {
  private DefaultTokenLists() {}

  private static final String NATIVE = "0xEeeeeEeeeEeEeeEeEeEeeEEEeeeeEeeeeeeeEEeE";

  private static TokenDescriptor token(String symbol, String name, String address, int decimals) {
    return new TokenDescriptor(symbol, name, address, decimals);
  }

  private static final Map<Integer, List<TokenDescriptor>> TOKENS =
      Map.of(
          1,
          List.of(
              token("ETH", "Ethereum", NATIVE, 18),
              token("USDC", "USD Coin", "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48", 6),
              token("USDT", "Tether", "0xdAC17F958D2ee523a2206206994597C13D831ec7", 6),
              token("DAI", "Dai", "0x6B175474E89094C44Da98b954EedeAC495271d0F", 18),
              token("WBTC", "Wrapped Bitcoin", "0x2260FAC5E5542a773Aa44fBCfeDf7C193bc2C599", 8)),
          56,
          List.of(
              token("BNB", "BNB", NATIVE, 18),
              token("USDT", "Tether", "0x55d398326f99059fF775485246999027B3197955", 18),
              token("USDC", "USD Coin", "0x8AC76a51cc950d9822D68b83fE1Ad97B32Cd580d", 18),
              token("BUSD", "Binance USD", "0xe9e7CEA3DedcA5984780Bafc599bD69ADd087D56", 18)),
          137,
          List.of(
              token("MATIC", "Polygon", NATIVE, 18),
              token("USDC", "USD Coin", "0x2791Bca1f2de4661ED88A30C99A7a9449Aa84174", 6),
              token("USDT", "Tether", "0xc2132D05D31c914a87C6611C10748AEb04B58e8F", 6),
              token("DAI", "Dai", "0x8f3Cf7ad23Cd3CaDbD9735AFf958023239c6A063", 18)),
          42161,
          List.of(
              token("ETH", "Ethereum", NATIVE, 18),
              token("USDC", "USD Coin", "0xFF970A61A04b1cA14834A43f5dE4533eBDDB5CC8", 6),
              token("USDT", "Tether", "0xFd086bC7CD5C481DCC9C85ebE478A1C0b69FCbb9", 6),
              token("DAI", "Dai", "0xDA10009cBd5D07dd0CeCc66161FC93D7c9000da1", 18)),
          10,
          List.of(
              token("ETH", "Ethereum", NATIVE, 18),
              token("USDC", "USD Coin", "0x7F5c764cBc14f9669B88837ca1490cCa17c31607", 6),
              token("USDT", "Tether", "0x94b008aA00579c1307B0EF2c499aD98a8ce58e58", 6),
              token("DAI", "Dai", "0xDA10009cBd5D07dd0CeCc66161FC93D7c9000da1", 18)),
          8453,
          List.of(
              token("ETH", "Ethereum", NATIVE, 18),
              token("USDC", "USD Coin", "0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913", 6),
              token("DAI", "Dai", "0x50c5725949A6F0c72E6C4a641F24049A917DB0Cb", 18)),
          43114,
          List.of(
              token("AVAX", "Avalanche", NATIVE, 18),
              token("USDC", "USD Coin", "0xB97EF9Ef8734C71904D8002F8b6Bc66Dd9c48a6E", 6),
              token("USDT", "Tether", "0x9702230A8Ea53601f5cD2dc00fDBc13d4dF4A8c7", 6),
              token("DAI", "Dai", "0xd586E7F844cEa2F87f50152665BCbc2C279D8d70", 18)),
          250,
          List.of(
              token("FTM", "Fantom", NATIVE, 18),
              token("USDC", "USD Coin", "0x04068DA6C83AFCFA0e13ba15A6696662335D5B75", 6),
              token("USDT", "Tether", "0x049d68029688eAbF473097a2fC38ef61633A3C7A", 6),
              token("DAI", "Dai", "0x8D11eC38a3EB5E956B052f67Da8Bdc9bef8Abf3E", 18)));

  public static List<TokenDescriptor> forChain(int chainId) {
    return TOKENS.getOrDefault(chainId, List.of());
  }

  /** Looks a token up by address (case-insensitive) or by symbol. */
  public static Optional<TokenDescriptor> find(int chainId, String token) {
    if (token == null || token.isBlank()) return Optional.empty();
    String t = token.trim();
    return forChain(chainId).stream()
        .filter(d -> d.address().equalsIgnoreCase(t) || d.symbol().equalsIgnoreCase(t))
        .findFirst();
  }
}
