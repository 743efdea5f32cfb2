package io.swapgate.backend.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.swapgate.backend.client.OneInchClient;
import io.swapgate.backend.config.SwapProperties;
import io.swapgate.backend.model.TokenDescriptor;
import io.swapgate.backend.support.StubHttpUpstream;
import io.swapgate.backend.util.DefaultTokenLists;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class TokenCatalogServiceTest {
  private StubHttpUpstream upstream;
  private RedisCache cache;
  private TokenCatalogService catalog;

  @BeforeEach
  void setUp() {
    upstream = new StubHttpUpstream();
    cache = mock(RedisCache.class);
    when(cache.get(anyString())).thenReturn(Optional.empty());
    SwapProperties properties = new SwapProperties();
    catalog =
        new TokenCatalogService(
            new OneInchClient(upstream.webClient(), properties),
            new ChainRegistry(),
            cache,
            new ObjectMapper(),
            properties);
  }

  @Test
  void unsupportedChainReturnsEmptyListWithoutCalling() {
    assertTrue(catalog.getSupportedTokens(12345).block().isEmpty());
    assertTrue(upstream.requests().isEmpty());
  }

  @Test
  void parsesUpstreamTokensAndCachesThem() {
    upstream.respond(
        HttpStatus.OK,
        "{\"tokens\":{\"0xa0b8\":{\"symbol\":\"USDC\",\"name\":\"USD Coin\","
            + "\"address\":\"0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48\",\"decimals\":6}}}");

    List<TokenDescriptor> tokens = catalog.getSupportedTokens(1).block();

    assertEquals(1, tokens.size());
    assertEquals("USDC", tokens.get(0).symbol());
    assertEquals(6, tokens.get(0).decimals());
    verify(cache).set(eq("tokens:1"), anyString(), anyLong());
  }

  @Test
  void upstreamFailureServesDefaults() {
    upstream.respond(HttpStatus.UNAUTHORIZED, "{}");
    assertEquals(DefaultTokenLists.forChain(56), catalog.getSupportedTokens(56).block());

    upstream.fail(new IllegalStateException("timeout"));
    assertEquals(DefaultTokenLists.forChain(137), catalog.getSupportedTokens(137).block());
  }

  @Test
  void cachedListSkipsUpstream() {
    when(cache.get("tokens:1"))
        .thenReturn(Optional.of("[{\"symbol\":\"DAI\",\"name\":\"Dai\",\"address\":\"0x6b17\",\"decimals\":18}]"));

    List<TokenDescriptor> tokens = catalog.getSupportedTokens(1).block();

    assertEquals("DAI", tokens.get(0).symbol());
    assertTrue(upstream.requests().isEmpty());
  }

  @Test
  void decimalsComeFromStaticTable() {
    assertEquals(6, catalog.decimalsOf(1, "USDC"));
    assertEquals(6, catalog.decimalsOf(1, "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48"));
    assertEquals(18, catalog.decimalsOf(1, "UNKNOWN"));
  }
}
