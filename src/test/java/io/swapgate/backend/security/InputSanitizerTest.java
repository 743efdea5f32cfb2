package io.swapgate.backend.security;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

class InputSanitizerTest {
  private final InputSanitizer sanitizer = new InputSanitizer();
  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void stripsScriptBlocks() {
    assertEquals("hello", sanitizer.sanitize("<script>alert(1)</script>hello"));
    assertEquals("hello", sanitizer.sanitize("<SCRIPT type=\"x\">alert(1)</SCRIPT>hello"));
  }

  @Test
  void stripsHandlersEvalAndNullBytes() {
    assertEquals("<img src=x alert(1)>", sanitizer.sanitize("<img src=x onerror=alert(1)>"));
    assertEquals("1+1)", sanitizer.sanitize("eval(1+1)"));
    assertEquals("width:1px)", sanitizer.sanitize("width:expression(1px)"));
    assertEquals("ab", sanitizer.sanitize("a\u0000b"));
  }

  @Test
  void nullBytesAreRemovedAfterPatternPass() {
    assertEquals("<script>x</script>ok", sanitizer.sanitize("<scr\u0000ipt>x</script>ok"));
    assertEquals("javaok", sanitizer.sanitize("java\u0000ok"));
  }

  @Test
  void leavesPlainValuesAlone() {
    assertEquals("0xd8dA6BF26964aF9D7eEd9e03E53415D37aA96045", sanitizer.sanitize("0xd8dA6BF26964aF9D7eEd9e03E53415D37aA96045"));
    assertEquals("", sanitizer.sanitize(""));
  }

  @Test
  void sanitizesStringLeavesOfJsonTree() throws Exception {
    JsonNode input =
        mapper.readTree("{\"a\":\"<iframe src=x></iframe>ok\",\"b\":[1,\"javascript:evil()\"]}");

    JsonNode cleaned = sanitizer.sanitize(input);

    assertEquals(mapper.readTree("{\"a\":\"ok\",\"b\":[1,\"\"]}"), cleaned);
    assertEquals("<iframe src=x></iframe>ok", input.path("a").asText());
  }

  @Test
  void keepsNumbersBooleansAndNulls() throws Exception {
    JsonNode input = mapper.readTree("{\"n\":1.5,\"t\":true,\"z\":null,\"o\":{\"s\":\"eval(x)\"}}");

    JsonNode cleaned = sanitizer.sanitize(input);

    assertEquals(mapper.readTree("{\"n\":1.5,\"t\":true,\"z\":null,\"o\":{\"s\":\"x)\"}}"), cleaned);
  }

  @Test
  void sanitizesQueryParameterValues() {
    MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
    query.add("token", "<script>x</script>USDC");
    query.addAll("tags", List.of("a", "onload=b"));

    MultiValueMap<String, String> cleaned = sanitizer.sanitize(query);

    assertEquals("USDC", cleaned.getFirst("token"));
    assertEquals(List.of("a", "b"), cleaned.get("tags"));
  }
}
