package io.swapgate.backend.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/**
 * Strips script-injection substrings from string leaves. Numbers, booleans and nulls pass
 * through untouched and the shape of the tree is preserved.
 */
@Component
public class InputSanitizer {
  private static final List<Pattern> PATTERNS =
      List.of(
          Pattern.compile("<script[^>]*>.*?</script>", Pattern.CASE_INSENSITIVE),
          Pattern.compile("javascript:[^\\s\"'<>]*", Pattern.CASE_INSENSITIVE),
          Pattern.compile("on\\w+\\s*=", Pattern.CASE_INSENSITIVE),
          Pattern.compile("<iframe[^>]*>.*?</iframe>", Pattern.CASE_INSENSITIVE),
          Pattern.compile("eval\\(", Pattern.CASE_INSENSITIVE),
          Pattern.compile("expression\\(", Pattern.CASE_INSENSITIVE));

  public String sanitize(String value) {
    if (value == null || value.isEmpty()) return value;
    String out = value;
    for (Pattern p : PATTERNS) {
      out = p.matcher(out).replaceAll("");
    }
    return out.replace("\u0000", "");
  }

  /** Returns a sanitized copy of {@code node}; the input is not modified. */
  public JsonNode sanitize(JsonNode node) {
    if (node == null) return null;
    if (node.isTextual()) {
      return JsonNodeFactory.instance.textNode(sanitize(node.textValue()));
    }
    if (node.isArray()) {
      ArrayNode out = JsonNodeFactory.instance.arrayNode(node.size());
      for (JsonNode item : node) out.add(sanitize(item));
      return out;
    }
    if (node.isObject()) {
      ObjectNode out = JsonNodeFactory.instance.objectNode();
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        out.set(field.getKey(), sanitize(field.getValue()));
      }
      return out;
    }
    return node.deepCopy();
  }

  public MultiValueMap<String, String> sanitize(MultiValueMap<String, String> params) {
    MultiValueMap<String, String> out = new LinkedMultiValueMap<>();
    params.forEach(
        (key, values) -> {
          List<String> cleaned = new ArrayList<>(values.size());
          for (String v : values) cleaned.add(sanitize(v));
          out.put(key, cleaned);
        });
    return out;
  }
}
