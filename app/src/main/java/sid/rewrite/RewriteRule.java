package sid.rewrite;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import sid.ast.Expression;
import sid.errors.ContractViolationException;
import sid.parse.ExpressionParser;

/** A named pattern/replacement pair plus provenance copied onto every node it creates. */
public record RewriteRule(
    String ruleId, Expression pattern, Expression replacement, Map<String, Object> metadata) {

  public static final String DEFAULT_RULE_ID = "rw";

  public RewriteRule {
    ruleId = ruleId == null || ruleId.isBlank() ? DEFAULT_RULE_ID : ruleId;
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(replacement, "replacement");
    metadata = metadata == null ? Map.of() : copyMetadata(metadata);
  }

  public static RewriteRule parse(String ruleId, String pattern, String replacement) {
    return new RewriteRule(
        ruleId, ExpressionParser.parse(pattern), ExpressionParser.parse(replacement), Map.of());
  }

  private static Map<String, Object> copyMetadata(Map<String, Object> metadata) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : metadata.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        throw new ContractViolationException("Rule metadata entries must be non-null");
      }
      copy.put(entry.getKey(), entry.getValue());
    }
    return Collections.unmodifiableMap(copy);
  }

  public RewriteRule withMetadata(Map<String, Object> newMetadata) {
    return new RewriteRule(ruleId, pattern, replacement, newMetadata);
  }
}
