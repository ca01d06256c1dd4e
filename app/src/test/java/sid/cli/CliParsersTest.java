package sid.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import sid.engine.EngineConfig;
import sid.rewrite.RewriteRule;

final class CliParsersTest {

  @Test
  void defaultsApplyWithoutOptions() {
    CliOptions options = CliParsers.parseOptions(new String[0]);
    assertTrue(options.arguments().isEmpty());
    assertEquals(EngineConfig.DEFAULT_NUM_NODES, options.numNodes());
    assertEquals(EngineConfig.DEFAULT_TOTAL_MASS, options.totalMass());
    assertEquals(CliOptions.DEFAULT_STEPS, options.steps());
    assertEquals(CliOptions.DEFAULT_ALPHA, options.alpha());
    assertEquals(RewriteRule.DEFAULT_RULE_ID, options.ruleId());
    assertNull(options.diagramId());
    assertFalse(options.pretty());
  }

  @Test
  void separatesArgumentsFromOptions() {
    CliOptions options =
        CliParsers.parseOptions(
            new String[] {
              "C(P(A), P(B))",
              "--steps",
              "4",
              "--alpha=0.5",
              "--num-nodes",
              "12",
              "--total-mass=60",
              "--pretty",
              "--rule-id",
              "swap",
              "T($x)"
            });

    assertEquals(List.of("C(P(A), P(B))", "T($x)"), options.arguments());
    assertEquals(4, options.steps());
    assertEquals(0.5, options.alpha());
    assertEquals(12, options.numNodes());
    assertEquals(60.0, options.totalMass());
    assertEquals("swap", options.ruleId());
    assertTrue(options.pretty());
    assertEquals(EngineConfig.of(12, 60.0), options.engineConfig());
  }

  @Test
  void parsesRuleMetadata() {
    CliOptions options =
        CliParsers.parseOptions(new String[] {"--rule-meta", "a=1, b = two ,flag"});
    assertEquals(Map.of("a", "1", "b", "two", "flag", "true"), options.ruleMetadata());
    assertTrue(CliParsers.parseKeyValues("  ").isEmpty());
    assertEquals(Map.of("k", "v=w"), CliParsers.parseKeyValues("k=v=w"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseKeyValues("=x"));
  }

  @Test
  void rejectsBadOptions() {
    assertThrows(
        IllegalArgumentException.class, () -> CliParsers.parseOptions(new String[] {"--verbose"}));
    assertThrows(
        IllegalArgumentException.class, () -> CliParsers.parseOptions(new String[] {"--steps"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> CliParsers.parseOptions(new String[] {"--steps=many"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> CliParsers.parseOptions(new String[] {"--alpha", "1.5"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> CliParsers.parseOptions(new String[] {"--num-nodes", "0"}));
  }

  @Test
  void missingPositionalArgumentIsNamed() {
    CliOptions options = CliParsers.parseOptions(new String[] {"only"});
    assertEquals("only", options.argument(0, "expr"));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> options.argument(1, "pattern"));
    assertTrue(ex.getMessage().contains("pattern"));
  }
}
