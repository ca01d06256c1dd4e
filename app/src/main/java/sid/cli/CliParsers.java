package sid.cli;

import com.google.common.base.Splitter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import sid.engine.EngineConfig;

/** Shared helpers for command-line option parsing. */
final class CliParsers {
  private static final Splitter ENTRY_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Splitter KEY_VALUE_SPLITTER = Splitter.on('=').limit(2).trimResults();

  private static final Map<String, OptionSpec> OPTION_SPECS = buildOptionSpecs();

  private CliParsers() {}

  /** Separates {@code --name value} / {@code --name=value} options from plain arguments. */
  static CliOptions parseOptions(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    String[] effectiveArgs = args == null ? new String[0] : args;
    for (int i = 0; i < effectiveArgs.length; i++) {
      String raw = effectiveArgs[i];
      if (!raw.startsWith("--")) {
        builder.argument(raw);
        continue;
      }
      ParsedArg parsed = ParsedArg.parse(raw);
      OptionSpec spec = OPTION_SPECS.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        value = nextValue(effectiveArgs, ++i, parsed.option());
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  static String nextValue(String[] args, int index, String option) {
    if (index >= args.length) {
      throw new IllegalArgumentException("Missing value for " + option);
    }
    return args[index];
  }

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static double parseDouble(String raw, double defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number for " + optionName + ": " + raw);
    }
  }

  /** Parses {@code key=value,key=value}; a bare key maps to {@code "true"}. */
  static Map<String, String> parseKeyValues(String raw) {
    Map<String, String> values = new LinkedHashMap<>();
    if (raw == null || raw.isBlank()) {
      return values;
    }
    for (String entry : ENTRY_SPLITTER.split(raw)) {
      var parts = KEY_VALUE_SPLITTER.splitToList(entry);
      if (parts.get(0).isEmpty()) {
        throw new IllegalArgumentException("Empty key in: " + raw);
      }
      values.put(parts.get(0), parts.size() > 1 ? parts.get(1) : "true");
    }
    return values;
  }

  private static Map<String, OptionSpec> buildOptionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put(
        "--num-nodes",
        OptionSpec.withValue(
            (b, raw) ->
                b.numNodes(parseInt(raw, EngineConfig.DEFAULT_NUM_NODES, "--num-nodes"))));
    specs.put(
        "--total-mass",
        OptionSpec.withValue(
            (b, raw) ->
                b.totalMass(parseDouble(raw, EngineConfig.DEFAULT_TOTAL_MASS, "--total-mass"))));
    specs.put(
        "--steps",
        OptionSpec.withValue(
            (b, raw) -> b.steps(parseInt(raw, CliOptions.DEFAULT_STEPS, "--steps"))));
    specs.put(
        "--alpha",
        OptionSpec.withValue(
            (b, raw) -> b.alpha(parseDouble(raw, CliOptions.DEFAULT_ALPHA, "--alpha"))));
    specs.put("--diagram-id", OptionSpec.withValue((b, raw) -> b.diagramId(raw)));
    specs.put("--rule-id", OptionSpec.withValue((b, raw) -> b.ruleId(raw)));
    specs.put(
        "--rule-meta", OptionSpec.withValue((b, raw) -> b.ruleMetadata(parseKeyValues(raw))));
    specs.put("--pretty", OptionSpec.flag(b -> b.pretty(true)));
    return Map.copyOf(specs);
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      int equalsIndex = raw.indexOf('=');
      if (equalsIndex > 0) {
        String value = raw.substring(equalsIndex + 1);
        return new ParsedArg(raw.substring(0, equalsIndex), value.isEmpty() ? null : value);
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
