package sid.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.diagram.Diagram;
import sid.diagram.DiagramBuilder;
import sid.diagram.DiagramJson;
import sid.parse.ExpressionParser;
import sid.rewrite.RewriteEngine;
import sid.rewrite.RewriteResult;
import sid.rewrite.RewriteRule;

/** Builds {@code <expr>}, applies one rule to it and prints the outcome. */
final class RewriteCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RewriteCommand.class);

  int execute(CliOptions options, PrintStream out) {
    String expr = options.argument(0, "expr");
    String pattern = options.argument(1, "pattern");
    String replacement = options.argument(2, "replacement");

    Diagram diagram =
        DiagramBuilder.build(ExpressionParser.parse(expr), options.diagramId(), null);
    RewriteRule rule =
        RewriteRule.parse(options.ruleId(), pattern, replacement)
            .withMetadata(new LinkedHashMap<>(options.ruleMetadata()));
    RewriteResult result = RewriteEngine.apply(diagram, rule);
    LOG.info("{}", result.message());

    Map<String, Object> report = new LinkedHashMap<>();
    report.put("rule_id", rule.ruleId());
    report.put("applied", result.applied());
    report.put("status", result.status().name());
    report.put("message", result.message());
    report.put("diagram", DiagramJson.toJsonTree(result.diagram()));
    out.println(gson(options).toJson(report));
    return result.applied() ? 0 : 3;
  }

  private static Gson gson(CliOptions options) {
    GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
    if (options.pretty()) {
      builder.setPrettyPrinting();
    }
    return builder.create();
  }
}
