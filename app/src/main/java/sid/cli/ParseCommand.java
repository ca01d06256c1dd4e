package sid.cli;

import java.io.PrintStream;
import sid.diagram.Diagram;
import sid.diagram.DiagramBuilder;
import sid.diagram.DiagramJson;
import sid.parse.ExpressionParser;

/** Prints the diagram an expression compiles to. */
final class ParseCommand {

  int execute(CliOptions options, PrintStream out) {
    String expr = options.argument(0, "expr");
    Diagram diagram =
        DiagramBuilder.build(ExpressionParser.parse(expr), options.diagramId(), null);
    out.println(options.pretty() ? DiagramJson.toPrettyJson(diagram) : DiagramJson.toJson(diagram));
    return 0;
  }
}
