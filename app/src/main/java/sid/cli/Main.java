package sid.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.errors.SidException;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code serve} (default): line-delimited JSON commands on stdin
 *   <li>{@code parse <expr> [--diagram-id id] [--pretty]}
 *   <li>{@code rewrite <expr> <pattern> <replacement> [--rule-id id] [--rule-meta k=v,...]}
 *   <li>{@code simulate [expr] [--num-nodes n] [--total-mass m] [--steps k] [--alpha a]}
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private Main() {}

  public static void main(String[] args) {
    int exit = run(args, System.in, System.out);
    if (exit != 0) {
      System.exit(exit);
    }
  }

  static int run(String[] args, InputStream in, PrintStream out) {
    String[] effectiveArgs = args == null ? new String[0] : args;
    boolean explicitCommand = effectiveArgs.length > 0 && !effectiveArgs[0].startsWith("--");
    String command =
        explicitCommand ? effectiveArgs[0].toLowerCase(Locale.ROOT) : "serve";
    String[] rest =
        explicitCommand
            ? Arrays.copyOfRange(effectiveArgs, 1, effectiveArgs.length)
            : effectiveArgs;

    try {
      switch (command) {
        case "serve":
          CliParsers.parseOptions(rest);
          BufferedReader reader =
              new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
          return new ServeCommand(new CommandRouter()).execute(reader, out);
        case "parse":
          return new ParseCommand().execute(CliParsers.parseOptions(rest), out);
        case "rewrite":
          return new RewriteCommand().execute(CliParsers.parseOptions(rest), out);
        case "simulate":
          return new SimulateCommand().execute(CliParsers.parseOptions(rest), out);
        case "help":
          printUsage(out);
          return 0;
        default:
          LOG.error("Unknown command: {}", command);
          printUsage(out);
          return 2;
      }
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      return 2;
    } catch (SidException ex) {
      LOG.error("[{}] {}", ex.code(), ex.getMessage());
      return 1;
    } catch (IOException ex) {
      LOG.error("I/O failure", ex);
      return 1;
    }
  }

  private static void printUsage(PrintStream out) {
    out.println("Usage: sid <command> [options]");
    out.println("  serve                                   JSON commands on stdin (default)");
    out.println("  parse <expr>                            print the compiled diagram");
    out.println("  rewrite <expr> <pattern> <replacement>  apply one rewrite rule");
    out.println("  simulate [expr]                         run collapse/step rounds");
    out.println("Options: --num-nodes --total-mass --steps --alpha --diagram-id --rule-id");
    out.println("         --rule-meta k=v,... --pretty");
  }
}
