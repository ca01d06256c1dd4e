package sid.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Line-delimited JSON loop: one request per input line, one response per output line. */
final class ServeCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ServeCommand.class);

  private final CommandRouter router;

  ServeCommand(CommandRouter router) {
    this.router = router;
  }

  int execute(BufferedReader in, PrintStream out) throws IOException {
    LOG.info("Serving SID commands on stdin");
    long handled = 0;
    String line;
    while ((line = in.readLine()) != null) {
      if (line.isBlank()) {
        continue;
      }
      out.println(router.executeLine(line));
      out.flush();
      handled++;
    }
    LOG.info("Input closed after {} request(s)", handled);
    return 0;
  }
}
