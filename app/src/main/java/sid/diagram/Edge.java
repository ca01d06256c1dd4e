package sid.diagram;

import java.util.Objects;

/** Directed argument link {@code from -> to}; {@code port} orders the arguments of {@code to}. */
public record Edge(String id, String from, String to, String label, int port) {

  public static final String DEFAULT_LABEL = "arg";

  public Edge {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    label = label == null ? DEFAULT_LABEL : label;
  }

  public static Edge arg(String id, String from, String to, int port) {
    return new Edge(id, from, to, DEFAULT_LABEL, port);
  }

  public Edge withFrom(String newFrom) {
    return new Edge(id, newFrom, to, label, port);
  }

  public Edge withTo(String newTo, int newPort) {
    return new Edge(id, from, newTo, label, newPort);
  }

  public boolean touches(String nodeId) {
    return from.equals(nodeId) || to.equals(nodeId);
  }
}
