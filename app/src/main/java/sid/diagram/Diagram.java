package sid.diagram;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import sid.errors.StructuralException;

/**
 * Mutable directed graph of {@link Node}s linked by {@link Edge}s.
 *
 * <p>Forward and reverse adjacency plus the id index are derived data, rebuilt lazily after any
 * mutation. Callers never see the cache directly.
 */
public final class Diagram {
  private String id;
  private String compartmentId;
  private final List<Node> nodes = new ArrayList<>();
  private final List<Edge> edges = new ArrayList<>();

  private Index index;

  public Diagram(String id) {
    this.id = Objects.requireNonNull(id, "id");
  }

  public String id() {
    return id;
  }

  public void setId(String id) {
    this.id = Objects.requireNonNull(id, "id");
  }

  public Optional<String> compartmentId() {
    return Optional.ofNullable(compartmentId);
  }

  public void setCompartmentId(String compartmentId) {
    this.compartmentId = compartmentId == null || compartmentId.isEmpty() ? null : compartmentId;
  }

  public List<Node> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  public List<Edge> edges() {
    return Collections.unmodifiableList(edges);
  }

  public int nodeCount() {
    return nodes.size();
  }

  public int edgeCount() {
    return edges.size();
  }

  public void addNode(Node node) {
    nodes.add(Objects.requireNonNull(node, "node"));
    invalidate();
  }

  public void addEdge(Edge edge) {
    edges.add(Objects.requireNonNull(edge, "edge"));
    invalidate();
  }

  /** Swaps in {@code node} for the existing node with the same id. */
  public void replaceNode(Node node) {
    Objects.requireNonNull(node, "node");
    for (int i = 0; i < nodes.size(); i++) {
      if (nodes.get(i).id().equals(node.id())) {
        nodes.set(i, node);
        invalidate();
        return;
      }
    }
    throw new StructuralException("Cannot replace missing node " + node.id());
  }

  public void replaceEdges(Collection<Edge> newEdges) {
    edges.clear();
    edges.addAll(newEdges);
    invalidate();
  }

  public void removeNodes(Set<String> nodeIds) {
    if (nodes.removeIf(node -> nodeIds.contains(node.id()))) {
      invalidate();
    }
  }

  /** Marks the derived adjacency stale; the next read rebuilds it. */
  public void invalidate() {
    index = null;
  }

  public Optional<Node> findNode(String nodeId) {
    return Optional.ofNullable(index().nodesById.get(nodeId));
  }

  public boolean containsNode(String nodeId) {
    return index().nodesById.containsKey(nodeId);
  }

  public Optional<Edge> findEdge(String edgeId) {
    return edges.stream().filter(edge -> edge.id().equals(edgeId)).findFirst();
  }

  public boolean containsId(String candidate) {
    return containsNode(candidate) || findEdge(candidate).isPresent();
  }

  /** Source ids of the edges entering {@code nodeId}, ordered by port. */
  public List<String> getInputs(String nodeId) {
    List<Edge> incoming = index().reverse.getOrDefault(nodeId, List.of());
    List<Edge> ordered = new ArrayList<>(incoming);
    ordered.sort(Comparator.comparingInt(Edge::port));
    List<String> result = new ArrayList<>(ordered.size());
    for (Edge edge : ordered) {
      result.add(edge.from());
    }
    return result;
  }

  public List<String> getOutputs(String nodeId) {
    List<Edge> outgoing = index().forward.getOrDefault(nodeId, List.of());
    List<String> result = new ArrayList<>(outgoing.size());
    for (Edge edge : outgoing) {
      result.add(edge.to());
    }
    return result;
  }

  /** Iterative depth-first search; safe for arbitrarily deep chains. */
  public boolean hasCycle() {
    Map<String, List<Edge>> forward = index().forward;
    Set<String> roots = new LinkedHashSet<>();
    for (Node node : nodes) {
      roots.add(node.id());
    }
    for (Edge edge : edges) {
      roots.add(edge.from());
      roots.add(edge.to());
    }

    Set<String> visited = new HashSet<>();
    Set<String> onStack = new HashSet<>();
    Deque<Frame> stack = new ArrayDeque<>();
    for (String root : roots) {
      if (visited.contains(root)) {
        continue;
      }
      stack.push(new Frame(root, false));
      while (!stack.isEmpty()) {
        Frame frame = stack.pop();
        if (frame.backtrack()) {
          onStack.remove(frame.nodeId());
          continue;
        }
        if (!visited.add(frame.nodeId())) {
          continue;
        }
        onStack.add(frame.nodeId());
        stack.push(new Frame(frame.nodeId(), true));
        for (Edge edge : forward.getOrDefault(frame.nodeId(), List.of())) {
          if (onStack.contains(edge.to())) {
            return true;
          }
          if (!visited.contains(edge.to())) {
            stack.push(new Frame(edge.to(), false));
          }
        }
      }
    }
    return false;
  }

  /** Throws on the first dangling edge endpoint or node input. */
  public void validateStructure() {
    Map<String, Node> byId = index().nodesById;
    for (Edge edge : edges) {
      if (!byId.containsKey(edge.from())) {
        throw new StructuralException(
            "Edge " + edge.id() + " references missing source node " + edge.from());
      }
      if (!byId.containsKey(edge.to())) {
        throw new StructuralException(
            "Edge " + edge.id() + " references missing target node " + edge.to());
      }
    }
    for (Node node : nodes) {
      for (String input : node.inputs()) {
        if (!byId.containsKey(input)) {
          throw new StructuralException(
              "Node " + node.id() + " references missing input node " + input);
        }
      }
    }
  }

  /** Independent copy with identical ids; nodes and edges are immutable values. */
  public Diagram copy() {
    Diagram copy = new Diagram(id);
    copy.compartmentId = compartmentId;
    copy.nodes.addAll(nodes);
    copy.edges.addAll(edges);
    return copy;
  }

  private Index index() {
    if (index == null) {
      index = Index.build(nodes, edges);
    }
    return index;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Diagram that)) {
      return false;
    }
    return id.equals(that.id)
        && Objects.equals(compartmentId, that.compartmentId)
        && nodes.equals(that.nodes)
        && edges.equals(that.edges);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, compartmentId, nodes, edges);
  }

  @Override
  public String toString() {
    return "Diagram[" + id + ", nodes=" + nodes.size() + ", edges=" + edges.size() + "]";
  }

  private record Frame(String nodeId, boolean backtrack) {}

  private static final class Index {
    private final Map<String, Node> nodesById = new HashMap<>();
    private final Map<String, List<Edge>> forward = new HashMap<>();
    private final Map<String, List<Edge>> reverse = new HashMap<>();

    static Index build(List<Node> nodes, List<Edge> edges) {
      Index index = new Index();
      for (Node node : nodes) {
        index.nodesById.putIfAbsent(node.id(), node);
      }
      for (Edge edge : edges) {
        index.forward.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
        index.reverse.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge);
      }
      return index;
    }
  }
}
