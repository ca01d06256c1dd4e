package sid.diagram;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.reflect.TypeToken;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import sid.ast.OperatorTag;
import sid.errors.StructuralException;

/**
 * Reads and writes the diagram wire format:
 *
 * <pre>
 * {"id": ..., "compartment_id": ...,
 *  "nodes": [{"id", "op", "inputs", "dof_refs", "irreversible", "meta"}],
 *  "edges": [{"id", "from", "to", "label", "port"}]}
 * </pre>
 *
 * Decoding validates the whole document before returning, so a rejected payload never reaches an
 * engine.
 */
public final class DiagramJson {
  public static final String DEFAULT_ID = "d_json";

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
  private static final Gson PRETTY =
      new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();
  private static final Type META_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

  private DiagramJson() {}

  public static String toJson(Diagram diagram) {
    return GSON.toJson(toJsonTree(diagram));
  }

  public static String toPrettyJson(Diagram diagram) {
    return PRETTY.toJson(toJsonTree(diagram));
  }

  public static JsonObject toJsonTree(Diagram diagram) {
    Objects.requireNonNull(diagram, "diagram");
    JsonObject root = new JsonObject();
    root.addProperty("id", diagram.id());
    diagram.compartmentId().ifPresent(value -> root.addProperty("compartment_id", value));

    JsonArray nodes = new JsonArray();
    for (Node node : diagram.nodes()) {
      JsonObject json = new JsonObject();
      json.addProperty("id", node.id());
      json.addProperty("op", node.operator().symbol());
      json.add("inputs", stringArray(node.inputs()));
      json.add("dof_refs", stringArray(node.dofRefs()));
      json.addProperty("irreversible", node.irreversible());
      if (!node.metadata().isEmpty()) {
        json.add("meta", GSON.toJsonTree(node.metadata()));
      }
      nodes.add(json);
    }
    root.add("nodes", nodes);

    JsonArray edges = new JsonArray();
    for (Edge edge : diagram.edges()) {
      JsonObject json = new JsonObject();
      json.addProperty("id", edge.id());
      json.addProperty("from", edge.from());
      json.addProperty("to", edge.to());
      json.addProperty("label", edge.label());
      json.addProperty("port", edge.port());
      edges.add(json);
    }
    root.add("edges", edges);
    return root;
  }

  public static Diagram fromJson(String json) {
    Objects.requireNonNull(json, "json");
    JsonElement element;
    try {
      element = JsonParser.parseString(json);
    } catch (JsonParseException ex) {
      throw new StructuralException("Malformed diagram JSON: " + ex.getMessage(), ex);
    }
    return fromJsonTree(element);
  }

  public static Diagram fromJsonTree(JsonElement element) {
    if (element == null || !element.isJsonObject()) {
      throw new StructuralException("Diagram JSON must be an object");
    }
    JsonObject root = element.getAsJsonObject();
    String id = root.has("id") ? requireId(root.get("id"), "Diagram id") : DEFAULT_ID;
    Diagram diagram = new Diagram(id);
    if (root.has("compartment_id") && !root.get("compartment_id").isJsonNull()) {
      diagram.setCompartmentId(requireString(root.get("compartment_id"), "compartment_id"));
    }

    for (JsonElement rawNode : requireArray(root, "nodes", true)) {
      diagram.addNode(readNode(rawNode));
    }
    for (JsonElement rawEdge : requireArray(root, "edges", false)) {
      diagram.addEdge(readEdge(rawEdge));
    }

    List<ValidationIssue> errors =
        DiagramValidator.validate(diagram).stream()
            .filter(ValidationIssue::isError)
            .collect(Collectors.toList());
    if (!errors.isEmpty()) {
      throw new StructuralException(
          "Invalid diagram "
              + id
              + ": "
              + errors.stream().map(ValidationIssue::message).collect(Collectors.joining("; ")));
    }
    return diagram;
  }

  private static Node readNode(JsonElement raw) {
    if (!raw.isJsonObject()) {
      throw new StructuralException("Node entry must be an object");
    }
    JsonObject json = raw.getAsJsonObject();
    String id = requireId(json.get("id"), "Node id");
    String symbol = requireString(json.get("op"), "Node " + id + " op");
    OperatorTag operator =
        OperatorTag.fromSymbol(symbol)
            .orElseThrow(
                () -> new StructuralException("Node " + id + " has unknown op '" + symbol + "'"));
    List<String> inputs = readStrings(json, "inputs", id);
    List<String> dofRefs = readStrings(json, "dof_refs", id);
    boolean irreversible = operator.irreversible();
    if (json.has("irreversible") && !json.get("irreversible").isJsonNull()) {
      JsonElement flag = json.get("irreversible");
      if (!flag.isJsonPrimitive() || !flag.getAsJsonPrimitive().isBoolean()) {
        throw new StructuralException("Node " + id + " irreversible must be a boolean");
      }
      irreversible = flag.getAsBoolean();
    }
    Map<String, Object> metadata = Map.of();
    if (json.has("meta") && !json.get("meta").isJsonNull()) {
      if (!json.get("meta").isJsonObject()) {
        throw new StructuralException("Node " + id + " meta must be an object");
      }
      metadata = GSON.fromJson(json.get("meta"), META_TYPE);
    }
    return new Node(id, operator, inputs, dofRefs, irreversible, metadata);
  }

  private static Edge readEdge(JsonElement raw) {
    if (!raw.isJsonObject()) {
      throw new StructuralException("Edge entry must be an object");
    }
    JsonObject json = raw.getAsJsonObject();
    String id = requireId(json.get("id"), "Edge id");
    String from = requireId(json.get("from"), "Edge " + id + " from");
    String to = requireId(json.get("to"), "Edge " + id + " to");
    String label = Edge.DEFAULT_LABEL;
    if (json.has("label") && !json.get("label").isJsonNull()) {
      label = requireString(json.get("label"), "Edge " + id + " label");
    }
    int port = 0;
    if (json.has("port")) {
      port = requirePort(json.get("port"), id);
    } else if (json.has("to_port")) {
      port = requirePort(json.get("to_port"), id);
    }
    return new Edge(id, from, to, label, port);
  }

  private static int requirePort(JsonElement element, String edgeId) {
    if (element == null
        || !element.isJsonPrimitive()
        || !element.getAsJsonPrimitive().isNumber()) {
      throw new StructuralException("Edge " + edgeId + " port must be a number");
    }
    double value = element.getAsDouble();
    if (value < 0 || value != Math.rint(value) || value > Integer.MAX_VALUE) {
      throw new StructuralException("Edge " + edgeId + " port must be a non-negative integer");
    }
    return (int) value;
  }

  private static Iterable<JsonElement> requireArray(
      JsonObject root, String field, boolean required) {
    JsonElement element = root.get(field);
    if (element == null || element.isJsonNull()) {
      if (required) {
        throw new StructuralException("Diagram JSON is missing '" + field + "' array");
      }
      return List.of();
    }
    if (!element.isJsonArray()) {
      throw new StructuralException("Diagram field '" + field + "' must be an array");
    }
    return element.getAsJsonArray();
  }

  private static List<String> readStrings(JsonObject json, String field, String nodeId) {
    JsonElement element = json.get(field);
    if (element == null || element.isJsonNull()) {
      return List.of();
    }
    if (!element.isJsonArray()) {
      throw new StructuralException("Node " + nodeId + " " + field + " must be an array");
    }
    List<String> values = new ArrayList<>();
    for (JsonElement item : element.getAsJsonArray()) {
      values.add(requireString(item, "Node " + nodeId + " " + field + " entry"));
    }
    return values;
  }

  private static String requireId(JsonElement element, String what) {
    String value = requireString(element, what);
    if (value.isEmpty()) {
      throw new StructuralException(what + " must be a non-empty string");
    }
    return value;
  }

  private static String requireString(JsonElement element, String what) {
    if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
      throw new StructuralException(what + " must be a string");
    }
    return element.getAsString();
  }

  private static JsonArray stringArray(List<String> values) {
    JsonArray array = new JsonArray();
    for (String value : values) {
      array.add(new JsonPrimitive(value));
    }
    return array;
  }
}
