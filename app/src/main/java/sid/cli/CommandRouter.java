package sid.cli;

import com.google.common.base.Stopwatch;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.diagram.Diagram;
import sid.diagram.DiagramJson;
import sid.engine.EngineConfig;
import sid.engine.EngineMetrics;
import sid.engine.SidTernaryEngine;
import sid.errors.SidException;
import sid.rewrite.RewriteRule;

/**
 * Executes {@code {"command": ..., "params": {...}}} requests against the engines it owns.
 *
 * <p>Every request yields exactly one envelope; failures never escape as exceptions.
 */
public final class CommandRouter {
  private static final Logger LOG = LoggerFactory.getLogger(CommandRouter.class);

  static final String ENGINE_TYPE = "sid_ternary";

  private final EngineRegistry registry = new EngineRegistry();
  private final ResponseBuilder responses = new ResponseBuilder();
  private final Map<String, Handler> handlers = buildHandlers();

  /** Parses one request line and returns the serialised response line. */
  public String executeLine(String line) {
    JsonElement request;
    try {
      request = JsonParser.parseString(line);
    } catch (JsonParseException ex) {
      return responses.toLine(
          responses.error(
              null, "Invalid JSON: " + ex.getMessage(), CommandException.PARSE_ERROR, 0));
    }
    if (request == null || !request.isJsonObject()) {
      return responses.toLine(
          responses.error(null, "Request must be a JSON object", CommandException.PARSE_ERROR, 0));
    }
    return responses.toLine(execute(request.getAsJsonObject()));
  }

  public JsonObject execute(JsonObject request) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    JsonElement rawCommand = request.get("command");
    if (rawCommand == null
        || !rawCommand.isJsonPrimitive()
        || !rawCommand.getAsJsonPrimitive().isString()) {
      return responses.error(null, "Missing 'command' field", CommandException.MISSING_COMMAND, 0);
    }
    String command = rawCommand.getAsString();
    Handler handler = handlers.get(command);
    if (handler == null) {
      return responses.error(
          command, "Unknown command: " + command, CommandException.UNKNOWN_COMMAND, 0);
    }

    try {
      JsonElement rawParams = request.get("params");
      if (rawParams != null && !rawParams.isJsonNull() && !rawParams.isJsonObject()) {
        throw CommandException.invalid("'params' must be an object");
      }
      Params params =
          new Params(
              rawParams == null || rawParams.isJsonNull() ? null : rawParams.getAsJsonObject());
      Map<String, Object> result = handler.handle(params);
      return responses.success(command, result, elapsed(stopwatch));
    } catch (CommandException ex) {
      LOG.warn("{} failed: {}", command, ex.getMessage());
      return responses.error(command, ex.getMessage(), ex.errorCode(), elapsed(stopwatch));
    } catch (SidException ex) {
      LOG.warn("{} failed [{}]: {}", command, ex.code(), ex.getMessage());
      return responses.error(command, ex.getMessage(), ex.code().name(), elapsed(stopwatch));
    } catch (RuntimeException ex) {
      LOG.error("{} failed unexpectedly", command, ex);
      return responses.error(
          command, ex.toString(), CommandException.EXECUTION_FAILED, elapsed(stopwatch));
    }
  }

  int engineCount() {
    return registry.size();
  }

  private Map<String, Handler> buildHandlers() {
    Map<String, Handler> map = new LinkedHashMap<>();
    map.put("get_capabilities", this::capabilities);
    map.put("create_engine", this::createEngine);
    map.put("destroy_engine", this::destroyEngine);
    map.put("list_engines", this::listEngines);
    map.put("sid_step", this::step);
    map.put("sid_collapse", this::collapse);
    map.put("sid_set_diagram_expr", this::setDiagramExpr);
    map.put("sid_set_diagram_json", this::setDiagramJson);
    map.put("sid_get_diagram_json", this::getDiagramJson);
    map.put("sid_rewrite", this::rewrite);
    map.put("sid_metrics", this::metrics);
    return map;
  }

  private Map<String, Object> capabilities(Params params) {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("engines", List.of(ENGINE_TYPE));
    result.put("commands", List.copyOf(handlers.keySet()));
    return result;
  }

  private Map<String, Object> createEngine(Params params) {
    String engineType = params.string("engine_type", ENGINE_TYPE);
    if (!ENGINE_TYPE.equals(engineType)) {
      throw CommandException.invalid("Unsupported engine_type: " + engineType);
    }
    int numNodes = params.integer("num_nodes", EngineConfig.DEFAULT_NUM_NODES);
    double totalMass =
        params.has("total_mass")
            ? params.number("total_mass", EngineConfig.DEFAULT_TOTAL_MASS)
            : params.number("capacity", EngineConfig.DEFAULT_TOTAL_MASS);
    if (numNodes <= 0) {
      throw CommandException.invalid("num_nodes must be positive");
    }
    if (totalMass <= 0.0) {
      throw CommandException.invalid("total_mass must be positive");
    }

    String engineId = registry.create(EngineConfig.of(numNodes, totalMass));
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("engine_id", engineId);
    result.put("engine_type", ENGINE_TYPE);
    result.put("num_nodes", numNodes);
    result.put("total_mass", totalMass);
    return result;
  }

  private Map<String, Object> destroyEngine(Params params) {
    String engineId = params.requireString("engine_id");
    if (!registry.destroy(engineId)) {
      throw new CommandException(
          CommandException.ENGINE_NOT_FOUND, "Engine not found: " + engineId);
    }
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("engine_id", engineId);
    result.put("destroyed", true);
    return result;
  }

  private Map<String, Object> listEngines(Params params) {
    List<Map<String, Object>> engines = new ArrayList<>();
    registry
        .engines()
        .forEach(
            (engineId, engine) -> {
              Map<String, Object> summary = new LinkedHashMap<>();
              summary.put("engine_id", engineId);
              summary.put("engine_type", ENGINE_TYPE);
              summary.put("num_nodes", engine.getNumNodes());
              summary.put("total_mass", engine.getTotalMass());
              summary.put("step_count", engine.getStepCount());
              engines.add(summary);
            });
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("engines", engines);
    return result;
  }

  private Map<String, Object> step(Params params) {
    String engineId = params.requireString("engine_id");
    SidTernaryEngine engine = registry.require(engineId);
    engine.step(params.number("alpha", 1.0));
    return stepResult(engineId, engine);
  }

  private Map<String, Object> collapse(Params params) {
    String engineId = params.requireString("engine_id");
    SidTernaryEngine engine = registry.require(engineId);
    engine.collapse(params.number("alpha", 1.0));
    return stepResult(engineId, engine);
  }

  private Map<String, Object> setDiagramExpr(Params params) {
    String engineId = params.requireString("engine_id");
    SidTernaryEngine engine = registry.require(engineId);
    String expr = params.requireString("expr");
    String ruleId = params.string("rule_id", SidTernaryEngine.DEFAULT_EXPR_RULE_ID);
    engine.setDiagramExpr(expr, ruleId);

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("engine_id", engineId);
    result.put("rule_id", ruleId);
    result.put("message", engine.getLastRewriteMessage());
    return result;
  }

  private Map<String, Object> setDiagramJson(Params params) {
    String engineId = params.requireString("engine_id");
    SidTernaryEngine engine = registry.require(engineId);
    Diagram diagram = decodeDiagram(params);
    engine.setDiagram(diagram);

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("engine_id", engineId);
    result.put("diagram_id", diagram.id());
    result.put("node_count", diagram.nodeCount());
    result.put("edge_count", diagram.edgeCount());
    result.put("message", engine.getLastRewriteMessage());
    return result;
  }

  private Diagram decodeDiagram(Params params) {
    Optional<JsonObject> inline = params.object("diagram");
    if (inline.isPresent()) {
      return DiagramJson.fromJsonTree(inline.get());
    }
    Optional<String> encoded = params.optionalString("diagram_json");
    if (encoded.isPresent()) {
      return DiagramJson.fromJson(encoded.get());
    }
    Optional<JsonObject> pkg = params.object("package");
    if (pkg.isEmpty()) {
      throw new CommandException(
          CommandException.MISSING_PARAMETER, "Missing diagram, diagram_json, or package");
    }
    JsonElement diagrams = pkg.get().get("diagrams");
    if (diagrams == null || !diagrams.isJsonArray() || diagrams.getAsJsonArray().isEmpty()) {
      throw CommandException.invalid("package missing diagrams");
    }
    Optional<String> wanted = params.optionalString("diagram_id").filter(id -> !id.isEmpty());
    if (wanted.isEmpty()) {
      return DiagramJson.fromJsonTree(diagrams.getAsJsonArray().get(0));
    }
    return DiagramJson.fromJsonTree(findPackaged(diagrams.getAsJsonArray(), wanted.get()));
  }

  private static JsonElement findPackaged(JsonArray diagrams, String diagramId) {
    for (JsonElement candidate : diagrams) {
      if (candidate.isJsonObject()) {
        JsonElement id = candidate.getAsJsonObject().get("id");
        if (id != null
            && id.isJsonPrimitive()
            && id.getAsJsonPrimitive().isString()
            && diagramId.equals(id.getAsString())) {
          return candidate;
        }
      }
    }
    throw CommandException.invalid("diagram_id not found in package: " + diagramId);
  }

  private Map<String, Object> getDiagramJson(Params params) {
    String engineId = params.requireString("engine_id");
    SidTernaryEngine engine = registry.require(engineId);
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("engine_id", engineId);
    result.put("diagram", DiagramJson.toJsonTree(engine.getDiagram()));
    return result;
  }

  private Map<String, Object> rewrite(Params params) {
    String engineId = params.requireString("engine_id");
    SidTernaryEngine engine = registry.require(engineId);
    String pattern = params.requireString("pattern");
    String replacement = params.requireString("replacement");
    String ruleId = params.string("rule_id", RewriteRule.DEFAULT_RULE_ID);
    boolean applied =
        engine.applyRewrite(pattern, replacement, ruleId, params.map("rule_metadata"));

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("engine_id", engineId);
    result.put("rule_id", ruleId);
    result.put("applied", applied);
    result.put("message", engine.getLastRewriteMessage());
    return result;
  }

  private Map<String, Object> metrics(Params params) {
    String engineId = params.requireString("engine_id");
    EngineMetrics metrics = registry.require(engineId).metricsSnapshot();
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("engine_id", engineId);
    result.put("I_mass", metrics.iMass());
    result.put("N_mass", metrics.nMass());
    result.put("U_mass", metrics.uMass());
    result.put("instantaneous_gain", metrics.instantaneousGain());
    result.put("is_conserved", metrics.conserved());
    result.put("last_rewrite_applied", metrics.lastRewriteApplied());
    result.put("last_rewrite_message", metrics.lastRewriteMessage());
    result.put("step_count", metrics.stepCount());
    result.put("transport_ready", metrics.transportReady());
    return result;
  }

  private static Map<String, Object> stepResult(String engineId, SidTernaryEngine engine) {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("engine_id", engineId);
    result.put("step_count", engine.getStepCount());
    return result;
  }

  private static long elapsed(Stopwatch stopwatch) {
    return stopwatch.elapsed(TimeUnit.MILLISECONDS);
  }

  @FunctionalInterface
  private interface Handler {
    Map<String, Object> handle(Params params);
  }
}
