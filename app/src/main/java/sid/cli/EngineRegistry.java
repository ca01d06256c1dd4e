package sid.cli;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.engine.EngineConfig;
import sid.engine.SidTernaryEngine;

/** Live engines addressed by generated ids {@code sid_1, sid_2, ...}. */
final class EngineRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(EngineRegistry.class);
  private static final String ID_PREFIX = "sid_";

  private final Map<String, SidTernaryEngine> engines = new LinkedHashMap<>();
  private int counter;

  String create(EngineConfig config) {
    SidTernaryEngine engine = new SidTernaryEngine(config);
    String engineId = ID_PREFIX + (++counter);
    engines.put(engineId, engine);
    LOG.info(
        "Created engine {} ({} nodes, total mass {})",
        engineId,
        config.numNodes(),
        config.totalMass());
    return engineId;
  }

  SidTernaryEngine require(String engineId) {
    Objects.requireNonNull(engineId, "engineId");
    SidTernaryEngine engine = engines.get(engineId);
    if (engine == null) {
      throw new CommandException(
          CommandException.ENGINE_NOT_FOUND, "Engine not found: " + engineId);
    }
    return engine;
  }

  boolean destroy(String engineId) {
    boolean removed = engines.remove(engineId) != null;
    if (removed) {
      LOG.info("Destroyed engine {}", engineId);
    }
    return removed;
  }

  Map<String, SidTernaryEngine> engines() {
    return Collections.unmodifiableMap(engines);
  }

  int size() {
    return engines.size();
  }
}
