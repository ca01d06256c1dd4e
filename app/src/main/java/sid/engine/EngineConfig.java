package sid.engine;

import sid.ssp.MixerConfig;

/** Construction parameters of a {@link SidTernaryEngine}. */
public record EngineConfig(int numNodes, double totalMass, MixerConfig mixer) {

  public static final int DEFAULT_NUM_NODES = 100;
  public static final double DEFAULT_TOTAL_MASS = 1000.0;

  public EngineConfig {
    mixer = MixerConfig.normalize(mixer);
  }

  public static EngineConfig defaults() {
    return new EngineConfig(DEFAULT_NUM_NODES, DEFAULT_TOTAL_MASS, MixerConfig.defaults());
  }

  public static EngineConfig of(int numNodes, double totalMass) {
    return new EngineConfig(numNodes, totalMass, MixerConfig.defaults());
  }

  public EngineConfig withNumNodes(int value) {
    return new EngineConfig(value, totalMass, mixer);
  }

  public EngineConfig withTotalMass(double value) {
    return new EngineConfig(numNodes, value, mixer);
  }
}
