package sid.engine;

/** Snapshot served by the metrics command. */
public record EngineMetrics(
    double iMass,
    double nMass,
    double uMass,
    double instantaneousGain,
    boolean conserved,
    boolean lastRewriteApplied,
    String lastRewriteMessage,
    long stepCount,
    boolean transportReady) {}
