package sid.ssp;

/** Field statistics recomputed by {@link SemanticProcessor#commitStep()}. */
public record SemanticMetrics(double stability, double coherence, double divergence) {

  public static SemanticMetrics empty() {
    return new SemanticMetrics(0.0, 0.0, 0.0);
  }
}
