package sid.ssp;

/** Observables emitted by each {@link Mixer#step}. */
public record MixerMetrics(
    double loopGain,
    double admissibleVolume,
    double excludedVolume,
    double undecidedVolume,
    double collapseRatio,
    double conservationError,
    boolean transportReady) {

  public static MixerMetrics initial() {
    return new MixerMetrics(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, false);
  }
}
