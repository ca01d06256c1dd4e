package sid.ssp;

/**
 * Tuning for the {@link Mixer}.
 *
 * @param epsConservation tolerated |I + N + U - C|
 * @param epsDelta tolerated per-step change of I and U for the stability predicate
 * @param stableWindow consecutive stable steps before transport is ready
 * @param emaAlpha smoothing factor of the loop gain, in [0, 1]
 */
public record MixerConfig(
    double epsConservation, double epsDelta, int stableWindow, double emaAlpha) {

  public static final double DEFAULT_EPSILON = 1e-6;
  public static final int DEFAULT_STABLE_WINDOW = 5;
  public static final double DEFAULT_EMA_ALPHA = 0.1;

  public static MixerConfig defaults() {
    return new MixerConfig(
        DEFAULT_EPSILON, DEFAULT_EPSILON, DEFAULT_STABLE_WINDOW, DEFAULT_EMA_ALPHA);
  }

  public static MixerConfig normalize(MixerConfig config) {
    return config == null ? defaults() : config;
  }

  /** Epsilons left at their default grow with the conserved mass: {@code 1e-6 * max(C, 1)}. */
  public MixerConfig scaledFor(double conservedMass) {
    double factor = Math.max(conservedMass, 1.0);
    double conservation =
        epsConservation == DEFAULT_EPSILON ? DEFAULT_EPSILON * factor : epsConservation;
    double delta = epsDelta == DEFAULT_EPSILON ? DEFAULT_EPSILON * factor : epsDelta;
    return new MixerConfig(conservation, delta, stableWindow, emaAlpha);
  }
}
