package sid.ssp;

import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.errors.ConservationViolationException;
import sid.errors.ContractViolationException;

/** Keeps {@code I + N + U = C} by correcting the undecided field after every step. */
public final class Mixer {
  private static final Logger LOG = LoggerFactory.getLogger(Mixer.class);

  /** Largest factor a deficit correction may scale U by. */
  public static final double MAX_SCALE_FACTOR = 10.0;

  static final double REQUEST_COLLAPSE_ALPHA = 0.01;
  private static final double MIN_GAIN_DENOMINATOR = 1e-12;

  private final double conservedMass;
  private final MixerConfig config;

  private boolean initialized;
  private double baselineU;
  private double previousI;
  private double previousU;
  private long stableCount;
  private MixerMetrics metrics = MixerMetrics.initial();

  public Mixer(double conservedMass) {
    this(conservedMass, MixerConfig.defaults());
  }

  public Mixer(double conservedMass, MixerConfig config) {
    MixerConfig requested = MixerConfig.normalize(config);
    if (!(conservedMass > 0.0) || Double.isInfinite(conservedMass)) {
      throw new ContractViolationException("Mixer total mass must be positive: " + conservedMass);
    }
    if (!(requested.epsConservation() >= 0.0)) {
      throw new ContractViolationException("Mixer eps_conservation must be non-negative");
    }
    if (!(requested.epsDelta() >= 0.0)) {
      throw new ContractViolationException("Mixer eps_delta must be non-negative");
    }
    if (requested.stableWindow() <= 0) {
      throw new ContractViolationException("Mixer stable window must be positive");
    }
    if (!(requested.emaAlpha() >= 0.0 && requested.emaAlpha() <= 1.0)) {
      throw new ContractViolationException("Mixer ema_alpha must be in [0,1]");
    }
    this.conservedMass = conservedMass;
    this.config = requested.scaledFor(conservedMass);
  }

  public double conservedMass() {
    return conservedMass;
  }

  public MixerConfig config() {
    return config;
  }

  public MixerMetrics metrics() {
    return metrics;
  }

  public boolean initialized() {
    return initialized;
  }

  /** Corrects drift in {@code u}, checks conservation, then updates gain and stability. */
  public MixerMetrics step(SemanticProcessor i, SemanticProcessor n, SemanticProcessor u) {
    int length = requireTriple(i, n, u, "step");

    double massI = i.totalMass();
    double massN = n.totalMass();
    double massU = u.totalMass();
    double total = massI + massN + massU;
    double totalBefore = total;

    if (total > conservedMass && massU > 0.0) {
      double alpha = Math.min(1.0, (total - conservedMass) / massU);
      u.applyCollapse(ones(length), alpha * massU / length);
      massU = u.totalMass();
      total = massI + massN + massU;
    } else if (total < conservedMass) {
      double deficit = conservedMass - total;
      if (massU > 0.0) {
        double scale = 1.0 + deficit / massU;
        if (scale > MAX_SCALE_FACTOR) {
          LOG.warn("Deficit correction needs scale {} (cap {}); refusing", scale, MAX_SCALE_FACTOR);
          throw ConservationViolationException.scaleCap(scale, MAX_SCALE_FACTOR);
        }
        u.scaleAll(scale);
      } else {
        u.addUniform(deficit / length);
      }
      massU = u.totalMass();
      total = massI + massN + massU;
    }

    double error = Math.abs(total - conservedMass);
    if (error > config.epsConservation()) {
      LOG.warn(
          "Conservation violated: before={} after={} target={}", totalBefore, total, conservedMass);
      throw ConservationViolationException.drift(error, config.epsConservation());
    }

    if (!initialized) {
      initialized = true;
      baselineU = massU;
      previousI = massI;
      previousU = massU;
      stableCount = 0;
      metrics = new MixerMetrics(0.0, massI, massN, massU, 0.0, error, false);
      return metrics;
    }

    double collapseRatio = baselineU > 0.0 ? Math.max(0.0, baselineU - massU) / baselineU : 0.0;
    double deltaI = massI - previousI;
    double deltaU = previousU - massU;
    double instantaneousGain = deltaI / Math.max(Math.abs(deltaU), MIN_GAIN_DENOMINATOR);
    double loopGain =
        (1.0 - config.emaAlpha()) * metrics.loopGain() + config.emaAlpha() * instantaneousGain;

    boolean stableNow =
        error <= config.epsConservation()
            && Math.abs(deltaI) <= config.epsDelta()
            && Math.abs(massU - previousU) <= config.epsDelta();
    stableCount = stableNow ? stableCount + 1 : 0;

    metrics =
        new MixerMetrics(
            loopGain,
            massI,
            massN,
            massU,
            collapseRatio,
            error,
            stableCount >= config.stableWindow());
    previousI = massI;
    previousU = massU;
    return metrics;
  }

  /** Uniform collapse of the undecided field with a small fixed alpha. */
  public void requestCollapse(SemanticProcessor i, SemanticProcessor n, SemanticProcessor u) {
    int length = requireTriple(i, n, u, "requestCollapse");
    u.applyCollapse(ones(length), REQUEST_COLLAPSE_ALPHA);
  }

  private static int requireTriple(
      SemanticProcessor i, SemanticProcessor n, SemanticProcessor u, String operation) {
    Objects.requireNonNull(i, "i");
    Objects.requireNonNull(n, "n");
    Objects.requireNonNull(u, "u");
    if (i.role() != Role.I || n.role() != Role.N || u.role() != Role.U) {
      throw new ContractViolationException(operation + ": role mismatch for I/N/U processors");
    }
    int length = u.fieldLength();
    if (i.fieldLength() != length || n.fieldLength() != length) {
      throw new ContractViolationException(operation + ": field length mismatch");
    }
    return length;
  }

  private static double[] ones(int length) {
    double[] mask = new double[length];
    Arrays.fill(mask, 1.0);
    return mask;
  }
}
