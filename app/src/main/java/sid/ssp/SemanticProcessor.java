package sid.ssp;

import java.util.Objects;
import sid.errors.ContractViolationException;

/**
 * Fixed-length, non-negative mass field with a role that gates which operations may mutate it.
 *
 * <p>Collapse operations require {@link Role#U}. Deltas are clamped so that no cell ever goes
 * negative; invalid arguments raise {@link ContractViolationException} instead of being clamped.
 */
public final class SemanticProcessor {
  private final Role role;
  private final double[] field;
  private final double capacity;

  private SemanticMetrics metrics = SemanticMetrics.empty();
  private long committedSteps;

  public SemanticProcessor(Role role, int fieldLength, double capacity) {
    this.role = Objects.requireNonNull(role, "role");
    if (fieldLength <= 0) {
      throw new ContractViolationException("field length must be positive: " + fieldLength);
    }
    if (!(capacity >= 0.0) || Double.isInfinite(capacity)) {
      throw new ContractViolationException("capacity must be finite and non-negative: " + capacity);
    }
    this.field = new double[fieldLength];
    this.capacity = capacity;
  }

  public Role role() {
    return role;
  }

  public int fieldLength() {
    return field.length;
  }

  public double capacity() {
    return capacity;
  }

  public double valueAt(int index) {
    return field[index];
  }

  public double[] fieldSnapshot() {
    return field.clone();
  }

  public double totalMass() {
    double total = 0.0;
    for (double value : field) {
      total += value;
    }
    return total;
  }

  public SemanticMetrics metrics() {
    return metrics;
  }

  public long committedSteps() {
    return committedSteps;
  }

  /** Overwrites the field; intended for setup and tests. Values must be finite and >= 0. */
  public void loadField(double[] values) {
    Objects.requireNonNull(values, "values");
    requireLength(values.length, "field");
    for (int i = 0; i < values.length; i++) {
      if (!(values[i] >= 0.0) || Double.isInfinite(values[i])) {
        throw new ContractViolationException("field value must be finite and >= 0 at " + i);
      }
    }
    System.arraycopy(values, 0, field, 0, field.length);
  }

  /** Removes {@code clamp(mask[i] * amount, 0, field[i])} from every cell. */
  public void applyCollapse(double[] mask, double amount) {
    requireRole(Role.U, "applyCollapse");
    Objects.requireNonNull(mask, "mask");
    requireLength(mask.length, "mask");
    requireUnitInterval(mask);
    if (Double.isNaN(amount) || Double.isInfinite(amount)) {
      throw new ContractViolationException("collapse amount must be finite");
    }
    for (int i = 0; i < field.length; i++) {
      double delta = clamp(mask[i] * amount, 0.0, field[i]);
      field[i] -= delta;
    }
  }

  /** Removes {@code clamp01(alpha) * clamp01(maskI + maskN) * field[i]} from every cell. */
  public void applyCollapseMask(CollapseMask mask, double alpha) {
    requireRole(Role.U, "applyCollapseMask");
    Objects.requireNonNull(mask, "mask");
    mask.validate(field.length);
    if (Double.isNaN(alpha)) {
      throw new ContractViolationException("collapse alpha must be a number");
    }
    double effective = clamp(alpha, 0.0, 1.0);
    for (int i = 0; i < field.length; i++) {
      double weight = clamp(mask.admissible(i) + mask.excluded(i), 0.0, 1.0);
      double delta = Math.min(effective * weight * field[i], field[i]);
      field[i] -= delta;
    }
  }

  /** Adds {@code max(0, alpha * mask[i] * source[i])} to every cell. */
  public void routeFromField(double[] source, double[] mask, double alpha) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(mask, "mask");
    requireLength(source.length, "source");
    requireLength(mask.length, "mask");
    if (!(alpha >= 0.0)) {
      throw new ContractViolationException("route alpha must be >= 0: " + alpha);
    }
    requireUnitInterval(mask);
    for (int i = 0; i < field.length; i++) {
      double contribution = alpha * mask[i] * source[i];
      if (contribution > 0.0) {
        field[i] += contribution;
      }
    }
  }

  public void scaleAll(double scale) {
    if (!(scale >= 0.0) || Double.isInfinite(scale)) {
      throw new ContractViolationException("scale must be finite and >= 0: " + scale);
    }
    for (int i = 0; i < field.length; i++) {
      field[i] *= scale;
    }
  }

  public void addUniform(double amountPerCell) {
    if (!(amountPerCell >= 0.0) || Double.isInfinite(amountPerCell)) {
      throw new ContractViolationException(
          "uniform amount must be finite and >= 0: " + amountPerCell);
    }
    for (int i = 0; i < field.length; i++) {
      field[i] += amountPerCell;
    }
  }

  /** Recomputes stability, coherence and divergence, then advances the step counter. */
  public SemanticMetrics commitStep() {
    double total = totalMass();
    double load = capacity > 0.0 ? clamp(total / capacity, 0.0, 1.0) : 1.0;

    double mean = total / field.length;
    double variance = 0.0;
    for (double value : field) {
      double diff = value - mean;
      variance += diff * diff;
    }
    variance = Math.max(0.0, variance / field.length);

    double divergence = 0.0;
    if (field.length > 1) {
      for (int i = 1; i < field.length; i++) {
        divergence += Math.abs(field[i] - field[i - 1]);
      }
      divergence /= field.length - 1;
    }

    metrics = new SemanticMetrics(1.0 - load, 1.0 / (1.0 + variance), divergence);
    committedSteps++;
    return metrics;
  }

  private void requireRole(Role required, String operation) {
    if (role != required) {
      throw new ContractViolationException(
          operation + " requires role " + required + " but processor has role " + role);
    }
  }

  private void requireLength(int length, String what) {
    if (length != field.length) {
      throw new ContractViolationException(
          what + " length " + length + " does not match field length " + field.length);
    }
  }

  private static void requireUnitInterval(double[] mask) {
    for (int i = 0; i < mask.length; i++) {
      if (!(mask[i] >= 0.0 && mask[i] <= 1.0)) {
        throw new ContractViolationException("mask value out of [0,1] at index " + i);
      }
    }
  }

  private static double clamp(double value, double low, double high) {
    return Math.max(low, Math.min(high, value));
  }

  @Override
  public String toString() {
    return "SemanticProcessor[" + role + ", len=" + field.length + ", mass=" + totalMass() + "]";
  }
}
