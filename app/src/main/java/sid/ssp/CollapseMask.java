package sid.ssp;

import java.util.Arrays;
import java.util.Objects;
import sid.errors.ContractViolationException;

/**
 * Dual admissible/inadmissible mask. Every entry lies in [0, 1] and {@code maskI[x] + maskN[x]}
 * never exceeds 1.
 */
public final class CollapseMask {
  private final double[] maskI;
  private final double[] maskN;

  public CollapseMask(double[] maskI, double[] maskN) {
    this.maskI = Objects.requireNonNull(maskI, "maskI").clone();
    this.maskN = Objects.requireNonNull(maskN, "maskN").clone();
  }

  public static CollapseMask uniform(int length, double weightI, double weightN) {
    double[] i = new double[length];
    double[] n = new double[length];
    Arrays.fill(i, weightI);
    Arrays.fill(n, weightN);
    return new CollapseMask(i, n);
  }

  public int length() {
    return maskI.length;
  }

  public double admissible(int index) {
    return maskI[index];
  }

  public double excluded(int index) {
    return maskN[index];
  }

  /** Throws unless both masks have {@code expectedLength} entries and the invariants hold. */
  public void validate(int expectedLength) {
    if (maskI.length != expectedLength || maskN.length != expectedLength) {
      throw new ContractViolationException(
          "Collapse mask length mismatch: expected "
              + expectedLength
              + ", got "
              + maskI.length
              + "/"
              + maskN.length);
    }
    for (int x = 0; x < expectedLength; x++) {
      double i = maskI[x];
      double n = maskN[x];
      if (!(i >= 0.0 && i <= 1.0) || !(n >= 0.0 && n <= 1.0)) {
        throw new ContractViolationException("Collapse mask value out of [0,1] at index " + x);
      }
      if (i + n > 1.0) {
        throw new ContractViolationException("Collapse mask sum exceeds 1 at index " + x);
      }
    }
  }

  public boolean isValid(int expectedLength) {
    try {
      validate(expectedLength);
      return true;
    } catch (ContractViolationException ex) {
      return false;
    }
  }
}
