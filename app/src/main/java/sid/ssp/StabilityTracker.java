package sid.ssp;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/** Bounded history of a scalar signal with a step-to-step convergence test. */
public final class StabilityTracker {
  public static final int MAX_HISTORY = 100;
  public static final double DEFAULT_EPSILON = 1e-6;

  private final Deque<Double> history = new ArrayDeque<>();

  /** Records {@code value} and reports whether it moved less than {@code epsilon} since last. */
  public boolean record(double value, double epsilon) {
    history.addLast(value);
    if (history.size() > MAX_HISTORY) {
      history.removeFirst();
    }
    return converged(epsilon);
  }

  public boolean record(double value) {
    return record(value, DEFAULT_EPSILON);
  }

  public boolean converged(double epsilon) {
    if (history.size() < 2) {
      return false;
    }
    double last = history.peekLast();
    double previous = history.stream().skip(history.size() - 2L).findFirst().orElse(last);
    return Math.abs(last - previous) < epsilon;
  }

  public int size() {
    return history.size();
  }

  public List<Double> history() {
    return List.copyOf(history);
  }
}
