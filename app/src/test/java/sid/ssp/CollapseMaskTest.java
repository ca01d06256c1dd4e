package sid.ssp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class CollapseMaskTest {

  @Test
  void uniformMaskWithinBoundsIsValid() {
    CollapseMask mask = CollapseMask.uniform(4, 0.5, 0.5);
    assertEquals(4, mask.length());
    assertTrue(mask.isValid(4));
    assertFalse(mask.isValid(3), "Length must match");
  }

  @Test
  void detectsOutOfRangeEntriesAndOverfullSums() {
    assertFalse(CollapseMask.uniform(2, 0.6, 0.6).isValid(2));
    assertFalse(CollapseMask.uniform(2, -0.1, 0.2).isValid(2));
    CollapseMask withNaN = new CollapseMask(new double[] {0.1, Double.NaN}, new double[2]);
    assertFalse(withNaN.isValid(2));
  }

  @Test
  void copiesInputArrays() {
    double[] admissible = {0.2, 0.3};
    CollapseMask mask = new CollapseMask(admissible, new double[] {0.1, 0.1});
    admissible[0] = 0.9;
    assertEquals(0.2, mask.admissible(0));
  }
}
