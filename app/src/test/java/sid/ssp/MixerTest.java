package sid.ssp;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import org.junit.jupiter.api.Test;
import sid.errors.ConservationViolationException;
import sid.errors.ContractViolationException;
import sid.errors.ErrorCode;

final class MixerTest {
  private static final double EPS = 1e-9;

  @Test
  void excessIsRemovedFromUndecided() {
    SemanticProcessor[] fields = fields(5, 3.0, 3.0, 5.0);
    Mixer mixer = new Mixer(10.0);

    MixerMetrics metrics = mixer.step(fields[0], fields[1], fields[2]);

    assertEquals(4.0, fields[2].totalMass(), EPS);
    assertEquals(10.0, total(fields), EPS);
    assertEquals(4.0, metrics.undecidedVolume(), EPS);
    assertEquals(0.0, metrics.loopGain(), "First step only records the baseline");
    assertFalse(metrics.transportReady());
    assertTrue(mixer.initialized());
  }

  @Test
  void deficitScalesUndecided() {
    SemanticProcessor[] fields = fields(5, 3.0, 3.0, 2.0);
    new Mixer(10.0).step(fields[0], fields[1], fields[2]);
    assertEquals(4.0, fields[2].totalMass(), EPS);
  }

  @Test
  void emptyUndecidedIsRefilledUniformly() {
    SemanticProcessor[] fields = fields(4, 3.0, 3.0, 0.0);
    new Mixer(10.0).step(fields[0], fields[1], fields[2]);
    assertArrayEquals(new double[] {1.0, 1.0, 1.0, 1.0}, fields[2].fieldSnapshot(), EPS);
  }

  @Test
  void refusesToScaleBeyondCap() {
    SemanticProcessor[] fields = fields(10, 2.5, 2.5, 5.0);
    for (int i = 0; i < 12; i++) {
      fields[2].applyCollapseMask(CollapseMask.uniform(10, 0.5, 0.0), 1.0);
    }
    double[] before = fields[2].fieldSnapshot();
    assertTrue(fields[2].totalMass() < 0.002);

    ConservationViolationException ex =
        assertThrows(
            ConservationViolationException.class,
            () -> new Mixer(10.0).step(fields[0], fields[1], fields[2]));
    assertEquals(ErrorCode.SCALE_CAP_EXCEEDED, ex.code());
    assertArrayEquals(before, fields[2].fieldSnapshot(), 0.0, "U is left untouched");
  }

  @Test
  void reportsDriftThatCollapseCannotRemove() {
    SemanticProcessor[] fields = fields(5, 6.0, 6.0, 0.0);
    fields[2].loadField(new double[] {0.0, 0.0, 0.0, 0.0, 1.0});

    ConservationViolationException ex =
        assertThrows(
            ConservationViolationException.class,
            () -> new Mixer(10.0).step(fields[0], fields[1], fields[2]));
    assertEquals(ErrorCode.CONSERVATION_VIOLATION, ex.code());
  }

  @Test
  void becomesTransportReadyAfterStableWindow() {
    SemanticProcessor[] fields = fields(4, 4.0, 4.0, 2.0);
    Mixer mixer = new Mixer(10.0);
    int window = mixer.config().stableWindow();

    MixerMetrics metrics = null;
    for (int step = 0; step < window; step++) {
      metrics = mixer.step(fields[0], fields[1], fields[2]);
      assertFalse(metrics.transportReady(), "Not ready at step " + step);
    }
    metrics = mixer.step(fields[0], fields[1], fields[2]);
    assertTrue(metrics.transportReady());
    assertEquals(0.0, metrics.collapseRatio(), EPS);
  }

  @Test
  void loopGainTracksTransferFromUndecided() {
    SemanticProcessor[] fields = fields(4, 3.0, 3.0, 4.0);
    Mixer mixer = new Mixer(10.0);
    mixer.step(fields[0], fields[1], fields[2]);

    fields[2].applyCollapseMask(CollapseMask.uniform(4, 0.5, 0.0), 1.0);
    fields[0].addUniform(0.25);
    fields[1].addUniform(0.25);
    MixerMetrics metrics = mixer.step(fields[0], fields[1], fields[2]);

    assertEquals(0.1 * 0.5, metrics.loopGain(), EPS);
    assertEquals(0.5, metrics.collapseRatio(), EPS);
  }

  @Test
  void requestCollapseRemovesSmallUniformAmount() {
    SemanticProcessor[] fields = fields(2, 1.0, 1.0, 1.0);
    new Mixer(3.0).requestCollapse(fields[0], fields[1], fields[2]);
    assertEquals(1.0 - 2 * Mixer.REQUEST_COLLAPSE_ALPHA, fields[2].totalMass(), EPS);
  }

  @Test
  void validatesRolesAndConfiguration() {
    SemanticProcessor[] fields = fields(2, 1.0, 1.0, 1.0);
    Mixer mixer = new Mixer(3.0);
    assertThrows(
        ContractViolationException.class, () -> mixer.step(fields[1], fields[0], fields[2]));
    assertThrows(
        ContractViolationException.class,
        () -> mixer.step(fields[0], fields[1], new SemanticProcessor(Role.U, 3, 1.0)));
    assertThrows(ContractViolationException.class, () -> new Mixer(0.0));
    assertThrows(
        ContractViolationException.class,
        () -> new Mixer(1.0, new MixerConfig(1e-6, 1e-6, 0, 0.1)));
    assertThrows(
        ContractViolationException.class,
        () -> new Mixer(1.0, new MixerConfig(1e-6, 1e-6, 5, 1.5)));
  }

  @Test
  void defaultTolerancesScaleWithMass() {
    MixerConfig config = new Mixer(1000.0).config();
    assertEquals(1e-3, config.epsConservation(), 1e-15);
    assertEquals(1e-3, config.epsDelta(), 1e-15);
    assertEquals(MixerConfig.defaults().stableWindow(), config.stableWindow());
  }

  private static SemanticProcessor[] fields(int length, double i, double n, double u) {
    SemanticProcessor[] fields = {
      new SemanticProcessor(Role.I, length, 100.0),
      new SemanticProcessor(Role.N, length, 100.0),
      new SemanticProcessor(Role.U, length, 100.0)
    };
    fields[0].loadField(uniform(length, i / length));
    fields[1].loadField(uniform(length, n / length));
    fields[2].loadField(uniform(length, u / length));
    return fields;
  }

  private static double[] uniform(int length, double value) {
    double[] values = new double[length];
    Arrays.fill(values, value);
    return values;
  }

  private static double total(SemanticProcessor[] fields) {
    return fields[0].totalMass() + fields[1].totalMass() + fields[2].totalMass();
  }
}
