package psp.encounter;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;

import psp.encounter.experiment.AngularBinExperiment;
import psp.encounter.experiment.ElectronPadExperiment;
import psp.encounter.experiment.HammerheadExperiment;
import psp.encounter.experiment.WavePowerExperiment;
import org.junit.Test;

/**
 * These tests verify that each enum matches its expected class for createExperiment().
 */
public class ExperimentFactoryTest {

  @Test
  public void wavePower_createExperiment() {
    assertThat(ExperimentFactory.WAVE_POWER.createExperiment(),
        instanceOf(WavePowerExperiment.class));
  }

  @Test
  public void electronPad_createExperiment() {
    assertThat(ExperimentFactory.ELECTRON_PAD.createExperiment(),
        instanceOf(ElectronPadExperiment.class));
  }

  @Test
  public void hammerhead_createExperiment() {
    assertThat(ExperimentFactory.HAMMERHEAD.createExperiment(),
        instanceOf(HammerheadExperiment.class));
  }

  @Test
  public void angularBins_createExperiment() {
    assertThat(ExperimentFactory.ANGULAR_BINS.createExperiment(),
        instanceOf(AngularBinExperiment.class));
  }

  @Test
  public void everyType_hasName() {
    assertEquals(4, ExperimentFactory.values().length);
    for (ExperimentFactory type : ExperimentFactory.values()) {
      assertEquals(false, type.getName().isEmpty());
    }
  }
}
