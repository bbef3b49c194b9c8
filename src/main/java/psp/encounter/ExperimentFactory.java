package psp.encounter;

import psp.encounter.experiment.AngularBinExperiment;
import psp.encounter.experiment.ElectronPadExperiment;
import psp.encounter.experiment.Experiment;
import psp.encounter.experiment.HammerheadExperiment;
import psp.encounter.experiment.WavePowerExperiment;

/**
 * Enumerated type defining each kind of derived-variable calculation, so that callers have a
 * list of all experiments available and a way to create the associated Experiment class.
 *
 * If adding a new calculation, make sure to also create a new extension for Experiment.
 */
public enum ExperimentFactory {

  WAVE_POWER("Wave power histograms") {
    @Override
    public Experiment createExperiment() {
      return new WavePowerExperiment();
    }
  },
  ELECTRON_PAD("Electron strahl pitch angle") {
    @Override
    public Experiment createExperiment() {
      return new ElectronPadExperiment();
    }
  },
  HAMMERHEAD("Hammerhead statistics") {
    @Override
    public Experiment createExperiment() {
      return new HammerheadExperiment();
    }
  },
  ANGULAR_BINS("Hammerhead occurrence by longitude") {
    @Override
    public Experiment createExperiment() {
      return new AngularBinExperiment();
    }
  };

  private final String name;

  ExperimentFactory(String name) {
    this.name = name;
  }

  /**
   * Instantiate an experiment of this type
   *
   * @return New experiment with default (configured) settings
   */
  public abstract Experiment createExperiment();

  /**
   * Get a human-readable name of this experiment type
   *
   * @return Name of the experiment
   */
  public String getName() {
    return name;
  }
}
