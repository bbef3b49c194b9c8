package psp.encounter.experiment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.junit.Test;
import psp.encounter.input.DataStore;
import psp.encounter.input.TimeSeries;
import psp.encounter.output.Centroid;
import psp.encounter.output.LogHistogram2D;
import psp.encounter.output.LogHistogram2D.Normalization;
import psp.encounter.output.ResampledSeries;
import psp.encounter.test.TestUtils;
import psp.encounter.utils.HistogramSettings;
import psp.encounter.utils.ResampleMode;
import psp.encounter.utils.TauWindow;

public class WavePowerExperimentTest {

  private static final double START = TestUtils.epochSeconds("2022-02-25T12:00:00Z");

  private static TimeSeries power(String name, double level) {
    double[] times = TestUtils.regularTimes(START, 1., 3600);
    double[] values = new double[times.length];
    for (int i = 0; i < values.length; ++i) {
      // a quiet stretch of dropouts in the second quarter hour
      values[i] = (i >= 900 && i < 1800) ? 0. : level * (1. + 0.5 * Math.sin(i / 60.));
    }
    return new TimeSeries(name, times, values);
  }

  private static WavePowerExperiment configured() {
    WavePowerExperiment experiment = new WavePowerExperiment();
    experiment.setTaus(TauWindow.parseAll("2m,20m"));
    experiment.setHistogramSettings(
        new HistogramSettings(-3., 3., 120, Normalization.DENSITY_ROW, Double.NaN));
    return experiment;
  }

  @Test
  public void backend_bothPolarizations() {
    DataStore dataStore = new DataStore();
    dataStore.setSeries(power(WavePowerExperiment.LEFT_HANDED, 0.1));
    dataStore.setSeries(power(WavePowerExperiment.RIGHT_HANDED, 10.));
    WavePowerExperiment experiment = configured();
    assertTrue(experiment.hasEnoughData(dataStore));
    experiment.runExperimentOnData(dataStore);

    assertTrue(experiment.getWarnings().isEmpty());
    for (String polarization : new String[]{WavePowerExperiment.LEFT_HANDED,
        WavePowerExperiment.RIGHT_HANDED}) {
      List<LogHistogram2D> histograms = experiment.getHistograms(polarization);
      assertEquals(2, histograms.size());
      assertEquals(30, histograms.get(0).getTimeBinCount());
      assertEquals(3, histograms.get(1).getTimeBinCount());
      assertEquals(polarization, histograms.get(0).getVariable());
    }
    // raw plot, then one collection per tau
    assertEquals(3, experiment.getData().size());
    assertEquals(2, experiment.getData().get(0).getSeriesCount());
    assertEquals(2, experiment.getData().get(1).getSeriesCount());
    assertEquals(START, experiment.getStart(), 1E-6);
    assertEquals(START + 3599., experiment.getEnd(), 1E-6);
  }

  @Test
  public void backend_centroidTracksPowerLevelAndDropouts() {
    DataStore dataStore = new DataStore();
    dataStore.setSeries(power(WavePowerExperiment.RIGHT_HANDED, 10.));
    WavePowerExperiment experiment = configured();
    experiment.runExperimentOnData(dataStore);

    Centroid centroid = experiment.getCentroids(WavePowerExperiment.RIGHT_HANDED).get(0);
    double[] values = centroid.getValues();
    assertEquals(30, values.length);
    // rows 8 through 14 hold only dropouts
    for (int i = 8; i < 15; ++i) {
      assertTrue(Double.isNaN(values[i]));
    }
    assertTrue(values[0] > 5. && values[0] < 20.);
    assertTrue(values[29] > 5. && values[29] < 20.);
    assertEquals(Math.pow(10, 3), centroid.getAxis().getValues()[119], 1E2);
  }

  @Test
  public void backend_defaultSettingsClipDenseCells() {
    double[] times = TestUtils.regularTimes(START, 1., 3600);
    double[] values = new double[times.length];
    for (int i = 0; i < values.length; ++i) {
      // first half sweeps every value bin center in turn, second half sits on one value
      values[i] = i < 1800 ? Math.pow(10, -2.975 + (i % 120) * 0.05) : 10.;
    }
    DataStore dataStore = new DataStore();
    dataStore.setSeries(new TimeSeries(WavePowerExperiment.RIGHT_HANDED, times, values));
    WavePowerExperiment experiment = new WavePowerExperiment();
    experiment.setTaus(TauWindow.parseAll("2m"));
    experiment.runExperimentOnData(dataStore);

    LogHistogram2D histogram = experiment.getHistograms(WavePowerExperiment.RIGHT_HANDED).get(0);
    assertEquals(Normalization.DENSITY_TOTAL, histogram.getNormalization());
    assertEquals(30, histogram.getTimeBinCount());
    // about 120 samples in one cell is a density over 1E-3; a handful stays below it
    int clipped = 0;
    for (double cell : histogram.getCells()[20]) {
      if (Double.isNaN(cell)) {
        ++clipped;
      }
    }
    assertEquals(1, clipped);
    double[] centroid = experiment.getCentroids(WavePowerExperiment.RIGHT_HANDED).get(0)
        .getValues();
    for (int i = 0; i < 15; ++i) {
      assertTrue(Double.isFinite(centroid[i]));
    }
    for (int i = 15; i < 30; ++i) {
      assertTrue(Double.isNaN(centroid[i]));
    }
  }

  @Test
  public void backend_missingPolarizationSkippedWithWarning() {
    DataStore dataStore = new DataStore();
    dataStore.setSeries(power(WavePowerExperiment.LEFT_HANDED, 1.));
    WavePowerExperiment experiment = configured();
    experiment.runExperimentOnData(dataStore);

    assertEquals(2, experiment.getHistograms(WavePowerExperiment.LEFT_HANDED).size());
    assertTrue(experiment.getHistograms(WavePowerExperiment.RIGHT_HANDED).isEmpty());
    assertTrue(experiment.getCentroids(WavePowerExperiment.RIGHT_HANDED).isEmpty());
    assertEquals(1, experiment.getWarnings().size());
    assertTrue(experiment.getWarnings().get(0).contains(WavePowerExperiment.RIGHT_HANDED));
    assertTrue(experiment.getInputNames().contains(WavePowerExperiment.LEFT_HANDED));
  }

  @Test
  public void backend_resamplesOntoTargetTimes() {
    DataStore dataStore = new DataStore();
    dataStore.setSeries(power(WavePowerExperiment.LEFT_HANDED, 1.));
    WavePowerExperiment experiment = configured();
    double[] target = TestUtils.regularTimes(START - 60., 7., 600);
    experiment.setTargetTimes(target);
    experiment.setResampleMode(ResampleMode.WINDOW_MEAN);
    experiment.runExperimentOnData(dataStore);

    ResampledSeries resampled = experiment.getResampled(WavePowerExperiment.LEFT_HANDED);
    assertNotNull(resampled);
    assertEquals(target.length, resampled.size());
    assertEquals(ResampleMode.WINDOW_MEAN, resampled.getMode());
    // targets before the data have an empty window
    assertTrue(Double.isNaN(resampled.getValues()[0]));
    assertTrue(Double.isFinite(resampled.getValues()[20]));
    assertNull(experiment.getResampled(WavePowerExperiment.RIGHT_HANDED));
  }

  @Test
  public void runExperimentOnData_noPowerVariables() {
    WavePowerExperiment experiment = configured();
    DataStore dataStore = new DataStore();
    assertEquals(false, experiment.hasEnoughData(dataStore));
    experiment.runExperimentOnData(dataStore);
    assertTrue(experiment.getData().isEmpty());
    assertEquals(1, experiment.getWarnings().size());
  }
}
