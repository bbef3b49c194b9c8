package psp.encounter.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.List;
import org.junit.Test;
import psp.encounter.input.TimeSeries;
import psp.encounter.output.Centroid;
import psp.encounter.output.CountHistogram;
import psp.encounter.output.LogHistogram2D;
import psp.encounter.output.LogHistogram2D.Normalization;
import psp.encounter.test.TestUtils;

public class HistogramUtilsTest {

  private static final TauWindow TWO_MINUTES = TauWindow.parse("2m");
  // log10 value in the middle of bin 40 of a [-3, 3] range with 60 bins
  private static final double IN_BIN = Math.pow(10, 1.05);

  /**
   * Ten-second samples over ten minutes; the third two-minute row holds only zeros
   */
  private static TimeSeries withEmptyThirdRow() {
    double[] times = TestUtils.regularTimes(0., 10., 61);
    double[] values = new double[times.length];
    for (int i = 0; i < times.length; ++i) {
      values[i] = (times[i] >= 240. && times[i] < 360.) ? 0. : IN_BIN;
    }
    return new TimeSeries("wavePower_LH", times, values);
  }

  private static HistogramSettings settings(Normalization normalization, double cMax) {
    return new HistogramSettings(-3., 3., 60, normalization, cMax);
  }

  @Test
  public void logHistograms_densityRow_emptyRowIsZeroAndCentroidNaN() {
    List<LogHistogram2D> histograms = HistogramUtils.logHistograms(withEmptyThirdRow(),
        Collections.singletonList(TWO_MINUTES), settings(Normalization.DENSITY_ROW, Double.NaN));
    assertEquals(1, histograms.size());
    LogHistogram2D histogram = histograms.get(0);
    assertEquals(5, histogram.getTimeBinCount());
    assertEquals(60, histogram.getValueBinCount());

    double[][] cells = histogram.getCells();
    for (double cell : cells[2]) {
      assertEquals(0., cell, 0.);
    }
    assertEquals(12, histogram.getInvalidCounts()[2]);
    assertEquals(0, histogram.getInvalidCounts()[0]);

    // a row with all samples in one bin has density 1 / bin width there
    for (int row : new int[]{0, 1, 3, 4}) {
      assertEquals(10., cells[row][40], 1E-9);
      double sum = 0.;
      for (double cell : cells[row]) {
        sum += cell * 0.1;
      }
      assertEquals(1., sum, 1E-9);
    }

    Centroid centroid = histogram.centroid();
    assertEquals(5, centroid.size());
    assertTrue(Double.isNaN(centroid.getValues()[2]));
    assertEquals(IN_BIN, centroid.getValues()[0], 1E-9);
    assertEquals(IN_BIN, centroid.getValues()[4], 1E-9);
    assertArrayEquals(new double[]{60., 180., 300., 420., 540.}, centroid.getTimes(), 1E-9);
  }

  @Test
  public void logHistograms_densityTotalIntegratesToOne() {
    double[] times = TestUtils.regularTimes(0., 7., 200);
    double[] values = new double[times.length];
    for (int i = 0; i < values.length; ++i) {
      values[i] = Math.pow(10, -2.5 + 5. * ((i * 37) % 200) / 200.);
    }
    TimeSeries series = new TimeSeries("wavePower_RH", times, values);
    LogHistogram2D histogram = HistogramUtils.logHistograms(series,
        Collections.singletonList(TWO_MINUTES), settings(Normalization.DENSITY_TOTAL, Double.NaN))
        .get(0);

    double[] timeEdges = histogram.getTimeEdges();
    double integral = 0.;
    for (int row = 0; row < histogram.getTimeBinCount(); ++row) {
      double dt = timeEdges[row + 1] - timeEdges[row];
      for (double cell : histogram.getCells()[row]) {
        integral += cell * dt * 0.1;
      }
    }
    assertEquals(1., integral, 1E-9);
  }

  @Test
  public void logHistograms_countsOutOfRangeSeparately() {
    double[] times = {0., 10., 20., 30.};
    double[] values = {1E5, 1E-4, IN_BIN, -1.};
    TimeSeries series = new TimeSeries("wavePower_LH", times, values);
    LogHistogram2D histogram = HistogramUtils.logHistograms(series,
        Collections.singletonList(TWO_MINUTES), settings(Normalization.COUNT, Double.NaN))
        .get(0);
    assertEquals(1, histogram.getTimeBinCount());
    assertEquals(2, histogram.getOutOfRangeCounts()[0]);
    assertEquals(1, histogram.getInvalidCounts()[0]);
    assertEquals(1., histogram.getCells()[0][40], 0.);
  }

  @Test
  public void logHistograms_allInvalidGivesNaNCells() {
    double[] times = TestUtils.regularTimes(0., 30., 20);
    TimeSeries series = new TimeSeries("wavePower_LH", times, new double[times.length]);
    LogHistogram2D histogram = HistogramUtils.logHistograms(series,
        Collections.singletonList(TWO_MINUTES), settings(Normalization.DENSITY_ROW, Double.NaN))
        .get(0);
    assertTrue(histogram.getTimeBinCount() > 0);
    assertTrue(histogram.isAllInvalid());
    for (double value : histogram.centroid().getValues()) {
      assertTrue(Double.isNaN(value));
    }
  }

  @Test
  public void logHistograms_cMaxClipsHighCells() {
    LogHistogram2D histogram = HistogramUtils.logHistograms(withEmptyThirdRow(),
        Collections.singletonList(TWO_MINUTES), settings(Normalization.COUNT, 11.)).get(0);
    double[][] cells = histogram.getCells();
    // row 0 holds t = 0..110, twelve samples
    assertTrue(Double.isNaN(cells[0][40]));
    // the last row also gets the final edge sample
    assertTrue(Double.isNaN(cells[4][40]));
    assertEquals(0., cells[0][39], 0.);
    assertFalse(histogram.isAllInvalid());
  }

  @Test
  public void logHistograms_oneHistogramPerTauInOrder() {
    List<TauWindow> taus = TauWindow.parseAll("30s,2m,5m");
    List<LogHistogram2D> histograms = HistogramUtils.logHistograms(withEmptyThirdRow(), taus,
        settings(Normalization.COUNT, Double.NaN));
    assertEquals(3, histograms.size());
    assertEquals(20, histograms.get(0).getTimeBinCount());
    assertEquals(5, histograms.get(1).getTimeBinCount());
    assertEquals(2, histograms.get(2).getTimeBinCount());
    assertEquals("5m", histograms.get(2).getTau().getLabel());
  }

  @Test
  public void timeEdges_edgeCases() {
    assertEquals(0, HistogramUtils.timeEdges(new double[]{}, TWO_MINUTES).length);
    assertArrayEquals(new double[]{50., 170.},
        HistogramUtils.timeEdges(new double[]{50., 50.}, TWO_MINUTES), 1E-12);
    // shorter than tau still makes one bin over the span
    assertArrayEquals(new double[]{0., 30.},
        HistogramUtils.timeEdges(new double[]{0., 30.}, TWO_MINUTES), 1E-12);
    assertArrayEquals(new double[]{0., 1000. / 3, 2000. / 3, 1000.},
        HistogramUtils.timeEdges(new double[]{0., 1000.}, TauWindow.parse("5m")), 1E-9);
  }

  @Test(expected = IllegalArgumentException.class)
  public void timeEdges_tooManyBinsRejected() {
    // about 3.3E10 bins of 30 s
    HistogramUtils.timeEdges(new double[]{0., 1E12}, TauWindow.parse("30s"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void countHistograms_tooManyBinsRejected() {
    HistogramUtils.countHistograms("detections", new double[]{0., 1E12},
        Collections.singletonList(TauWindow.parse("30s")));
  }

  @Test
  public void countHistograms_countsEveryEvent() {
    double[] events = {0., 5., 100., 130., 131., 400., 600.};
    List<CountHistogram> histograms = HistogramUtils.countHistograms("detections", events,
        TauWindow.parseAll("2m,10m"));
    CountHistogram twoMinutes = histograms.get(0);
    assertEquals(5, twoMinutes.getCounts().length);
    assertArrayEquals(new double[]{3., 2., 0., 1., 1.}, twoMinutes.getCounts(), 0.);
    assertEquals(7., twoMinutes.getTotal(), 0.);
    assertEquals(60., twoMinutes.getCenters()[0], 1E-9);

    CountHistogram tenMinutes = histograms.get(1);
    assertEquals(1, tenMinutes.getCounts().length);
    assertEquals(7., tenMinutes.getTotal(), 0.);
  }

  @Test
  public void countHistograms_noEventsGivesNoBins() {
    List<CountHistogram> histograms = HistogramUtils.countHistograms("detections",
        new double[]{}, Collections.singletonList(TWO_MINUTES));
    assertEquals(1, histograms.size());
    assertEquals(0, histograms.get(0).getCounts().length);
    assertEquals(0., histograms.get(0).getTotal(), 0.);
  }
}
