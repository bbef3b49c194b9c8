package psp.encounter.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import psp.encounter.output.AngularBin;
import psp.encounter.output.AngularBinGeometry;
import psp.encounter.output.BackwardBinReport;
import psp.encounter.output.Encounter;

public class AngularBinUtilsTest {

  private static Encounter encounterOf(List<AngularBin> bins) {
    return new Encounter("E99", Instant.parse("2022-06-01T22:51:00Z"), 0., 10, 100, 8, bins);
  }

  private static AngularBin forward() {
    return new AngularBin(10., 12., 1, 3);
  }

  private static AngularBin backward() {
    return new AngularBin(12., 10., 1, 3);
  }

  @Test
  public void geometry_binAcrossSeam() {
    AngularBinGeometry geometry = AngularBinUtils.geometry(new AngularBin(340., 10., 2, 5), 0.);
    assertEquals(30., geometry.getDelta(), 1E-12);
    assertTrue(geometry.isForward());
    assertEquals(355., geometry.getCenter(), 1E-12);
    assertEquals(-20., geometry.getStartFromPerihelion(), 1E-12);
    assertEquals(10., geometry.getEndFromPerihelion(), 1E-12);
    assertEquals(-5., geometry.getCenterFromPerihelion(), 1E-12);
  }

  @Test
  public void geometry_unknownPerihelionLongitude() {
    AngularBinGeometry geometry = AngularBinUtils.geometry(new AngularBin(20., 25., 0, 5),
        Double.NaN);
    assertEquals(5., geometry.getDelta(), 1E-12);
    assertEquals(22.5, geometry.getCenter(), 1E-12);
    assertTrue(Double.isNaN(geometry.getCenterFromPerihelion()));
  }

  @Test
  public void wrapDelta_staysWithinHalfCircle() {
    for (double start = 0.; start < 360.; start += 7.5) {
      for (double end = 0.; end < 360.; end += 7.5) {
        double delta = AngularBinUtils.wrapDelta(start, end);
        assertTrue(delta > -180. && delta <= 180.);
        assertEquals(0., NumericUtils.normalizeDegrees(start + delta - end), 1E-9);
      }
    }
    assertEquals(180., AngularBinUtils.wrapDelta(0., 180.), 1E-12);
    assertEquals(180., AngularBinUtils.wrapDelta(180., 0.), 1E-12);
  }

  @Test
  public void isForward_zeroWidthIsBackward() {
    assertFalse(AngularBinUtils.isForward(0.));
    assertFalse(AngularBinUtils.isForward(-3.));
    assertTrue(AngularBinUtils.isForward(0.5));
  }

  @Test
  public void barCenter_bothSeamDirections() {
    assertEquals(355., AngularBinUtils.barCenter(340., 10.), 1E-12);
    assertEquals(355., AngularBinUtils.barCenter(10., 340.), 1E-12);
    assertEquals(5., AngularBinUtils.barCenter(350., 20.), 1E-12);
    assertEquals(150., AngularBinUtils.barCenter(100., 200.), 1E-12);
  }

  @Test
  public void degreesFrom_signedAndWrapped() {
    assertEquals(-20., AngularBinUtils.degreesFrom(340., 0.), 1E-12);
    assertEquals(20., AngularBinUtils.degreesFrom(10., 350.), 1E-12);
    assertEquals(-180., AngularBinUtils.degreesFrom(180., 0.), 1E-12);
    assertTrue(Double.isNaN(AngularBinUtils.degreesFrom(Double.NaN, 0.)));
  }

  @Test
  public void hamFraction_isNotClamped() {
    assertEquals(0.5, AngularBinUtils.hamFraction(2, 3), 1E-12);
    assertEquals(0., AngularBinUtils.hamFraction(0, 0), 1E-12);
    assertEquals(3., AngularBinUtils.hamFraction(6, 1), 1E-12);
  }

  @Test
  public void hamFraction_derivedByBinFromCounts() {
    assertEquals(AngularBinUtils.hamFraction(9, 2), new AngularBin(359., 1., 9, 2).getHamFrac(),
        0.);
    assertEquals(0.25, forward().getHamFrac(), 1E-12);
    // an explicit fraction read back from a cache is kept as given
    assertEquals(0.7, new AngularBin(10., 12., 1, 3, 0.7).getHamFrac(), 0.);
  }

  @Test
  public void diagnose_leadingTrailingAndInteriorRuns() {
    List<AngularBin> bins = Arrays.asList(backward(), backward(), forward(), forward(),
        backward(), forward(), backward());
    BackwardBinReport report = AngularBinUtils.diagnose(encounterOf(bins));
    assertEquals(7, report.getBinCount());
    assertEquals(2, report.getLeadingRun());
    assertEquals(1, report.getTrailingRun());
    assertEquals(Collections.singletonList(4), report.getInteriorAnomalies());
    assertEquals(Arrays.asList(0, 1, 4, 6), report.getBackwardIndices());
    assertEquals(4, report.getTotalBackward());
    assertFalse(report.isWellFormed());
  }

  @Test
  public void diagnose_allBackwardCountsOnlyLeading() {
    List<AngularBin> bins = Arrays.asList(backward(), backward(), backward());
    BackwardBinReport report = AngularBinUtils.diagnose(encounterOf(bins));
    assertEquals(3, report.getLeadingRun());
    assertEquals(0, report.getTrailingRun());
    assertTrue(report.getInteriorAnomalies().isEmpty());
    assertTrue(report.isWellFormed());
  }

  @Test
  public void diagnose_reportsExcessFraction() {
    List<AngularBin> bins = Arrays.asList(forward(), new AngularBin(10., 12., 9, 2), forward());
    BackwardBinReport report = AngularBinUtils.diagnose(encounterOf(bins));
    assertEquals(Collections.singletonList(1), report.getExcessFractionIndices());
    assertEquals(3., report.getMaxHamFrac(), 1E-12);
    assertEquals(0, report.getTotalBackward());
  }

  @Test
  public void interpolateLongitudes_acrossSeam() {
    double[] times = {0., 10., 20.};
    double[] lons = {350., 358., 6.};
    double[] result = AngularBinUtils.interpolateLongitudes(times, lons,
        new double[]{-1., 5., 15., 20.});
    assertTrue(Double.isNaN(result[0]));
    assertEquals(354., result[1], 1E-9);
    assertEquals(2., result[2], 1E-9);
    assertEquals(6., result[3], 1E-9);
  }

  @Test
  public void groupByAngularSeparation_splitsOnLimitAndNaN() {
    double[] lons = {0., 1., 2., 3., Double.NaN, 10., 10.5, 359.};
    double[] lats = new double[lons.length];
    List<int[]> ranges = AngularBinUtils.groupByAngularSeparation(lons, lats, 2.5);
    assertEquals(4, ranges.size());
    assertArrayEquals(new int[]{0, 3}, ranges.get(0));
    assertArrayEquals(new int[]{3, 4}, ranges.get(1));
    assertArrayEquals(new int[]{5, 7}, ranges.get(2));
    assertArrayEquals(new int[]{7, 8}, ranges.get(3));
  }

  @Test
  public void groupByAngularSeparation_seamIsShortDistance() {
    double[] lons = {359., 0., 1.};
    List<int[]> ranges = AngularBinUtils.groupByAngularSeparation(lons, new double[3], 2.5);
    assertEquals(1, ranges.size());
    assertArrayEquals(new int[]{0, 3}, ranges.get(0));
  }

  @Test
  public void countInRanges_closedOnBothEnds() {
    double[] events = {1., 2., 2., 5., 9.};
    int[] counts = AngularBinUtils.countInRanges(events, new double[]{2., 3., 9., 10.},
        new double[]{5., 4., 9., 12.});
    assertArrayEquals(new int[]{3, 0, 1, 0}, counts);
  }

  @Test
  public void buildBins_countsDetectionsAndSamples() {
    double[] times = {0., 60., 120., 180., 240., 300.};
    double[] lons = {0., 1., 2., 3., 4., 5.};
    double[] lats = new double[times.length];
    double[] detections = {0., 30., 125., 130., 250., 400.};
    List<AngularBin> bins = AngularBinUtils.buildBins(times, lons, lats, detections, 2.5);
    assertEquals(2, bins.size());

    AngularBin first = bins.get(0);
    assertEquals(0., first.getStartLon(), 1E-12);
    assertEquals(2., first.getEndLon(), 1E-12);
    // detections between the last sample of one bin and the first of the next are not counted
    assertEquals(2, first.getHamCount());
    assertEquals(3, first.getAllCount());
    assertEquals(0.5, first.getHamFrac(), 1E-12);

    AngularBin second = bins.get(1);
    assertEquals(3., second.getStartLon(), 1E-12);
    assertEquals(5., second.getEndLon(), 1E-12);
    assertEquals(1, second.getHamCount());
    assertEquals(3, second.getAllCount());
  }

  @Test(expected = IllegalArgumentException.class)
  public void buildBins_lengthMismatchThrows() {
    AngularBinUtils.buildBins(new double[2], new double[2], new double[3], new double[]{}, 1.);
  }

  @Test(expected = IllegalArgumentException.class)
  public void angularBin_negativeCountThrows() {
    new AngularBin(0., 1., -1, 3);
  }
}
