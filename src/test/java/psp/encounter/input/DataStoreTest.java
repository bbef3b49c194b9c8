package psp.encounter.input;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import org.junit.Test;

public class DataStoreTest {

  @Test
  public void getSeries_missingThrowsWithName() {
    DataStore dataStore = new DataStore();
    try {
      dataStore.getSeries("wavePower_LH");
    } catch (MissingInputException e) {
      assertEquals("wavePower_LH", e.getVariableName());
      assertEquals("Variable not found: wavePower_LH", e.getMessage());
      return;
    }
    throw new AssertionError("Expected MissingInputException");
  }

  @Test
  public void setters_keyByNameAndKeepShapesApart() throws MissingInputException {
    DataStore dataStore = new DataStore();
    dataStore.setSeries(new TimeSeries("spi_density", new double[]{1.}, new double[]{5.}));
    dataStore.setVectors(new VectorSeries("ham_core_u", new double[]{1.},
        new double[][]{{1., 2., 3.}}));
    dataStore.setCube(new CubeSeries("flux", new double[]{1.}, new double[1][2][3]));

    assertTrue(dataStore.hasSeries("spi_density"));
    assertFalse(dataStore.hasSeries("ham_core_u"));
    assertTrue(dataStore.hasVectors("ham_core_u"));
    assertTrue(dataStore.hasCube("flux"));
    assertEquals(Arrays.asList("flux", "ham_core_u", "spi_density"),
        Arrays.asList(dataStore.getNames().toArray(new String[0])));
    assertEquals(5., dataStore.getSeries("spi_density").getValues()[0], 0.);
  }

  @Test
  public void fromEncounterSources_fillsTrajectoryAndDetections() throws MissingInputException {
    TrajectorySource trajectories = (start, end) -> new Trajectory(new double[]{start, end},
        new double[]{10., 20.}, new double[]{1., 2.});
    DetectionSource detections = (start, end) -> new double[]{start + 1., start + 2.};
    DataStore dataStore = DataStore.fromEncounterSources(trajectories, detections, 100., 200.);

    assertArrayEquals(new double[]{10., 20.},
        dataStore.getSeries(DataStore.TRAJECTORY_LON).getValues(), 0.);
    assertArrayEquals(new double[]{1., 2.},
        dataStore.getSeries(DataStore.TRAJECTORY_LAT).getValues(), 0.);
    TimeSeries found = dataStore.getSeries(DataStore.DETECTIONS);
    assertArrayEquals(new double[]{101., 102.}, found.getTimes(), 0.);
    assertArrayEquals(new double[]{1., 1.}, found.getValues(), 0.);
  }

  @Test
  public void vectorComponent_namedByIndex() {
    VectorSeries velocity = new VectorSeries("ham_core_u", new double[]{0., 1.},
        new double[][]{{1., 2., 3.}, {4., 5., 6.}});
    assertEquals(3, velocity.getComponentCount());
    TimeSeries y = velocity.getComponent(1);
    assertEquals("ham_core_u[1]", y.getName());
    assertArrayEquals(new double[]{2., 5.}, y.getValues(), 0.);
  }

  @Test
  public void cubeSlice_badEnergyIndexThrows() {
    CubeSeries cube = new CubeSeries("flux", new double[]{0.}, new double[1][4][3]);
    assertEquals(3, cube.getEnergyCount());
    try {
      cube.getEnergySlice(3);
    } catch (ShapeMismatchException e) {
      return;
    }
    throw new AssertionError("Expected ShapeMismatchException");
  }

  @Test
  public void timeSeries_emptyHasNaNSpan() {
    TimeSeries empty = new TimeSeries("empty", new double[]{}, new double[]{});
    assertTrue(empty.isEmpty());
    assertTrue(Double.isNaN(empty.getStartTime()));
    assertTrue(Double.isNaN(empty.getEndTime()));
  }
}
