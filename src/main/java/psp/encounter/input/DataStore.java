package psp.encounter.input;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.apache.log4j.Logger;

/**
 * Holds the named input variables that an experiment runs on. Scalar series, vector series and
 * cube series are each kept in their own map; a name is looked up only in the map matching the
 * requested shape.
 *
 * A data store also doubles as the in-memory {@link VariableSource}, so experiments can be fed
 * either from a real loader (by copying its output into a store) or directly from arrays in
 * tests.
 */
public class DataStore implements VariableSource {

  /**
   * Carrington longitude of the spacecraft, values in degrees
   */
  public static final String TRAJECTORY_LON = "trajectory_lon";

  /**
   * Carrington latitude of the spacecraft, values in degrees
   */
  public static final String TRAJECTORY_LAT = "trajectory_lat";

  /**
   * Detection-event stream; each time is one detection, each value is 1 if the detection carries
   * the original ("og") flag and 0 otherwise
   */
  public static final String DETECTIONS = "ham_detections";

  /**
   * Timestamps of the measurement cadence that detections are compared against when forming
   * occurrence fractions (values are unused)
   */
  public static final String REFERENCE_TIMES = "reference_times";

  private static final Logger logger = Logger.getLogger(DataStore.class);

  private final Map<String, TimeSeries> series;
  private final Map<String, VectorSeries> vectors;
  private final Map<String, CubeSeries> cubes;

  public DataStore() {
    series = new LinkedHashMap<>();
    vectors = new LinkedHashMap<>();
    cubes = new LinkedHashMap<>();
  }

  /**
   * Populate a data store with the trajectory and detections covering an encounter window, as
   * supplied by the upstream collaborators.
   *
   * @param trajectorySource Supplier of Carrington position samples
   * @param detectionSource Supplier of detection timestamps
   * @param start Window start (epoch seconds)
   * @param end Window end (epoch seconds)
   * @return Data store with {@link #TRAJECTORY_LON}, {@link #TRAJECTORY_LAT} and
   * {@link #DETECTIONS} set
   */
  public static DataStore fromEncounterSources(TrajectorySource trajectorySource,
      DetectionSource detectionSource, double start, double end) {
    DataStore dataStore = new DataStore();
    Trajectory trajectory = trajectorySource.getTrajectory(start, end);
    dataStore.setSeries(
        new TimeSeries(TRAJECTORY_LON, trajectory.getTimes(), trajectory.getLongitudes()));
    dataStore.setSeries(
        new TimeSeries(TRAJECTORY_LAT, trajectory.getTimes(), trajectory.getLatitudes()));

    double[] detections = detectionSource.getDetectionTimes(start, end);
    double[] flags = new double[detections.length];
    Arrays.fill(flags, 1.);
    dataStore.setSeries(new TimeSeries(DETECTIONS, detections, flags));
    logger.info("Loaded " + trajectory.size() + " trajectory samples and " + detections.length
        + " detections for window");
    return dataStore;
  }

  /**
   * Add a scalar series to the store, replacing any series of the same name
   *
   * @param timeSeries Series to add; its name is used as key
   */
  public void setSeries(TimeSeries timeSeries) {
    series.put(timeSeries.getName(), timeSeries);
  }

  public void setVectors(VectorSeries vectorSeries) {
    vectors.put(vectorSeries.getName(), vectorSeries);
  }

  public void setCube(CubeSeries cubeSeries) {
    cubes.put(cubeSeries.getName(), cubeSeries);
  }

  @Override
  public TimeSeries getSeries(String name) throws MissingInputException {
    TimeSeries found = series.get(name);
    if (found == null) {
      throw new MissingInputException(name);
    }
    return found;
  }

  @Override
  public boolean hasSeries(String name) {
    return series.containsKey(name);
  }

  /**
   * Get a vector series by name
   *
   * @param name Variable name
   * @return Vector series with that name
   * @throws MissingInputException if the store has no vector series with that name
   */
  public VectorSeries getVectors(String name) throws MissingInputException {
    VectorSeries found = vectors.get(name);
    if (found == null) {
      throw new MissingInputException(name);
    }
    return found;
  }

  public boolean hasVectors(String name) {
    return vectors.containsKey(name);
  }

  /**
   * Get a cube series by name
   *
   * @param name Variable name
   * @return Cube series with that name
   * @throws MissingInputException if the store has no cube series with that name
   */
  public CubeSeries getCube(String name) throws MissingInputException {
    CubeSeries found = cubes.get(name);
    if (found == null) {
      throw new MissingInputException(name);
    }
    return found;
  }

  public boolean hasCube(String name) {
    return cubes.containsKey(name);
  }

  /**
   * Get every variable name held by this store, regardless of shape
   *
   * @return Sorted set of names
   */
  public Set<String> getNames() {
    Set<String> names = new TreeSet<>(series.keySet());
    names.addAll(vectors.keySet());
    names.addAll(cubes.keySet());
    return names;
  }
}
