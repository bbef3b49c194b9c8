package psp.encounter.experiment;

import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import psp.encounter.input.DataStore;
import psp.encounter.utils.NumericUtils;
import psp.encounter.utils.TimeSeriesUtils;

/**
 * This class defines template patterns for each derived-variable calculation (we use the term
 * "experiment" in the code, as each one takes a set of named input variables and produces a
 * family of derived results). Concrete extensions of this class define a backend for the
 * calculations; the results are then handed to a rendering layer as plottable series.
 *
 * Experiments work in a manner similar to builder patterns: experiments that rely on variables
 * to determine how their calculations are run, such as a target time base or a perihelion time,
 * have those set first, and then "runExperimentOnData" is called with a given DataStore
 * containing the relevant variables.
 *
 * Each derived quantity is computed independently. If a variable a quantity depends on is
 * missing, or an index into its data does not fit, that quantity is skipped with a warning
 * (see {@link #getWarnings()}) and the remaining quantities are still computed. Typed results
 * are available from the concrete class's getters once the experiment has been run; they are
 * empty (or NaN) for skipped quantities.
 *
 * Experiments are not thread-safe; use one instance per thread.
 */
public abstract class Experiment {

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.###");
        NumericUtils.setInfinityPrintable(format);
        return format;
      });

  private static final Logger logger = Logger.getLogger(Experiment.class);

  private final EventListenerList eventHelper;
  double start;
  double end;
  List<XYSeriesCollection> xySeriesData;
  /**
   * Names of the input variables actually used in the last run, in the order they were read
   */
  List<String> dataNames;
  private List<String> warnings;
  private String status;

  /**
   * Initialize all fields common to experiment objects
   */
  Experiment() {
    start = Double.NaN;
    end = Double.NaN;
    dataNames = new ArrayList<>();
    xySeriesData = new ArrayList<>();
    warnings = new ArrayList<>();
    status = "";
    eventHelper = new EventListenerList();
  }

  /**
   * Convert a series into plottable form. The x values are epoch milliseconds, matching the
   * date axes of the rendering layer; points with a non-finite value are left out.
   *
   * @param name Name of the plotted series
   * @param times Times in epoch seconds
   * @param values Values, same length as times
   * @return New XYSeries holding the finite points
   */
  static XYSeries toXYSeries(String name, double[] times, double[] values) {
    XYSeries series = new XYSeries(name, false);
    for (int i = 0; i < times.length; ++i) {
      if (Double.isFinite(values[i]) && Double.isFinite(times[i])) {
        series.add(times[i] * 1000., values[i]);
      }
    }
    return series;
  }

  /**
   * Stub method to be overridden for other methods to produce String data for experiment result.
   * Includes formatting of numeric data. This may not be used for all experiments.
   * @return String containing human-readable data
   */
  String[] getDataStrings() {
    return new String[]{""};
  }

  /**
   * Stub method to be overridden for other methods to produce String data for plot data.
   * Includes formatting of numeric data.
   * @return String containing human-readable data
   */
  public String[] getInsetStrings() {
    return getDataStrings();
  }

  /**
   * Produce the human-readable summary of the last run, one line group per result
   * @return String containing human-readable data
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    String[] strings = getDataStrings();
    for (int i = 0; i < strings.length; ++i) {
      String insetString = strings[i];
      sb.append(insetString);
      // add space between inset strings
      if (i + 1 < strings.length) {
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  /**
   * Method to get a formatted string with start and end dates of data, to be used in
   * producing reports of the given data. This is empty if no time range was set.
   * @return String of formatted start and end, if they have been set
   */
  public String getFormattedDateRange() {
    StringBuilder sb = new StringBuilder();
    if (!Double.isNaN(start) && !Double.isNaN(end)) {
      sb.append("Data start time:\n");
      sb.append(TimeSeriesUtils.formatEpochSeconds(start));
      sb.append('\n');
      sb.append("Data end time:\n");
      sb.append(TimeSeriesUtils.formatEpochSeconds(end));
      sb.append('\n');
    }
    return sb.toString();
  }

  /**
   * Add an object to the list of objects to be notified when the experiment's
   * status changes
   *
   * @param listener ChangeListener to be notified
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  /**
   * Abstract function that runs the calculations specific to a given procedure,
   * overwritten by concrete experiments with specific operations.
   * Information on what an experiment's implementation does is in its documentation intro section.
   *
   * @param dataStore Object containing the named input variables to process
   */
  protected abstract void backend(final DataStore dataStore);

  /**
   * Update processing status and notify listeners of change
   *
   * @param newStatus Status change message to notify listeners of
   */
  void fireStateChange(String newStatus) {
    status = newStatus;
    ChangeListener[] listeners = eventHelper.getListeners(ChangeListener.class);
    if (listeners != null && listeners.length > 0) {
      ChangeEvent event = new ChangeEvent(this);
      for (ChangeListener listener : listeners) {
        listener.stateChanged(event);
      }
    }
  }

  /**
   * Record that a derived quantity was skipped, and log it
   *
   * @param quantity Name of the quantity that could not be computed
   * @param cause Reason it was skipped
   */
  void skipQuantity(String quantity, Exception cause) {
    String message = quantity + " skipped: " + cause.getMessage();
    logger.warn(message);
    warnings.add(message);
  }

  /**
   * Record a recoverable problem with the run that does not skip a quantity
   *
   * @param message Description of the problem
   */
  void addWarning(String message) {
    logger.warn(message);
    warnings.add(message);
  }

  /**
   * Widen the recorded data time range to include a series' span
   *
   * @param times Sample times of an input used by the run
   */
  void includeTimeRange(double[] times) {
    if (times.length == 0) {
      return;
    }
    double first = times[0];
    double last = times[times.length - 1];
    start = Double.isNaN(start) ? first : Math.min(start, first);
    end = Double.isNaN(end) ? last : Math.max(end, last);
  }

  /**
   * Return the plottable data for this experiment, populated in the backend
   * function of an implementing class.
   * The results are returned as a list, where each list is the data to be
   * placed into a separate chart.
   *
   * @return Plottable data
   */
  public List<XYSeriesCollection> getData() {
    return xySeriesData;
  }

  /**
   * Get the end time of the data sent into this experiment
   *
   * @return End time, in epoch seconds, NaN if no data was used
   */
  public double getEnd() {
    return end;
  }

  /**
   * Get the names of data sent into program (set during backend calculations),
   * mainly used in report metadata generation
   *
   * @return Names of the variables the last run read
   */
  public List<String> getInputNames() {
    return dataNames;
  }

  /**
   * Get the start time of the data sent into this experiment
   *
   * @return Start time, in epoch seconds, NaN if no data was used
   */
  public double getStart() {
    return start;
  }

  /**
   * Return newest status message produced by this program
   *
   * @return String representing status of program
   */
  public String getStatus() {
    return status;
  }

  /**
   * Get the warnings raised during the last run, including every skipped quantity
   *
   * @return Warning messages in the order they were raised
   */
  public List<String> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }

  /**
   * Used to check if the current input has enough data to do any of the calculations.
   *
   * @param dataStore DataStore to be fed into experiment calculation
   * @return True if there is enough data to be run
   */
  public abstract boolean hasEnoughData(final DataStore dataStore);

  /**
   * Driver to do data processing on inputted data (calls a concrete backend
   * method which is different for each type of experiment).
   * Results from a previous run are cleared first. If the store lacks the data needed for any
   * of the calculations, a warning is recorded and no results are produced.
   *
   * @param dataStore Named variables to be processed
   */
  public void runExperimentOnData(final DataStore dataStore) {

    fireStateChange("Beginning loading data...");

    dataNames = new ArrayList<>();
    xySeriesData = new ArrayList<>();
    warnings = new ArrayList<>();
    start = Double.NaN;
    end = Double.NaN;

    if (!hasEnoughData(dataStore)) {
      addWarning(getClass().getSimpleName() + " has no usable inputs among "
          + dataStore.getNames());
      fireStateChange("Not enough data to run");
      return;
    }

    fireStateChange("Beginning calculations...");

    backend(dataStore);

    fireStateChange("Calculations done!");
  }
}
