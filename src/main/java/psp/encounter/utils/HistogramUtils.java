package psp.encounter.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.log4j.Logger;
import psp.encounter.input.TimeSeries;
import psp.encounter.output.CountHistogram;
import psp.encounter.output.LogHistogram2D;
import psp.encounter.output.LogHistogram2D.Normalization;

/**
 * Static methods for binning time series into histograms at several time resolutions (tau
 * windows). Every tau window is computed independently of the others.
 */
public class HistogramUtils {

  private static final Logger logger = Logger.getLogger(HistogramUtils.class);

  /**
   * Compute one (time, log10 value) histogram per tau window.
   *
   * Values are log-transformed first; non-positive and non-finite values are counted per row as
   * invalid, and log values outside the settings' range are counted per row as out of range.
   * The time span from first to last sample is split into max(1, round(span / tau)) equal bins.
   * If there is no valid in-range sample at all, every cell is NaN and a warning is logged.
   *
   * @param series Variable to histogram; times must be non-decreasing
   * @param taus Time resolutions, computed in the given order
   * @param settings Value range, bin count, normalization and clip level
   * @return Histograms in the same order as taus
   */
  public static List<LogHistogram2D> logHistograms(TimeSeries series, List<TauWindow> taus,
      HistogramSettings settings) {
    TimeSeriesUtils.checkOrder(series.getTimes());
    double[] logValues = NumericUtils.log10Masked(series.getValues());
    List<LogHistogram2D> out = new ArrayList<>();
    for (TauWindow tau : taus) {
      out.add(logHistogram(series.getName(), series.getTimes(), logValues, tau, settings));
    }
    return out;
  }

  private static LogHistogram2D logHistogram(String name, double[] times, double[] logValues,
      TauWindow tau, HistogramSettings settings) {
    double[] timeEdges = timeEdges(times, tau);
    double[] valueEdges = settings.getValueEdges();
    int rows = Math.max(0, timeEdges.length - 1);
    int columns = settings.getValueBins();
    double[][] cells = new double[rows][columns];
    int[] invalid = new int[rows];
    int[] outOfRange = new int[rows];

    double logMin = settings.getLogMin();
    double logMax = settings.getLogMax();
    double valueWidth = (logMax - logMin) / columns;
    double[] rowTotals = new double[rows];
    double total = 0.;

    for (int i = 0; i < times.length; ++i) {
      int row = binIndex(timeEdges, times[i]);
      double logValue = logValues[i];
      if (Double.isNaN(logValue)) {
        ++invalid[row];
        continue;
      }
      if (logValue < logMin || logValue > logMax) {
        ++outOfRange[row];
        continue;
      }
      int column = Math.min(columns - 1, (int) ((logValue - logMin) / valueWidth));
      ++cells[row][column];
      ++rowTotals[row];
      ++total;
    }

    if (total == 0.) {
      logger.warn("No valid samples of " + name + " within [" + logMin + ", " + logMax
          + "] for tau " + tau + "; histogram is all NaN");
      for (double[] row : cells) {
        Arrays.fill(row, Double.NaN);
      }
      return new LogHistogram2D(name, tau, timeEdges, valueEdges, cells,
          settings.getNormalization(), invalid, outOfRange);
    }

    normalize(cells, rowTotals, total, timeEdges, valueWidth, settings.getNormalization());
    clip(cells, settings.getCMax());
    return new LogHistogram2D(name, tau, timeEdges, valueEdges, cells,
        settings.getNormalization(), invalid, outOfRange);
  }

  private static void normalize(double[][] cells, double[] rowTotals, double total,
      double[] timeEdges, double valueWidth, Normalization normalization) {
    switch (normalization) {
      case COUNT:
        break;
      case DENSITY_TOTAL:
        for (int row = 0; row < cells.length; ++row) {
          double timeWidth = timeEdges[row + 1] - timeEdges[row];
          double scale = total * timeWidth * valueWidth;
          for (int column = 0; column < cells[row].length; ++column) {
            cells[row][column] /= scale;
          }
        }
        break;
      case DENSITY_ROW:
        for (int row = 0; row < cells.length; ++row) {
          if (rowTotals[row] == 0.) {
            continue; // empty rows stay zero
          }
          double scale = rowTotals[row] * valueWidth;
          for (int column = 0; column < cells[row].length; ++column) {
            cells[row][column] /= scale;
          }
        }
        break;
      default:
        throw new IllegalArgumentException("Unknown normalization " + normalization);
    }
  }

  private static void clip(double[][] cells, double cMax) {
    if (Double.isNaN(cMax)) {
      return;
    }
    for (double[] row : cells) {
      for (int column = 0; column < row.length; ++column) {
        if (row[column] > cMax) {
          row[column] = Double.NaN;
        }
      }
    }
  }

  /**
   * Count detection events per time bin for each tau window. Bins cover the span from the first
   * to the last event, max(1, round(span / tau)) of them.
   *
   * @param name Name of the event stream, used in the histograms and warnings
   * @param eventTimes Non-decreasing event times, epoch seconds
   * @param taus Time resolutions, computed in the given order
   * @return Count histograms in the same order as taus; with no events each has no bins
   */
  public static List<CountHistogram> countHistograms(String name, double[] eventTimes,
      List<TauWindow> taus) {
    TimeSeriesUtils.checkOrder(eventTimes);
    if (eventTimes.length == 0) {
      logger.warn("No events in " + name + " to count");
    }
    List<CountHistogram> out = new ArrayList<>();
    for (TauWindow tau : taus) {
      double[] edges = timeEdges(eventTimes, tau);
      double[] counts = new double[Math.max(0, edges.length - 1)];
      for (double time : eventTimes) {
        ++counts[binIndex(edges, time)];
      }
      out.add(new CountHistogram(name, tau, edges, counts));
    }
    return out;
  }

  /**
   * Equal-width time bin edges spanning the first to last time
   *
   * @param times Non-decreasing times
   * @param tau Target bin width
   * @return Strictly increasing edges; empty when there are no times
   * @throws IllegalArgumentException if the span holds too many tau widths to fit an array
   */
  static double[] timeEdges(double[] times, TauWindow tau) {
    if (times.length == 0) {
      return new double[]{};
    }
    double start = times[0];
    double end = times[times.length - 1];
    double span = end - start;
    if (span <= 0.) {
      // a single instant still gets one bin of the tau width
      return new double[]{start, start + tau.getSeconds()};
    }
    long rounded = Math.max(1, Math.round(span / tau.getSeconds()));
    if (rounded >= Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Span of " + span + " s at tau " + tau + " needs "
          + rounded + " time bins, too many to allocate");
    }
    int bins = (int) rounded;
    double[] edges = new double[bins + 1];
    double width = span / bins;
    for (int i = 0; i < bins; ++i) {
      edges[i] = start + i * width;
    }
    edges[bins] = end;
    return edges;
  }

  /**
   * Index of the bin a time falls in; the last edge belongs to the last bin
   */
  private static int binIndex(double[] edges, double time) {
    int bins = edges.length - 1;
    int idx = TimeSeriesUtils.upperBound(edges, time) - 1;
    return Math.max(0, Math.min(bins - 1, idx));
  }
}
