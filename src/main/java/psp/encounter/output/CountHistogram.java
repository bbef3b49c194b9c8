package psp.encounter.output;

import psp.encounter.utils.TauWindow;

/**
 * Number of detection events falling in each time bin at one tau resolution
 */
public class CountHistogram {

  private final String name;
  private final TauWindow tau;
  private final double[] edges;
  private final double[] counts;

  public CountHistogram(String name, TauWindow tau, double[] edges, double[] counts) {
    if (counts.length != Math.max(0, edges.length - 1)) {
      throw new IllegalArgumentException("Count histogram " + name + " has " + edges.length
          + " edges but " + counts.length + " counts");
    }
    this.name = name;
    this.tau = tau;
    this.edges = edges;
    this.counts = counts;
  }

  public String getName() {
    return name;
  }

  public TauWindow getTau() {
    return tau;
  }

  public double[] getEdges() {
    return edges;
  }

  public double[] getCounts() {
    return counts;
  }

  /**
   * @return Center time of each bin, epoch seconds
   */
  public double[] getCenters() {
    double[] out = new double[counts.length];
    for (int i = 0; i < out.length; ++i) {
      out[i] = (edges[i] + edges[i + 1]) / 2.;
    }
    return out;
  }

  /**
   * @return Sum of all bin counts
   */
  public double getTotal() {
    double total = 0.;
    for (double count : counts) {
      total += count;
    }
    return total;
  }
}
