package sivantoledo.assimilation.localization;

import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 * Observations selected for the analysis of one domain: indices into the
 * global observation vector and the distance of each from the domain.
 */
public final class LocalObservations {

  public final int[]    indices;
  public final double[] distances;

  public LocalObservations(int[] indices, double[] distances) {
    if (indices.length != distances.length) throw new DimensionMismatchException(distances.length, indices.length);
    this.indices   = indices;
    this.distances = distances;
  }

  public int count() { return indices.length; }

  public boolean isEmpty() { return indices.length == 0; }
}
