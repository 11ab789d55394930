package sivantoledo.assimilation.localization;

import java.util.Arrays;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NullArgumentException;

import sivantoledo.assimilation.CovarianceOperator;
import sivantoledo.assimilation.ObservationOperator;

/**
 * Domain-based localization of the analysis update.
 *
 * The state space is split into local domains by a partitioning, the analysis
 * is computed for each domain independently using only the observations
 * within the support range of the taper function, and those observations are
 * down-weighted by their distance from the domain.
 *
 * The taper function may be replaced between analysis steps.
 */
public class DomainLocalization {

  private final StateSpacePartitioning partitioning;
  private TaperFunction                taper;

  public DomainLocalization(StateSpacePartitioning partitioning, TaperFunction taper) {
    if (partitioning == null) throw new NullArgumentException();
    this.partitioning = partitioning;
    setTaper(taper);
  }

  public StateSpacePartitioning partitioning() { return partitioning; }

  public TaperFunction taper() { return taper; }

  public void setTaper(TaperFunction taper) {
    if (taper == null) throw new NullArgumentException();
    this.taper = taper;
  }

  public LocalObservations getLocalObservations(int domain, Object observationCoordinates) {
    return partitioning.getLocalObservations(domain, observationCoordinates, taper);
  }

  /**
   * Restricts the observation operator to the selected observations.
   *
   * @return the restricted operator, or null if no observations are selected
   */
  public ObservationOperator getLocalH(ObservationOperator H, int[] indices) {
    if (indices.length == 0) return null;
    ObservationOperator Hl = H.localize(indices);
    if (Hl.observationCount() != indices.length) throw new DimensionMismatchException(Hl.observationCount(), indices.length);
    if (Hl.stateDimension() != H.stateDimension()) throw new DimensionMismatchException(Hl.stateDimension(), H.stateDimension());
    return Hl;
  }

  /**
   * Restricts the observation error covariance to the selected observations
   * and down-weights them by the taper weights of their distances.
   */
  public CovarianceOperator getLocalR(CovarianceOperator R, int[] indices, double[] distances) {
    if (indices.length != distances.length) throw new DimensionMismatchException(distances.length, indices.length);
    double[] ones = new double[ distances.length ];
    Arrays.fill(ones, 1.0);
    return R.localize(indices, taper.taper(ones, distances));
  }
}
