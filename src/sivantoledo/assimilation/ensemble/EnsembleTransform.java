package sivantoledo.assimilation.ensemble;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * The result of one analysis: the N by N matrix X5 such that the analysis
 * ensemble is the forecast ensemble times X5, and optionally a different
 * transform for the retroactive smoother updates.
 */
public final class EnsembleTransform {

  public final RealMatrix filter;
  public final RealMatrix smoother; // null if the same as filter

  public EnsembleTransform(RealMatrix filter, RealMatrix smoother) {
    this.filter   = filter;
    this.smoother = smoother;
  }

  /**
   * @return the transform to apply to past ensembles
   */
  public RealMatrix forSmoother() {
    return smoother != null ? smoother : filter;
  }
}
