package sivantoledo.assimilation.ensemble;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import sivantoledo.assimilation.CovarianceOperator;
import sivantoledo.assimilation.Ensemble;
import sivantoledo.assimilation.ObservationOperator;
import sivantoledo.assimilation.localization.DomainLocalization;

/**
 * A variant of the Ensemble Kalman Filter/Smoother.
 *
 * Variants compute the analysis update as a transform X5 applied to the
 * ensemble from the right. The driver (EnsembleKalmanSmoother) decides where
 * the transform is applied: to the whole ensemble for global analysis, or to
 * the local ensemble of every domain for localized analysis.
 */
public interface EnsembleTransformVariant {

  /**
   * Called by the driver before the first analysis, and again if the state
   * dimension changes.
   *
   * @param n state dimension
   * @param N ensemble size
   */
  public default void init(int n, int N) {
  }

  /**
   * Applies covariance inflation to the forecast ensemble at the beginning
   * of an analysis step. The default scales the anomalies in place.
   */
  public default void applyCovarianceInflation(RealMatrix ensemble, double factor) {
    Ensemble.inflate(ensemble, factor);
  }

  /**
   * Computes whatever the transform needs from the global ensemble, once per
   * assimilation, so that the per-domain loop does not repeat the work.
   *
   * @param globalEnsemble n by N ensemble
   * @param H global observation operator
   * @return data with one row per observation, or null
   */
  public default GlobalEnsembleData processGlobalEnsemble(RealMatrix globalEnsemble, ObservationOperator H) {
    return null;
  }

  /**
   * Computes the ensemble transform of one (local or global) analysis.
   *
   * @param globalEnsemble the n by N global ensemble
   * @param localEnsemble the ensemble being updated; the global one for global analysis
   * @param z observations
   * @param H observation operator for the observations in z
   * @param R observation error covariance for the observations in z
   * @param data result of processGlobalEnsemble() restricted to the observations in z, or null
   * @param inflation covariance inflation factor, 1 for none
   * @param localization the localization in use, or null for global analysis
   * @return the filter transform and, if different, the smoother transform
   */
  public EnsembleTransform ensembleTransform(RealMatrix globalEnsemble, RealMatrix localEnsemble,
                                             RealVector z, ObservationOperator H, CovarianceOperator R,
                                             GlobalEnsembleData data, double inflation,
                                             DomainLocalization localization);
}
