package sivantoledo.assimilation;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Receives filter and smoother results.
 */
@FunctionalInterface
public interface ResultCallback {

  /**
   * @param state the state estimate (the ensemble mean for ensemble filters)
   * @param covarianceOrEnsemble the error covariance, or the ensemble itself
   * @param time the time the estimate refers to
   */
  void onResult(RealVector state, RealMatrix covarianceOrEnsemble, double time);
}
