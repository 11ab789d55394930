package sivantoledo.assimilation.kalman;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * A state vector together with its error covariance matrix.
 */
public final class StateEstimate {

  public final RealVector state;
  public final RealMatrix covariance;
  public final double     time;       // NaN if not known

  public StateEstimate(RealVector state, RealMatrix covariance, double time) {
    this.state      = state;
    this.covariance = covariance;
    this.time       = time;
  }

  @Override
  public String toString() { return String.format("StateEstimate(t=%.3f, x=%s)", time, state); }
}
