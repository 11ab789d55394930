package sivantoledo.assimilation;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * A dynamical model that moves states forward in time.
 *
 * @param <T> type of the trajectory data the model records for its tangent linear and adjoint
 */
@FunctionalInterface
public interface ForwardModel<T> {

  /**
   * Advances every column of states from time t to time t+dt, in place.
   *
   * @param states n by N matrix; a single state is passed as an n by 1 matrix
   * @param dt time increment
   * @return trajectory data for the tangent linear and the adjoint, may be null
   */
  T advance(RealMatrix states, double dt);
}
