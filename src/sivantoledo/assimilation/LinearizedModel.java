package sivantoledo.assimilation;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * A forward model together with its linearization M around a trajectory.
 *
 * The two products are defined so that adjoint(t, tangentLinear(t, P)) = M*P*M'.
 */
public interface LinearizedModel<T> extends ForwardModel<T> {

  /**
   * @return M*x
   */
  RealMatrix tangentLinear(T trajectory, RealMatrix x);

  /**
   * @return x*M'
   */
  RealMatrix adjoint(T trajectory, RealMatrix x);
}
