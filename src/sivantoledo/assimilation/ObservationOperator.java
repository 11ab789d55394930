package sivantoledo.assimilation;

import org.apache.commons.math3.exception.MathUnsupportedOperationException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Mapping from the state space to the observation space, y = H(x).
 *
 * The operator has shape (k, n) where k is the number of observations
 * and n the dimension of the state vector.
 */
public interface ObservationOperator {

  /**
   * @return k, the number of observations
   */
  public int observationCount();

  /**
   * @return n, the dimension of the state vector
   */
  public int stateDimension();

  public RealVector apply(RealVector x);

  /**
   * Applies the operator to every column of X.
   *
   * @param X n by N matrix, for example an ensemble
   * @return k by N matrix
   */
  public RealMatrix apply(RealMatrix X);

  /**
   * Restricts the operator to a subset of the observations. The result has
   * shape (indices.length, n) and the same representation as this operator.
   *
   * @param indices indices into the observation vector
   * @return the restricted operator
   */
  public ObservationOperator localize(int[] indices);

  /**
   * Returns the explicit k by n matrix of a linear operator.
   */
  public default RealMatrix toMatrix() {
    throw new MathUnsupportedOperationException();
  }
}
