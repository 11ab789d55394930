package sivantoledo.assimilation;

import org.apache.commons.math3.exception.MathUnsupportedOperationException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Representation of a covariance matrix C.
 *
 * Only sampling and solving are mandatory. The remaining operations are
 * optional; a representation that cannot provide one of them throws
 * MathUnsupportedOperationException, which callers should read as
 * "this representation does not support this mode" and not as a failure.
 *
 * @author Sivan Toledo
 */

public interface CovarianceOperator {
  /**
   * Returns the dimension of this square matrix.
   *
   * @return the dimension of C
   */
  public int dimension();

  /**
   * Draws N independent samples from the zero-mean multivariate normal
   * distribution with covariance C.
   *
   * @param N number of samples
   * @return a dimension() by N matrix, one sample per column
   */
  public RealMatrix randomMultivariateNormal(int N);

  /**
   * Solves C*x = b.
   *
   * @param b right-hand side
   * @return inv(C)*b
   */
  public RealVector solve(RealVector b);

  /**
   * Solves C*X = B.
   *
   * @param B right-hand sides, one per column
   * @return inv(C)*B
   */
  public RealMatrix solve(RealMatrix B);

  /**
   * Adds C to an explicit matrix in place, x = x + C.
   *
   * @param x a dimension() by dimension() matrix
   */
  public default void addTo(RealMatrix x) {
    throw new MathUnsupportedOperationException();
  }

  /**
   * Restricts C to a subset of its rows/columns and down-weights the retained
   * variances by tapering weights, so that the variance of element i becomes
   * C(i,i)/w(i). Weights may be null, meaning no tapering.
   *
   * @param indices retained indices, in the order of the result
   * @param taperWeights weights in (0,1], one per index, or null
   * @return covariance of dimension indices.length
   */
  public default CovarianceOperator localize(int[] indices, double[] taperWeights) {
    throw new MathUnsupportedOperationException();
  }

  /**
   * Returns an explicit representation of C.
   *
   * @return an explicit representation of C.
   */
  public default RealMatrix toMatrix() {
    throw new MathUnsupportedOperationException();
  }
}
