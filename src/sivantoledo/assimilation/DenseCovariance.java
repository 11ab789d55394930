package sivantoledo.assimilation;

import java.util.Arrays;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * An explicit, dense covariance matrix. Only suitable for small problems.
 */
public class DenseCovariance implements CovarianceOperator {

  private final static Logger log = LogManager.getLogger();

  private final RealMatrix          C;
  private final RealMatrix          L;      // lower Cholesky factor, C = L*L'
  private final DecompositionSolver solver;
  private final RandomGenerator     random;

  public int dimension() { return C.getColumnDimension(); }

  public DenseCovariance(RealMatrix C) {
    this(C, new Well19937c());
  }

  public DenseCovariance(RealMatrix C, RandomGenerator random) {
    if (!C.isSquare()) throw new DimensionMismatchException(C.getColumnDimension(), C.getRowDimension());
    this.C      = C.copy();
    this.random = random;

    CholeskyDecomposition chol;
    try {
      chol = new CholeskyDecomposition(this.C);
    } catch (NonPositiveDefiniteMatrixException npdme) {
      /*
       * Shift the spectrum by twice the most negative eigenvalue and try again.
       * If that fails as well, the exception propagates.
       */
      double[] eigenvalues = new EigenDecomposition(this.C).getRealEigenvalues();
      double mev = Arrays.stream(eigenvalues).min().getAsDouble();
      log.warn("covariance matrix is not symmetric positive definite (min eigenvalue {}), perturbing", mev);
      RealMatrix p = this.C.add(MatrixUtils.createRealIdentityMatrix(eigenvalues.length).scalarMultiply(2*Math.abs(mev)));
      chol = new CholeskyDecomposition(p);
    }
    L      = chol.getL();
    solver = chol.getSolver();
  }

  @Override
  public RealMatrix randomMultivariateNormal(int N) {
    if (N < 1) throw new NotStrictlyPositiveException(N);
    int n = dimension();
    RealMatrix Z = MatrixUtils.createRealMatrix(n, N);
    for (int i=0; i<n; i++)
      for (int j=0; j<N; j++) Z.setEntry(i, j, random.nextGaussian());
    return L.multiply(Z);
  }

  @Override
  public RealVector solve(RealVector b) {
    return solver.solve(b);
  }

  @Override
  public RealMatrix solve(RealMatrix B) {
    return solver.solve(B);
  }

  @Override
  public void addTo(RealMatrix x) {
    if (x.getRowDimension() != dimension()) throw new DimensionMismatchException(x.getRowDimension(), dimension());
    for (int i=0; i<dimension(); i++)
      for (int j=0; j<dimension(); j++) x.addToEntry(i, j, C.getEntry(i, j));
  }

  /*
   * Tapering scales the variances by 1/w_i, so the correlation structure
   * among the retained elements is preserved: C_ij / sqrt(w_i*w_j).
   */
  @Override
  public DenseCovariance localize(int[] indices, double[] taperWeights) {
    if (taperWeights != null && taperWeights.length != indices.length)
      throw new DimensionMismatchException(taperWeights.length, indices.length);
    RealMatrix S = C.getSubMatrix(indices, indices);
    if (taperWeights != null) {
      for (int i=0; i<indices.length; i++)
        for (int j=0; j<indices.length; j++)
          S.setEntry(i, j, S.getEntry(i, j) / Math.sqrt(taperWeights[i]*taperWeights[j]));
    }
    return new DenseCovariance(S, random);
  }

  @Override
  public RealMatrix toMatrix() {
    return C.copy();
  }

  @Override
  public String toString() { return "C="+Ensemble.toString(C.getData(),"%.3e"); };

}
