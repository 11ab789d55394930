package sivantoledo.assimilation;

import java.util.Arrays;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

public class DiagonalCovariance implements CovarianceOperator {

  public static enum Representation {
    DIAGONAL_VARIANCES,
    DIAGONAL_STANDARD_DEVIATIONS,
    DIAGONAL_INVERSE_VARIANCES,
  }

  /*
   * We keep both the variances and their reciprocals; the inverse is the
   * original when the covariance was built from inverse variances, which
   * avoids huge entries for nearly-unobserved elements.
   */
  private final double[]        variances;
  private final double[]        inverseVariances;
  private final RandomGenerator random;

  public int dimension() { return variances.length; }

  public DiagonalCovariance(double[] variances) {
    this(variances, Representation.DIAGONAL_VARIANCES);
  }

  public DiagonalCovariance(double[] v, DiagonalCovariance.Representation rep) {
    this(v, rep, new Well19937c());
  }

  public DiagonalCovariance(RealVector v, DiagonalCovariance.Representation rep, RandomGenerator random) {
    this(v.toArray(), rep, random);
  }

  public DiagonalCovariance(double[] v, DiagonalCovariance.Representation rep, RandomGenerator random) {
    variances        = new double[v.length];
    inverseVariances = new double[v.length];
    for (int i=0; i<v.length; i++) {
      if (!(v[i] > 0)) throw new NotStrictlyPositiveException(v[i]);
      switch (rep) {
      case DIAGONAL_VARIANCES:
        variances[i]        = v[i];
        inverseVariances[i] = 1.0/v[i];
        break;
      case DIAGONAL_STANDARD_DEVIATIONS:
        variances[i]        = v[i]*v[i];
        inverseVariances[i] = 1.0/variances[i];
        break;
      case DIAGONAL_INVERSE_VARIANCES:
        inverseVariances[i] = v[i];
        variances[i]        = 1.0/v[i];
        break;
      }
    }
    this.random = random;
  }

  public double[] variances() { return variances.clone(); }

  @Override
  public RealMatrix randomMultivariateNormal(int N) {
    if (N < 1) throw new NotStrictlyPositiveException(N);
    RealMatrix X = MatrixUtils.createRealMatrix(variances.length, N);
    for (int i=0; i<variances.length; i++) {
      double sd = Math.sqrt(variances[i]);
      for (int j=0; j<N; j++) X.setEntry(i, j, sd*random.nextGaussian());
    }
    return X;
  }

  @Override
  public RealVector solve(RealVector b) {
    if (b.getDimension() != variances.length) throw new DimensionMismatchException(b.getDimension(), variances.length);
    return MatrixUtils.createRealVector(inverseVariances).ebeMultiply(b);
  }

  @Override
  public RealMatrix solve(RealMatrix B) {
    if (B.getRowDimension() != variances.length) throw new DimensionMismatchException(B.getRowDimension(), variances.length);
    return new DiagonalMatrix(inverseVariances, false).multiply(B);
  }

  @Override
  public void addTo(RealMatrix x) {
    if (x.getRowDimension() != variances.length) throw new DimensionMismatchException(x.getRowDimension(), variances.length);
    for (int i=0; i<variances.length; i++) x.addToEntry(i, i, variances[i]);
  }

  @Override
  public DiagonalCovariance localize(int[] indices, double[] taperWeights) {
    if (taperWeights != null && taperWeights.length != indices.length)
      throw new DimensionMismatchException(taperWeights.length, indices.length);
    double[] selected = new double[indices.length];
    for (int i=0; i<indices.length; i++) {
      selected[i] = inverseVariances[ indices[i] ];
      if (taperWeights != null) selected[i] *= taperWeights[i];
    }
    return new DiagonalCovariance(selected, Representation.DIAGONAL_INVERSE_VARIANCES, random);
  }

  @Override
  public RealMatrix toMatrix() {
    return MatrixUtils.createRealDiagonalMatrix(variances);
  }

  @Override
  public String toString() { return String.format("DiagonalCovariance(variances=%s)",Arrays.toString(variances)); };

}
