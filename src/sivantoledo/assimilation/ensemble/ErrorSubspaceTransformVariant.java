package sivantoledo.assimilation.ensemble;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import sivantoledo.assimilation.CovarianceOperator;
import sivantoledo.assimilation.Ensemble;
import sivantoledo.assimilation.ObservationOperator;
import sivantoledo.assimilation.localization.DomainLocalization;

/**
 * Error Subspace Transform Kalman Filter (ESTKF), a deterministic square-root
 * filter that computes the analysis in the (N-1)-dimensional error subspace
 * spanned by the ensemble anomalies.
 *
 * Covariance inflation is applied inside the transform as a forgetting factor
 * rho = 1-(inflation-1), and the smoother transform uses the projection scaled
 * by rho, so that past ensembles are not inflated again.
 *
 * @author Sivan Toledo
 */
public class ErrorSubspaceTransformVariant implements EnsembleTransformVariant {

  private static final int ENSEMBLE = 0;
  private static final int MEAN     = 1;

  private final boolean         rotation;
  private final RandomGenerator random;

  private RealMatrix T; // N by N-1 projection, built lazily for the ensemble size in use

  public ErrorSubspaceTransformVariant() {
    this(true, new Well19937c());
  }

  public ErrorSubspaceTransformVariant(boolean rotation) {
    this(rotation, new Well19937c());
  }

  /**
   * @param rotation whether to apply a random mean-preserving rotation to the transform
   * @param random source of the rotations
   */
  public ErrorSubspaceTransformVariant(boolean rotation, RandomGenerator random) {
    this.rotation = rotation;
    this.random   = random;
  }

  public boolean rotation() { return rotation; }

  @Override
  public void init(int n, int N) {
    if (N < 2) throw new NumberIsTooSmallException(N, 2, true);
    T = projection(N);
  }

  /* the inflation reaches the transform through its inflation argument */
  @Override
  public void applyCovarianceInflation(RealMatrix ensemble, double factor) {
  }

  @Override
  public GlobalEnsembleData processGlobalEnsemble(RealMatrix globalEnsemble, ObservationOperator H) {
    RealMatrix Hx = MatrixUtils.createColumnRealMatrix(H.apply(Ensemble.mean(globalEnsemble)).toArray());
    return new GlobalEnsembleData(H.apply(globalEnsemble), Hx);
  }

  /**
   * The projection matrix T of the ESTKF: its columns are orthonormal and
   * orthogonal to the vector of all ones.
   */
  public static RealMatrix projection(int N) {
    double a = (1.0/N) * (1.0/(1.0/Math.sqrt(N) + 1.0));
    RealMatrix T = new Array2DRowRealMatrix(N, N-1);
    for (int i=0; i<N-1; i++)
      for (int j=0; j<N-1; j++)
        T.setEntry(i, j, i == j ? 1.0 - a : -a);
    for (int j=0; j<N-1; j++) T.setEntry(N-1, j, -1.0/Math.sqrt(N));
    return T;
  }

  @Override
  public EnsembleTransform ensembleTransform(RealMatrix globalEnsemble, RealMatrix localEnsemble,
                                             RealVector z, ObservationOperator H, CovarianceOperator R,
                                             GlobalEnsembleData data, double inflation,
                                             DomainLocalization localization) {
    int N = globalEnsemble.getColumnDimension();
    int m = z.getDimension();
    if (H.observationCount() != m) throw new DimensionMismatchException(H.observationCount(), m);
    if (R.dimension() != m)        throw new DimensionMismatchException(R.dimension(), m);

    double rho = 1.0 - (inflation - 1.0);
    if (rho <= 0) throw new NotStrictlyPositiveException(rho);

    if (T == null || T.getRowDimension() != N) init(globalEnsemble.getRowDimension(), N);
    if (data == null) data = processGlobalEnsemble(globalEnsemble, H);

    RealMatrix HL = data.get(ENSEMBLE).multiply(T);
    RealMatrix RinvHL = R.solve(HL);

    RealMatrix Ainv = HL.transpose().multiply(RinvHL);
    Ainv = Ainv.add(Ainv.transpose()).scalarMultiply(0.5); // rounding can break symmetry
    for (int i=0; i<N-1; i++) Ainv.addToEntry(i, i, rho*(N-1));

    RealVector dz = z.subtract(data.get(MEAN).getColumnVector(0));
    RealVector w  = new CholeskyDecomposition(Ainv).getSolver().solve(RinvHL.transpose().operate(dz));

    // symmetric inverse square root of Ainv
    EigenDecomposition eig = new EigenDecomposition(Ainv);
    double[] s = eig.getRealEigenvalues();
    for (int i=0; i<s.length; i++) s[i] = 1.0/Math.sqrt(s[i]);
    RealMatrix V = eig.getV();
    RealMatrix C = V.multiply(MatrixUtils.createRealDiagonalMatrix(s)).multiply(V.transpose());

    RealMatrix W = C.multiply(T.transpose()).scalarMultiply(Math.sqrt(N-1));
    if (rotation) W = W.multiply(randomRotation(N));

    RealMatrix dW = W;
    for (int i=0; i<N-1; i++)
      for (int j=0; j<N; j++) dW.addToEntry(i, j, w.getEntry(i));

    RealMatrix G  = T.multiply(dW);
    RealMatrix Gs = G.scalarMultiply(rho);
    for (int i=0; i<N; i++)
      for (int j=0; j<N; j++) {
        G .addToEntry(i, j, 1.0/N);
        Gs.addToEntry(i, j, 1.0/N);
      }

    return new EnsembleTransform(G, rho == 1.0 ? null : Gs);
  }

  /*
   * A random N by N orthogonal matrix that maps the vector of ones to itself,
   * T*Q*T' + ones/N, where Q is a random orthogonal matrix of order N-1.
   * Q comes from the QR decomposition of a standard-normal matrix, with the
   * signs normalized so that R has a positive diagonal.
   */
  private RealMatrix randomRotation(int N) {
    RealMatrix Y = new Array2DRowRealMatrix(N-1, N-1);
    for (int i=0; i<N-1; i++)
      for (int j=0; j<N-1; j++) Y.setEntry(i, j, random.nextGaussian());

    QRDecomposition qr = new QRDecomposition(Y);
    RealMatrix Q  = qr.getQ();
    RealMatrix RR = qr.getR();
    for (int j=0; j<N-1; j++) {
      if (RR.getEntry(j, j) < 0) {
        for (int i=0; i<N-1; i++) Q.multiplyEntry(i, j, -1.0);
      }
    }

    RealMatrix Omega = T.multiply(Q).multiply(T.transpose());
    for (int i=0; i<N; i++)
      for (int j=0; j<N; j++) Omega.addToEntry(i, j, 1.0/N);
    return Omega;
  }
}
