package sivantoledo.assimilation.ensemble;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import sivantoledo.assimilation.CovarianceOperator;
import sivantoledo.assimilation.Ensemble;
import sivantoledo.assimilation.ObservationOperator;
import sivantoledo.assimilation.localization.DomainLocalization;

/**
 * The classic stochastic Ensemble Kalman Filter, in which every member
 * assimilates its own perturbed copy of the observations.
 *
 * The observation perturbations are drawn from R, so the randomness of this
 * variant is controlled by the random generator of the covariance operator.
 * The smoother reuses the filter transform.
 */
public class PerturbedObservationsVariant implements EnsembleTransformVariant {

  private static final int ENSEMBLE    = 0;
  private static final int ANOMALIES   = 1;

  /*
   * H applied to the members and to their anomalies; for a linear
   * operator the second is the first minus its row means.
   */
  @Override
  public GlobalEnsembleData processGlobalEnsemble(RealMatrix globalEnsemble, ObservationOperator H) {
    return new GlobalEnsembleData(H.apply(globalEnsemble), H.apply(Ensemble.toAnomaly(globalEnsemble)));
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

    if (data == null) data = processGlobalEnsemble(globalEnsemble, H);
    RealMatrix HE = data.get(ENSEMBLE);
    RealMatrix HX = data.get(ANOMALIES);

    /*
     * F = HX*HX'/(N-1) + R, and K = (inv(F)*HX)'/(N-1), which is the same
     * gain as solving with HX*HX' + (N-1)*R.
     */
    RealMatrix F = HX.multiply(HX.transpose()).scalarMultiply(1.0/(N-1));
    R.addTo(F);
    RealMatrix K = new CholeskyDecomposition(F).getSolver().solve(HX).transpose().scalarMultiply(1.0/(N-1));

    // innovations of the perturbed observations
    RealMatrix D = R.randomMultivariateNormal(N);
    Ensemble.center(D);
    for (int i=0; i<m; i++)
      for (int j=0; j<N; j++)
        D.addToEntry(i, j, z.getEntry(i) - HE.getEntry(i, j));

    RealMatrix X5 = K.multiply(D).add(MatrixUtils.createRealIdentityMatrix(N));
    return new EnsembleTransform(X5, null);
  }
}
