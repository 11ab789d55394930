package sivantoledo.assimilation.ensemble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import sivantoledo.assimilation.DiagonalCovariance;
import sivantoledo.assimilation.Ensemble;
import sivantoledo.assimilation.MatrixObservationOperator;
import sivantoledo.assimilation.ObservationOperator;

class PerturbedObservationsVariantTest {

  private static final int N = 40;

  private static final ObservationOperator H = new MatrixObservationOperator(new double[][] {{ 1, 0 }});

  private static RealMatrix forecast() {
    Well19937c random = new Well19937c(21);
    RealMatrix E = MatrixUtils.createRealMatrix(2, N);
    for (int i=0; i<2; i++)
      for (int j=0; j<N; j++) E.setEntry(i, j, random.nextGaussian());
    return E;
  }

  private static DiagonalCovariance observationError(double variance) {
    return new DiagonalCovariance(new double[] { variance }, DiagonalCovariance.Representation.DIAGONAL_VARIANCES, new Well19937c(22));
  }

  @Test
  void uninformativeObservationsLeaveTheEnsembleAlone() {
    RealMatrix E = forecast();
    PerturbedObservationsVariant variant = new PerturbedObservationsVariant();
    EnsembleTransform X5 = variant.ensembleTransform(E, E, MatrixUtils.createRealVector(new double[] { 3.0 }),
                                                     H, observationError(1e12), null, 1.0, null);
    assertNull(X5.smoother);
    assertEquals(N, X5.filter.getRowDimension());
    assertEquals(N, X5.filter.getColumnDimension());
    for (int i=0; i<N; i++)
      for (int j=0; j<N; j++) assertEquals(i == j ? 1.0 : 0.0, X5.filter.getEntry(i, j), 1e-3);
  }

  @Test
  void accurateObservationsPullTheObservedVariable() {
    RealMatrix E = forecast();
    PerturbedObservationsVariant variant = new PerturbedObservationsVariant();
    RealVector z = MatrixUtils.createRealVector(new double[] { 2.0 });
    EnsembleTransform X5 = variant.ensembleTransform(E, E, z, H, observationError(0.01),
                                                     variant.processGlobalEnsemble(E, H), 1.0, null);
    RealMatrix Ea = E.multiply(X5.filter);

    assertTrue(Ensemble.std(Ea).getEntry(0) < 0.5*Ensemble.std(E).getEntry(0));
    assertEquals(2.0, Ensemble.mean(Ea).getEntry(0), 0.2);
  }

  @Test
  void mismatchedObservationsAreRejected() {
    RealMatrix E = forecast();
    PerturbedObservationsVariant variant = new PerturbedObservationsVariant();
    RealVector z = MatrixUtils.createRealVector(new double[] { 1.0, 2.0 });
    assertThrows(DimensionMismatchException.class,
                 () -> variant.ensembleTransform(E, E, z, H, observationError(1.0), null, 1.0, null));
  }
}
