package sivantoledo.assimilation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

class DiagonalCovarianceTest {

  @Test
  void representationsDescribeTheSameCovariance() {
    double[] expected = { 4.0, 0.25 };
    assertArrayEquals(expected, new DiagonalCovariance(new double[] { 4.0, 0.25 }).variances(), 0.0);
    assertArrayEquals(expected, new DiagonalCovariance(new double[] { 2.0, 0.5 },
                                  DiagonalCovariance.Representation.DIAGONAL_STANDARD_DEVIATIONS).variances(), 1e-15);
    assertArrayEquals(expected, new DiagonalCovariance(new double[] { 0.25, 4.0 },
                                  DiagonalCovariance.Representation.DIAGONAL_INVERSE_VARIANCES).variances(), 1e-15);

    assertThrows(NotStrictlyPositiveException.class, () -> new DiagonalCovariance(new double[] { 1.0, 0.0 }));
  }

  @Test
  void solveAndAddTo() {
    DiagonalCovariance C = new DiagonalCovariance(new double[] { 2.0, 4.0 });
    assertArrayEquals(new double[] { 0.5, 2.0 },
                      C.solve(MatrixUtils.createRealVector(new double[] { 1.0, 8.0 })).toArray(), 1e-15);

    RealMatrix X = MatrixUtils.createRealIdentityMatrix(2);
    C.addTo(X);
    assertArrayEquals(new double[] { 3.0, 0.0 }, X.getRow(0), 0.0);
    assertArrayEquals(new double[] { 0.0, 5.0 }, X.getRow(1), 0.0);
  }

  @Test
  void localizeSelectsAndDownWeights() {
    DiagonalCovariance C = new DiagonalCovariance(new double[] { 1.0, 2.0, 3.0 });
    assertArrayEquals(new double[] { 3.0, 1.0 }, C.localize(new int[] { 2, 0 }, null).variances(), 1e-15);
    assertArrayEquals(new double[] { 8.0 },      C.localize(new int[] { 1 }, new double[] { 0.25 }).variances(), 1e-14);
  }

  @Test
  void samplesHaveTheRightVariance() {
    DiagonalCovariance C = new DiagonalCovariance(new double[] { 0.5, 3.0 },
                                                  DiagonalCovariance.Representation.DIAGONAL_VARIANCES, new Well19937c(3));
    RealMatrix X = C.randomMultivariateNormal(20000);
    double[] std = Ensemble.std(X).toArray();
    assertEquals(Math.sqrt(0.5), std[0], 0.02);
    assertEquals(Math.sqrt(3.0), std[1], 0.05);
  }
}
