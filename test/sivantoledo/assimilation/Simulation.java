package sivantoledo.assimilation;

import java.util.Random;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Simulates the true trajectory of a rotating point and noisy observations
 * of it.
 *
 * The standard scenario starts at (0,0,1), rotates by pi/6 every step with
 * model error standard deviations (0.08, 0.01, 0.01), and observes the sum
 * of the first two elements with standard deviation 0.4.
 *
 * @author Sivan Toledo
 */
public class Simulation {

  public final static int    STEPS             = 120;
  public final static double ALPHA             = Math.PI / 6;
  public final static double OBSERVATION_STD   = 0.4;
  public final static double[] EVOLUTION_STD   = { 0.08, 0.01, 0.01 };

  public final Random random;

  public final RotationModel model;
  public final RealMatrix    H;

  public final RealVector[] states;
  public final RealVector[] observations; // none at step 0

  public Simulation(long seed) {
    random = new Random(seed);
    model  = new RotationModel(ALPHA);
    H      = MatrixUtils.createRealMatrix(new double[][] { { 1, 1, 0 } });

    states       = new RealVector[ STEPS ];
    observations = new RealVector[ STEPS ];

    states[0] = initialState();
    for (int i=1; i<STEPS; i++) {
      states[i] = model.M.operate(states[i-1]).add( noise(EVOLUTION_STD) );
      observations[i] = H.operate(states[i]).add( noise(new double[] { OBSERVATION_STD }) );
    }
  }

  public static RealVector initialState() {
    return MatrixUtils.createRealVector(new double[] { 0, 0, 1 });
  }

  public static RealMatrix initialCovariance() {
    return MatrixUtils.createRealIdentityMatrix(3);
  }

  public RealVector noise(double[] std) {
    double[] a = new double[ std.length ];
    for (int i=0; i<a.length; i++) a[i] = std[i]*random.nextGaussian();
    return MatrixUtils.createRealVector(a);
  }

  /**
   * Root mean square error of the estimates of steps first..STEPS-1, over
   * all elements of the state.
   */
  public double rmse(RealVector[] estimates, int first) {
    double s = 0;
    int count = 0;
    for (int i=first; i<STEPS; i++) {
      RealVector e = estimates[i].subtract(states[i]);
      s += e.dotProduct(e);
      count += e.getDimension();
    }
    return Math.sqrt(s/count);
  }
}
