package sivantoledo.assimilation.kalman;

import java.util.LinkedList;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.MathUnsupportedOperationException;
import org.apache.commons.math3.exception.NotPositiveException;
import org.apache.commons.math3.exception.NullArgumentException;
import org.apache.commons.math3.exception.OutOfRangeException;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import sivantoledo.assimilation.CovarianceOperator;
import sivantoledo.assimilation.LinearizedModel;
import sivantoledo.assimilation.ObservationOperator;
import sivantoledo.assimilation.ResultCallback;
import sivantoledo.assimilation.cache.ArrayCache;

/**
 * Kalman Filter and fixed-lag Rauch-Tung-Striebel smoother with explicit
 * covariance matrices.
 *
 * Each time step is processed by calling
 *   forecast
 *   beginAnalysis
 *   assimilate (zero or more times)
 *   endAnalysis
 * With lag L > 0 smoothing must be started by smootherBegin(), and the
 * forecasts and analyses of the last L steps are held in the array cache.
 * When a step becomes L steps old, the smoother recursion is run backward
 * over the held steps and the smoothed estimate of the oldest one is passed
 * to the callback. smootherFinish() emits the remaining steps, newest first.
 *
 * @param <T> type of the trajectory data of the model
 *
 * @author Sivan Toledo
 */
public class KalmanSmoother<T> {

  private final static Logger log = LogManager.getLogger();

  /*
   * The forecast that led to a step, the analysis of the step, and the
   * trajectory of the model from the previous step. The initial step has no
   * forecast, and the forecast of a step is dropped with it.
   */
  private static class Step<T> {
    final int    xfHandle; // -1 for the initial step
    final int    PfHandle;
    final int    xaHandle;
    final int    PaHandle;
    final T      trajectory;
    final double time;

    Step(int xfHandle, int PfHandle, int xaHandle, int PaHandle, T trajectory, double time) {
      this.xfHandle   = xfHandle;
      this.PfHandle   = PfHandle;
      this.xaHandle   = xaHandle;
      this.PaHandle   = PaHandle;
      this.trajectory = trajectory;
      this.time       = time;
    }
  }

  private final LinearizedModel<T> model;
  private final int                lag;
  private final ArrayCache         cache;
  private double                   forgettingFactor = 1.0;

  private final LinkedList<Step<T>> steps   = new LinkedList<>(); // oldest first
  private boolean                   started = false;

  private T          trajectory = null; // of the last forecast
  private boolean    analyzing  = false;
  private double     t;
  private RealVector xf, xa;
  private RealMatrix Pf, Pa;

  public KalmanSmoother(LinearizedModel<T> model, int lag, ArrayCache cache) {
    if (model == null || cache == null) throw new NullArgumentException();
    if (lag < 0) throw new NotPositiveException(lag);
    this.model = model;
    this.lag   = lag;
    this.cache = cache;
  }

  public int getLag() { return lag; }

  /**
   * @return the number of steps held for smoothing
   */
  public int getLedgerSize() { return steps.size(); }

  public double getForgettingFactor() { return forgettingFactor; }

  /**
   * Sets the forgetting factor f in (0,1] that scales the smoother gains.
   */
  public void setForgettingFactor(double f) {
    if (!(f > 0.0 && f <= 1.0)) throw new OutOfRangeException(f, 0.0, 1.0);
    forgettingFactor = f;
  }

  /**
   * Starts smoothing from the initial estimate (x0, P0) at time t0.
   * Does nothing for lag 0.
   */
  public void smootherBegin(RealVector x0, RealMatrix P0, double t0) {
    if (analyzing) throw new IllegalStateException("smootherBegin(...) cannot be called during an analysis");
    checkCovariance(P0, x0.getDimension());
    started = true;
    if (lag == 0) return;

    discardSteps();
    int xaHandle = cache.put(MatrixUtils.createColumnRealMatrix(x0.toArray()));
    int PaHandle = cache.put(P0);
    steps.add(new Step<T>(-1, -1, xaHandle, PaHandle, null, t0));
  }

  /**
   * Moves the background estimate forward by dt: xf = M(xb) and
   * Pf = M*Pb*M' + Q. The arguments are not modified.
   *
   * @param Q model error covariance, or null for a perfect model
   * @return the forecast, with an unknown (NaN) time
   */
  public StateEstimate forecast(RealVector xb, RealMatrix Pb, CovarianceOperator Q, double dt) {
    if (lag > 0 && !started) throw new IllegalStateException("forecast(...) must be preceded by smootherBegin(...) when smoothing");
    if (analyzing) throw new IllegalStateException("forecast(...) cannot be called during an analysis");
    int n = xb.getDimension();
    checkCovariance(Pb, n);

    RealMatrix X = MatrixUtils.createColumnRealMatrix(xb.toArray());
    trajectory = model.advance(X, dt);

    RealMatrix P = model.adjoint(trajectory, model.tangentLinear(trajectory, Pb));
    if (Q != null) {
      if (Q.dimension() != n) throw new DimensionMismatchException(Q.dimension(), n);
      P = add(P, Q);
    }
    return new StateEstimate(X.getColumnVector(0), P, Double.NaN);
  }

  /**
   * Starts the analysis of the forecast (x, P) at time t.
   */
  public void beginAnalysis(RealVector x, RealMatrix P, double t) {
    if (analyzing) throw new IllegalStateException("beginAnalysis(...) called twice without endAnalysis(...)");
    checkCovariance(P, x.getDimension());
    this.t  = t;
    this.xf = x.copy();
    this.Pf = P.copy();
    this.xa = xf;
    this.Pa = Pf;
    analyzing = true;
  }

  /**
   * Assimilates observations z = H*x + e, where e has covariance R. Repeated
   * calls within one step assimilate the batches one after the other; a null
   * or empty z leaves the analysis unchanged.
   */
  public void assimilate(RealVector z, ObservationOperator H, CovarianceOperator R) {
    if (!analyzing) throw new IllegalStateException("assimilate(...) must be called between beginAnalysis(...) and endAnalysis(...)");
    if (z == null || z.getDimension() == 0) return;
    int m = z.getDimension();
    if (H.observationCount() != m)               throw new DimensionMismatchException(H.observationCount(), m);
    if (H.stateDimension() != xa.getDimension()) throw new DimensionMismatchException(H.stateDimension(), xa.getDimension());
    if (R.dimension() != m)                      throw new DimensionMismatchException(R.dimension(), m);

    RealMatrix HP  = H.apply(Pa);                 // H*P
    RealMatrix F   = symmetric(H.apply(HP.transpose()));
    F = add(F, R);                                // H*P*H' + R

    DecompositionSolver solver = new CholeskyDecomposition(F).getSolver();
    RealVector dz = z.subtract(H.apply(xa));

    RealVector x = xa.add(HP.transpose().operate(solver.solve(dz)));
    RealMatrix P = symmetric(Pa.subtract(HP.transpose().multiply(solver.solve(HP))));

    xa = x;
    Pa = P;
  }

  /**
   * Ends the analysis step. With lag 0 the callback receives the analysis;
   * otherwise it receives the smoothed estimate of the step that has become
   * lag steps old, if any.
   *
   * @return the analysis
   */
  public StateEstimate endAnalysis(ResultCallback callback) {
    if (!analyzing) throw new IllegalStateException("endAnalysis(...) must be called after beginAnalysis(...)");
    analyzing = false;
    StateEstimate analysis = new StateEstimate(xa, Pa, t);

    if (lag == 0) {
      if (callback != null) callback.onResult(xa, Pa, t);
      return analysis;
    }

    steps.add(new Step<T>(cache.put(MatrixUtils.createColumnRealMatrix(xf.toArray())), cache.put(Pf),
                          cache.put(MatrixUtils.createColumnRealMatrix(xa.toArray())), cache.put(Pa),
                          trajectory, t));

    if (steps.size() > lag) {
      StateEstimate smoothed = smoothBackward(false, null);
      Step<T> oldest = steps.removeFirst();
      discard(oldest);
      log.debug("smoother result for t={}", oldest.time);
      if (callback != null) callback.onResult(smoothed.state, smoothed.covariance, smoothed.time);
    }
    return analysis;
  }

  /**
   * Emits the smoothed estimates of all the held steps, newest first, and
   * removes them from the cache.
   */
  public void smootherFinish(ResultCallback callback) {
    if (analyzing) throw new IllegalStateException("smootherFinish(...) cannot be called during an analysis");
    if (steps.isEmpty()) return;
    smoothBackward(true, callback);
    while (!steps.isEmpty()) discard(steps.removeLast());
  }

  /*
   * Runs the smoother recursion from the newest held step back to the
   * oldest. If emitAll, every estimate is passed to the callback as it is
   * computed; the estimate of the oldest step is returned.
   */
  private StateEstimate smoothBackward(boolean emitAll, ResultCallback callback) {
    Step<T> newest = steps.getLast();
    RealVector xs = cache.get(newest.xaHandle, true).getColumnVector(0);
    RealMatrix Ps = cache.get(newest.PaHandle, true);
    if (emitAll && callback != null) callback.onResult(xs, Ps, newest.time);

    double time = newest.time;
    for (int k=steps.size()-2; k>=0; k--) {
      Step<T> step = steps.get(k);
      Step<T> next = steps.get(k+1);

      RealVector xfNext = cache.get(next.xfHandle).getColumnVector(0);
      RealMatrix PfNext = cache.get(next.PfHandle);
      RealVector xak    = cache.get(step.xaHandle).getColumnVector(0);
      RealMatrix Pak    = cache.get(step.PaHandle);

      // J = Pa*M'*inv(Pf), computed as (inv(Pf)*M*Pa)'
      RealMatrix J = new CholeskyDecomposition(symmetric(PfNext)).getSolver()
                         .solve(model.tangentLinear(next.trajectory, Pak))
                         .transpose()
                         .scalarMultiply(forgettingFactor);

      xs = xak.add(J.operate(xs.subtract(xfNext)));
      Ps = symmetric(Pak.add(J.multiply(Ps.subtract(PfNext)).multiply(J.transpose())));
      time = step.time;

      if (emitAll) {
        log.debug("smoother result for t={}", time);
        if (callback != null) callback.onResult(xs, Ps, time);
      }
    }
    return new StateEstimate(xs, Ps, time);
  }

  private void discard(Step<T> step) {
    if (step.xfHandle >= 0) cache.remove(step.xfHandle);
    if (step.PfHandle >= 0) cache.remove(step.PfHandle);
    cache.remove(step.xaHandle);
    cache.remove(step.PaHandle);
  }

  private void discardSteps() {
    while (!steps.isEmpty()) discard(steps.removeFirst());
  }

  /*
   * P + Q, through Q.addTo() when the representation supports it.
   */
  private static RealMatrix add(RealMatrix P, CovarianceOperator Q) {
    RealMatrix S = P.copy();
    try {
      Q.addTo(S);
      return S;
    } catch (MathUnsupportedOperationException muoe) {
      return P.add(Q.toMatrix());
    }
  }

  private static RealMatrix symmetric(RealMatrix A) {
    return A.add(A.transpose()).scalarMultiply(0.5);
  }

  private static void checkCovariance(RealMatrix P, int n) {
    if (P.getRowDimension() != n)    throw new DimensionMismatchException(P.getRowDimension(), n);
    if (P.getColumnDimension() != n) throw new DimensionMismatchException(P.getColumnDimension(), n);
  }
}
