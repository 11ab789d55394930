package sivantoledo.assimilation.kalman;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.Test;

import sivantoledo.assimilation.DenseCovariance;
import sivantoledo.assimilation.DiagonalCovariance;
import sivantoledo.assimilation.MatrixObservationOperator;
import sivantoledo.assimilation.ResultCallback;
import sivantoledo.assimilation.RotationModel;
import sivantoledo.assimilation.Simulation;
import sivantoledo.assimilation.cache.MemoryArrayCache;

class KalmanSmootherTest {

  private final static Logger log = LogManager.getLogger();

  private static final DiagonalCovariance Q =
      new DiagonalCovariance(Simulation.EVOLUTION_STD, DiagonalCovariance.Representation.DIAGONAL_STANDARD_DEVIATIONS);
  private static final DiagonalCovariance R =
      new DiagonalCovariance(new double[] { Simulation.OBSERVATION_STD }, DiagonalCovariance.Representation.DIAGONAL_STANDARD_DEVIATIONS);

  private static class Run {
    final RealVector[] filtered = new RealVector[ Simulation.STEPS ];
    final RealVector[] smoothed = new RealVector[ Simulation.STEPS ];
    final List<Double> times    = new ArrayList<>();
    int                finishedAt;
  }

  private static Run run(Simulation sim, int lag, MemoryArrayCache cache) {
    return run(sim, lag, cache, Simulation.STEPS);
  }

  /*
   * Runs the first steps of the scenario.
   */
  private static Run run(Simulation sim, int lag, MemoryArrayCache cache, int steps) {
    return run(sim, lag, cache, steps, 1.0);
  }

  private static Run run(Simulation sim, int lag, MemoryArrayCache cache, int steps, double forgettingFactor) {
    KalmanSmoother<Void> kf = new KalmanSmoother<>(sim.model, lag, cache);
    kf.setForgettingFactor(forgettingFactor);
    MatrixObservationOperator H = new MatrixObservationOperator(sim.H);

    Run run = new Run();
    ResultCallback onResult = (x, P, t) -> {
      run.smoothed[(int) t] = x;
      run.times.add(t);
    };

    RealVector x = Simulation.initialState();
    RealMatrix P = Simulation.initialCovariance();
    run.filtered[0] = x;
    kf.smootherBegin(x, P, 0);
    for (int t=1; t<steps; t++) {
      StateEstimate forecast = kf.forecast(x, P, Q, 1);
      kf.beginAnalysis(forecast.state, forecast.covariance, t);
      kf.assimilate(sim.observations[t], H, R);
      StateEstimate analysis = kf.endAnalysis(onResult);
      x = analysis.state;
      P = analysis.covariance;
      run.filtered[t] = x;
    }
    run.finishedAt = run.times.size();
    kf.smootherFinish(onResult);
    return run;
  }

  @Test
  void forecastPropagatesTheCovariance() {
    RotationModel model = new RotationModel(Simulation.ALPHA);
    KalmanSmoother<Void> kf = new KalmanSmoother<>(model, 0, new MemoryArrayCache());
    RealMatrix Pb = MatrixUtils.createRealMatrix(new double[][] {
      { 2.0, 0.3, 0.0 },
      { 0.3, 1.0, 0.1 },
      { 0.0, 0.1, 0.5 }
    });
    RealVector xb = MatrixUtils.createRealVector(new double[] { 1, 2, 3 });

    StateEstimate forecast = kf.forecast(xb, Pb, Q, 1);

    RealMatrix expected = model.M.multiply(Pb).multiply(model.M.transpose()).add(Q.toMatrix());
    assertArrayEquals(model.M.operate(xb).toArray(), forecast.state.toArray(), 1e-12);
    for (int i=0; i<3; i++) assertArrayEquals(expected.getRow(i), forecast.covariance.getRow(i), 1e-12);
    assertArrayEquals(new double[] { 1, 2, 3 }, xb.toArray(), 0.0);
    assertTrue(Double.isNaN(forecast.time));
  }

  @Test
  void analysisCovarianceIsSymmetricPositiveSemidefinite() {
    KalmanSmoother<Void> kf = new KalmanSmoother<>(new RotationModel(Simulation.ALPHA), 0, new MemoryArrayCache());
    RealMatrix P = MatrixUtils.createRealMatrix(new double[][] {
      { 4.0, 1.9, 0.5 },
      { 1.9, 1.0, 0.2 },
      { 0.5, 0.2, 0.3 }
    });
    MatrixObservationOperator H = new MatrixObservationOperator(new double[][] { { 1, 1, 0 }, { 1, 0, 1 }, { 0, 1, 0 } });
    DenseCovariance Rd = new DenseCovariance(MatrixUtils.createRealMatrix(new double[][] {
      { 0.10, 0.02, 0.00 },
      { 0.02, 0.20, 0.01 },
      { 0.00, 0.01, 0.05 }
    }));

    kf.beginAnalysis(MatrixUtils.createRealVector(new double[] { 0, 0, 1 }), P, 1);
    kf.assimilate(MatrixUtils.createRealVector(new double[] { 0.4, 1.1, -0.2 }), H, Rd);
    RealMatrix Pa = kf.endAnalysis(null).covariance;

    for (int i=0; i<3; i++)
      for (int j=0; j<3; j++) assertEquals(Pa.getEntry(i, j), Pa.getEntry(j, i), 0.0);
    for (double lambda: new EigenDecomposition(Pa).getRealEigenvalues()) assertTrue(lambda >= -1e-12, "eigenvalue "+lambda);
    for (int i=0; i<3; i++) assertTrue(Pa.getEntry(i, i) <= P.getEntry(i, i));
  }

  @Test
  void noObservationsLeaveTheForecastUnchanged() {
    KalmanSmoother<Void> kf = new KalmanSmoother<>(new RotationModel(Simulation.ALPHA), 0, new MemoryArrayCache());
    RealVector x = MatrixUtils.createRealVector(new double[] { 0.1, 0.2, 0.3 });
    RealMatrix P = MatrixUtils.createRealIdentityMatrix(3);
    MatrixObservationOperator H = new MatrixObservationOperator(new double[][] { { 1, 1, 0 } });

    kf.beginAnalysis(x, P, 1);
    kf.assimilate(MatrixUtils.createRealVector(new double[0]), H, R);
    kf.assimilate(null, H, R);
    StateEstimate analysis = kf.endAnalysis(null);

    assertArrayEquals(x.toArray(), analysis.state.toArray(), 0.0);
    for (int i=0; i<3; i++) assertArrayEquals(P.getRow(i), analysis.covariance.getRow(i), 0.0);
  }

  @Test
  void lagZeroReportsTheFilterResult() {
    Simulation sim = new Simulation(1234);
    MemoryArrayCache cache = new MemoryArrayCache();
    Run run = run(sim, 0, cache);

    assertEquals(Simulation.STEPS-1, run.times.size());
    for (int t=1; t<Simulation.STEPS; t++) assertArrayEquals(run.filtered[t].toArray(), run.smoothed[t].toArray(), 0.0);
    assertEquals(0, cache.size());
  }

  @Test
  void smootherEmitsEveryStepOnceAndEmptiesTheCache() {
    Simulation sim = new Simulation(1234);
    MemoryArrayCache cache = new MemoryArrayCache();
    int lag = 3;
    Run run = run(sim, lag, cache);

    assertEquals(Simulation.STEPS, run.times.size());
    for (int t=0; t<Simulation.STEPS; t++) assertTrue(run.times.contains((double) t), "missing t="+t);
    for (int i=1; i<run.finishedAt; i++) assertTrue(run.times.get(i) > run.times.get(i-1));
    assertEquals(lag, run.times.size() - run.finishedAt);
    for (int i=run.finishedAt+1; i<run.times.size(); i++) assertTrue(run.times.get(i) < run.times.get(i-1));

    // the newest step has no later observations
    assertArrayEquals(run.filtered[Simulation.STEPS-1].toArray(), run.smoothed[Simulation.STEPS-1].toArray(), 1e-12);
    assertEquals(0, cache.size());
  }

  @Test
  void fixedLagResultEqualsFixedIntervalSmootherOfTheWindow() {
    Simulation sim = new Simulation(99);
    int lag = 5;
    int t   = 20;
    Run fixedLag = run(sim, lag, new MemoryArrayCache());
    Run interval = run(sim, Simulation.STEPS, new MemoryArrayCache(), t+lag+1);

    assertArrayEquals(interval.smoothed[t].toArray(), fixedLag.smoothed[t].toArray(), 1e-10);
    assertTrue(fixedLag.smoothed[t].getDistance(fixedLag.filtered[t]) > 1e-6);
  }

  @Test
  void vanishingForgettingFactorReducesTheSmootherToTheFilter() {
    Run run = run(new Simulation(7), 4, new MemoryArrayCache(), 40, 1e-12);
    for (int t=0; t<40; t++) assertArrayEquals(run.filtered[t].toArray(), run.smoothed[t].toArray(), 1e-8, "t="+t);
  }

  @Test
  void rotationScenarioTracksTheTruth() {
    Simulation sim = new Simulation(1234);
    Run run = run(sim, 10, new MemoryArrayCache());

    double filterError   = sim.rmse(run.filtered, 0);
    double smootherError = sim.rmse(run.smoothed, 0);
    log.info("KF rmse filter {} smoother {}", filterError, smootherError);

    assertTrue(filterError   < 0.5);
    assertTrue(smootherError < 0.5);
  }

  @Test
  void invalidUseIsRejected() {
    KalmanSmoother<Void> kf = new KalmanSmoother<>(new RotationModel(Simulation.ALPHA), 2, new MemoryArrayCache());
    RealVector x = Simulation.initialState();
    RealMatrix P = Simulation.initialCovariance();
    MatrixObservationOperator H = new MatrixObservationOperator(new double[][] { { 1, 1, 0 } });

    assertThrows(IllegalStateException.class, () -> kf.forecast(x, P, Q, 1));
    assertThrows(IllegalStateException.class, () -> kf.assimilate(MatrixUtils.createRealVector(new double[] { 1 }), H, R));
    assertThrows(IllegalStateException.class, () -> kf.endAnalysis(null));

    kf.smootherBegin(x, P, 0);
    kf.beginAnalysis(x, P, 1);
    assertThrows(IllegalStateException.class, () -> kf.beginAnalysis(x, P, 2));
    assertThrows(IllegalStateException.class, () -> kf.smootherFinish(null));
  }
}
