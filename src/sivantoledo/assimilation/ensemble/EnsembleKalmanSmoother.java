package sivantoledo.assimilation.ensemble;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotPositiveException;
import org.apache.commons.math3.exception.NullArgumentException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.exception.OutOfRangeException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import sivantoledo.assimilation.CovarianceOperator;
import sivantoledo.assimilation.Ensemble;
import sivantoledo.assimilation.ForwardModel;
import sivantoledo.assimilation.ObservationOperator;
import sivantoledo.assimilation.ResultCallback;
import sivantoledo.assimilation.cache.ArrayCache;
import sivantoledo.assimilation.localization.DomainLocalization;
import sivantoledo.assimilation.localization.LocalObservations;
import sivantoledo.assimilation.localization.StateSpacePartitioning;

/**
 * Ensemble Kalman Filter and fixed-lag Ensemble Kalman Smoother.
 *
 * The driver handles forecasting, global or domain-localized analysis and the
 * smoother bookkeeping; the analysis update itself is computed by an
 * EnsembleTransformVariant. Every time step is processed by calling
 *   forecast
 *   beginAnalysis
 *   assimilate (zero or more times)
 *   endAnalysis
 * and smootherFinish() emits the remaining smoother results at the end.
 *
 * With lag L > 0 the analysis ensembles of the last L steps are kept in the
 * array cache and updated retroactively by every new analysis; the smoother
 * result of a step is emitted once it is L steps old. With localization the
 * stored ensembles are in local-buffer form, the concatenation of the local
 * ensembles of all domains, which may be longer than the state because the
 * domains may overlap.
 *
 * The callback receives the filter result at every endAnalysis() when the lag
 * is 0, and smoother results otherwise.
 *
 * @author Sivan Toledo
 */
public class EnsembleKalmanSmoother {

  private final static Logger log = LogManager.getLogger();

  private static final class LedgerEntry {
    final int    handle;
    final double time;

    LedgerEntry(int handle, double time) {
      this.handle = handle;
      this.time   = time;
    }
  }

  private final EnsembleTransformVariant variant;
  private final int                      ensembleSize;
  private final int                      lag;
  private final ArrayCache               cache;

  private double          covarianceInflation = 1.0;
  private double          forgettingFactor    = 1.0;
  private ExecutorService executor            = null;

  private boolean            localized    = false;
  private DomainLocalization localization = null;
  private int[]              domainStart  = new int[0];
  private int[]              domainSize   = new int[0];
  private int                localBufferSize;

  private final LinkedList<LedgerEntry> ledger  = new LinkedList<>(); // oldest first
  private AnalysisSession               session = null;
  private int                           stateDimension = -1;
  private int                           variantDimension = -1; // state dimension the variant was initialized for

  /**
   * @param variant the EnKF variant that computes the analysis transforms
   * @param ensembleSize number of members, N
   * @param lag smoother lag in time steps, 0 for filtering only
   * @param cache storage for the lagged ensembles
   */
  public EnsembleKalmanSmoother(EnsembleTransformVariant variant, int ensembleSize, int lag, ArrayCache cache) {
    if (variant == null || cache == null) throw new NullArgumentException();
    if (ensembleSize < 2) throw new NumberIsTooSmallException(ensembleSize, 2, true);
    if (lag < 0) throw new NotPositiveException(lag);
    this.variant      = variant;
    this.ensembleSize = ensembleSize;
    this.lag          = lag;
    this.cache        = cache;
  }

  public int getLag() { return lag; }

  public int getEnsembleSize() { return ensembleSize; }

  public int getNumDomains() { return domainSize.length; }

  /**
   * @return the number of past steps held for smoothing
   */
  public int getLedgerSize() { return ledger.size(); }

  public double getCovarianceInflation() { return covarianceInflation; }

  /**
   * Sets the multiplicative inflation of the forecast ensemble anomalies,
   * applied at the beginning of every analysis step. 1 means no inflation.
   */
  public void setCovarianceInflation(double factor) {
    if (!(factor >= 1.0)) throw new NumberIsTooSmallException(factor, 1.0, true);
    covarianceInflation = factor;
  }

  public double getForgettingFactor() { return forgettingFactor; }

  /**
   * Sets the forgetting factor f in (0,1] of the smoother. A transform X is
   * deflated to I+f*(X-I) for every step it is carried back in time.
   */
  public void setForgettingFactor(double f) {
    if (!(f > 0.0 && f <= 1.0)) throw new OutOfRangeException(f, 0.0, 1.0);
    forgettingFactor = f;
  }

  /**
   * Computes the transforms of the local domains concurrently on the given
   * executor; null computes them on the calling thread. The random
   * generators of the variant and of the observation error covariances are
   * then used from several threads and must be thread safe.
   */
  public void setExecutor(ExecutorService executor) {
    this.executor = executor;
  }

  /**
   * Selects domain-localized analysis, or global analysis if localization is
   * null. Must be called before the first analysis and cannot be changed
   * while steps are held for smoothing.
   */
  public void localize(DomainLocalization localization) {
    if (session != null) throw new IllegalStateException("localize(...) cannot be called during an analysis");
    if (!ledger.isEmpty()) throw new IllegalStateException("localize(...) cannot be called while the smoother holds past steps");

    this.localization = localization;
    this.localized    = true;
    if (localization == null) {
      domainStart = new int[0];
      domainSize  = new int[0];
      localBufferSize = 0;
      return;
    }

    StateSpacePartitioning partitioning = localization.partitioning();
    int numDomains = partitioning.numDomains();
    domainStart = new int[numDomains];
    domainSize  = new int[numDomains];
    localBufferSize = 0;
    for (int d=0; d<numDomains; d++) {
      int size = partitioning.getLocalStateSize(d);
      if (size < 0) throw new NotPositiveException(size);
      domainStart[d] = localBufferSize;
      domainSize [d] = size;
      localBufferSize += size;
    }
    log.debug("localized analysis with {} domains, local buffer of {} rows", numDomains, localBufferSize);
  }

  /**
   * Advances every member with the model and adds a centered sample of the
   * model error, if Q is not null. The ensemble is modified in place.
   *
   * @return the forecast ensemble
   */
  public RealMatrix forecast(ForwardModel<?> model, RealMatrix ensemble, CovarianceOperator Q, double dt) {
    checkEnsemble(ensemble);
    if (Q != null && Q.dimension() != ensemble.getRowDimension()) throw new DimensionMismatchException(Q.dimension(), ensemble.getRowDimension());
    model.advance(ensemble, dt);
    if (Q != null) {
      RealMatrix QX = Q.randomMultivariateNormal(ensembleSize);
      Ensemble.center(QX);
      ensemble.setSubMatrix(ensemble.add(QX).getData(), 0, 0);
    }
    return ensemble;
  }

  /**
   * Starts smoothing from the initial ensemble at time t0, discarding the
   * steps held from earlier runs. Other arrays in the cache are left alone.
   * Does nothing for lag 0.
   */
  public void smootherBegin(RealMatrix initialEnsemble, double t0) {
    checkLocalized();
    if (session != null) throw new IllegalStateException("smootherBegin(...) cannot be called during an analysis");
    checkEnsemble(initialEnsemble);
    if (lag == 0) return;

    while (!ledger.isEmpty()) cache.remove(ledger.removeFirst().handle);
    stateDimension = initialEnsemble.getRowDimension();
    int handle = cache.put(localization == null ? initialEnsemble : gather(initialEnsemble));
    ledger.add(new LedgerEntry(handle, t0));
  }

  /**
   * Starts the analysis of the forecast ensemble at time t. The argument is
   * not modified; the analysis is returned by endAnalysis().
   */
  public void beginAnalysis(RealMatrix ensemble, double t) {
    checkLocalized();
    if (session != null) throw new IllegalStateException("beginAnalysis(...) called twice without endAnalysis(...)");
    checkEnsemble(ensemble);
    int n = ensemble.getRowDimension();
    if (!ledger.isEmpty() && n != stateDimension) throw new DimensionMismatchException(n, stateDimension);
    stateDimension = n;

    if (n != variantDimension) {
      variant.init(n, ensembleSize);
      variantDimension = n;
    }

    RealMatrix E = ensemble.copy();
    if (covarianceInflation != 1.0) variant.applyCovarianceInflation(E, covarianceInflation);

    session = new AnalysisSession(t, E, localization == null ? null : gather(E), getNumDomains());
    log.debug("begin analysis at t={}", t);
  }

  /**
   * Assimilates a batch of observations z = H(x) + e, where e has covariance R.
   * May be called several times within one analysis step; a null or empty z
   * leaves the analysis unchanged.
   *
   * @param observationCoordinates the locations of the observations, in a form
   *        the partitioning understands; ignored for global analysis
   */
  public void assimilate(RealVector z, Object observationCoordinates, ObservationOperator H, CovarianceOperator R) {
    if (session == null) throw new IllegalStateException("assimilate(...) must be called between beginAnalysis(...) and endAnalysis(...)");
    if (z == null || z.getDimension() == 0) return;
    int m = z.getDimension();
    if (H.observationCount() != m) throw new DimensionMismatchException(H.observationCount(), m);
    if (H.stateDimension() != stateDimension) throw new DimensionMismatchException(H.stateDimension(), stateDimension);
    if (R.dimension() != m) throw new DimensionMismatchException(R.dimension(), m);

    RealMatrix Eg = session.globalEnsemble;
    GlobalEnsembleData data = variant.processGlobalEnsemble(Eg, H);

    if (localization == null) {
      EnsembleTransform t = variant.ensembleTransform(Eg, Eg, z, H, R, data, covarianceInflation, null);
      session.globalEnsemble = Eg.multiply(t.filter);
      session.accumulate(0, t.forSmoother(), m);
      return;
    }

    int numDomains = getNumDomains();
    int[] observations = new int[numDomains];
    List<Integer> domains = new ArrayList<>();
    List<Callable<EnsembleTransform>> tasks = new ArrayList<>();
    for (int d=0; d<numDomains; d++) {
      if (domainSize[d] == 0) continue;
      LocalObservations local = localization.getLocalObservations(d, observationCoordinates);
      if (local.isEmpty()) continue;

      ObservationOperator Hd = localization.getLocalH(H, local.indices);
      CovarianceOperator  Rd = localization.getLocalR(R, local.indices, local.distances);
      RealVector          zd = MatrixUtils.createRealVector(new double[local.count()]);
      for (int i=0; i<local.count(); i++) zd.setEntry(i, z.getEntry(local.indices[i]));
      GlobalEnsembleData  dd = data == null ? null : data.localize(local.indices);
      RealMatrix          Ad = localSlice(session.localBuffer, d);

      observations[d] = local.count();
      domains.add(d);
      tasks.add(() -> variant.ensembleTransform(Eg, Ad, zd, Hd, Rd, dd, covarianceInflation, localization));
    }

    List<EnsembleTransform> transforms = computeTransforms(tasks);

    // all transforms are known; from here on the session is updated
    for (int i=0; i<domains.size(); i++) {
      int d = domains.get(i);
      EnsembleTransform t = transforms.get(i);
      RealMatrix Ad = localSlice(session.localBuffer, d);
      session.localBuffer.setSubMatrix(Ad.multiply(t.filter).getData(), domainStart[d], 0);
      session.accumulate(d, t.forSmoother(), observations[d]);
    }
    scatter(session.localBuffer, Eg);
    log.debug("assimilated {} observations in {} of {} domains", m, domains.size(), numDomains);
  }

  /**
   * Ends the analysis step: updates the ensembles held for smoothing with the
   * transform of this step, emits the smoother result that has become final,
   * and stores the new analysis. With lag 0 the callback receives the
   * analysis itself.
   *
   * @return the analysis ensemble
   */
  public RealMatrix endAnalysis(ResultCallback callback) {
    if (session == null) throw new IllegalStateException("endAnalysis(...) must be called after beginAnalysis(...)");
    AnalysisSession s = session;
    RealMatrix Ea = s.globalEnsemble;

    if (lag == 0) {
      session = null;
      if (callback != null) callback.onResult(Ensemble.mean(Ea), Ea, s.time);
      log.debug("end analysis at t={}, {} domains received observations", s.time, s.domainsWithObservations());
      return Ea;
    }

    int size   = ledger.size();
    int oldest = Math.max(0, size - lag);
    for (int j=size-1; j>=oldest; j--) {
      LedgerEntry entry = ledger.get(j);
      applyTransforms(entry.handle, s.transforms);
      if (j == size - lag) {
        emit(entry, callback);
        ledger.remove(j);
      }
    }

    int handle = cache.put(localization == null ? Ea : s.localBuffer);
    ledger.add(new LedgerEntry(handle, s.time));
    session = null;
    log.debug("end analysis at t={}, {} domains received observations, {} steps held", s.time, s.domainsWithObservations(), ledger.size());
    return Ea;
  }

  /**
   * Emits the smoother results of all the steps still held, newest first,
   * and removes them from the cache.
   */
  public void smootherFinish(ResultCallback callback) {
    if (session != null) throw new IllegalStateException("smootherFinish(...) cannot be called during an analysis");
    while (!ledger.isEmpty()) {
      emit(ledger.getLast(), callback);
      ledger.removeLast();
    }
  }

  /*
   * Multiplies a stored ensemble by the transforms of the current step, domain
   * by domain, after deflating the transforms by the forgetting factor. The
   * deflation is applied to the accumulated transforms themselves, so it
   * compounds as the walk moves back in time.
   */
  private void applyTransforms(int handle, RealMatrix[] transforms) {
    if (forgettingFactor != 1.0) {
      RealMatrix I = MatrixUtils.createRealIdentityMatrix(ensembleSize);
      for (int d=0; d<transforms.length; d++) {
        if (transforms[d] == null) continue;
        transforms[d] = I.add(transforms[d].subtract(I).scalarMultiply(forgettingFactor));
      }
    }

    RealMatrix A = cache.getExclusive(handle);
    try {
      if (localization == null) {
        if (transforms[0] != null) Ensemble.copy(A, A.multiply(transforms[0]));
      } else {
        for (int d=0; d<transforms.length; d++) {
          if (transforms[d] == null || domainSize[d] == 0) continue;
          A.setSubMatrix(localSlice(A, d).multiply(transforms[d]).getData(), domainStart[d], 0);
        }
      }
    } finally {
      cache.release(handle);
    }
  }

  private void emit(LedgerEntry entry, ResultCallback callback) {
    RealMatrix A = cache.get(entry.handle, true);
    if (localization != null) {
      RealMatrix global = MatrixUtils.createRealMatrix(stateDimension, ensembleSize);
      scatter(A, global);
      A = global;
    }
    cache.remove(entry.handle);
    log.debug("smoother result for t={}", entry.time);
    if (callback != null) callback.onResult(Ensemble.mean(A), A, entry.time);
  }

  private List<EnsembleTransform> computeTransforms(List<Callable<EnsembleTransform>> tasks) {
    List<EnsembleTransform> transforms = new ArrayList<>(tasks.size());
    if (executor == null) {
      for (Callable<EnsembleTransform> task: tasks) {
        try {
          transforms.add(task.call());
        } catch (RuntimeException re) {
          throw re;
        } catch (Exception e) {
          throw new IllegalStateException(e);
        }
      }
      return transforms;
    }

    try {
      for (Future<EnsembleTransform> f: executor.invokeAll(tasks)) transforms.add(f.get());
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while computing local analyses", ie);
    } catch (ExecutionException ee) {
      Throwable cause = ee.getCause();
      if (cause instanceof RuntimeException) throw (RuntimeException) cause;
      if (cause instanceof Error) throw (Error) cause;
      throw new IllegalStateException(cause);
    }
    return transforms;
  }

  private RealMatrix localSlice(RealMatrix buffer, int d) {
    return buffer.getSubMatrix(domainStart[d], domainStart[d] + domainSize[d] - 1, 0, ensembleSize - 1);
  }

  private RealMatrix gather(RealMatrix global) {
    StateSpacePartitioning partitioning = localization.partitioning();
    RealMatrix buffer = MatrixUtils.createRealMatrix(localBufferSize, global.getColumnDimension());
    for (int d=0; d<domainSize.length; d++) {
      if (domainSize[d] == 0) continue;
      RealMatrix local = partitioning.getLocalState(d, global);
      if (local.getRowDimension() != domainSize[d]) throw new DimensionMismatchException(local.getRowDimension(), domainSize[d]);
      buffer.setSubMatrix(local.getData(), domainStart[d], 0);
    }
    return buffer;
  }

  private void scatter(RealMatrix buffer, RealMatrix global) {
    StateSpacePartitioning partitioning = localization.partitioning();
    for (int d=0; d<domainSize.length; d++) {
      if (domainSize[d] == 0) continue;
      partitioning.putLocalState(d, localSlice(buffer, d), global);
    }
  }

  private void checkLocalized() {
    if (!localized) throw new IllegalStateException("localize(...) must be called before the first analysis, with null for global analysis");
  }

  private void checkEnsemble(RealMatrix ensemble) {
    if (ensemble.getColumnDimension() != ensembleSize) throw new DimensionMismatchException(ensemble.getColumnDimension(), ensembleSize);
  }
}
