package sivantoledo.assimilation.localization;

import java.util.Arrays;

import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.OutOfRangeException;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Partitioning in which every state variable is its own domain.
 *
 * The index of a state variable is also its coordinate, and observations are
 * located by the (possibly fractional) index of the state variable they
 * relate to. Observation coordinates are passed as double[] or int[].
 *
 * Mainly useful for synthetic problems; the number of domains equals the
 * state dimension, which makes localized analysis slow for large n.
 */
public class GenericStateSpace1d implements StateSpacePartitioning {

  private final int n;

  public GenericStateSpace1d(int n) {
    if (n <= 0) throw new NotStrictlyPositiveException(n);
    this.n = n;
  }

  @Override
  public int numDomains() { return n; }

  @Override
  public int getLocalStateSize(int domain) {
    checkDomain(domain);
    return 1;
  }

  @Override
  public RealMatrix getLocalState(int domain, RealMatrix global) {
    checkDomain(domain);
    return global.getSubMatrix(domain, domain, 0, global.getColumnDimension()-1);
  }

  @Override
  public void putLocalState(int domain, RealMatrix local, RealMatrix global) {
    checkDomain(domain);
    global.setRow(domain, local.getRow(0));
  }

  @Override
  public LocalObservations getLocalObservations(int domain, Object observationCoordinates, TaperFunction taper) {
    checkDomain(domain);
    double[] coordinates = asCoordinates(observationCoordinates);
    double   range       = taper.supportRange();

    int[]    indices   = new int   [ coordinates.length ];
    double[] distances = new double[ coordinates.length ];
    int      count     = 0;
    for (int i=0; i<coordinates.length; i++) {
      double d = Math.abs(coordinates[i] - domain);
      if (d < range && taper.weight(d) > 0) {
        indices  [count] = i;
        distances[count] = d;
        count++;
      }
    }
    return new LocalObservations(Arrays.copyOf(indices, count), Arrays.copyOf(distances, count));
  }

  private static double[] asCoordinates(Object observationCoordinates) {
    if (observationCoordinates instanceof double[]) return (double[]) observationCoordinates;
    if (observationCoordinates instanceof int[]) return Arrays.stream((int[]) observationCoordinates).asDoubleStream().toArray();
    throw new IllegalArgumentException("GenericStateSpace1d expects observation coordinates as double[] or int[], got "
                                       + (observationCoordinates == null ? "null" : observationCoordinates.getClass().getName()));
  }

  private void checkDomain(int domain) {
    if (domain < 0 || domain >= n) throw new OutOfRangeException(domain, 0, n-1);
  }
}
