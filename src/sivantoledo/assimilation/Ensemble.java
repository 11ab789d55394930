package sivantoledo.assimilation;

import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Helpers for ensembles stored as n by N matrices, one member per column.
 */
public class Ensemble {

  /**
   * Generates an ensemble of N members around x with covariance C.
   * The random perturbations are centered, so the mean of the result is x.
   */
  public static RealMatrix generate(int N, RealVector x, CovarianceOperator C) {
    if (N < 1) throw new NotStrictlyPositiveException(N);
    RealMatrix E = C.randomMultivariateNormal(N);
    center(E);
    for (int i=0; i<E.getRowDimension(); i++)
      for (int j=0; j<N; j++) E.addToEntry(i, j, x.getEntry(i));
    return E;
  }

  public static RealVector mean(RealMatrix E) {
    int N = E.getColumnDimension();
    double[] m = new double[ E.getRowDimension() ];
    for (int i=0; i<m.length; i++) {
      double s = 0;
      for (int j=0; j<N; j++) s += E.getEntry(i, j);
      m[i] = s/N;
    }
    return MatrixUtils.createRealVector(m);
  }

  /**
   * @return a new matrix holding the deviations of the members from the mean
   */
  public static RealMatrix toAnomaly(RealMatrix E) {
    RealMatrix X = E.copy();
    center(X);
    return X;
  }

  /**
   * Subtracts the ensemble mean from every member, in place.
   */
  public static void center(RealMatrix E) {
    RealVector m = mean(E);
    for (int i=0; i<E.getRowDimension(); i++)
      for (int j=0; j<E.getColumnDimension(); j++) E.addToEntry(i, j, -m.getEntry(i));
  }

  /**
   * Multiplies the anomalies by factor, in place, keeping the mean.
   */
  public static void inflate(RealMatrix E, double factor) {
    RealVector m = mean(E);
    for (int i=0; i<E.getRowDimension(); i++) {
      double mi = m.getEntry(i);
      for (int j=0; j<E.getColumnDimension(); j++)
        E.setEntry(i, j, mi + factor*(E.getEntry(i, j) - mi));
    }
  }

  /**
   * Sample standard deviation of every state element.
   */
  public static RealVector std(RealMatrix E) {
    RealMatrix X = toAnomaly(E);
    int N = E.getColumnDimension();
    double[] s = new double[ E.getRowDimension() ];
    for (int i=0; i<s.length; i++) {
      double ss = 0;
      for (int j=0; j<N; j++) ss += X.getEntry(i, j)*X.getEntry(i, j);
      s[i] = Math.sqrt(ss/(N-1));
    }
    return MatrixUtils.createRealVector(s);
  }

  /**
   * Copies the contents of src into dest, which must have the same shape.
   */
  public static void copy(RealMatrix dest, RealMatrix src) {
    dest.setSubMatrix(src.getData(), 0, 0);
  }

  public static String toString(double[][] A, String format) {
    StringBuilder s = new StringBuilder();
    s.append('[');
    for (int d=0; d<A.length; d++) {
      s.append('[');
      for (int i=0; i<A[d].length; i++) {
        s.append(String.format(format, A[d][i]));
        if (i < A[d].length-1) s.append(' ');
      }
      s.append(']');
    }
    s.append(']');
    return s.toString();
  }
}
