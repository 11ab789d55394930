package sivantoledo.assimilation.localization;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;

/**
 * The Gaspari-Cohn fifth-order piecewise rational taper.
 *
 * With r = d/L,
 *   w(r) = 1 - 5/3 r^2 + 5/8 r^3 + 1/2 r^4 - 1/4 r^5                 for 0 <= r < 1
 *   w(r) = 4 - 5r + 5/3 r^2 + 5/8 r^3 - 1/2 r^4 + 1/12 r^5 - 2/(3r)  for 1 <= r < 2
 *   w(r) = 0                                                         otherwise,
 * so the support range is 2L.
 */
public class GaspariCohnTaper implements TaperFunction {

  private final double L;

  /**
   * @param L correlation length; the weight reaches zero at 2L
   */
  public GaspariCohnTaper(double L) {
    if (!(L > 0)) throw new NotStrictlyPositiveException(L);
    this.L = L;
  }

  @Override
  public double supportRange() { return 2*L; }

  /*
   * Close to r = 2 the second polynomial cancels and can round to slightly
   * negative values, so the result is clamped at zero.
   */
  @Override
  public double weight(double d) {
    double r = Math.abs(d)/L;
    if (r < 1) {
      return 1 + r*r*(-5.0/3 + r*(5.0/8 + r*(1.0/2 - r/4)));
    } else if (r < 2) {
      return Math.max(0, 4 + r*(-5 + r*(5.0/3 + r*(5.0/8 + r*(-1.0/2 + r/12)))) - 2.0/(3*r));
    }
    return 0;
  }

  @Override
  public double[] taper(double[] values, double[] distances) {
    if (values.length != distances.length) throw new DimensionMismatchException(distances.length, values.length);
    double[] tapered = new double[values.length];
    for (int i=0; i<values.length; i++) tapered[i] = values[i]*weight(distances[i]);
    return tapered;
  }
}
