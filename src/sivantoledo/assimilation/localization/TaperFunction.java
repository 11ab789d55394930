package sivantoledo.assimilation.localization;

/**
 * Covariance tapering function, used to limit the influence of observations
 * by their distance.
 */
public interface TaperFunction {

  /**
   * @return the distance at which the weight drops to zero
   */
  double supportRange();

  /**
   * @return the weight in [0,1] of an observation at the given distance
   */
  double weight(double distance);

  /**
   * Multiplies each values[i] by the weight w(distances[i]).
   *
   * @param values values to taper
   * @param distances one distance per value
   * @return a new array with the tapered values
   */
  double[] taper(double[] values, double[] distances);
}
