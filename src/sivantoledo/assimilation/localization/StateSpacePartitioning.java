package sivantoledo.assimilation.localization;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Partitioning of the state space into local domains for localized analysis.
 *
 * Domains are identified by indices 0..numDomains()-1. The local state of a
 * domain may include elements that also belong to other domains (padding),
 * so the local sizes can add up to more than the global state dimension.
 *
 * Global and local states are passed as matrices with one state per column,
 * so a single state is an n by 1 matrix and an ensemble is n by N.
 */
public interface StateSpacePartitioning {

  /**
   * @return the number of local domains; fixed for the lifetime of the partitioning
   */
  int numDomains();

  /**
   * @return the number of rows of the local state of a domain; 0 means the domain is empty
   */
  int getLocalStateSize(int domain);

  /**
   * Extracts the local state (or ensemble) of a domain.
   *
   * @param domain domain index
   * @param global n by N global state or ensemble
   * @return getLocalStateSize(domain) by N matrix
   */
  RealMatrix getLocalState(int domain, RealMatrix global);

  /**
   * Writes the local state (or ensemble) of a domain back to the global one.
   */
  void putLocalState(int domain, RealMatrix local, RealMatrix global);

  /**
   * Selects the observations that lie within the support range of the taper
   * function from the domain and have a positive taper weight.
   *
   * @param domain domain index
   * @param observationCoordinates locations of all observations; the accepted
   *        types are defined by the implementation
   * @param taper tapering function that defines the localization radius
   * @return indices into the observation vector and their distances from the domain
   * @throws IllegalArgumentException if the coordinates are of a type the partitioning does not understand
   */
  LocalObservations getLocalObservations(int domain, Object observationCoordinates, TaperFunction taper);
}
