package sivantoledo.assimilation.cache;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * A store for large arrays, addressed by integer handles.
 *
 * The cache owns the arrays it stores: put() copies its argument. A handle
 * is valid from put() until remove() or clear(); using it afterwards throws
 * NoSuchElementException.
 *
 * Implementations are not required to be thread safe.
 *
 * @author Sivan Toledo
 */
public interface ArrayCache {

  /**
   * Stores a copy of the argument.
   *
   * @param data array to store
   * @return handle that identifies the stored copy
   */
  int put(RealMatrix data);

  /**
   * Same as get(handle, false).
   */
  default RealMatrix get(int handle) {
    return get(handle, false);
  }

  /**
   * Retrieves an array. The result must not be modified unless forceCopy is
   * true; use getExclusive() for in-place updates.
   *
   * @param handle handle returned by put()
   * @param forceCopy if true, the result is always an independent copy
   * @return the stored array or a copy of it
   */
  RealMatrix get(int handle, boolean forceCopy);

  /**
   * Retrieves the stored array itself for in-place modification. Every call
   * must be paired with release(handle) once the caller is done writing.
   */
  RealMatrix getExclusive(int handle);

  /**
   * Ends the exclusive access granted by getExclusive().
   */
  void release(int handle);

  /**
   * Drops the array and invalidates the handle.
   */
  void remove(int handle);

  /**
   * Drops everything and restarts handle numbering.
   */
  void clear();

  /**
   * @return the number of valid handles
   */
  int size();
}
