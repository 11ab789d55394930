package sivantoledo.assimilation.cache;

import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Keeps every array in memory.
 */
public class MemoryArrayCache implements ArrayCache {

  private final Map<Integer, RealMatrix> items = new HashMap<>();
  private int keyCounter = 0;

  @Override
  public int put(RealMatrix data) {
    keyCounter++;
    items.put(keyCounter, data.copy());
    return keyCounter;
  }

  @Override
  public RealMatrix get(int handle, boolean forceCopy) {
    RealMatrix data = lookup(handle);
    return forceCopy ? data.copy() : data;
  }

  @Override
  public RealMatrix getExclusive(int handle) {
    return lookup(handle);
  }

  @Override
  public void release(int handle) {
    lookup(handle);
  }

  @Override
  public void remove(int handle) {
    if (items.remove(handle) == null) throw new NoSuchElementException("no array with handle "+handle+" in cache");
  }

  @Override
  public void clear() {
    items.clear();
    keyCounter = 0;
  }

  @Override
  public int size() { return items.size(); }

  private RealMatrix lookup(int handle) {
    RealMatrix data = items.get(handle);
    if (data == null) throw new NoSuchElementException("no array with handle "+handle+" in cache");
    return data;
  }
}
