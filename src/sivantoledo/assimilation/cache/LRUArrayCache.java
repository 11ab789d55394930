package sivantoledo.assimilation.cache;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.UUID;

import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A cache that keeps recently used arrays in memory and swaps the others
 * to files.
 *
 * Arrays stay in memory as long as their combined size is below the capacity.
 * When the capacity is reached, the least recently used arrays are written to
 * the storage directory, one file per array named by a random UUID. Reading
 * an evicted array brings it back to memory, possibly evicting others.
 *
 * get() always returns a fresh copy. Arrays checked out with getExclusive()
 * are pinned in memory until release().
 */
public class LRUArrayCache implements ArrayCache, AutoCloseable {

  private final static Logger log = LogManager.getLogger();

  public final static String DEFAULT_DIRECTORY_NAME = "ensemble-kalman-cache";

  private static class Item {
    final RealMatrix data;
    final long       size;
    Item(RealMatrix data, long size) { this.data = data; this.size = size; }
  }

  private static class Retired {
    final UUID uid;
    final long size;
    Retired(UUID uid, long size) { this.uid = uid; this.size = size; }
  }

  // access-ordered: iteration starts at the least recently used item
  private final LinkedHashMap<Integer, Item> memoryItems  = new LinkedHashMap<>(16, 0.75f, true);
  private final Map<Integer, Retired>        retiredItems = new HashMap<>();
  private final Set<Integer>                 pinned       = new HashSet<>();

  private final long capacity;
  private final Path directory;

  private int  keyCounter  = 0;
  private long memorySize  = 0;
  private long retiredSize = 0;

  /**
   * Creates a cache that swaps to a directory under java.io.tmpdir, which is
   * created if needed.
   *
   * @param capacityBytes memory budget in bytes
   */
  public LRUArrayCache(long capacityBytes) {
    this(capacityBytes, Paths.get(System.getProperty("java.io.tmpdir"), DEFAULT_DIRECTORY_NAME), true);
  }

  /**
   * @param capacityBytes memory budget in bytes
   * @param directory storage directory; must exist
   */
  public LRUArrayCache(long capacityBytes, Path directory) {
    this(capacityBytes, directory, false);
  }

  private LRUArrayCache(long capacityBytes, Path directory, boolean create) {
    if (capacityBytes <= 0) throw new NotStrictlyPositiveException(capacityBytes);
    this.capacity  = capacityBytes;
    this.directory = directory;

    if (!Files.isDirectory(directory)) {
      if (!create) throw new IllegalArgumentException("array cache directory "+directory+" does not exist");
      try {
        Files.createDirectories(directory);
      } catch (IOException ioe) {
        throw new UncheckedIOException(ioe);
      }
    }
  }

  public Path directory() { return directory; }

  public long capacity() { return capacity; }

  public long memorySize() { return memorySize; }

  public long retiredSize() { return retiredSize; }

  public static long itemSize(RealMatrix data) {
    return 8L * data.getRowDimension() * data.getColumnDimension();
  }

  @Override
  public int put(RealMatrix data) {
    keyCounter++;
    long size = itemSize(data);
    log.debug("inserting array of {} bytes, handle {}", size, keyCounter);

    reserveSpace(size);
    memoryItems.put(keyCounter, new Item(data.copy(), size));
    memorySize += size;
    return keyCounter;
  }

  @Override
  public RealMatrix get(int handle, boolean forceCopy) {
    return residentItem(handle).data.copy();
  }

  @Override
  public RealMatrix getExclusive(int handle) {
    Item item = residentItem(handle);
    pinned.add(handle);

    // the caller may modify the array, so the stored copy becomes stale
    Retired retired = retiredItems.remove(handle);
    if (retired != null) {
      retiredSize -= retired.size;
      dropQuietly(retired.uid);
    }
    return item.data;
  }

  @Override
  public void release(int handle) {
    if (!pinned.remove(handle)) {
      if (!memoryItems.containsKey(handle) && !retiredItems.containsKey(handle))
        throw new NoSuchElementException("no array with handle "+handle+" in cache");
      throw new IllegalStateException("array with handle "+handle+" was not checked out with getExclusive()");
    }
  }

  @Override
  public void remove(int handle) {
    Item item = memoryItems.remove(handle);
    if (item != null) memorySize -= item.size;
    pinned.remove(handle);

    Retired retired = retiredItems.remove(handle);
    if (retired != null) {
      log.debug("removing array with handle {} from storage, uid {}", handle, retired.uid);
      retiredSize -= retired.size;
      dropQuietly(retired.uid);
    }

    if (item == null && retired == null) throw new NoSuchElementException("no array with handle "+handle+" in cache");
  }

  @Override
  public void clear() {
    memoryItems.clear();
    pinned.clear();
    memorySize = 0;

    for (Retired retired: retiredItems.values()) dropQuietly(retired.uid);
    retiredItems.clear();
    retiredSize = 0;
    keyCounter  = 0;
  }

  @Override
  public int size() {
    Set<Integer> handles = new HashSet<>(memoryItems.keySet());
    handles.addAll(retiredItems.keySet());
    return handles.size();
  }

  @Override
  public void close() {
    clear();
  }

  /*
   * Storage of evicted arrays. The layout is the row count, the column count,
   * and the entries in row-major order, all big-endian.
   */

  protected Path storageFile(UUID uid) {
    return directory.resolve(uid.toString()+".bin");
  }

  protected void retire(RealMatrix data, UUID uid) throws IOException {
    try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(storageFile(uid))))) {
      out.writeInt(data.getRowDimension());
      out.writeInt(data.getColumnDimension());
      for (int i=0; i<data.getRowDimension(); i++)
        for (int j=0; j<data.getColumnDimension(); j++) out.writeDouble(data.getEntry(i, j));
    }
  }

  protected RealMatrix restore(UUID uid) throws IOException {
    try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(storageFile(uid))))) {
      int rows = in.readInt();
      int cols = in.readInt();
      RealMatrix data = MatrixUtils.createRealMatrix(rows, cols);
      for (int i=0; i<rows; i++)
        for (int j=0; j<cols; j++) data.setEntry(i, j, in.readDouble());
      return data;
    }
  }

  protected void drop(UUID uid) throws IOException {
    Files.delete(storageFile(uid));
  }

  private void dropQuietly(UUID uid) {
    try {
      drop(uid);
    } catch (IOException ioe) {
      log.warn("could not delete cache storage file for uid {}: {}", uid, ioe.toString());
    }
  }

  private Item residentItem(int handle) {
    Item item = memoryItems.get(handle); // also marks it as most recently used
    if (item != null) return item;

    Retired retired = retiredItems.get(handle);
    if (retired == null) throw new NoSuchElementException("no array with handle "+handle+" in cache");

    // we keep the file, so evicting this array again costs nothing until it is modified
    reserveSpace(retired.size);
    log.debug("restoring array of {} bytes, handle {}, uid {}", retired.size, handle, retired.uid);
    RealMatrix data;
    try {
      data = restore(retired.uid);
    } catch (IOException ioe) {
      throw new UncheckedIOException(ioe);
    }
    item = new Item(data, retired.size);
    memoryItems.put(handle, item);
    memorySize += retired.size;
    return item;
  }

  private void reserveSpace(long size) {
    Iterator<Map.Entry<Integer, Item>> i = memoryItems.entrySet().iterator();
    while (memorySize + size > capacity && i.hasNext()) {
      Map.Entry<Integer, Item> lru = i.next();
      int handle = lru.getKey();
      if (pinned.contains(handle)) continue;

      Item item = lru.getValue();
      if (!retiredItems.containsKey(handle)) {
        UUID uid = UUID.randomUUID();
        log.debug("retiring array of {} bytes, handle {}, to storage with uid {}", item.size, handle, uid);
        try {
          retire(item.data, uid);
        } catch (IOException ioe) {
          throw new UncheckedIOException(ioe);
        }
        retiredItems.put(handle, new Retired(uid, item.size));
        retiredSize += item.size;
      }
      i.remove();
      memorySize -= item.size;
    }
  }
}
