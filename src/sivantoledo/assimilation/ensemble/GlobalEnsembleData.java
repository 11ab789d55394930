package sivantoledo.assimilation.ensemble;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Products of the observation operator with the global ensemble, computed
 * once per assimilation and shared by all local analyses.
 *
 * Every array has one row per observation, so the data of a local analysis
 * is obtained by selecting the rows of the observations it uses.
 */
public final class GlobalEnsembleData {

  private final List<RealMatrix> arrays;

  public GlobalEnsembleData(RealMatrix... arrays) {
    List<RealMatrix> list = new ArrayList<>(arrays.length);
    for (RealMatrix a: arrays) {
      if (a.getRowDimension() != arrays[0].getRowDimension())
        throw new DimensionMismatchException(a.getRowDimension(), arrays[0].getRowDimension());
      list.add(a);
    }
    this.arrays = Collections.unmodifiableList(list);
  }

  public RealMatrix get(int i) { return arrays.get(i); }

  public int size() { return arrays.size(); }

  /**
   * @param indices indices of the observations to keep
   * @return the same data restricted to the given observations
   */
  public GlobalEnsembleData localize(int[] indices) {
    RealMatrix[] selected = new RealMatrix[ arrays.size() ];
    for (int i=0; i<selected.length; i++) {
      RealMatrix a = arrays.get(i);
      int[] columns = new int[ a.getColumnDimension() ];
      for (int j=0; j<columns.length; j++) columns[j] = j;
      selected[i] = a.getSubMatrix(indices, columns);
    }
    return new GlobalEnsembleData(selected);
  }
}
