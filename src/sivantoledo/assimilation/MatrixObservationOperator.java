package sivantoledo.assimilation;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * A linear observation operator given by an explicit k by n matrix.
 */
public class MatrixObservationOperator implements ObservationOperator {

  private final RealMatrix H;

  public MatrixObservationOperator(double[][] H) {
    this(MatrixUtils.createRealMatrix(H));
  }

  public MatrixObservationOperator(RealMatrix H) {
    this.H = H;
  }

  @Override
  public int observationCount() { return H.getRowDimension(); }

  @Override
  public int stateDimension() { return H.getColumnDimension(); }

  @Override
  public RealVector apply(RealVector x) {
    return H.operate(x);
  }

  @Override
  public RealMatrix apply(RealMatrix X) {
    if (X.getRowDimension() != H.getColumnDimension()) throw new DimensionMismatchException(X.getRowDimension(), H.getColumnDimension());
    return H.multiply(X);
  }

  @Override
  public MatrixObservationOperator localize(int[] indices) {
    int[] columns = new int[ H.getColumnDimension() ];
    for (int j=0; j<columns.length; j++) columns[j] = j;
    return new MatrixObservationOperator(H.getSubMatrix(indices, columns));
  }

  @Override
  public RealMatrix toMatrix() {
    return H.copy();
  }

  @Override
  public String toString() { return "H="+Ensemble.toString(H.getData(),"%.3e"); };
}
