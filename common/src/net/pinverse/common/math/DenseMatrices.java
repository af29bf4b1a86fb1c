/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.pinverse.common.math;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.DefaultRealMatrixPreservingVisitor;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

/**
 * Contains utility methods for dense {@link RealMatrix} instances that Commons Math does not
 * offer directly.
 */
public final class DenseMatrices {

  private DenseMatrices() {
  }

  /**
   * Note that {@link RealMatrix#getNorm()} in Commons Math 3 walks columns and so computes the
   * maximum absolute column sum, despite its documentation.
   *
   * @param M matrix
   * @return infinity norm of M: the maximum absolute row sum
   */
  public static double infinityNorm(RealMatrix M) {
    Preconditions.checkNotNull(M);
    return M.walkInRowOrder(new DefaultRealMatrixPreservingVisitor() {
      private int lastColumn;
      private double rowSum;
      private double maxRowSum;
      @Override
      public void start(int rows, int columns, int startRow, int endRow, int startColumn, int endColumn) {
        lastColumn = endColumn;
        rowSum = 0.0;
        maxRowSum = 0.0;
      }
      @Override
      public void visit(int row, int column, double value) {
        rowSum += FastMath.abs(value);
        if (column == lastColumn) {
          if (rowSum > maxRowSum || Double.isNaN(rowSum)) {
            maxRowSum = rowSum;
          }
          rowSum = 0.0;
        }
      }
      @Override
      public double end() {
        return maxRowSum;
      }
    });
  }

  /**
   * @param dimension size of the identity
   * @return 2I as a newly allocated {@code dimension x dimension} matrix
   */
  public static RealMatrix doubledIdentity(int dimension) {
    return MatrixUtils.createRealIdentityMatrix(dimension).scalarMultiply(2.0);
  }

  /**
   * @return ||A * X - I||, infinity norm, where I has A's row dimension
   */
  public static double rightIdentityResidual(RealMatrix A, RealMatrix X) {
    RealMatrix product = A.multiply(X);
    return infinityNorm(product.subtract(MatrixUtils.createRealIdentityMatrix(product.getRowDimension())));
  }

  /**
   * @return ||X * A - I||, infinity norm, where I has A's column dimension
   */
  public static double leftIdentityResidual(RealMatrix A, RealMatrix X) {
    RealMatrix product = X.multiply(A);
    return infinityNorm(product.subtract(MatrixUtils.createRealIdentityMatrix(product.getRowDimension())));
  }

  /**
   * Measures how far {@code X} is from the Moore-Penrose inverse of {@code A} on the first two
   * Penrose conditions.
   *
   * @return the larger of ||A X A - A|| and ||X A X - X||, infinity norm
   */
  public static double penroseResidual(RealMatrix A, RealMatrix X) {
    double first = infinityNorm(A.multiply(X).multiply(A).subtract(A));
    double second = infinityNorm(X.multiply(A).multiply(X).subtract(X));
    return FastMath.max(first, second);
  }

}
