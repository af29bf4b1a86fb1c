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

import com.google.common.primitives.Doubles;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Renders dense matrices as text, either as padded columns for logs or as CSV.
 */
public final class DenseMatrixFormat {

  private static final int PRINT_COLUMN_WIDTH = 12;

  private DenseMatrixFormat() {
  }

  /**
   * @param M matrix to print
   * @return a print-friendly rendering of a matrix, one row per line. Not useful for wide matrices.
   */
  public static String matrixToString(RealMatrix M) {
    StringBuilder result = new StringBuilder();
    int rows = M.getRowDimension();
    int columns = M.getColumnDimension();
    for (int row = 0; row < rows; row++) {
      for (int col = 0; col < columns; col++) {
        if (col > 0) {
          result.append('\t');
        }
        appendWithPadOrTruncate(M.getEntry(row, col), result);
      }
      result.append('\n');
    }
    return result.toString();
  }

  /**
   * @param M matrix to write
   * @return M in CSV form, one row per line, values at full precision
   */
  public static String toCSV(RealMatrix M) {
    StringBuilder result = new StringBuilder();
    for (int row = 0; row < M.getRowDimension(); row++) {
      result.append(Doubles.join(",", M.getRow(row))).append('\n');
    }
    return result.toString();
  }

  private static void appendWithPadOrTruncate(double value, StringBuilder to) {
    String stringValue = Double.toString(value);
    if (value >= 0.0) {
      stringValue = ' ' + stringValue;
    }
    appendWithPadOrTruncate(stringValue, to);
  }

  private static void appendWithPadOrTruncate(CharSequence value, StringBuilder to) {
    int length = value.length();
    if (length >= PRINT_COLUMN_WIDTH) {
      to.append(value, 0, PRINT_COLUMN_WIDTH);
    } else {
      for (int i = length; i < PRINT_COLUMN_WIDTH; i++) {
        to.append(' ');
      }
      to.append(value);
    }
  }

}
