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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.google.common.io.Files;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.pinverse.common.LangUtils;

/**
 * Reads a dense matrix from CSV text: one row per line, values separated by commas. Blank lines
 * and lines starting with {@code #} are skipped.
 */
public final class DenseMatrixReader {

  private static final Logger log = LoggerFactory.getLogger(DenseMatrixReader.class);

  private static final Splitter COMMA = Splitter.on(',').trimResults();

  private DenseMatrixReader() {
  }

  /**
   * @param file CSV file to read
   * @return matrix in the file
   * @throws IOException if the file can't be read, or does not contain a rectangular matrix of finite numbers
   */
  public static RealMatrix read(File file) throws IOException {
    log.info("Reading {}", file);
    List<String> lines = Files.asCharSource(file, StandardCharsets.UTF_8).readLines();
    try {
      return parse(lines);
    } catch (IllegalArgumentException iae) { // includes NumberFormatException
      throw new IOException("Bad matrix in " + file + ": " + iae.getMessage(), iae);
    }
  }

  /**
   * @param lines CSV lines
   * @return matrix described by the lines
   * @throws IllegalArgumentException if rows have differing lengths, there are no rows, or a value is not
   *  a finite number
   */
  public static RealMatrix parse(Iterable<String> lines) {
    List<double[]> rows = Lists.newArrayList();
    int columns = -1;
    int lineNumber = 0;
    for (String line : lines) {
      lineNumber++;
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.charAt(0) == '#') {
        continue;
      }
      List<String> tokens = COMMA.splitToList(trimmed);
      if (columns < 0) {
        columns = tokens.size();
      } else if (tokens.size() != columns) {
        throw new IllegalArgumentException(
            "Line " + lineNumber + " has " + tokens.size() + " values, expected " + columns);
      }
      double[] row = new double[columns];
      for (int i = 0; i < columns; i++) {
        row[i] = LangUtils.parseDouble(tokens.get(i));
      }
      rows.add(row);
    }
    if (rows.isEmpty()) {
      throw new IllegalArgumentException("No matrix rows");
    }
    return new Array2DRowRealMatrix(rows.toArray(new double[rows.size()][]), false);
  }

}
