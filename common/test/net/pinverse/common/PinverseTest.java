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

package net.pinverse.common;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.BeforeClass;

import net.pinverse.common.log.MemoryHandler;
import net.pinverse.common.math.DenseMatrices;

public abstract class PinverseTest extends Assert {

  private static final double DOUBLE_EPSILON = 1.0e-12;

  private File testTempDir;

  public static void assertEquals(double expected, double actual) {
    Assert.assertEquals(expected, actual, DOUBLE_EPSILON);
  }

  public static void assertEquals(String message, double expected, double actual) {
    Assert.assertEquals(message, expected, actual, DOUBLE_EPSILON);
  }

  public static void assertArrayEquals(double[] expecteds, double[] actuals) {
    Assert.assertArrayEquals(expecteds, actuals, DOUBLE_EPSILON);
  }

  /**
   * Asserts that two matrices have the same shape and that the infinity norm of their difference
   * is at most {@code epsilon}.
   */
  public static void assertMatrixEquals(RealMatrix expected, RealMatrix actual, double epsilon) {
    assertEquals("rows", expected.getRowDimension(), actual.getRowDimension());
    assertEquals("columns", expected.getColumnDimension(), actual.getColumnDimension());
    double difference = DenseMatrices.infinityNorm(expected.subtract(actual));
    assertTrue("Matrices differ by " + difference, difference <= epsilon);
  }

  public static void assertIdentity(RealMatrix actual, double epsilon) {
    assertTrue("Not square", actual.isSquare());
    assertMatrixEquals(MatrixUtils.createRealIdentityMatrix(actual.getRowDimension()), actual, epsilon);
  }

  protected static void assertNaN(double d) {
    assertTrue("Expected NaN but got " + d, Double.isNaN(d));
  }

  @BeforeClass
  public static void setUpClass() {
    MemoryHandler.setSensibleLogFormat();
  }

  @Before
  public void setUp() throws Exception {
    testTempDir = null;
  }

  @After
  public void tearDown() throws Exception {
    if (testTempDir != null) {
      MoreFiles.deleteRecursively(testTempDir.toPath(), RecursiveDeleteOption.ALLOW_INSECURE);
    }
  }

  protected final synchronized File getTestTempDir() throws IOException {
    if (testTempDir == null) {
      testTempDir = Files.createTempDirectory("pinverse").toFile();
      testTempDir.deleteOnExit();
    }
    return testTempDir;
  }

}
