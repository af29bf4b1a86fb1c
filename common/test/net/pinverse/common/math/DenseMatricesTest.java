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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

import net.pinverse.common.PinverseTest;

/**
 * Tests {@link DenseMatrices}.
 */
public final class DenseMatricesTest extends PinverseTest {

  @Test
  public void testInfinityNormIsMaxRowSum() {
    RealMatrix M = new Array2DRowRealMatrix(new double[][] {
        {1.0, -2.0, 3.0},
        {-10.0, 0.0, 0.0},
    });
    // Row sums 6 and 10; column sums 11, 2 and 3
    assertEquals(10.0, DenseMatrices.infinityNorm(M));
    assertEquals(11.0, DenseMatrices.infinityNorm(M.transpose()));
  }

  @Test
  public void testInfinityNormOfZero() {
    assertEquals(0.0, DenseMatrices.infinityNorm(new Array2DRowRealMatrix(3, 2)));
  }

  @Test
  public void testInfinityNormOfNaN() {
    RealMatrix M = new Array2DRowRealMatrix(new double[][] {{1.0, Double.NaN}, {5.0, 5.0}});
    assertNaN(DenseMatrices.infinityNorm(M));
  }

  @Test
  public void testDoubledIdentity() {
    RealMatrix twoI = DenseMatrices.doubledIdentity(3);
    assertArrayEquals(new double[] {2.0, 0.0, 0.0}, twoI.getRow(0));
    assertArrayEquals(new double[] {0.0, 2.0, 0.0}, twoI.getRow(1));
    assertArrayEquals(new double[] {0.0, 0.0, 2.0}, twoI.getRow(2));
  }

  @Test
  public void testResiduals() {
    RealMatrix A = new Array2DRowRealMatrix(new double[][] {{2.0, 0.0}, {0.0, 4.0}});
    RealMatrix inverse = new Array2DRowRealMatrix(new double[][] {{0.5, 0.0}, {0.0, 0.25}});
    assertEquals(0.0, DenseMatrices.rightIdentityResidual(A, inverse));
    assertEquals(0.0, DenseMatrices.leftIdentityResidual(A, inverse));
    assertEquals(0.0, DenseMatrices.penroseResidual(A, inverse));
    RealMatrix wrong = new Array2DRowRealMatrix(new double[][] {{0.5, 0.0}, {0.0, 0.5}});
    assertEquals(1.0, DenseMatrices.rightIdentityResidual(A, wrong));
  }

  @Test
  public void testPenroseResidualOfTallMatrix() {
    // A = [1; 1] has pseudo-inverse [0.5 0.5]
    RealMatrix A = new Array2DRowRealMatrix(new double[][] {{1.0}, {1.0}});
    RealMatrix X = new Array2DRowRealMatrix(new double[][] {{0.5, 0.5}});
    assertEquals(0.0, DenseMatrices.penroseResidual(A, X));
    assertEquals(0.0, DenseMatrices.leftIdentityResidual(A, X));
    // A X is a projection, not the identity
    assertEquals(1.0, DenseMatrices.rightIdentityResidual(A, X));
  }

}
