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

package net.pinverse.core;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

import net.pinverse.common.PinverseTest;

public final class IterativeInversesTest extends PinverseTest {

  @Test
  public void testWideExample() {
    RealMatrix A = new Array2DRowRealMatrix(new double[][] {
        {2.0, 1.0, 1.0, 3.0},
        {1.0, 0.0, 0.0, -1.0},
        {1.0, 1.0, 0.0, 4.0},
    });
    InversionResult result = IterativeInverses.computePseudoInverse(A);
    assertSame(InversionStatus.CONVERGED, result.getStatus());
    assertIdentity(A.multiply(result.getInverse()), 1.0e-6);
  }

  @Test
  public void testSquareExample() {
    RealMatrix A = new Array2DRowRealMatrix(new double[][] {
        {1.0, 2.0, 1.0},
        {0.0, 1.0, 0.0},
        {0.0, 2.0, 2.0},
    });
    InversionResult result = IterativeInverses.computeInverse(A);
    assertSame(InversionStatus.CONVERGED, result.getStatus());
    assertIdentity(A.multiply(result.getInverse()), 1.0e-6);
  }

  @Test
  public void testFailuresAreValues() {
    RealMatrix wide = new Array2DRowRealMatrix(new double[][] {{1.0, 2.0, 3.0}, {2.0, 4.0, 6.0}});
    assertSame(InversionStatus.NON_SQUARE_MATRIX, IterativeInverses.computeInverse(wide).getStatus());
    assertSame(InversionStatus.RANK_DEFICIENT, IterativeInverses.computePseudoInverse(wide).getStatus());
    RealMatrix singular = new Array2DRowRealMatrix(new double[][] {{1.0, 2.0}, {2.0, 4.0}});
    assertSame(InversionStatus.SINGULAR_MATRIX, IterativeInverses.computeInverse(singular).getStatus());
  }

  @Test
  public void testLooseTolerance() {
    RealMatrix A = new Array2DRowRealMatrix(new double[][] {{1.0, 2.0}, {3.0, 4.0}});
    InversionConfiguration loose = new InversionConfiguration();
    loose.setTolerance(1.0e-2);
    InversionResult looseResult = IterativeInverses.computeInverse(A, loose);
    InversionResult tightResult = IterativeInverses.computeInverse(A);
    assertTrue(looseResult.isConverged());
    assertTrue(tightResult.isConverged());
    assertTrue(looseResult.getIterations() < tightResult.getIterations());
  }

  @Test(expected = NullPointerException.class)
  public void testNullMatrix() {
    IterativeInverses.computeInverse(null);
  }

}
