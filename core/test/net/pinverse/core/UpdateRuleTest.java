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

public final class UpdateRuleTest extends PinverseTest {

  private static final RealMatrix TALL = new Array2DRowRealMatrix(new double[][] {{1.0}, {1.0}});
  private static final RealMatrix TALL_PINV = new Array2DRowRealMatrix(new double[][] {{0.5, 0.5}});

  @Test
  public void testIdentityDimensions() {
    assertEquals(1, UpdateRule.LEFT.doubledIdentityFor(TALL).getRowDimension());
    assertEquals(2, UpdateRule.RIGHT.doubledIdentityFor(TALL).getRowDimension());
  }

  @Test
  public void testPseudoInverseIsFixedPoint() {
    RealMatrix twoI = UpdateRule.LEFT.doubledIdentityFor(TALL);
    assertMatrixEquals(TALL_PINV, UpdateRule.LEFT.apply(TALL, TALL_PINV, twoI), 0.0);
    RealMatrix wide = TALL.transpose();
    RealMatrix widePinv = TALL_PINV.transpose();
    assertMatrixEquals(widePinv,
                       UpdateRule.RIGHT.apply(wide, widePinv, UpdateRule.RIGHT.doubledIdentityFor(wide)),
                       0.0);
  }

  @Test
  public void testScalarStep() {
    // x' = x (2 - a x) with a = 4, x = 0.2: 0.2 * 1.2 = 0.24
    RealMatrix A = new Array2DRowRealMatrix(new double[][] {{4.0}});
    RealMatrix X = new Array2DRowRealMatrix(new double[][] {{0.2}});
    RealMatrix next = UpdateRule.RIGHT.apply(A, X, UpdateRule.RIGHT.doubledIdentityFor(A));
    assertEquals(0.24, next.getEntry(0, 0));
    next = UpdateRule.LEFT.apply(A, X, UpdateRule.LEFT.doubledIdentityFor(A));
    assertEquals(0.24, next.getEntry(0, 0));
  }

  @Test
  public void testArgumentsUnchanged() {
    RealMatrix A = new Array2DRowRealMatrix(new double[][] {{1.0, 2.0}, {3.0, 4.0}});
    RealMatrix X = new Array2DRowRealMatrix(new double[][] {{0.1, 0.2}, {0.3, 0.4}});
    RealMatrix ACopy = A.copy();
    RealMatrix XCopy = X.copy();
    for (UpdateRule rule : UpdateRule.values()) {
      RealMatrix twoI = rule.doubledIdentityFor(A);
      RealMatrix next = rule.apply(A, X, twoI);
      assertNotSame(X, next);
      assertEquals(ACopy, A);
      assertEquals(XCopy, X);
      assertEquals(rule.doubledIdentityFor(A), twoI);
    }
  }

  @Test
  public void testForRankClass() {
    assertSame(UpdateRule.LEFT, UpdateRule.forRankClass(RankClass.FULL_COLUMN_RANK));
    assertSame(UpdateRule.RIGHT, UpdateRule.forRankClass(RankClass.FULL_ROW_RANK));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoRuleForRankDeficient() {
    UpdateRule.forRankClass(RankClass.RANK_DEFICIENT);
  }

}
