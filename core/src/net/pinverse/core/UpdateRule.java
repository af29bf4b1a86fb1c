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

import org.apache.commons.math3.linear.RealMatrix;

import net.pinverse.common.math.DenseMatrices;

/**
 * The two forms of the quadratically convergent update X<sub>k+1</sub> = X<sub>k</sub> (2I - A X<sub>k</sub>).
 * Each application allocates a new matrix and leaves its arguments untouched.
 */
public enum UpdateRule {

  /**
   * X<sub>k+1</sub> = (2I - X<sub>k</sub> A) X<sub>k</sub>, with I of A's column dimension.
   * Used for tall matrices of full column rank.
   */
  LEFT {
    @Override
    int identityDimension(RealMatrix A) {
      return A.getColumnDimension();
    }
    @Override
    RealMatrix apply(RealMatrix A, RealMatrix X, RealMatrix twoI) {
      return twoI.subtract(X.multiply(A)).multiply(X);
    }
  },

  /**
   * X<sub>k+1</sub> = X<sub>k</sub> (2I - A X<sub>k</sub>), with I of A's row dimension.
   * Used for wide or square matrices of full row rank, and for the ordinary inverse.
   */
  RIGHT {
    @Override
    int identityDimension(RealMatrix A) {
      return A.getRowDimension();
    }
    @Override
    RealMatrix apply(RealMatrix A, RealMatrix X, RealMatrix twoI) {
      return X.multiply(twoI.subtract(A.multiply(X)));
    }
  };

  abstract int identityDimension(RealMatrix A);

  /**
   * @param A the input matrix
   * @param X current approximation
   * @param twoI doubled identity from {@link #doubledIdentityFor(RealMatrix)}
   * @return next approximation
   */
  abstract RealMatrix apply(RealMatrix A, RealMatrix X, RealMatrix twoI);

  /**
   * @return 2I of the dimension this rule needs for A
   */
  RealMatrix doubledIdentityFor(RealMatrix A) {
    return DenseMatrices.doubledIdentity(identityDimension(A));
  }

  /**
   * @return the rule to use for a matrix of the given class
   * @throws IllegalArgumentException for {@link RankClass#RANK_DEFICIENT}
   */
  static UpdateRule forRankClass(RankClass rankClass) {
    switch (rankClass) {
      case FULL_COLUMN_RANK:
        return LEFT;
      case FULL_ROW_RANK:
        return RIGHT;
      default:
        throw new IllegalArgumentException("No update rule for " + rankClass);
    }
  }

}
