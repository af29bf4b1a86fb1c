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

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which {@link RankClass} a matrix falls in. Rank comes from Commons Math's
 * {@link SingularValueDecomposition}, with its default tolerance.
 */
public final class RankClassifier {

  private static final Logger log = LoggerFactory.getLogger(RankClassifier.class);

  private RankClassifier() {
  }

  /**
   * @param A m x n matrix
   * @return {@link RankClass#FULL_COLUMN_RANK} if m &gt; n and rank is n; {@link RankClass#FULL_ROW_RANK}
   *  if m &lt;= n and rank is m; {@link RankClass#RANK_DEFICIENT} otherwise
   */
  public static RankClass classify(RealMatrix A) {
    Preconditions.checkNotNull(A);
    return classify(A.getRowDimension(), A.getColumnDimension(), rank(A));
  }

  /**
   * @param A m x n matrix
   * @return numerical rank of A. The SVD tolerance scales with the largest singular value, so
   *  multiplying A by a nonzero constant does not change the result.
   */
  static int rank(RealMatrix A) {
    int rank = new SingularValueDecomposition(A).getRank();
    log.debug("{} x {} matrix has rank {}", A.getRowDimension(), A.getColumnDimension(), rank);
    return rank;
  }

  static RankClass classify(int rows, int columns, int rank) {
    if (rows > columns) {
      return rank == columns ? RankClass.FULL_COLUMN_RANK : RankClass.RANK_DEFICIENT;
    }
    return rank == rows ? RankClass.FULL_ROW_RANK : RankClass.RANK_DEFICIENT;
  }

}
