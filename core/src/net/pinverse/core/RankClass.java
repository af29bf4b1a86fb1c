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

/**
 * How an input matrix's rank relates to its shape, which decides the form of the
 * generalized inverse iteration.
 *
 * @see RankClassifier
 */
public enum RankClass {

  /** Rank equals the row count; rows do not outnumber columns. The square nonsingular case lands here. */
  FULL_ROW_RANK,

  /** Rank equals the column count, and there are more rows than columns. */
  FULL_COLUMN_RANK,

  /** Rank is less than the smaller dimension. */
  RANK_DEFICIENT

}
