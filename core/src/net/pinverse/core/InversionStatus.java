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
 * The terminal state of one inversion. Exactly one is reached per call.
 */
public enum InversionStatus {

  /** The relative change fell below tolerance; an approximation is available. */
  CONVERGED(false),

  /** An ordinary inverse was requested for a non-square matrix. */
  NON_SQUARE_MATRIX(true),

  /** An ordinary inverse was requested for a square matrix of less than full rank, so determinant 0. */
  SINGULAR_MATRIX(true),

  /** A generalized inverse was requested for a matrix of neither full row nor full column rank. */
  RANK_DEFICIENT(true),

  /** The iteration cap was reached, or the relative change stopped being finite. */
  NON_CONVERGENCE(false),

  /** An approximation's infinity norm was 0, so the relative change is undefined. */
  DEGENERATE_NORM(false);

  private final boolean rejectedInput;

  InversionStatus(boolean rejectedInput) {
    this.rejectedInput = rejectedInput;
  }

  /**
   * @return true if this status means the input was rejected before any iteration
   */
  public boolean isRejectedInput() {
    return rejectedInput;
  }

}
