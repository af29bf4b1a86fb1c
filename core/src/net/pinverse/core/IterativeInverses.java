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

/**
 * Entry points for computing inverses without factorization.
 */
public final class IterativeInverses {

  private IterativeInverses() {
  }

  /**
   * Like {@link #computePseudoInverse(RealMatrix, InversionConfiguration)} with default configuration.
   */
  public static InversionResult computePseudoInverse(RealMatrix A) {
    return computePseudoInverse(A, new InversionConfiguration());
  }

  /**
   * @param A m x n matrix of full row or full column rank
   * @param config tolerance, iteration cap and trace settings
   * @return n x m Moore-Penrose inverse if converged
   * @see BenIsraelPseudoInverter
   */
  public static InversionResult computePseudoInverse(RealMatrix A, InversionConfiguration config) {
    return new BenIsraelPseudoInverter(config).invert(A);
  }

  /**
   * Like {@link #computeInverse(RealMatrix, InversionConfiguration)} with default configuration.
   */
  public static InversionResult computeInverse(RealMatrix A) {
    return computeInverse(A, new InversionConfiguration());
  }

  /**
   * @param A square nonsingular matrix
   * @param config tolerance, iteration cap and trace settings
   * @return inverse of A if converged
   * @see SchultzInverter
   */
  public static InversionResult computeInverse(RealMatrix A, InversionConfiguration config) {
    return new SchultzInverter(config).invert(A);
  }

}
