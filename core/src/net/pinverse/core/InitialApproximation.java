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

/**
 * The starting point of both iterations: X<sub>0</sub> = alpha * A<sup>T</sup>, where
 * alpha = 1.8 / ||A||<sub>F</sub><sup>2</sup>. Any alpha in (0, 2 / sigma<sub>max</sub><sup>2</sup>)
 * converges; since ||A||<sub>F</sub> bounds sigma<sub>max</sub> this choice always qualifies.
 */
public final class InitialApproximation {

  static final double ALPHA_NUMERATOR = 1.8;

  private final double frobeniusNorm;
  private final double alpha;
  private final RealMatrix approximation;

  InitialApproximation(double frobeniusNorm, double alpha, RealMatrix approximation) {
    this.frobeniusNorm = frobeniusNorm;
    this.alpha = alpha;
    this.approximation = approximation;
  }

  /**
   * @param A matrix to (pseudo-)invert; must not be all zeroes
   * @return scaled transpose of A
   */
  public static InitialApproximation of(RealMatrix A) {
    Preconditions.checkNotNull(A);
    double frobeniusNorm = A.getFrobeniusNorm();
    Preconditions.checkArgument(frobeniusNorm > 0.0, "Zero matrix has no starting point");
    double alpha = ALPHA_NUMERATOR / (frobeniusNorm * frobeniusNorm);
    return new InitialApproximation(frobeniusNorm, alpha, A.transpose().scalarMultiply(alpha));
  }

  public double getFrobeniusNorm() {
    return frobeniusNorm;
  }

  public double getAlpha() {
    return alpha;
  }

  /**
   * @return X<sub>0</sub>, with the shape of A<sup>T</sup>
   */
  public RealMatrix getApproximation() {
    return approximation;
  }

}
