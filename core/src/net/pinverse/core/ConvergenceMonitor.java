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

import net.pinverse.common.math.DenseMatrices;

/**
 * Decides when iteration stops. The measure of progress is
 * sigma = ||X<sub>k+1</sub> - X<sub>k</sub>|| / ||X<sub>k</sub>||, infinity norm. Iteration continues while
 * sigma &gt;= tolerance and fewer than the maximum number of updates were applied. Success requires
 * sigma strictly below tolerance, so a sigma exactly at tolerance keeps iterating.
 */
final class ConvergenceMonitor {

  private final double tolerance;
  private final int maxIterations;

  ConvergenceMonitor(double tolerance, int maxIterations) {
    Preconditions.checkArgument(tolerance > 0.0, "tolerance must be positive: %s", tolerance);
    Preconditions.checkArgument(maxIterations >= 0, "maxIterations must be nonnegative: %s", maxIterations);
    this.tolerance = tolerance;
    this.maxIterations = maxIterations;
  }

  /**
   * @param iterations updates applied so far
   * @param sigma last relative change; ignored when no update has been applied
   * @return true if another update should be applied
   */
  boolean shouldContinue(int iterations, double sigma) {
    if (iterations >= maxIterations) {
      return false;
    }
    return iterations == 0 || sigma >= tolerance;
  }

  /**
   * @return true if sigma is strictly below tolerance; false for {@link Double#NaN}
   */
  boolean hasConverged(double sigma) {
    return sigma < tolerance;
  }

  /**
   * @param previous X<sub>k</sub>
   * @param previousNorm infinity norm of {@code previous}, which must be nonzero
   * @param next X<sub>k+1</sub>
   * @return sigma
   */
  static double relativeChange(RealMatrix previous, double previousNorm, RealMatrix next) {
    Preconditions.checkArgument(previousNorm != 0.0, "Zero norm");
    return DenseMatrices.infinityNorm(next.subtract(previous)) / previousNorm;
  }

}
