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
 * Receives progress of an iterative inversion. Implementations observe only: they must not modify the
 * matrices passed to them, and nothing they do affects the result.
 */
public interface IterationListener {

  /**
   * Called once, after the starting approximation is built and before the first update.
   *
   * @param frobeniusNorm Frobenius norm of the input
   * @param alpha scale applied to the input's transpose
   * @param initialApproximation X<sub>0</sub>
   */
  void initialized(double frobeniusNorm, double alpha, RealMatrix initialApproximation);

  /**
   * Called after every update.
   *
   * @param iteration 1-based index of the update just applied
   * @param sigma relative change in this update
   * @param approximation the new approximation
   */
  void iterationCompleted(int iteration, double sigma, RealMatrix approximation);

}
