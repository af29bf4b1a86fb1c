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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.pinverse.common.LangUtils;
import net.pinverse.common.math.DenseMatrices;

/**
 * Applies an {@link UpdateRule} repeatedly, from a starting approximation, until its
 * {@link ConvergenceMonitor} says to stop.
 */
final class IterationEngine {

  private static final Logger log = LoggerFactory.getLogger(IterationEngine.class);

  private final ConvergenceMonitor monitor;
  private final IterationListener listener;

  IterationEngine(ConvergenceMonitor monitor, IterationListener listener) {
    this.monitor = monitor;
    this.listener = listener;
  }

  /**
   * @param A input matrix, not modified
   * @param initial starting point
   * @param rule update to apply
   * @return {@link InversionStatus#CONVERGED}, {@link InversionStatus#NON_CONVERGENCE} or
   *  {@link InversionStatus#DEGENERATE_NORM} result
   */
  InversionResult run(RealMatrix A, InitialApproximation initial, UpdateRule rule) {
    RealMatrix X = initial.getApproximation();
    listener.initialized(initial.getFrobeniusNorm(), initial.getAlpha(), X);

    RealMatrix twoI = rule.doubledIdentityFor(A);
    double sigma = Double.NaN;
    int iterations = 0;

    while (monitor.shouldContinue(iterations, sigma)) {
      double previousNorm = DenseMatrices.infinityNorm(X);
      if (previousNorm == 0.0) {
        log.warn("Approximation has zero norm after {} iterations", iterations);
        return InversionResult.failed(InversionStatus.DEGENERATE_NORM, iterations, sigma);
      }
      RealMatrix next = rule.apply(A, X, twoI);
      iterations++;
      sigma = ConvergenceMonitor.relativeChange(X, previousNorm, next);
      listener.iterationCompleted(iterations, sigma, next);
      X = next;
      if (!LangUtils.isFinite(sigma)) {
        log.warn("Invalid relative change, aborting iteration! {}", sigma);
        return InversionResult.failed(InversionStatus.NON_CONVERGENCE, iterations, sigma);
      }
      log.debug("Finished iteration {}, sigma {}", iterations, sigma);
    }

    if (iterations > 0 && monitor.hasConverged(sigma)) {
      return InversionResult.converged(X, iterations, sigma);
    }
    return InversionResult.failed(InversionStatus.NON_CONVERGENCE, iterations, sigma);
  }

}
