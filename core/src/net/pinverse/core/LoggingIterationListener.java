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

import net.pinverse.common.math.DenseMatrixFormat;

/**
 * Writes progress to the log at INFO: the starting point, then the index, relative change and
 * approximation of each update.
 */
public final class LoggingIterationListener implements IterationListener {

  private static final Logger log = LoggerFactory.getLogger(LoggingIterationListener.class);

  @Override
  public void initialized(double frobeniusNorm, double alpha, RealMatrix initialApproximation) {
    if (log.isInfoEnabled()) {
      log.info("Frobenius norm {}, alpha {}, initial approximation:\n{}",
               frobeniusNorm, alpha, DenseMatrixFormat.matrixToString(initialApproximation));
    }
  }

  @Override
  public void iterationCompleted(int iteration, double sigma, RealMatrix approximation) {
    if (log.isInfoEnabled()) {
      log.info("Iteration {}: sigma {}\n{}", iteration, sigma, DenseMatrixFormat.matrixToString(approximation));
    }
  }

}
