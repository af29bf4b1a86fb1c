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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the inverse of a square nonsingular matrix by the Schultz iteration
 * X<sub>k+1</sub> = X<sub>k</sub> (2I - A X<sub>k</sub>), from X<sub>0</sub> = 1.8 A<sup>T</sup> / ||A||<sub>F</sub><sup>2</sup>.
 */
public final class SchultzInverter implements MatrixInverter {

  private static final Logger log = LoggerFactory.getLogger(SchultzInverter.class);

  private static final String NAME = "Schultz iteration";

  private final double tolerance;
  private final int maxIterations;
  private final IterationListener listener;

  public SchultzInverter() {
    this(new InversionConfiguration());
  }

  public SchultzInverter(InversionConfiguration config) {
    Preconditions.checkNotNull(config);
    this.tolerance = config.getTolerance();
    this.maxIterations = config.getMaxIterations();
    this.listener = config.getEffectiveListener();
  }

  @Override
  public InversionResult invert(RealMatrix A) {
    Preconditions.checkNotNull(A);
    if (!A.isSquare()) {
      return ResultReporter.report(NAME, InversionResult.rejected(InversionStatus.NON_SQUARE_MATRIX));
    }
    int rank = RankClassifier.rank(A);
    if (rank < A.getRowDimension()) {
      log.debug("Rank {} is less than dimension {}", rank, A.getRowDimension());
      return ResultReporter.report(NAME, InversionResult.rejected(InversionStatus.SINGULAR_MATRIX));
    }
    IterationEngine engine = new IterationEngine(new ConvergenceMonitor(tolerance, maxIterations), listener);
    return ResultReporter.report(NAME, engine.run(A, InitialApproximation.of(A), UpdateRule.RIGHT));
  }

}
