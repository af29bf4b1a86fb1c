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
 * <p>Computes the Moore-Penrose generalized inverse A<sup>+</sup> of an m x n matrix A by the
 * Ben-Israel iteration. A must have full row rank or full column rank.</p>
 *
 * <p>A tall matrix of full column rank uses X<sub>k+1</sub> = (2I - X<sub>k</sub> A) X<sub>k</sub>; otherwise
 * X<sub>k+1</sub> = X<sub>k</sub> (2I - A X<sub>k</sub>). Starting from
 * X<sub>0</sub> = 1.8 A<sup>T</sup> / ||A||<sub>F</sub><sup>2</sup> both converge quadratically.</p>
 */
public final class BenIsraelPseudoInverter implements MatrixInverter {

  private static final String NAME = "Ben-Israel iteration";

  private final double tolerance;
  private final int maxIterations;
  private final IterationListener listener;

  public BenIsraelPseudoInverter() {
    this(new InversionConfiguration());
  }

  public BenIsraelPseudoInverter(InversionConfiguration config) {
    Preconditions.checkNotNull(config);
    this.tolerance = config.getTolerance();
    this.maxIterations = config.getMaxIterations();
    this.listener = config.getEffectiveListener();
  }

  @Override
  public InversionResult invert(RealMatrix A) {
    Preconditions.checkNotNull(A);
    RankClass rankClass = RankClassifier.classify(A);
    if (rankClass == RankClass.RANK_DEFICIENT) {
      return ResultReporter.report(NAME, InversionResult.rejected(InversionStatus.RANK_DEFICIENT));
    }
    IterationEngine engine = new IterationEngine(new ConvergenceMonitor(tolerance, maxIterations), listener);
    InversionResult result =
        engine.run(A, InitialApproximation.of(A), UpdateRule.forRankClass(rankClass));
    return ResultReporter.report(NAME, result);
  }

}
