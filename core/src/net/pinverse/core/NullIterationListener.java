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
 * Ignores all progress.
 */
public final class NullIterationListener implements IterationListener {

  public static final IterationListener INSTANCE = new NullIterationListener();

  private NullIterationListener() {
  }

  @Override
  public void initialized(double frobeniusNorm, double alpha, RealMatrix initialApproximation) {
    // do nothing
  }

  @Override
  public void iterationCompleted(int iteration, double sigma, RealMatrix approximation) {
    // do nothing
  }

}
