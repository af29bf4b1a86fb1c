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

import net.pinverse.common.LangUtils;

/**
 * Encapsulates all configuration for a {@link MatrixInverter}. Defaults may be overridden with
 * system properties {@code inverse.tolerance}, {@code inverse.maxIterations} and {@code inverse.trace}.
 * Inverters copy what they need when constructed, so later changes to an instance do not affect them.
 */
public final class InversionConfiguration {

  public static final double DEFAULT_TOLERANCE = 1.0e-7;
  public static final int DEFAULT_MAX_ITERATIONS = 1000;

  private double tolerance;
  private int maxIterations;
  private boolean trace;
  private IterationListener listener;

  public InversionConfiguration() {
    setTolerance(LangUtils.getDoubleProperty("inverse.tolerance", DEFAULT_TOLERANCE));
    setMaxIterations(LangUtils.getIntProperty("inverse.maxIterations", DEFAULT_MAX_ITERATIONS));
    trace = LangUtils.getBooleanProperty("inverse.trace", false);
  }

  /**
   * @return iteration stops successfully once the relative change between approximations falls
   *  strictly below this. Defaults to {@link #DEFAULT_TOLERANCE}.
   */
  public double getTolerance() {
    return tolerance;
  }

  /**
   * @param tolerance convergence threshold, must be positive and finite
   */
  public void setTolerance(double tolerance) {
    Preconditions.checkArgument(tolerance > 0.0 && LangUtils.isFinite(tolerance),
                                "tolerance must be positive: %s", tolerance);
    this.tolerance = tolerance;
  }

  /**
   * @return maximum number of updates; 0 means no update is applied and the result is
   *  {@link InversionStatus#NON_CONVERGENCE}. Defaults to {@link #DEFAULT_MAX_ITERATIONS}.
   */
  public int getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(int maxIterations) {
    Preconditions.checkArgument(maxIterations >= 0, "maxIterations must be nonnegative: %s", maxIterations);
    this.maxIterations = maxIterations;
  }

  /**
   * @return if true and no explicit listener is set, progress is written to the log by a
   *  {@link LoggingIterationListener}
   */
  public boolean isTrace() {
    return trace;
  }

  public void setTrace(boolean trace) {
    this.trace = trace;
  }

  /**
   * @return explicitly set listener, or {@code null}
   */
  public IterationListener getListener() {
    return listener;
  }

  /**
   * @param listener receives progress; takes precedence over {@link #isTrace()}. May be {@code null}.
   */
  public void setListener(IterationListener listener) {
    this.listener = listener;
  }

  /**
   * @return the listener an inverter should report to given these settings
   */
  IterationListener getEffectiveListener() {
    if (listener != null) {
      return listener;
    }
    return trace ? new LoggingIterationListener() : NullIterationListener.INSTANCE;
  }

  @Override
  public String toString() {
    return "InversionConfiguration[tolerance:" + tolerance + ", maxIterations:" + maxIterations +
        ", trace:" + trace + ']';
  }

}
