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
 * Outcome of one call to a {@link MatrixInverter}: an {@link InversionStatus}, the approximation when
 * the status is {@link InversionStatus#CONVERGED}, the number of updates performed and the last
 * relative change observed.
 */
public final class InversionResult {

  private final InversionStatus status;
  private final RealMatrix inverse;
  private final int iterations;
  private final double sigma;

  private InversionResult(InversionStatus status, RealMatrix inverse, int iterations, double sigma) {
    this.status = status;
    this.inverse = inverse;
    this.iterations = iterations;
    this.sigma = sigma;
  }

  static InversionResult converged(RealMatrix inverse, int iterations, double sigma) {
    Preconditions.checkNotNull(inverse);
    return new InversionResult(InversionStatus.CONVERGED, inverse, iterations, sigma);
  }

  static InversionResult failed(InversionStatus status, int iterations, double sigma) {
    Preconditions.checkArgument(status != InversionStatus.CONVERGED);
    return new InversionResult(status, null, iterations, sigma);
  }

  static InversionResult rejected(InversionStatus status) {
    Preconditions.checkArgument(status.isRejectedInput(), "Not a rejection: %s", status);
    return new InversionResult(status, null, 0, Double.NaN);
  }

  public InversionStatus getStatus() {
    return status;
  }

  public boolean isConverged() {
    return status == InversionStatus.CONVERGED;
  }

  /**
   * @return the converged approximation
   * @throws InversionException if the status is not {@link InversionStatus#CONVERGED}
   */
  public RealMatrix getInverse() {
    if (inverse == null) {
      throw new InversionException(status, iterations);
    }
    return inverse;
  }

  /**
   * @return number of updates applied, 0 if input was rejected
   */
  public int getIterations() {
    return iterations;
  }

  /**
   * @return relative change of the last update, or {@link Double#NaN} if no update was applied
   */
  public double getSigma() {
    return sigma;
  }

  @Override
  public String toString() {
    return status + " (" + iterations + " iterations, sigma " + sigma + ')';
  }

}
