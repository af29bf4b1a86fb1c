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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the outcome of an inversion.
 */
final class ResultReporter {

  private static final Logger log = LoggerFactory.getLogger(ResultReporter.class);

  private ResultReporter() {
  }

  /**
   * @param algorithm name to use in messages
   * @param result outcome to describe
   * @return {@code result}
   */
  static InversionResult report(String algorithm, InversionResult result) {
    switch (result.getStatus()) {
      case CONVERGED:
        log.info("{} converged after {} iterations (sigma {})", algorithm, result.getIterations(), result.getSigma());
        break;
      case NON_CONVERGENCE:
        log.warn("{} did not converge after {} iterations (sigma {}); increase maxIterations or tolerance",
                 algorithm, result.getIterations(), result.getSigma());
        break;
      case DEGENERATE_NORM:
        log.warn("{} stopped after {} iterations: approximation norm is 0", algorithm, result.getIterations());
        break;
      case NON_SQUARE_MATRIX:
        log.warn("{}: matrix is not square, so has no inverse", algorithm);
        break;
      case SINGULAR_MATRIX:
        log.warn("{}: matrix is singular, so has no inverse", algorithm);
        break;
      case RANK_DEFICIENT:
        log.warn("{}: matrix is of neither full row nor full column rank", algorithm);
        break;
      default:
        throw new IllegalStateException("Unknown status " + result.getStatus());
    }
    return result;
  }

}
