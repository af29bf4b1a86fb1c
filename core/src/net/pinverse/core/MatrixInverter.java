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
 * Encapsulates inverting a matrix iteratively. Implementations are immutable and may be shared.
 */
public interface MatrixInverter {

  /**
   * @param A matrix to invert; never modified
   * @return result whose status explains why there is no inverse, if there isn't one
   */
  InversionResult invert(RealMatrix A);

}
