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

/**
 * Thrown by {@link InversionResult#getInverse()} when there is no inverse to return.
 */
public final class InversionException extends RuntimeException {

  private final InversionStatus status;
  private final int iterations;

  public InversionException(InversionStatus status, int iterations) {
    super(status + " after " + iterations + " iterations");
    this.status = status;
    this.iterations = iterations;
  }

  public InversionStatus getStatus() {
    return status;
  }

  public int getIterations() {
    return iterations;
  }

}
