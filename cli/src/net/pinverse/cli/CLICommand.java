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

package net.pinverse.cli;

/**
 * Commands understood by {@link CLI}.
 */
enum CLICommand {

  /** Moore-Penrose inverse of the matrix in a CSV file, by the Ben-Israel iteration. */
  PSEUDOINVERSE,

  /** Inverse of the square matrix in a CSV file, by the Schultz iteration. */
  INVERSE,

  /** Runs both iterations on built-in sample matrices. */
  EXAMPLE

}
