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

import java.util.List;

import com.lexicalscope.jewel.cli.Option;
import com.lexicalscope.jewel.cli.Unparsed;

/**
 * Command line argument object for {@link CLI}.
 */
public interface CLIArgs {

  @Option(description = "Verbose logging")
  boolean isVerbose();

  @Option(description = "Log the relative change and approximation after every iteration")
  boolean isTrace();

  @Option(defaultValue = "1.0e-7", description = "Stop once the relative change falls below this")
  double getTolerance();

  @Option(defaultValue = "1000", description = "Maximum number of iterations")
  int getMaxIterations();

  @Option(helpRequest = true)
  boolean getHelp();

  @Unparsed
  List<String> getCommands();

}
