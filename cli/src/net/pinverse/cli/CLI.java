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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

import com.lexicalscope.jewel.cli.ArgumentValidationException;
import com.lexicalscope.jewel.cli.CliFactory;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.pinverse.common.log.MemoryHandler;
import net.pinverse.common.math.DenseMatrices;
import net.pinverse.common.math.DenseMatrixFormat;
import net.pinverse.common.math.DenseMatrixReader;
import net.pinverse.core.InversionConfiguration;
import net.pinverse.core.InversionResult;
import net.pinverse.core.IterativeInverses;
import net.pinverse.core.LoggingIterationListener;

/**
 * <p>A command-line interface to the iterative inverters. It is run like so:</p>
 *
 * <p>{@code java -cp ... net.pinverse.cli.CLI [options] command [file]}</p>
 *
 * <p>"options" configure an {@link InversionConfiguration}:</p>
 *
 * <ul>
 *   <li>{@code --tolerance}: sets {@link InversionConfiguration#setTolerance(double)}</li>
 *   <li>{@code --maxIterations}: sets {@link InversionConfiguration#setMaxIterations(int)}</li>
 *   <li>{@code --trace}: sets {@link InversionConfiguration#setTrace(boolean)}</li>
 *   <li>{@code --verbose}: log more messages to standard out</li>
 * </ul>
 *
 * <p>"command" is one of:</p>
 *
 * <ul>
 *   <li>{@code pseudoInverse file.csv}: Moore-Penrose inverse of a matrix of full row or column rank</li>
 *   <li>{@code inverse file.csv}: inverse of a square nonsingular matrix</li>
 *   <li>{@code example}: runs both on two small sample matrices, with tracing</li>
 * </ul>
 *
 * <p>Files hold one matrix row per line, values separated by commas. The result is printed in
 * the same format. If there is no result, a single line like {@code SINGULAR_MATRIX (0 iterations)}
 * is printed instead.</p>
 */
public final class CLI {

  private static final Logger log = LoggerFactory.getLogger(CLI.class);

  static final String CORE_PACKAGE = IterativeInverses.class.getPackage().getName();

  static final double[][] EXAMPLE_WIDE = {
      {2.0, 1.0, 1.0, 3.0},
      {1.0, 0.0, 0.0, -1.0},
      {1.0, 1.0, 0.0, 4.0},
  };

  static final double[][] EXAMPLE_SQUARE = {
      {1.0, 2.0, 1.0},
      {0.0, 1.0, 0.0},
      {0.0, 2.0, 2.0},
  };

  private CLI() {
  }

  public static void main(String[] args) {
    run(args, System.out);
  }

  /**
   * @param args command line arguments
   * @param out where results go
   * @return true if the command ran and produced an inverse
   */
  static boolean run(String[] args, PrintStream out) {

    CLIArgs cliArgs;
    try {
      cliArgs = CliFactory.parseArguments(CLIArgs.class, args);
    } catch (ArgumentValidationException ave) {
      printHelp(out, ave.getMessage());
      return false;
    }

    List<String> programArgsList = cliArgs.getCommands();
    if (programArgsList == null || programArgsList.isEmpty()) {
      printHelp(out, "No command specified");
      return false;
    }
    String[] commandArgs = programArgsList.toArray(new String[programArgsList.size()]);

    CLICommand command;
    try {
      command = CLICommand.valueOf(commandArgs[0].toUpperCase(Locale.ENGLISH));
    } catch (IllegalArgumentException iae) {
      printHelp(out, iae.getMessage());
      return false;
    }

    if (cliArgs.isVerbose()) {
      MemoryHandler.setSensibleLogFormat();
      MemoryHandler.enableDebugLoggingIn(CLI.class.getName(), CORE_PACKAGE);
      log.debug("{}", cliArgs);
    }

    InversionConfiguration config;
    try {
      config = buildConfiguration(cliArgs);
    } catch (IllegalArgumentException iae) {
      printHelp(out, iae.getMessage());
      return false;
    }

    try {
      switch (command) {
        case PSEUDOINVERSE:
          return doInvert(commandArgs, config, true, out);
        case INVERSE:
          return doInvert(commandArgs, config, false, out);
        case EXAMPLE:
          return doExample(commandArgs, config, out);
        default:
          throw new IllegalStateException("Unknown command " + command);
      }
    } catch (ArgumentValidationException ave) {
      printHelp(out, ave.getMessage());
      return false;
    } catch (IOException ioe) {
      log.warn("Unable to read input", ioe);
      out.println("Unable to read input: " + ioe.getMessage());
      return false;
    }
  }

  private static boolean doInvert(String[] programArgs,
                                  InversionConfiguration config,
                                  boolean pseudoInverse,
                                  PrintStream out) throws IOException {
    if (programArgs.length != 2) {
      throw new ArgumentValidationException("args are file.csv");
    }
    RealMatrix A = DenseMatrixReader.read(new File(programArgs[1]));
    InversionResult result =
        pseudoInverse ? IterativeInverses.computePseudoInverse(A, config) : IterativeInverses.computeInverse(A, config);
    return output(result, out);
  }

  private static boolean doExample(String[] programArgs, InversionConfiguration config, PrintStream out) {
    if (programArgs.length != 1) {
      throw new ArgumentValidationException("no arguments");
    }
    if (config.getListener() == null) {
      config.setListener(new LoggingIterationListener());
    }

    RealMatrix wide = new Array2DRowRealMatrix(EXAMPLE_WIDE);
    out.println("Pseudo-inverse of");
    out.print(DenseMatrixFormat.matrixToString(wide));
    InversionResult pseudoInverse = IterativeInverses.computePseudoInverse(wide, config);
    boolean ok = output(pseudoInverse, out);
    if (ok) {
      out.println("||A X - I|| = " + DenseMatrices.rightIdentityResidual(wide, pseudoInverse.getInverse()));
    }

    RealMatrix square = new Array2DRowRealMatrix(EXAMPLE_SQUARE);
    out.println("Inverse of");
    out.print(DenseMatrixFormat.matrixToString(square));
    InversionResult inverse = IterativeInverses.computeInverse(square, config);
    if (output(inverse, out)) {
      out.println("||A X - I|| = " + DenseMatrices.rightIdentityResidual(square, inverse.getInverse()));
    } else {
      ok = false;
    }
    return ok;
  }

  private static boolean output(InversionResult result, PrintStream out) {
    if (result.isConverged()) {
      out.print(DenseMatrixFormat.toCSV(result.getInverse()));
      return true;
    }
    out.println(result.getStatus() + " (" + result.getIterations() + " iterations)");
    return false;
  }

  private static InversionConfiguration buildConfiguration(CLIArgs cliArgs) {
    InversionConfiguration config = new InversionConfiguration();
    config.setTolerance(cliArgs.getTolerance());
    config.setMaxIterations(cliArgs.getMaxIterations());
    config.setTrace(cliArgs.isTrace());
    return config;
  }

  private static void printHelp(PrintStream out, String message) {
    out.println();
    out.println("Iterative matrix inversion command line interface.");
    out.println("Usage: [--tolerance t] [--maxIterations n] [--trace] [--verbose] " +
                "(pseudoInverse file.csv | inverse file.csv | example)");
    out.println();
    if (message != null) {
      out.println(message);
      out.println();
    }
  }

}
