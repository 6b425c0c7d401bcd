/*
Copyright 2026 The Sudokuforge Authors

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package org.sudokuforge.tools;

import org.sudokuforge.core.Grid;
import org.sudokuforge.core.Solver;
import org.sudokuforge.core.UnsolvableException;
import org.sudokuforge.gen.Difficulty;
import org.sudokuforge.gen.PuzzleGenerator;
import org.sudokuforge.gen.PuzzleResult;
import org.sudokuforge.json.GridJson;

import java.io.PrintStream;
import java.util.logging.Logger;

/**
 * Generates a puzzle and prints it as json, or solves one given on the
 * command line.
 */
public class GeneratePuzzle {
  private static final Logger logger = Logger.getLogger(GeneratePuzzle.class.getName());

  static final int USAGE_ERROR = 1;
  static final int UNSOLVABLE = 2;

  public static void main(String[] args) {
    int status = run(args, System.out, System.err);
    if (status != 0) System.exit(status);
  }

  /** Does the work of {@link #main}, returns the exit status. */
  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args.length == 2 && args[0].equals("--solve"))
      return solve(args[1], out, err);
    if (args.length < 1 || args.length > 2)
      return usage(err, "wrong number of arguments");

    Difficulty difficulty;
    try {
      difficulty = Difficulty.fromName(args[0]);
    } catch (IllegalArgumentException e) {
      return usage(err, e.getMessage());
    }
    PuzzleResult result = args.length > 1
        ? PuzzleGenerator.generate(difficulty, args[1])
        : PuzzleGenerator.generate(difficulty);
    out.println(GridJson.toJson(result));
    return 0;
  }

  private static int solve(String flat, PrintStream out, PrintStream err) {
    Grid start;
    try {
      start = Grid.fromString(flat);
    } catch (IllegalArgumentException e) {
      return usage(err, e.getMessage());
    }
    try {
      out.println(GridJson.toJson(Solver.solve(start)));
      return 0;
    } catch (UnsolvableException e) {
      err.println(e.getMessage());
      return UNSOLVABLE;
    }
  }

  private static int usage(PrintStream err, String problem) {
    logger.info("Bad arguments: " + problem);
    err.println("Usage: GeneratePuzzle <easy|medium|hard|expert> [<seed>]");
    err.println("       GeneratePuzzle --solve <81 digits, with . or 0 for blanks>");
    return USAGE_ERROR;
  }
}
