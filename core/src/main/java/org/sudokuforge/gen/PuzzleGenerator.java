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
package org.sudokuforge.gen;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import org.sudokuforge.core.Grid;
import org.sudokuforge.core.Location;
import org.sudokuforge.core.Solver;

import com.google.common.base.Stopwatch;
import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generates Sudoku puzzles with unique solutions from a difficulty and a seed.
 * Everything random is drawn from one {@link Mulberry32} built from the seed,
 * first to build the solved target grid and then to order the cells for
 * removal, so a given seed and difficulty always produce the same puzzle.
 *
 * <p> The approach: fill a blank grid with a randomized solver, then take
 * away givens one at a time in random order, keeping each removal only if the
 * puzzle still has exactly one solution, until the difficulty's target number
 * of givens is reached or the cells run out.
 */
public final class PuzzleGenerator {
  private static final Logger logger = Logger.getLogger(PuzzleGenerator.class.getName());

  private PuzzleGenerator() {}

  /**
   * Generates a puzzle with a seed taken from the clock.  The seed is part of
   * the result, so the puzzle can be regenerated later.
   */
  public static PuzzleResult generate(Difficulty difficulty) {
    return generate(difficulty, Long.toString(System.currentTimeMillis()));
  }

  /**
   * Generates a puzzle.  The same difficulty and seed always give the same
   * result.
   */
  public static PuzzleResult generate(Difficulty difficulty, String seed) {
    checkNotNull(difficulty);
    checkNotNull(seed);
    Stopwatch stopwatch = Stopwatch.createStarted();

    Random random = Mulberry32.forSeed(seed);
    Grid solution = makeTarget(random);
    Grid puzzle = carve(solution, difficulty.givens(), randomLocations(random));
    PuzzleResult result = new PuzzleResult(seed, puzzle, solution, Fingerprints.of(solution));

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(String.format("Generated %s puzzle with %d givens from seed %s in %d ms",
          difficulty, puzzle.size(), seed, stopwatch.elapsed(MILLISECONDS)));
    }
    return result;
  }

  /** Creates a completely solved grid. */
  public static Grid makeTarget(Random random) {
    return Solver.solve(Grid.BLANK, random);
  }

  /** Returns all locations in random order. */
  public static List<Location> randomLocations(Random random) {
    List<Location> locs = Lists.newArrayList(Location.all());
    Collections.shuffle(locs, random);
    return locs;
  }

  /**
   * Removes givens from the target grid in the given order, skipping any whose
   * removal would leave more than one solution, and stopping once no more than
   * {@code givens} remain.  The result is uniquely solvable as the target.
   */
  public static Grid carve(Grid target, int givens, List<Location> order) {
    checkArgument(target.isSolved(), "target must be a solved grid");
    Grid.Builder builder = target.asBuilder();
    int size = builder.size();
    for (Location loc : order) {
      if (size <= givens) break;
      if (!builder.containsKey(loc)) continue;
      Grid prev = builder.build();
      builder.remove(loc);
      if (Solver.countSolutions(builder.build(), 2) == 1)
        --size;
      else
        builder.reset(prev);
    }
    return builder.build();
  }
}
