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
package org.sudokuforge.core;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Random;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A depth-first, backtracking Sudoku solver.  Cells are visited in row-major
 * order; at each empty cell the candidates are tried in ascending order, or
 * in an order drawn from a caller-supplied {@link Random}.  Every tentative
 * placement is gated by a check of the 27 cells in the target's row, column
 * and block.
 *
 * <p> The solver never touches the grids it is given: each search runs on its
 * own copy.  Instances are immutable and may be shared; the static methods use
 * an instance with no step budget.
 */
@Immutable
public final class Solver {

  /** The solution count at which {@link #countSolutions(Grid)} stops looking. */
  public static final int DEFAULT_LIMIT = 2;

  private static final Solver UNLIMITED = new Solver(Long.MAX_VALUE);

  private final long maxSteps;

  private Solver(long maxSteps) {
    this.maxSteps = maxSteps;
  }

  /**
   * Returns a solver that abandons any search taking more than the given
   * number of placements, by throwing {@link StepLimitExceededException}.
   * Searches that finish within the budget give the same answers as the
   * unlimited solver.
   */
  public static Solver withMaxSteps(long maxSteps) {
    checkArgument(maxSteps > 0, "maxSteps must be positive: %s", maxSteps);
    return new Solver(maxSteps);
  }

  /**
   * Solves the given grid, trying candidates in ascending order, so repeated
   * solves of the same grid give the same answer.
   *
   * @throws UnsolvableException if the grid has no valid completion
   */
  public static Grid solve(Grid start) {
    return UNLIMITED.solution(start, null);
  }

  /**
   * Solves the given grid, trying each cell's candidates in an order shuffled
   * with the given random source.  Solving a blank grid this way produces a
   * random solved grid that is reproducible for a reproducible source.
   *
   * @throws UnsolvableException if the grid has no valid completion
   */
  public static Grid solve(Grid start, Random random) {
    return UNLIMITED.solution(start, checkNotNull(random));
  }

  /**
   * Counts the solutions to the given grid, stopping once {@link
   * #DEFAULT_LIMIT} have been found.
   */
  public static int countSolutions(Grid start) {
    return countSolutions(start, DEFAULT_LIMIT);
  }

  /**
   * Counts the solutions to the given grid, stopping as soon as the count
   * reaches the given limit.  The answer is in [0, limit].
   */
  public static int countSolutions(Grid start, int limit) {
    return UNLIMITED.result(start, limit).numSolutions;
  }

  /** Tells whether the given grid has exactly one solution. */
  public static boolean hasUniqueSolution(Grid start) {
    return countSolutions(start, 2) == 1;
  }

  /**
   * Like {@link #solve(Grid)}, but subject to this solver's step budget.
   *
   * @throws UnsolvableException if the grid has no valid completion
   * @throws StepLimitExceededException if the budget runs out first
   */
  public Grid solution(Grid start) {
    return solution(start, null);
  }

  /**
   * Searches the given grid for up to {@code limit} solutions, subject to this
   * solver's step budget, and summarizes the search.
   *
   * @throws StepLimitExceededException if the budget runs out first
   */
  public Result result(Grid start, int limit) {
    checkArgument(limit >= 1, "limit must be at least 1: %s", limit);
    return new Search(checkNotNull(start), limit, null).run();
  }

  private Grid solution(Grid start, @Nullable Random random) {
    Result result = new Search(checkNotNull(start), 1, random).run();
    if (result.solution == null)
      throw new UnsolvableException(start);
    return result.solution;
  }

  /**
   * A summary of a solver's work.
   */
  @Immutable
  public static final class Result {
    public final Grid start;
    public final int numSolutions;  // Never more than the limit searched for.
    public final long numSteps;  // Placements tried.
    @Nullable public final Grid solution;  // The first one found, null when there are none.

    private Result(Grid start, int numSolutions, long numSteps, @Nullable Grid solution) {
      this.start = start;
      this.numSolutions = numSolutions;
      this.numSteps = numSteps;
      this.solution = solution;
    }

    @Override public String toString() {
      return String.format("%d solution(s) in %d steps", numSolutions, numSteps);
    }
  }

  /**
   * Tells whether the given numeral may be placed at the given index without
   * repeating a numeral already present in its row, column, or block.
   */
  static boolean isValid(byte[] cells, int index, int number) {
    int row = index / 9, column = index % 9;
    for (int i = 0; i < 9; ++i) {
      if (cells[row * 9 + i] == number || cells[i * 9 + column] == number)
        return false;
    }
    int top = row / 3 * 3, left = column / 3 * 3;
    for (int r = top; r < top + 3; ++r) {
      for (int c = left; c < left + 3; ++c) {
        if (cells[r * 9 + c] == number)
          return false;
      }
    }
    return true;
  }

  /** One search, with its own working copy of the grid. */
  private final class Search {
    private final Grid start;
    private final byte[] cells;
    private final int limit;
    @Nullable private final Random random;
    private int count;
    private long steps;
    @Nullable private Grid first;

    Search(Grid start, int limit, @Nullable Random random) {
      this.start = start;
      this.cells = start.copySquares();
      this.limit = limit;
      this.random = random;
    }

    Result run() {
      // A grid that already breaks the rules can't be completed legally.
      if (start.getState() != Grid.State.BROKEN)
        fill(0);
      return new Result(start, count, steps, first);
    }

    /** Returns true when the search should stop. */
    private boolean fill(int from) {
      int index = from;
      while (index < Location.COUNT && cells[index] != 0)
        ++index;
      if (index == Location.COUNT) {
        if (++count == 1)
          first = Grid.adopt(cells.clone());
        return count >= limit;
      }
      for (int number : candidates()) {
        if (isValid(cells, index, number)) {
          if (++steps > maxSteps)
            throw new StepLimitExceededException(maxSteps);
          cells[index] = (byte) number;
          if (fill(index + 1))
            return true;
          cells[index] = 0;
        }
      }
      return false;
    }

    private int[] candidates() {
      int[] order = {1, 2, 3, 4, 5, 6, 7, 8, 9};
      if (random != null) {
        for (int last = order.length - 1; last > 0; --last) {
          int index = random.nextInt(last + 1);
          int temp = order[index];
          order[index] = order[last];
          order[last] = temp;
        }
      }
      return order;
    }
  }
}
