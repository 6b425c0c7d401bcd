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

import static com.google.common.base.Preconditions.checkNotNull;

import org.sudokuforge.core.Grid;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * What a generation produces: the seed it was generated from, the puzzle, the
 * puzzle's unique solution, and the solution's fingerprint.
 */
@Immutable
public final class PuzzleResult {
  public final String seed;
  public final Grid puzzle;
  public final Grid solution;
  public final String solutionHash;

  public PuzzleResult(String seed, Grid puzzle, Grid solution, String solutionHash) {
    this.seed = checkNotNull(seed);
    this.puzzle = checkNotNull(puzzle);
    this.solution = checkNotNull(solution);
    this.solutionHash = checkNotNull(solutionHash);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof PuzzleResult)) return false;
    PuzzleResult that = (PuzzleResult) o;
    return this.seed.equals(that.seed)
        && this.puzzle.equals(that.puzzle)
        && this.solution.equals(that.solution)
        && this.solutionHash.equals(that.solutionHash);
  }

  @Override public int hashCode() {
    return Objects.hashCode(seed, puzzle, solution, solutionHash);
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("seed", seed)
        .add("puzzle", puzzle.toFlatString())
        .add("solutionHash", solutionHash)
        .toString();
  }
}
