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
import static org.sudokuforge.core.Numeral.numeral;

import com.google.common.collect.ImmutableSortedSet;

import java.util.Arrays;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * An immutable Sudoku grid: each location is either empty or holds a numeral.
 * The nested Builder class is a mutable version of the grid.  It accepts any
 * numeral at any location: it does not enforce the constraints of the game.
 *
 * <p> The wire form of a grid, produced by {@link #toRows} and accepted by
 * {@link #fromRows}, is a 9x9 array in row-major order whose cells are either
 * an integer 1-9 or null.
 */
@Immutable
public final class Grid {

  private final byte[] squares;

  private Grid(byte[] squares) {
    this.squares = squares;
  }

  public static final Grid BLANK = new Grid(new byte[Location.COUNT]);

  /** Returns a new Builder, initially blank. */
  public static Builder builder() {
    return new Builder(BLANK);
  }

  /** Returns a mutable version of this grid. */
  public Builder asBuilder() {
    return new Builder(this);
  }

  /** Possible states for a Sudoku grid. */
  public enum State {
    INCOMPLETE,  // Not all filled in, but nothing that is filled in breaks the rules.
    BROKEN,      // Something that's filled in breaks the rules.
    SOLVED;      // Completely filled in, no rule violations.
  }

  public State getState() {
    if (!getBrokenLocations().isEmpty())
      return State.BROKEN;
    return isComplete() ? State.SOLVED : State.INCOMPLETE;
  }

  public boolean isSolved() {
    return getState() == State.SOLVED;
  }

  /** Tells whether every location is filled in, whether or not legally. */
  public boolean isComplete() {
    return size() == Location.COUNT;
  }

  /**
   * Returns the locations whose numerals are duplicated within some unit.
   */
  public ImmutableSortedSet<Location> getBrokenLocations() {
    ImmutableSortedSet.Builder<Location> answer = ImmutableSortedSet.naturalOrder();
    for (Unit unit : Unit.allUnits()) {
      int seen = 0, dups = 0;
      for (Location loc : unit) {
        int number = squares[loc.index];
        if (number > 0) {
          int bit = 1 << number;
          if ((seen & bit) != 0) dups |= bit;
          seen |= bit;
        }
      }
      if (dups != 0) {
        for (Location loc : unit)
          if ((dups & (1 << squares[loc.index])) != 0)
            answer.add(loc);
      }
    }
    return answer.build();
  }

  /** Tells whether the given location holds a numeral. */
  public boolean containsKey(Location loc) {
    return squares[loc.index] > 0;
  }

  /** Returns the numeral at the given location, or null. */
  @Nullable public Numeral get(Location loc) {
    return numeral(squares[loc.index]);
  }

  /** Returns the number of locations filled in: the givens, for a puzzle. */
  public int size() {
    int answer = 0;
    for (byte square : squares) {
      if (square > 0) ++answer;
    }
    return answer;
  }

  /** Builds a grid from 81 row-major cells, 0 for empty ones. */
  public static Grid fromArray(int[] cells) {
    checkArgument(cells.length == Location.COUNT,
        "a grid has %s cells, got %s", Location.COUNT, cells.length);
    byte[] squares = new byte[Location.COUNT];
    for (int i = 0; i < cells.length; ++i) {
      checkArgument(cells[i] >= 0 && cells[i] <= Numeral.COUNT,
          "cell %s out of range: %s", i, cells[i]);
      squares[i] = (byte) cells[i];
    }
    return new Grid(squares);
  }

  /** Returns the wire form: nine rows of nine cells, null for empty ones. */
  public Integer[][] toRows() {
    Integer[][] rows = new Integer[9][9];
    for (Location loc : Location.all()) {
      int square = squares[loc.index];
      rows[loc.row][loc.column] = square == 0 ? null : square;
    }
    return rows;
  }

  /** Parses the wire form; see {@link #toRows}. */
  public static Grid fromRows(Integer[][] rows) {
    checkArgument(rows.length == 9, "expected 9 rows, got %s", rows.length);
    Builder builder = builder();
    for (int r = 0; r < 9; ++r) {
      Integer[] row = checkNotNull(rows[r], "row %s", r);
      checkArgument(row.length == 9, "expected 9 cells in row %s, got %s", r, row.length);
      for (int c = 0; c < 9; ++c) {
        if (row[c] != null)
          builder.put(Location.ofIndices(r, c), Numeral.of(row[c]));
      }
    }
    return builder.build();
  }

  /**
   * Generates a string of 81 characters with dots for unset locations and
   * digits for set ones.
   */
  public String toFlatString() {
    StringBuilder sb = new StringBuilder();
    for (byte square : squares)
      sb.append(square == 0 ? '.' : (char) ('0' + square));
    return sb.toString();
  }

  /**
   * Ignores all characters except digits and periods, requires there to be 81
   * total.  Zeros and periods are empty locations.
   */
  public static Grid fromString(String s) {
    Builder builder = builder();
    int index = 0;
    for (char c : s.toCharArray()) {
      if (c >= '1' && c <= '9') {
        if (index < Location.COUNT)
          builder.put(Location.of(index), Numeral.of(c - '0'));
        ++index;
      } else if (c == '0' || c == '.') {
        ++index;
      }
    }
    if (index != Location.COUNT) {
      throw new IllegalArgumentException(
          String.format("Grid.fromString requires 81 locations, got %d in %s", index, s));
    }
    return builder.build();
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Grid)) return false;
    Grid that = (Grid) object;
    return Arrays.equals(this.squares, that.squares);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(squares);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Location loc : Location.all()) {
      int square = squares[loc.index];
      sb.append(' ').append(square == 0 ? "." : Integer.toString(square));
      if (loc.column == 2 || loc.column == 5)
        sb.append(" |");
      if (loc.column == 8) {
        sb.append('\n');
        if (loc.row == 2 || loc.row == 5)
          sb.append("-------+-------+-------\n");
      }
    }
    return sb.toString();
  }

  /** Returns a private copy of the squares, for the solver's working state. */
  byte[] copySquares() {
    return squares.clone();
  }

  /** Wraps the given squares, which the caller must not touch afterwards. */
  static Grid adopt(byte[] squares) {
    return new Grid(squares);
  }

  /**
   * A mutable grid.  Snapshots taken with {@link #build} are never affected by
   * later changes to the builder.
   */
  public static final class Builder {
    private Grid grid;
    private boolean built;

    private Builder(Grid grid) {
      this.grid = grid;
      this.built = true;
    }

    private Grid grid() {
      if (built) {
        this.grid = new Grid(this.grid.squares.clone());
        this.built = false;
      }
      return this.grid;
    }

    /** Returns an immutable snapshot of this grid. */
    public Grid build() {
      built = true;
      return grid;
    }

    /** Resets this builder to match the given grid. */
    public Builder reset(Grid grid) {
      this.grid = checkNotNull(grid);
      built = true;
      return this;
    }

    public boolean containsKey(Location loc) {
      return grid.containsKey(loc);
    }

    @Nullable public Numeral get(Location loc) {
      return grid.get(loc);
    }

    /** Sets the numeral for the given location. */
    public Builder put(Location loc, Numeral num) {
      grid().squares[loc.index] = (byte) num.number;
      return this;
    }

    /** Erases the given location. */
    public Builder remove(Location loc) {
      grid().squares[loc.index] = 0;
      return this;
    }

    /** Returns the number of locations filled in. */
    public int size() {
      return grid.size();
    }
  }
}
