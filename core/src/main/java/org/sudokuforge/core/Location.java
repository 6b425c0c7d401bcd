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

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;

import javax.annotation.concurrent.Immutable;

/**
 * A cell of a Sudoku grid.  Locations are numbered in row-major order, row 0
 * first and column 0 first within a row.
 */
@Immutable
public final class Location implements Comparable<Location> {

  /** The number of distinct locations. */
  public static final int COUNT = 81;

  /** A number in the range [0, COUNT). */
  public final int index;

  /** Zero-based row, column and block indices, each in [0, 9). */
  public final int row;
  public final int column;
  public final int block;

  public static Location of(int index) {
    checkElementIndex(index, COUNT, "location index");
    return instances[index];
  }

  public static Location ofIndices(int rowIndex, int columnIndex) {
    checkElementIndex(rowIndex, 9, "row index");
    checkElementIndex(columnIndex, 9, "column index");
    return instances[rowIndex * 9 + columnIndex];
  }

  /** All locations, in row-major order. */
  public static ImmutableList<Location> all() {
    return ALL;
  }

  @Override public int compareTo(Location that) {
    return this.index - that.index;
  }

  @Override public String toString() {
    return String.format("(%d, %d)", row + 1, column + 1);
  }

  private Location(int index) {
    this.index = index;
    this.row = index / 9;
    this.column = index % 9;
    this.block = index / 27 * 3 + index % 9 / 3;
  }

  private static final Location[] instances;
  private static final ImmutableList<Location> ALL;
  static {
    instances = new Location[COUNT];
    for (int i = 0; i < COUNT; ++i) {
      instances[i] = new Location(i);
    }
    ALL = ImmutableList.copyOf(instances);
  }
}
