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

import com.google.common.collect.ImmutableList;

import java.util.AbstractCollection;
import java.util.Iterator;

import javax.annotation.concurrent.Immutable;

/**
 * A row, column, or block of a Sudoku grid: a set of 9 locations that must all
 * contain different numerals in a valid Sudoku.
 */
@Immutable
public final class Unit extends AbstractCollection<Location> {

  private enum Type {
    ROW, COLUMN, BLOCK;

    int indexOf(Location loc) {
      switch (this) {
        case ROW: return loc.row;
        case COLUMN: return loc.column;
        default: return loc.block;
      }
    }
  }

  private final Type type;
  private final int index;
  private final ImmutableList<Location> locations;

  /** Returns all 27 units: rows first, then columns, then blocks. */
  public static ImmutableList<Unit> allUnits() {
    return ALL;
  }

  @Override public int size() {
    return locations.size();
  }

  @Override public Iterator<Location> iterator() {
    return locations.iterator();
  }

  @Override public String toString() {
    String name = type.name();
    return name.charAt(0) + name.substring(1).toLowerCase() + " " + (index + 1);
  }

  private Unit(Type type, int index) {
    this.type = type;
    this.index = index;
    ImmutableList.Builder<Location> builder = ImmutableList.builder();
    for (Location loc : Location.all()) {
      if (type.indexOf(loc) == index)
        builder.add(loc);
    }
    this.locations = builder.build();
  }

  private static final ImmutableList<Unit> ALL;
  static {
    ImmutableList.Builder<Unit> builder = ImmutableList.builder();
    for (Type type : Type.values())
      for (int i = 0; i < 9; ++i)
        builder.add(new Unit(type, i));
    ALL = builder.build();
  }
}
