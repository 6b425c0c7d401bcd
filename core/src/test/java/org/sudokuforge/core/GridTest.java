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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import com.google.common.collect.ImmutableSet;

import org.junit.Test;

public class GridTest {

  private static final String SOLVED =
      "123456789456789123789123456214365897365897214897214365531642978642978531978531642";

  @Test public void reset() {
    Grid solved = Grid.fromString(SOLVED);
    Grid.Builder builder = Grid.builder()
        .put(Location.of(34), Numeral.of(6));
    assertEquals(1, builder.size());
    builder.reset(solved);
    assertEquals(81, builder.size());
    builder.remove(Location.of(0));
    assertEquals(81, solved.size());
    builder.reset(Grid.BLANK);
    assertEquals(Grid.BLANK, builder.build());
  }

  @Test public void build() {
    Grid.Builder builder = Grid.builder()
        .put(Location.of(34), Numeral.of(6));
    Grid g1 = builder.build();
    builder.put(Location.of(77), Numeral.of(1));
    Grid g2 = builder.build();
    builder.remove(Location.of(77));
    Grid g3 = builder.build();
    assertEquals(g1, g3);
    assertEquals(false, g1.equals(g2));
    assertEquals(1, g1.size());
    assertEquals(2, g2.size());
    assertEquals(1, g3.size());
  }

  @Test public void snapshotsAreUnaffectedByLaterChanges() {
    Grid solved = Grid.fromString(SOLVED);
    Grid.Builder builder = solved.asBuilder();
    builder.remove(Location.of(0));
    assertEquals(81, solved.size());
    assertSame(Numeral.of(1), solved.get(Location.of(0)));
    assertNull(builder.get(Location.of(0)));
  }

  @Test public void states() {
    assertEquals(Grid.State.INCOMPLETE, Grid.BLANK.getState());
    assertEquals(Grid.State.SOLVED, Grid.fromString(SOLVED).getState());
    assertEquals(true, Grid.fromString(SOLVED).isSolved());

    Grid broken = Grid.fromString("55" + dots(79));
    assertEquals(Grid.State.BROKEN, broken.getState());
    assertEquals(ImmutableSet.of(Location.of(0), Location.of(1)), broken.getBrokenLocations());
  }

  @Test public void brokenInBlockOnly() {
    // (1, 1) and (2, 2) share a block but neither a row nor a column.
    Grid broken = Grid.builder()
        .put(Location.ofIndices(0, 0), Numeral.of(4))
        .put(Location.ofIndices(1, 1), Numeral.of(4))
        .build();
    assertEquals(Grid.State.BROKEN, broken.getState());
    assertEquals(2, broken.getBrokenLocations().size());
  }

  @Test public void flatString() {
    Grid grid = Grid.fromString(SOLVED);
    assertEquals(SOLVED, grid.toFlatString());
    assertEquals(dots(81), Grid.BLANK.toFlatString());
    assertEquals(Grid.BLANK, Grid.fromString("0" + dots(80)));
  }

  @Test public void fromStringIgnoresOtherCharacters() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < 9; ++i)
      sb.append(SOLVED, i * 9, i * 9 + 9).append(" |\n");
    assertEquals(Grid.fromString(SOLVED), Grid.fromString(sb.toString()));
  }

  @Test(expected = IllegalArgumentException.class) public void fromStringTooShort() {
    Grid.fromString(dots(80));
  }

  @Test(expected = IllegalArgumentException.class) public void fromStringTooLong() {
    Grid.fromString(SOLVED + "1");
  }

  @Test public void rows() {
    Grid grid = Grid.builder()
        .put(Location.ofIndices(0, 0), Numeral.of(5))
        .put(Location.ofIndices(8, 3), Numeral.of(9))
        .build();
    Integer[][] rows = grid.toRows();
    assertEquals(9, rows.length);
    assertEquals(Integer.valueOf(5), rows[0][0]);
    assertEquals(Integer.valueOf(9), rows[8][3]);
    assertNull(rows[0][1]);
    assertEquals(grid, Grid.fromRows(rows));
  }

  @Test(expected = IllegalArgumentException.class) public void fromRowsBadValue() {
    Integer[][] rows = Grid.BLANK.toRows();
    rows[4][4] = 10;
    Grid.fromRows(rows);
  }

  @Test(expected = IllegalArgumentException.class) public void fromRowsShortRow() {
    Integer[][] rows = Grid.BLANK.toRows();
    rows[2] = new Integer[8];
    Grid.fromRows(rows);
  }

  @Test public void array() {
    int[] cells = new int[81];
    cells[0] = 1;
    cells[80] = 2;
    Grid grid = Grid.fromArray(cells);
    assertEquals(2, grid.size());
    assertEquals("1" + dots(79) + "2", grid.toFlatString());
    cells[40] = 5;
    assertEquals(2, grid.size());
  }

  @Test(expected = IllegalArgumentException.class) public void fromArrayBadValue() {
    int[] cells = new int[81];
    cells[3] = 10;
    Grid.fromArray(cells);
  }

  @Test public void prettyString() {
    String s = Grid.fromString(SOLVED).toString();
    assertEquals(true, s.startsWith(" 1 2 3 | 4 5 6 | 7 8 9\n"));
    assertEquals(true, s.contains("-------+-------+-------\n"));
  }

  @Test public void equalsAndHashCode() {
    assertEquals(Grid.fromString(SOLVED), Grid.fromString(SOLVED));
    assertEquals(Grid.fromString(SOLVED).hashCode(), Grid.fromString(SOLVED).hashCode());
    assertEquals(false, Grid.BLANK.equals(Grid.fromString(SOLVED)));
  }

  static String dots(int count) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < count; ++i)
      sb.append('.');
    return sb.toString();
  }
}
