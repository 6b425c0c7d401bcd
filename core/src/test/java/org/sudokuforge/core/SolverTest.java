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
import static org.junit.Assert.fail;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.Collection;

@RunWith(Parameterized.class)
public class SolverTest {
  private final Grid start;
  private final int numSolutions;
  private final String solution;

  @Parameters public static Collection<Object[]> getParams() {
    return Arrays.asList(new Object[][]{
        { "55...............................................................................", -1, null },  // Broken
        { "12345678.........9...............................................................", 0, null },  // No solution
        { ".6.5.4.3.1...9...8.........9...5...6.4.6.2.7.7...4...5.........4...8...1.5.2.3.4.", 1,
          "869574132124396758375128694932857416541632879786941325217469583493785261658213947" },
        { ".9..74....2....6.375...........9..545.3.4.......58.....45....8....1.2.3.......92.", 1,
          "396874512428915673751326849812697354563241798974583261245739186689152437137468925" },
        { ".....6....59.....82....8....45........3........6..3.54...325..6..................", 2,
          "138246579659137248274598163745682391813459627926713854487325916362971485591864732" },
      });
  }

  public SolverTest(String start, int numSolutions, String solution) {
    this.start = Grid.fromString(start);
    this.numSolutions = numSolutions < 0 ? 0 : numSolutions;
    this.solution = solution;
    assertEquals(numSolutions < 0 ? Grid.State.BROKEN : Grid.State.INCOMPLETE,
                 this.start.getState());
  }

  @Test public void countSolutions() {
    assertEquals(numSolutions, Solver.countSolutions(start));
    assertEquals(Math.min(numSolutions, 1), Solver.countSolutions(start, 1));
    assertEquals(numSolutions == 1, Solver.hasUniqueSolution(start));
  }

  @Test public void solve() {
    String before = start.toFlatString();
    try {
      Grid solved = Solver.solve(start);
      if (solution == null) fail("expected no solution, got " + solved.toFlatString());
      assertEquals(solution, solved.toFlatString());
      assertEquals(true, solved.isSolved());
      for (Location loc : Location.all()) {
        if (start.containsKey(loc))
          assertEquals(start.get(loc), solved.get(loc));
      }
      // Solving again gives the same answer.
      assertEquals(solved, Solver.solve(start));
    } catch (UnsolvableException e) {
      if (solution != null) fail("expected a solution");
      assertEquals(start, e.getStart());
    }
    assertEquals(before, start.toFlatString());
  }

  @Test public void result() {
    Solver.Result result = Solver.withMaxSteps(10000000).result(start, 2);
    assertEquals(numSolutions, result.numSolutions);
    assertEquals(start, result.start);
    if (numSolutions == 0) {
      assertNull(result.solution);
    } else {
      assertEquals(solution, result.solution.toFlatString());
    }
  }
}
