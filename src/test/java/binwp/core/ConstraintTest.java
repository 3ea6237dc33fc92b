// Copyright 2024 The binwp Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package binwp.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;

public class ConstraintTest {
	private Context ctx;

	@BeforeEach
	public void setup() {
		ctx = new Context();
	}

	@AfterEach
	public void teardown() {
		ctx.close();
	}

	@Test
	public void emptyHypothesesAreConjunction() {
		BitVecExpr x = ctx.mkBVConst("x", 8);
		Constraint c = Constraint.conjunction(Constraint.goal("a", ctx.mkBVUGT(x, ctx.mkBV(1, 8))),
				Constraint.goal("b", ctx.mkBVULT(x, ctx.mkBV(3, 8))));
		assertEquals(ctx.mkAnd(ctx.mkBVUGT(x, ctx.mkBV(1, 8)), ctx.mkBVULT(x, ctx.mkBV(3, 8))), c.eval(ctx));
	}

	@Test
	public void substitutionReachesEveryGoal() {
		BitVecExpr x = ctx.mkBVConst("x", 8);
		BitVecExpr y = ctx.mkBVConst("y", 8);
		Constraint.Goal shared = Constraint.goal("shared", ctx.mkEq(x, ctx.mkBV(0, 8)));
		Constraint c = Constraint.implies(shared, Constraint.conjunction(shared, Constraint.goal("other",
				ctx.mkEq(x, y))));
		Constraint d = c.substitute(x, ctx.mkBV(0, 8));
		Solver solver = ctx.mkSolver();
		solver.add(ctx.mkNot(d.eval(ctx)));
		// y = 0 refutes the substituted constraint, nothing else does
		solver.add(ctx.mkNot(ctx.mkEq(y, ctx.mkBV(0, 8))));
		assertEquals(Status.SATISFIABLE, solver.check());
		assertSame(d, d.substitute(new com.microsoft.z3.Expr<?>[0], new com.microsoft.z3.Expr<?>[0]));
	}

	@Test
	public void mismatchedSubstitutionIsRejected() {
		BitVecExpr x = ctx.mkBVConst("x", 8);
		Constraint c = Constraint.goal("g", ctx.mkEq(x, x));
		assertThrows(IllegalArgumentException.class,
				() -> c.substitute(new com.microsoft.z3.Expr<?>[] { x }, new com.microsoft.z3.Expr<?>[0]));
	}

	@Test
	public void refutedGoalsRespectHypotheses() {
		BitVecExpr x = ctx.mkBVConst("x", 8);
		Constraint.Goal small = Constraint.goal("small", ctx.mkBVULT(x, ctx.mkBV(10, 8)));
		Constraint.Goal zero = Constraint.goal("zero", ctx.mkEq(x, ctx.mkBV(0, 8)));
		Constraint.Goal big = Constraint.goal("big", ctx.mkBVUGT(x, ctx.mkBV(100, 8)));
		// small ==> zero, and big ==> false
		Constraint c = Constraint.conjunction(Constraint.implies(small, zero),
				Constraint.implies(big, Constraint.goal("never", ctx.mkFalse())));
		Solver solver = ctx.mkSolver();
		solver.add(ctx.mkEq(x, ctx.mkBV(5, 8)));
		assertEquals(Status.SATISFIABLE, solver.check());
		Model model = solver.getModel();
		List<Constraint.Goal> refuted = c.getRefutedGoals(model);
		assertEquals(Collections.singletonList(zero), refuted);
	}

	@Test
	public void statisticsCountSharedTreesOnce() {
		Constraint.Goal g = Constraint.goal("g", ctx.mkTrue());
		Constraint inner = Constraint.clause(Arrays.asList(g), Arrays.asList(g));
		Constraint outer = Constraint.conjunction(inner, inner);
		Constraint.Stats stats = outer.getStats();
		assertEquals(1, stats.getGoals());
		assertEquals(2, stats.getClauses());
		assertEquals(3, stats.getDepth());
	}
}
