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
package binwp.util;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;

import binwp.core.Architecture;
import binwp.core.BirFile.Var;
import binwp.core.Constraint;
import binwp.core.Environment;

public class Z3VerifierTest {
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
	public void validConstraintIsProved() {
		BitVecExpr x = ctx.mkBVConst("x", 32);
		Constraint c = Constraint.goal("comm", ctx.mkEq(ctx.mkBVAdd(x, ctx.mkBV(1, 32)), ctx.mkBVAdd(ctx.mkBV(1, 32), x)));
		Solver solver = new Z3Verifier(ctx).setTimeout(10000).newSolver();
		assertEquals(Z3Verifier.Verdict.PROVED, Z3Verifier.verdict(Z3Verifier.check(solver, ctx, c)));
	}

	@Test
	public void satisfiabilityCheckWithoutRefuting() {
		BitVecExpr x = ctx.mkBVConst("x", 8);
		Constraint c = Constraint.goal("x_is_3", ctx.mkEq(x, ctx.mkBV(3, 8)));
		Solver solver = ctx.mkSolver();
		assertEquals(Status.SATISFIABLE, Z3Verifier.check(solver, ctx, c, false));
	}

	@Test
	public void excludeEnumeratesCounterexamples() {
		BitVecExpr x = ctx.mkBVConst("x", 64);
		// refuted exactly when x is 5 or 7
		Constraint c = Constraint.goal("not_5_or_7",
				ctx.mkAnd(ctx.mkNot(ctx.mkEq(x, ctx.mkBV(5, 64))), ctx.mkNot(ctx.mkEq(x, ctx.mkBV(7, 64)))));
		Solver solver = ctx.mkSolver();
		Set<Long> found = new HashSet<>();
		assertEquals(Status.SATISFIABLE, Z3Verifier.check(solver, ctx, c));
		found.add(((BitVecNum) solver.getModel().eval(x, true)).getLong());
		assertEquals(Status.SATISFIABLE, Z3Verifier.exclude(solver, ctx, x, c));
		found.add(((BitVecNum) solver.getModel().eval(x, true)).getLong());
		assertEquals(Status.UNSATISFIABLE, Z3Verifier.exclude(solver, ctx, x, c));
		assertEquals(Set.of(5L, 7L), found);
	}

	@Test
	public void counterexampleReportsInitialValues() {
		Environment env = new Environment.Builder(ctx).build();
		Var rdi = Architecture.X86_64.findRegister("RDI");
		env.initVar(rdi);
		env.initVar(Architecture.X86_64.getMemory());
		BitVecExpr init = ExpressionTranslator.asBitVector(env.getInitVar(rdi));
		Constraint c = Constraint.goal("rdi_not_42", ctx.mkNot(ctx.mkEq(init, ctx.mkBV(42, 64))));
		Solver solver = ctx.mkSolver();
		assertEquals(Status.SATISFIABLE, Z3Verifier.check(solver, ctx, c));
		Z3Verifier.Counterexample cex = Z3Verifier.getCounterexample(solver.getModel(), env);
		assertEquals(BigInteger.valueOf(42), cex.get("RDI"));
		// memory is never reported
		assertEquals(1, cex.getValues().size());
		assertTrue(cex.toString().contains("RDI |-> 0x2a"));
	}

	@Test
	public void unknownIsNeverProved() {
		assertEquals(Z3Verifier.Verdict.UNKNOWN, Z3Verifier.verdict(Status.UNKNOWN));
		assertEquals(Z3Verifier.Verdict.REFUTED, Z3Verifier.verdict(Status.SATISFIABLE));
	}
}
