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

import static binwp.core.BirFile.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;

import binwp.core.Architecture;
import binwp.core.BirFile;
import binwp.core.Environment;
import binwp.util.testing.BirBuilder;

public class SmtlibTest {
	private static final Var RAX = Architecture.X86_64.findRegister("RAX");
	private static final Var RDI = Architecture.X86_64.findRegister("RDI");

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
	public void bareTermsResolveRegisters() {
		Environment env = new Environment.Builder(ctx).build();
		env.initVar(RDI);
		env.mkVar(RAX);
		BoolExpr f = Smtlib.parse(ctx, "(= RAX init_RDI)", Smtlib.names(env, ""));
		assertEquals(ctx.mkEq(env.getVar(RAX), env.getInitVar(RDI)), f);
	}

	@Test
	public void assertionsAreConjoined() {
		Environment env = new Environment.Builder(ctx).freshen(true).build();
		env.mkVar(RAX);
		BoolExpr f = Smtlib.parse(ctx, "(assert (bvugt RAX_mod #x0000000000000001)) (assert (bvult RAX_mod #x0000000000000003))",
				Smtlib.names(env, "_mod"));
		Solver solver = ctx.mkSolver();
		solver.add(f);
		solver.add(ctx.mkNot(ctx.mkEq(env.getVar(RAX), ctx.mkBV(2, 64))));
		assertEquals(Status.UNSATISFIABLE, solver.check());
	}

	@Test
	public void malformedFormulasAreRejected() {
		Environment env = new Environment.Builder(ctx).build();
		assertThrows(TranslationException.class, () -> Smtlib.parse(ctx, "(= RBX", Smtlib.names(env, "")));
	}

	@Test
	public void collectsVariablesOfSubroutine() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").def(RAX, ADD(VAR(RDI), CONST(1, 64))).ret()
				.end().build();
		Subroutine f = file.getSubroutine("f");
		Set<Var> vars = VariableCollector.collect(f);
		assertTrue(vars.contains(RAX));
		assertTrue(vars.contains(RDI));
		assertEquals(Set.of(RAX), VariableCollector.collectAssigned(f));
	}
}
