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
package binwp.tasks;

import static binwp.core.BirFile.*;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;

import binwp.core.Architecture;
import binwp.core.BirFile;
import binwp.core.Constraint;
import binwp.core.Environment;
import binwp.core.Environment.ExpCond;
import binwp.core.Weakening;
import binwp.util.SideConditions;
import binwp.util.Smtlib;
import binwp.util.Z3Verifier;
import binwp.util.Z3Verifier.Verdict;
import binwp.util.testing.BirBuilder;

public class PreconditionCompilerTest {
	private static final Var RAX = Architecture.X86_64.findRegister("RAX");
	private static final Var RBX = Architecture.X86_64.findRegister("RBX");
	private static final Var RCX = Architecture.X86_64.findRegister("RCX");
	private static final Var RDI = Architecture.X86_64.findRegister("RDI");
	private static final Var MEM = Architecture.X86_64.getMemory();

	private Context ctx;
	private Solver solver;

	@BeforeEach
	public void setup() {
		ctx = new Context();
	}

	@AfterEach
	public void teardown() {
		ctx.close();
	}

	private Environment env(BirFile file, int numUnroll, ExpCond... conds) {
		return new Environment.Builder(ctx).architecture(file.getArchitecture()).subroutines(file.getSubroutines())
				.specs(FunctionSpecs.defaults()).defaultSpec(FunctionSpecs.defaultSelector())
				.expConds(Arrays.asList(conds)).numUnroll(numUnroll).build();
	}

	private Constraint post(Environment env, Subroutine sub, String smtlib) {
		Compare.initVariables(env, sub);
		return Constraint.goal("post", Smtlib.parse(ctx, smtlib, Smtlib.names(env, "")));
	}

	private Verdict check(Environment env, Constraint pre) {
		List<Constraint> hyps = new ArrayList<>(env.getInitHypotheses());
		hyps.addAll(PreconditionCompiler.notCalled(env));
		solver = ctx.mkSolver();
		return Z3Verifier.verdict(Z3Verifier.check(solver, ctx, Constraint.clause(hyps, Collections.singletonList(pre))));
	}

	private Verdict verify(BirFile file, String func, String smtlib) {
		Environment env = env(file, 5);
		Subroutine sub = file.getSubroutine(func);
		Constraint post = post(env, sub, smtlib);
		return check(env, new PreconditionCompiler().visitSub(env, post, sub));
	}

	private static String bv64(long value) {
		return String.format("#x%016x", value);
	}

	private static boolean weakened(Environment env, Weakening.Kind kind) {
		return env.getWeakenings().stream().anyMatch(w -> w.getKind() == kind);
	}

	@Test
	public void assignmentSubstitutes() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").def(RAX, ADD(VAR(RDI), CONST(1, 64))).ret()
				.end().build();
		assertEquals(Verdict.PROVED, verify(file, "f", "(= RAX (bvadd init_RDI " + bv64(1) + "))"));
		assertEquals(Verdict.REFUTED, verify(file, "f", "(= RAX init_RDI)"));
	}

	@Test
	public void conditionalJumpsSplitPaths() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").goTo(EQ(VAR(RDI), CONST(0, 64)), "zero").goTo("nonzero")
					.block("zero").def(RAX, CONST(1, 64)).ret()
					.block("nonzero").def(RAX, CONST(2, 64)).ret()
				.end().build();
		String post = "(= (= RAX " + bv64(1) + ") (= init_RDI " + bv64(0) + "))";
		assertEquals(Verdict.PROVED, verify(file, "f", post));
		assertEquals(Verdict.REFUTED, verify(file, "f", "(= RAX " + bv64(1) + ")"));
	}

	@Test
	public void jumpsAreTriedInOrder() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").goTo(EQ(VAR(RDI), CONST(0, 64)), "a").goTo(EQ(VAR(RDI), CONST(0, 64)), "b")
						.goTo("c")
					.block("a").def(RAX, CONST(1, 64)).ret()
					.block("b").def(RAX, CONST(2, 64)).ret()
					.block("c").def(RAX, CONST(3, 64)).ret()
				.end().build();
		// the second jump is shadowed by the first
		assertEquals(Verdict.PROVED, verify(file, "f", "(not (= RAX " + bv64(2) + "))"));
	}

	@Test
	public void neverTakenJumpsAreIgnored() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").goTo(FALSE(), "a").goTo("b")
					.block("a").def(RAX, CONST(1, 64)).ret()
					.block("b").def(RAX, CONST(2, 64)).ret()
				.end().build();
		assertEquals(Verdict.PROVED, verify(file, "f", "(= RAX " + bv64(2) + ")"));
	}

	@Test
	public void sharedBlocksAreComputedOnce() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").goTo(EQ(VAR(RDI), CONST(0, 64)), "a").goTo("b")
					.block("a").def(RAX, CONST(1, 64)).goTo("exit")
					.block("b").def(RAX, CONST(2, 64)).goTo("exit")
					.block("exit").def(RBX, VAR(RAX)).ret()
				.end().build();
		Environment env = env(file, 5);
		Subroutine f = file.getSubroutine("f");
		Constraint post = post(env, f, "(bvult RBX " + bv64(3) + ")");
		PreconditionCompiler pc = new PreconditionCompiler();
		Constraint pre = pc.visitSub(env, post, f);
		// one condition and three assignments
		assertEquals(4, env.getTranslator().getCallCount());
		Block exit = f.getBlock(BirBuilder.blockTid("f", "exit"));
		Constraint cached = env.getPrecondition(exit.getTid());
		assertNotNull(cached);
		assertSame(cached, pc.visitBlock(env, post, exit));
		assertEquals(4, env.getTranslator().getCallCount());
		assertEquals(Verdict.PROVED, check(env, pre));
	}

	@Test
	public void loopsAreUnrolledAtMostBound() {
		Expr.Constant marker = CONST(7, 64);
		int[] count = new int[1];
		ExpCond counter = (env, e) -> {
			if (e == marker) {
				count[0]++;
			}
			return Optional.empty();
		};
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").goTo("head")
					.block("head").def(RAX, ADD(VAR(RAX), marker)).goTo(LT(VAR(RAX), CONST(100, 64)), "head")
						.goTo("exit")
					.block("exit").ret()
				.end().build();
		Environment env = env(file, 3, counter);
		Subroutine f = file.getSubroutine("f");
		new PreconditionCompiler().visitSub(env, env.trivialConstraint(), f);
		assertEquals(3, count[0]);
		assertTrue(weakened(env, Weakening.Kind.LOOP_UNROLL_BOUND));
	}

	@Test
	public void unrollingZeroStillVisitsLoopOnce() {
		Expr.Constant marker = CONST(7, 64);
		int[] count = new int[1];
		ExpCond counter = (env, e) -> {
			if (e == marker) {
				count[0]++;
			}
			return Optional.empty();
		};
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("head").def(RAX, ADD(VAR(RAX), marker)).goTo(LT(VAR(RAX), CONST(100, 64)), "head")
					.block("exit").ret()
				.end().build();
		Environment env = env(file, 0, counter);
		new PreconditionCompiler().visitSub(env, env.trivialConstraint(), file.getSubroutine("f"));
		assertEquals(1, count[0]);
	}

	@Test
	public void boundedLoopsAreExact() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").def(RCX, CONST(0, 64)).goTo("head")
					.block("head").def(RCX, ADD(VAR(RCX), CONST(1, 64))).goTo(LT(VAR(RCX), CONST(2, 64)), "head")
						.goTo("exit")
					.block("exit").ret()
				.end().build();
		assertEquals(Verdict.PROVED, verify(file, "f", "(= RCX " + bv64(2) + ")"));
		assertEquals(Verdict.REFUTED, verify(file, "f", "(= RCX " + bv64(3) + ")"));
	}

	@Test
	public void indirectJumpsWeaken() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").goToIndirect(VAR(RAX))
				.end().build();
		Environment env = env(file, 5);
		Subroutine f = file.getSubroutine("f");
		Constraint post = env.trivialConstraint();
		Compare.initVariables(env, f);
		assertSame(post, new PreconditionCompiler().visitSub(env, post, f));
		assertTrue(weakened(env, Weakening.Kind.INDIRECT_JUMP));
	}

	@Test
	public void phiNodesUseIncomingEdge() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").goTo("a")
					.block("a").goTo("join")
					.block("b").goTo("join")
					.block("join").phi(RAX, Map.of("a", CONST(1, 64), "b", CONST(2, 64))).ret()
				.end().build();
		Environment env = env(file, 5);
		Subroutine f = file.getSubroutine("f");
		Constraint post = post(env, f, "(= RAX " + bv64(1) + ")");
		Constraint pre = new PreconditionCompiler().visitSub(env, post, f);
		assertTrue(weakened(env, Weakening.Kind.PHI_NODE));
		assertEquals(Verdict.PROVED, check(env, pre));
	}

	@Test
	public void nullLoadsAreChecked() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").def(RAX, LOAD(VAR(MEM), VAR(RDI), Endian.LITTLE, 64)).ret()
				.end().build();
		Subroutine f = file.getSubroutine("f");
		Environment env = env(file, 5, SideConditions.NON_NULL_LOAD_VC);
		Compare.initVariables(env, f);
		Constraint pre = new PreconditionCompiler().visitSub(env, env.trivialConstraint(), f);
		assertEquals(Verdict.REFUTED, check(env, pre));
		Z3Verifier.Counterexample cex = Z3Verifier.getCounterexample(solver.getModel(), env);
		assertEquals(0, cex.get("RDI").signum());
		List<Constraint.Goal> refuted = pre.getRefutedGoals(solver.getModel());
		assertEquals(1, refuted.size());
		assertEquals("load_non_null", refuted.get(0).getName());
		// as an assumption, the same load is harmless
		Environment assume = env(file, 5, SideConditions.NON_NULL_LOAD_ASSUME);
		Compare.initVariables(assume, f);
		pre = new PreconditionCompiler().visitSub(assume, assume.trivialConstraint(), f);
		assertEquals(Verdict.PROVED, check(assume, pre));
	}

	@Test
	public void divisionByZeroIsChecked() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").goTo(EQ(VAR(RDI), CONST(0, 64)), "exit").goTo("div")
					.block("div").def(RAX, DIV(VAR(RAX), VAR(RDI))).goTo("exit")
					.block("exit").ret()
				.end().build();
		Subroutine f = file.getSubroutine("f");
		Environment env = env(file, 5, SideConditions.DIVISION_BY_ZERO_VC);
		Compare.initVariables(env, f);
		Constraint pre = new PreconditionCompiler().visitSub(env, env.trivialConstraint(), f);
		assertEquals(Verdict.PROVED, check(env, pre));
	}

	@Test
	public void interruptsResume() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").def(RAX, CONST(5, 64)).interrupt(0x80, "after")
					.block("after").ret()
				.end().build();
		assertEquals(Verdict.PROVED, verify(file, "f", "(= RAX " + bv64(5) + ")"));
	}

	@Test
	public void callsAreTracked() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("calls")
					.block("entry").call("g", "after")
					.block("after").ret()
				.end()
				.sub("skips")
					.block("entry").ret()
				.end()
				.external("g")
				.build();
		for (String name : Arrays.asList("calls", "skips")) {
			Environment env = env(file, 5);
			Subroutine sub = file.getSubroutine(name);
			Compare.initVariables(env, sub);
			Constraint post = Constraint.goal("called_g", env.getCalled("g"));
			Constraint pre = new PreconditionCompiler().visitSub(env, post, sub);
			Verdict expected = name.equals("calls") ? Verdict.PROVED : Verdict.REFUTED;
			assertEquals(expected, check(env, pre), name);
		}
	}

	@Test
	public void jumpsOutsideSubroutineAreRejected() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").goTo("nowhere")
				.end().build();
		Environment env = env(file, 5);
		Subroutine f = file.getSubroutine("f");
		assertThrows(IllegalArgumentException.class,
				() -> new PreconditionCompiler().visitSub(env, env.trivialConstraint(), f));
	}

	@Test
	public void subroutinesWithoutBlocksAreRejected() {
		BirFile file = new BirBuilder(Architecture.X86_64).external("g").build();
		Environment env = env(file, 5);
		assertThrows(IllegalArgumentException.class,
				() -> new PreconditionCompiler().visitSub(env, env.trivialConstraint(), file.getSubroutine("g")));
	}

	@Test
	public void forcedPathsRequireGuards() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").goTo(EQ(VAR(RDI), CONST(0, 64)), "a").goTo("b")
					.block("a").ret()
					.block("b").ret()
				.end().build();
		Subroutine f = file.getSubroutine("f");
		Tid first = f.getEntry().getJmps().get(0).getTid();
		Environment env = new Environment.Builder(ctx).architecture(Architecture.X86_64)
				.subroutines(file.getSubroutines()).jmpSpec(JumpSpecs.reach(Map.of(first, true))).build();
		Compare.initVariables(env, f);
		Constraint pre = new PreconditionCompiler().visitSub(env, env.trivialConstraint(), f);
		assertEquals(Verdict.REFUTED, check(env, pre));
		assertEquals(1, Z3Verifier.getCounterexample(solver.getModel(), env).get("RDI").signum());
	}

	@Test
	public void forcedReturnsFallBackToDefault() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").def(RAX, CONST(1, 64)).ret(EQ(VAR(RDI), CONST(0, 64))).goTo("b")
					.block("b").def(RAX, CONST(2, 64)).ret()
				.end().build();
		Subroutine f = file.getSubroutine("f");
		Tid ret = f.getEntry().getJmps().get(0).getTid();
		Environment env = new Environment.Builder(ctx).architecture(Architecture.X86_64)
				.subroutines(file.getSubroutines()).jmpSpec(JumpSpecs.reach(Map.of(ret, true))).build();
		Constraint post = post(env, f, "(=> (= init_RDI " + bv64(0) + ") (= RAX " + bv64(1) + "))");
		Constraint pre = new PreconditionCompiler().visitSub(env, post, f);
		assertEquals(Verdict.PROVED, check(env, pre));
	}

	@Test
	public void elementsAreVisitedIndividually() {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").def(RAX, ADD(VAR(RDI), CONST(1, 64))).ret()
				.end().build();
		Environment env = env(file, 5);
		Subroutine f = file.getSubroutine("f");
		Constraint post = post(env, f, "(= RAX " + bv64(1) + ")");
		Block entry = f.getEntry();
		PreconditionCompiler compiler = new PreconditionCompiler();
		Constraint pre = compiler.visitElement(env, post, entry, entry.getDefs().get(0));
		assertEquals(Verdict.REFUTED, check(env, pre));
		assertNotEquals(BigInteger.ZERO, Z3Verifier.getCounterexample(solver.getModel(), env).get("RDI"));
		// jumps need an enclosing subroutine
		assertThrows(IllegalStateException.class,
				() -> compiler.visitElement(env, post, entry, entry.getJmps().get(0)));
	}

	@Test
	public void sharedPreconditionsAreEvaluatedOnce() {
		int n = 30;
		BirBuilder.BlockBuilder b = new BirBuilder(Architecture.X86_64).sub("f").block("d0");
		for (int i = 0; i != n; ++i) {
			b = b.goTo(EQ(VAR(RDI), CONST(i, 64)), "a" + i).goTo("b" + i)
					.block("a" + i).def(RAX, CONST(i, 64)).goTo("d" + (i + 1))
					.block("b" + i).goTo("d" + (i + 1))
					.block("d" + (i + 1));
		}
		BirFile file = b.ret().end().build();
		Environment env = env(file, 5);
		Subroutine f = file.getSubroutine("f");
		Constraint post = post(env, f, "(not (= RAX " + bv64(7) + "))");
		assertTimeoutPreemptively(Duration.ofSeconds(60), () -> {
			Constraint pre = new PreconditionCompiler().visitSub(env, post, f);
			Constraint.Stats stats = pre.getStats();
			assertTrue(stats.getClauses() < 20 * n, () -> "clauses: " + stats.getClauses());
			assertTrue(stats.getDepth() < 20 * n, () -> "depth: " + stats.getDepth());
			assertNotNull(pre.eval(ctx));
			assertEquals(Verdict.REFUTED, check(env, pre));
			assertFalse(pre.getRefutedGoals(solver.getModel()).isEmpty());
		});
	}

	@Test
	public void loadsOutsideStackAndHeapAreRefuted() {
		assertEquals(Verdict.PROVED, access(LOAD(VAR(MEM), CONST(0x1000, 64), Endian.LITTLE, 64)));
		assertEquals(Verdict.PROVED, access(LOAD(VAR(MEM), CONST(0x8ff8, 64), Endian.LITTLE, 64)));
		assertEquals(Verdict.REFUTED, access(LOAD(VAR(MEM), CONST(0x4000, 64), Endian.LITTLE, 64)));
		// straddles the end of the heap
		assertEquals(Verdict.REFUTED, access(LOAD(VAR(MEM), CONST(0x1ffc, 64), Endian.LITTLE, 64)));
	}

	@Test
	public void storesOutsideStackAndHeapAreRefuted() {
		BirFile unchecked = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").def(MEM, STORE(VAR(MEM), VAR(RDI), VAR(RAX), Endian.LITTLE, 64)).ret()
				.end().build();
		Environment env = regions(unchecked, SideConditions.VALID_STORE_VC);
		Subroutine f = unchecked.getSubroutine("f");
		Compare.initVariables(env, f);
		assertEquals(Verdict.REFUTED, check(env, new PreconditionCompiler().visitSub(env, env.trivialConstraint(), f)));
		long rdi = Z3Verifier.getCounterexample(solver.getModel(), env).get("RDI").longValue();
		assertFalse((rdi >= 0x1000 && rdi <= 0x1ff8) || (rdi >= 0x8000 && rdi <= 0x8ff8), () -> "RDI: " + rdi);
		// only stores into the heap
		BirFile checked = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").goTo(LT(VAR(RDI), CONST(0x1000, 64)), "out")
						.goTo(LT(CONST(0x1ff8, 64), VAR(RDI)), "out").goTo("store")
					.block("store").def(MEM, STORE(VAR(MEM), VAR(RDI), VAR(RAX), Endian.LITTLE, 64)).ret()
					.block("out").ret()
				.end().build();
		env = regions(checked, SideConditions.VALID_STORE_VC);
		f = checked.getSubroutine("f");
		Compare.initVariables(env, f);
		assertEquals(Verdict.PROVED, check(env, new PreconditionCompiler().visitSub(env, env.trivialConstraint(), f)));
	}

	private Verdict access(Expr load) {
		BirFile file = new BirBuilder(Architecture.X86_64)
				.sub("f")
					.block("entry").def(RAX, load).ret()
				.end().build();
		Environment env = regions(file, SideConditions.VALID_LOAD_VC);
		Subroutine f = file.getSubroutine("f");
		Compare.initVariables(env, f);
		return check(env, new PreconditionCompiler().visitSub(env, env.trivialConstraint(), f));
	}

	/**
	 * An environment with a stack at <code>0x8000</code> and a heap at
	 * <code>0x1000</code>, each one page long.
	 */
	private Environment regions(BirFile file, ExpCond cond) {
		return new Environment.Builder(ctx).architecture(file.getArchitecture()).subroutines(file.getSubroutines())
				.expConds(Arrays.asList(cond))
				.stackRange(new Environment.Range(BigInteger.valueOf(0x8000), BigInteger.valueOf(0x8fff)))
				.heapRange(new Environment.Range(BigInteger.valueOf(0x1000), BigInteger.valueOf(0x1fff))).build();
	}
}
