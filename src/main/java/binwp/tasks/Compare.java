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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;

import binwp.core.Architecture;
import binwp.core.BirFile.Block;
import binwp.core.BirFile.Elt;
import binwp.core.BirFile.Subroutine;
import binwp.core.BirFile.Var;
import binwp.core.Constraint;
import binwp.core.Environment;
import binwp.util.ExpressionTranslator;
import binwp.util.Smtlib;
import binwp.util.Util;
import binwp.util.VariableCollector;

/**
 * Relates an original program to a modified one. A comparison is built from
 * comparators, each of which contributes a postcondition relating the final
 * states of both programs or a hypothesis relating their initial states. The
 * two programs are analysed in separate environments whose constants never
 * share a name, so the precondition of one can be computed from the
 * precondition of the other.
 */
public class Compare {
	private static final Logger logger = LoggerFactory.getLogger(Compare.class);

	/**
	 * Builds a constraint from the original and modified programs. A comparator
	 * may bind variables in either environment but must not depend on another
	 * comparator having run.
	 */
	public interface Comparator {
		public Constraint apply(Subroutine original, Environment envOrig, Subroutine modified, Environment envMod);
	}

	/**
	 * A postcondition builder and a hypothesis builder.
	 */
	public static final class ComparatorPair {
		private final Comparator postcondition;
		private final Comparator hypothesis;

		public ComparatorPair(Comparator postcondition, Comparator hypothesis) {
			this.postcondition = postcondition;
			this.hypothesis = hypothesis;
		}

		public Comparator getPostcondition() {
			return postcondition;
		}

		public Comparator getHypothesis() {
			return hypothesis;
		}
	}

	private static final Comparator TRIVIAL = (o, eo, m, em) -> eo.trivialConstraint();

	// =========================================================================
	// Comparisons
	// =========================================================================

	/**
	 * Construct the constraint <code>hyps ==> pre</code> where
	 * <code>pre</code> is the precondition of the original program computed from
	 * the precondition of the modified program, itself computed from the
	 * conjunction of the given postconditions.
	 *
	 * @param pairs
	 * @param original
	 * @param envOrig
	 * @param modified
	 * @param envMod
	 * @return
	 */
	public static Constraint compareSubs(List<ComparatorPair> pairs, Subroutine original, Environment envOrig,
			Subroutine modified, Environment envMod) {
		ArrayList<Comparator> postconds = new ArrayList<>();
		ArrayList<Comparator> hyps = new ArrayList<>();
		for (ComparatorPair p : pairs) {
			postconds.add(p.getPostcondition());
			hyps.add(p.getHypothesis());
		}
		return compareSubs(postconds, hyps, original, envOrig, modified, envMod);
	}

	public static Constraint compareSubs(List<Comparator> postconds, List<Comparator> hyps, Subroutine original,
			Environment envOrig, Subroutine modified, Environment envMod) {
		if (!envMod.isFreshened()
				|| (envOrig.isFreshened() && envOrig.getNamespace().equals(envMod.getNamespace()))) {
			throw new IllegalArgumentException("modified environment must use a distinct namespace");
		}
		logger.info("comparing {} with {}", original.getName(), modified.getName());
		initVariables(envOrig, original);
		initVariables(envMod, modified);
		Constraint post = conjoin(postconds, original, envOrig, modified, envMod);
		Constraint hyp = conjoin(hyps, original, envOrig, modified, envMod);
		PreconditionCompiler pc = new PreconditionCompiler();
		Constraint preMod = pc.visitSub(envMod, post, modified);
		Constraint preOrig = pc.visitSub(envOrig, preMod, original);
		List<Constraint> hypotheses = new ArrayList<>();
		hypotheses.add(hyp);
		hypotheses.addAll(envOrig.getInitHypotheses());
		hypotheses.addAll(envMod.getInitHypotheses());
		hypotheses.addAll(PreconditionCompiler.notCalled(envOrig));
		hypotheses.addAll(PreconditionCompiler.notCalled(envMod));
		return Constraint.clause(hypotheses, Collections.singletonList(preOrig));
	}

	/**
	 * Compare two blocks in isolation. Only the assignments of each block are
	 * considered; its jumps are ignored.
	 *
	 * @param original
	 * @param envOrig
	 * @param modified
	 * @param envMod
	 * @param inputRegs  registers assumed equal on entry.
	 * @param outputRegs registers required equal on exit.
	 * @param smtPre     an additional SMT-LIB2 hypothesis, or <code>null</code>.
	 * @param smtPost    an additional SMT-LIB2 postcondition, or
	 *                   <code>null</code>.
	 * @return
	 */
	public static Constraint compareBlocks(Block original, Environment envOrig, Block modified, Environment envMod,
			List<String> inputRegs, List<String> outputRegs, String smtPre, String smtPost) {
		initVariables(envOrig, blockVariables(original));
		initVariables(envMod, blockVariables(modified));
		ComparatorPair eq = compareSubsEq(inputRegs, outputRegs);
		ComparatorPair smt = compareSubsSmtlib(smtPre, smtPost);
		Constraint post = Constraint.conjunction(eq.getPostcondition().apply(null, envOrig, null, envMod),
				smt.getPostcondition().apply(null, envOrig, null, envMod));
		Constraint hyp = Constraint.conjunction(eq.getHypothesis().apply(null, envOrig, null, envMod),
				smt.getHypothesis().apply(null, envOrig, null, envMod));
		PreconditionCompiler pc = new PreconditionCompiler();
		Constraint pre = visitDefs(pc, envOrig, visitDefs(pc, envMod, post, modified), original);
		List<Constraint> hypotheses = Util.append(envOrig.getInitHypotheses(), envMod.getInitHypotheses());
		hypotheses.add(hyp);
		return Constraint.clause(hypotheses, Collections.singletonList(pre));
	}

	// =========================================================================
	// Comparators
	// =========================================================================

	/**
	 * Require the given output registers to be equal on exit, assuming the given
	 * input registers are equal on entry.
	 *
	 * @param inputRegs
	 * @param outputRegs
	 * @return
	 */
	public static ComparatorPair compareSubsEq(List<String> inputRegs, List<String> outputRegs) {
		Comparator post = (o, eo, m, em) -> {
			Context ctx = eo.getContext();
			ArrayList<Constraint> goals = new ArrayList<>();
			for (String r : outputRegs) {
				Expr<?> x = eo.mkVar(register(eo, r));
				Expr<?> y = em.mkVar(register(em, r));
				goals.add(Constraint.goal(r + "_equal", Util.equal(ctx, x, y)));
			}
			logger.debug("comparing output registers {}", outputRegs);
			return Constraint.clause(Collections.emptyList(), goals);
		};
		return new ComparatorPair(post, equalInputs(inputRegs));
	}

	/**
	 * Compare nothing. The resulting constraint only checks the side conditions
	 * of both programs.
	 *
	 * @return
	 */
	public static ComparatorPair compareSubsEmpty() {
		return new ComparatorPair(TRIVIAL, TRIVIAL);
	}

	/**
	 * Assume every register of the original program is equal on entry, with no
	 * postcondition.
	 *
	 * @return
	 */
	public static ComparatorPair compareSubsEmptyPost() {
		Comparator hyp = (o, eo, m, em) -> {
			ArrayList<String> names = new ArrayList<>();
			for (Var v : eo.getInitVars().keySet()) {
				if (em.findVar(v.getName()) != null) {
					names.add(v.getName());
				}
			}
			return equalInputs(names).apply(o, eo, m, em);
		};
		return new ComparatorPair(TRIVIAL, hyp);
	}

	/**
	 * Assume the stack pointers of both programs lie within their stack regions
	 * on entry.
	 *
	 * @return
	 */
	public static ComparatorPair compareSubsSp() {
		Comparator hyp = (o, eo, m, em) -> Constraint.conjunction(stackPointerInRange(eo), stackPointerInRange(em));
		return new ComparatorPair(TRIVIAL, hyp);
	}

	/**
	 * Use fixed constraints.
	 *
	 * @param pre
	 * @param post
	 * @return
	 */
	public static ComparatorPair compareSubsConstraints(Constraint pre, Constraint post) {
		return new ComparatorPair((o, eo, m, em) -> post, (o, eo, m, em) -> pre);
	}

	/**
	 * Require both programs to call the same functions. A function which is
	 * called by one program must be called by the other.
	 *
	 * @return
	 */
	public static ComparatorPair compareSubsFun() {
		Comparator post = (o, eo, m, em) -> {
			Context ctx = eo.getContext();
			ArrayList<Constraint> goals = new ArrayList<>();
			for (Subroutine s : eo.getSubroutines()) {
				if (em.getSubroutine(s.getName()) != null) {
					BoolExpr c = ctx.mkEq(eo.getCalled(s.getName()), em.getCalled(s.getName()));
					goals.add(Constraint.goal("called_" + s.getName(), c));
				}
			}
			return Constraint.clause(Collections.emptyList(), goals);
		};
		return new ComparatorPair(post, TRIVIAL);
	}

	/**
	 * Use SMT-LIB2 formulas for the hypothesis and postcondition. Each register
	 * <code>x</code> is available as <code>x_orig</code> and <code>x_mod</code>,
	 * and its initial value as <code>init_x_orig</code> and
	 * <code>init_x_mod</code>.
	 *
	 * @param pre  the hypothesis, or <code>null</code>.
	 * @param post the postcondition, or <code>null</code>.
	 * @return
	 */
	public static ComparatorPair compareSubsSmtlib(String pre, String post) {
		return new ComparatorPair(smtlib("postcondition", post), smtlib("precondition", pre));
	}

	/**
	 * Assume the entry memories of both programs are equal.
	 *
	 * @return
	 */
	public static ComparatorPair compareSubsMemEq() {
		Comparator hyp = (o, eo, m, em) -> {
			Var mem = eo.getArchitecture().getMemory();
			Expr<?> x = init(eo, mem);
			Expr<?> y = init(em, mem);
			return Constraint.goal("memory_equal", Util.equal(eo.getContext(), x, y));
		};
		return new ComparatorPair(TRIVIAL, hyp);
	}

	/**
	 * Assume the given registers hold valid pointers on entry in both programs,
	 * meaning they point into either the stack or the heap.
	 *
	 * @param regs
	 * @return
	 */
	public static ComparatorPair compareSubsPointers(List<String> regs) {
		Comparator hyp = (o, eo, m, em) -> {
			ArrayList<Constraint> hyps = new ArrayList<>();
			for (Environment env : Arrays.asList(eo, em)) {
				Context ctx = env.getContext();
				for (String r : regs) {
					BitVecExpr p = ExpressionTranslator.asBitVector(init(env, register(env, r)));
					BoolExpr valid = ctx.mkOr(env.getStackRange().contains(ctx, p), env.getHeapRange().contains(ctx, p));
					hyps.add(Constraint.goal(env.getConstantName(r) + "_is_pointer", valid));
				}
			}
			return Constraint.clause(Collections.emptyList(), hyps);
		};
		return new ComparatorPair(TRIVIAL, hyp);
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	/**
	 * Bind the variables of a subroutine, the registers of its architecture and
	 * its memory together with their initial values.
	 *
	 * @param env
	 * @param sub
	 */
	public static void initVariables(Environment env, Subroutine sub) {
		initVariables(env, VariableCollector.collect(sub));
	}

	private static void initVariables(Environment env, Collection<Var> vars) {
		Set<Var> all = new LinkedHashSet<>(vars);
		Architecture arch = env.getArchitecture();
		all.addAll(arch.getRegisters());
		all.add(arch.getMemory());
		PreconditionCompiler.initVariables(env, all);
	}

	/**
	 * Assume the initial values of the given registers are equal in both
	 * programs.
	 */
	private static Comparator equalInputs(List<String> regs) {
		return (o, eo, m, em) -> {
			Context ctx = eo.getContext();
			ArrayList<Constraint> hyps = new ArrayList<>();
			for (String r : regs) {
				Expr<?> x = init(eo, register(eo, r));
				Expr<?> y = init(em, register(em, r));
				hyps.add(Constraint.goal("init_" + r + "_equal", Util.equal(ctx, x, y)));
			}
			return Constraint.clause(Collections.emptyList(), hyps);
		};
	}

	private static Comparator smtlib(String kind, String formula) {
		return (o, eo, m, em) -> {
			if (formula == null || formula.isBlank()) {
				return eo.trivialConstraint();
			}
			Map<String, Expr<?>> names = new LinkedHashMap<>();
			Smtlib.addNames(eo, "_orig", names);
			Smtlib.addNames(em, "_mod", names);
			return Constraint.goal("smtlib_" + kind, Smtlib.parse(eo.getContext(), formula, names));
		};
	}

	/**
	 * Construct the hypothesis that the initial stack pointer lies in the stack
	 * region.
	 *
	 * @param env
	 * @return
	 */
	public static Constraint stackPointerInRange(Environment env) {
		Var sp = env.getArchitecture().getStackPointer();
		if (sp == null) {
			return env.trivialConstraint();
		}
		BitVecExpr x = ExpressionTranslator.asBitVector(init(env, sp));
		return Constraint.goal(env.getConstantName(sp.getName()) + "_in_stack",
				env.getStackRange().contains(env.getContext(), x));
	}

	/**
	 * Find a variable by name, looking first at the bound variables and then at
	 * the registers of the architecture.
	 */
	private static Var register(Environment env, String name) {
		Var v = env.findVar(name);
		return v != null ? v : env.getArchitecture().findRegister(name);
	}

	private static Expr<?> init(Environment env, Var var) {
		Expr<?> init = env.getInitVar(var);
		if (init == null) {
			env.initVar(var);
			init = env.getInitVar(var);
		}
		return init;
	}

	private static Constraint conjoin(List<Comparator> comparators, Subroutine original, Environment envOrig,
			Subroutine modified, Environment envMod) {
		ArrayList<Constraint> cs = new ArrayList<>();
		for (Comparator c : comparators) {
			cs.add(c.apply(original, envOrig, modified, envMod));
		}
		return Constraint.clause(Collections.emptyList(), cs);
	}

	private static Set<Var> blockVariables(Block blk) {
		Set<Var> vars = new LinkedHashSet<>();
		for (Elt.Def d : blk.getDefs()) {
			vars.add(d.getLhs());
			vars.addAll(VariableCollector.collect(d.getRhs()));
		}
		return vars;
	}

	private static Constraint visitDefs(PreconditionCompiler pc, Environment env, Constraint post, Block blk) {
		List<Elt.Def> defs = blk.getDefs();
		for (int i = defs.size() - 1; i >= 0; --i) {
			post = pc.visitDef(env, post, defs.get(i));
		}
		return post;
	}
}
