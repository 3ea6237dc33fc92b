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

import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Global;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;

import binwp.ConfigurationException;
import binwp.Parameters;
import binwp.core.BirFile;
import binwp.core.BirFile.Subroutine;
import binwp.core.BirFile.Var;
import binwp.core.Constraint;
import binwp.core.Environment;
import binwp.core.Environment.ExpCond;
import binwp.core.Environment.FunSpecSelector;
import binwp.core.VarGen;
import binwp.core.Weakening;
import binwp.io.BirFilePrinter;
import binwp.io.ConstraintPrinter;
import binwp.util.ExpressionTranslator;
import binwp.util.SideConditions;
import binwp.util.Smtlib;
import binwp.util.Z3Verifier;

/**
 * Runs an analysis over one program, or compares two programs, as configured
 * by a set of parameters. Anything requested through the <code>show</code>
 * and <code>debug</code> options is written to a given output stream.
 */
public class WpTask {
	private static final Logger logger = LoggerFactory.getLogger(WpTask.class);

	private final Context ctx;
	private final Parameters params;
	private final OutputStream output;
	/**
	 * Shared by every environment, so fresh names never clash between programs.
	 */
	private final VarGen varGen = new VarGen();

	public WpTask(Context ctx, Parameters params, OutputStream output) {
		if (ctx == null) {
			throw new IllegalArgumentException("invalid context");
		} else if (params == null) {
			throw new IllegalArgumentException("invalid parameters");
		}
		this.ctx = ctx;
		this.params = params;
		this.output = output;
	}

	/**
	 * Analyse one program, or compare two. The first of two programs is the
	 * original and the second the modified one.
	 *
	 * @param programs
	 * @return
	 * @throws ConfigurationException if the parameters are invalid for the
	 *                                programs given.
	 */
	public WpResult run(BirFile... programs) {
		params.validate(programs.length);
		if (params.isDebug("z3-verbose")) {
			Global.setParameter("verbose", "10");
		}
		if (programs.length == 1) {
			return single(programs[0]);
		} else {
			return comparative(programs[0], programs[1]);
		}
	}

	/**
	 * Check a single program satisfies the postcondition given by the parameters,
	 * assuming the precondition.
	 *
	 * @param program
	 * @return
	 */
	public WpResult single(BirFile program) {
		Subroutine sub = findFunction(program, params.getFunc());
		logger.info("analysing {}", sub.getName());
		Environment env = newEnvironment(program, expConds(Cond.VC), false);
		Compare.initVariables(env, sub);
		Constraint post = params.getPostcond().isBlank() ? env.trivialConstraint()
				: Constraint.goal("postcondition", Smtlib.parse(ctx, params.getPostcond(), Smtlib.names(env, "")));
		Constraint pre = new PreconditionCompiler().visitSub(env, post, sub);
		if (!params.getPrecond().isBlank()) {
			BoolExpr precond = Smtlib.parse(ctx, params.getPrecond(), Smtlib.names(env, ""));
			pre = Constraint.clause(Collections.singletonList(Constraint.goal("precondition", precond)),
					Collections.singletonList(pre));
		}
		List<Constraint> hyps = new ArrayList<>();
		hyps.add(Compare.stackPointerInRange(env));
		hyps.addAll(pointers(env));
		hyps.addAll(env.getInitHypotheses());
		hyps.addAll(PreconditionCompiler.notCalled(env));
		pre = Constraint.clause(hyps, Collections.singletonList(pre));
		if (params.isShown("bir")) {
			BirFilePrinter printer = new BirFilePrinter(output);
			printer.write(sub);
		}
		return check(pre, env);
	}

	/**
	 * Compare an original program against a modified one using the comparators
	 * selected by the parameters.
	 *
	 * @param original
	 * @param modified
	 * @return
	 */
	public WpResult comparative(BirFile original, BirFile modified) {
		Subroutine subOrig = findFunction(original, params.getFunc());
		Subroutine subMod = findFunction(modified, params.getFunc());
		logger.info("comparing {} in both programs", params.getFunc());
		// The modified environment comes first as reads in the original are related to it
		Environment envMod = newEnvironment(modified, expConds(Cond.VC), true);
		Compare.initVariables(envMod, subMod);
		List<ExpCond> condsOrig = new ArrayList<>();
		condsOrig.add(SideConditions.memReadOffsets(envMod, memOffset()));
		condsOrig.addAll(expConds(Cond.ASSUME));
		Environment envOrig = newEnvironment(original, condsOrig, false);
		Compare.initVariables(envOrig, subOrig);
		Constraint pre = Compare.compareSubs(comparators(envOrig, envMod, subOrig, subMod), subOrig, envOrig, subMod,
				envMod);
		if (params.isShown("bir")) {
			BirFilePrinter printer = new BirFilePrinter(output);
			printer.write(subOrig);
			printer.write(subMod);
		}
		return check(pre, envOrig, envMod);
	}

	/**
	 * Check a precondition is valid, and report a counterexample if it is not.
	 *
	 * @param pre
	 * @param envs the environments the precondition was computed in.
	 * @return
	 */
	public WpResult check(Constraint pre, Environment... envs) {
		PrintWriter out = new PrintWriter(output);
		if (params.isDebug("constraint-stats")) {
			out.println("Constraint statistics: " + pre.getStats());
			out.flush();
		}
		if (params.isDebug("eval-constraint-stats")) {
			long start = System.currentTimeMillis();
			pre.eval(ctx);
			logger.info("evaluated constraint in {}ms", System.currentTimeMillis() - start);
		}
		Z3Verifier verifier = new Z3Verifier(ctx);
		if (params.getTimeout() > 0) {
			verifier.setTimeout(params.getTimeout());
		}
		Solver solver = verifier.newSolver();
		Status status = Z3Verifier.check(solver, ctx, pre);
		Z3Verifier.Verdict verdict = Z3Verifier.verdict(status);
		logger.info("verdict for {}: {}", params.getFunc(), verdict);
		Z3Verifier.Counterexample cex = null;
		List<Constraint.Goal> refuted = Collections.emptyList();
		Model model = null;
		if (verdict == Z3Verifier.Verdict.REFUTED) {
			model = solver.getModel();
			cex = Z3Verifier.getCounterexample(model, envs);
			refuted = pre.getRefutedGoals(model);
		}
		Map<String, String> stats = Z3Verifier.getStatistics(solver);
		if (params.isShown("precond-smtlib")) {
			out.println(solver);
		}
		if (params.isDebug("z3-solver-stats")) {
			out.println("Solver statistics:");
			for (Map.Entry<String, String> e : stats.entrySet()) {
				out.println("  " + e.getKey() + " = " + e.getValue());
			}
		}
		out.println(verdict);
		if (cex != null) {
			out.println("Countermodel:");
			out.println(cex);
		}
		if (model != null && params.isShown("refuted-goals")) {
			out.println("Refuted goals:");
			for (Constraint.Goal g : refuted) {
				out.println("  " + g.getName() + (g.getOrigin() == null ? "" : " @ " + g.getOrigin()) + ": "
						+ g.getTerm());
			}
		}
		out.flush();
		if (params.isShown("precond-internal")) {
			new ConstraintPrinter(output).write(pre);
		}
		if (model != null && params.isShown("paths")) {
			new ConstraintPrinter(output).writePaths(pre, model);
		}
		List<Weakening> weakenings = new ArrayList<>();
		for (Environment env : envs) {
			weakenings.addAll(env.getWeakenings());
		}
		return new WpResult(verdict, pre, cex, refuted, weakenings, stats);
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	private enum Cond {
		VC, ASSUME
	}

	private Environment newEnvironment(BirFile program, List<ExpCond> conds, boolean freshen) {
		return new Environment.Builder(ctx, varGen).architecture(program.getArchitecture())
				.subroutines(program.getSubroutines()).specs(specs())
				.defaultSpec(FunctionSpecs.defaultSelector()).expConds(conds).numUnroll(params.getNumUnroll())
				.useFunInputRegs(params.getUseFunInputRegs()).stackRange(params.getStackRange())
				.heapRange(params.getHeapRange()).freshen(freshen).build();
	}

	/**
	 * Determine the function specs, in the order they are tried.
	 *
	 * @return
	 */
	private List<FunSpecSelector> specs() {
		ArrayList<FunSpecSelector> specs = new ArrayList<>();
		for (Parameters.UserFuncSpec u : params.getUserFuncSpecs()) {
			specs.add(FunctionSpecs.userFuncSpec(u.getName(), u.getPre(), u.getPost()));
		}
		if (params.getTripAsserts()) {
			specs.add(FunctionSpecs.VERIFIER_ERROR);
		}
		if (params.getInline() != null) {
			specs.add(FunctionSpecs.inline(params.getInline()));
		}
		if (params.getFunSpecs().isEmpty()) {
			specs.addAll(FunctionSpecs.defaults());
		} else {
			for (String name : params.getFunSpecs()) {
				specs.add(FunctionSpecs.byName(name));
			}
		}
		return specs;
	}

	private List<ExpCond> expConds(Cond kind) {
		ArrayList<ExpCond> conds = new ArrayList<>();
		boolean vc = kind == Cond.VC;
		if (params.getCheckNullDerefs()) {
			conds.add(vc ? SideConditions.NON_NULL_LOAD_VC : SideConditions.NON_NULL_LOAD_ASSUME);
			conds.add(vc ? SideConditions.NON_NULL_STORE_VC : SideConditions.NON_NULL_STORE_ASSUME);
		}
		if (params.getCheckInvalidDerefs()) {
			conds.add(vc ? SideConditions.VALID_LOAD_VC : SideConditions.VALID_LOAD_ASSUME);
			conds.add(vc ? SideConditions.VALID_STORE_VC : SideConditions.VALID_STORE_ASSUME);
		}
		return conds;
	}

	private UnaryOperator<BitVecExpr> memOffset() {
		if (params.getMemOffset() == null) {
			return UnaryOperator.identity();
		} else {
			return SideConditions.constantOffset(ctx, params.getMemOffset());
		}
	}

	private List<Compare.ComparatorPair> comparators(Environment envOrig, Environment envMod, Subroutine subOrig,
			Subroutine subMod) {
		ArrayList<Compare.ComparatorPair> comps = new ArrayList<>();
		comps.add(Compare.compareSubsSp());
		if (params.getCompareFuncCalls()) {
			comps.add(Compare.compareSubsFun());
		}
		if (!params.getComparePostRegValues().isEmpty()) {
			Set<String> inputs = new LinkedHashSet<>();
			for (Environment env : Arrays.asList(envOrig, envMod)) {
				for (Var v : env.getInitVars().keySet()) {
					if (!v.isMemory()) {
						inputs.add(v.getName());
					}
				}
			}
			// Only registers known to both programs can be compared
			inputs.removeIf(r -> envOrig.findVar(r) == null || envMod.findVar(r) == null);
			logger.debug("pre registers {}, post registers {}", inputs, params.getComparePostRegValues());
			comps.add(Compare.compareSubsEq(new ArrayList<>(inputs), params.getComparePostRegValues()));
		}
		if (!params.getPrecond().isBlank() || !params.getPostcond().isBlank()) {
			comps.add(Compare.compareSubsSmtlib(params.getPrecond(), params.getPostcond()));
		}
		if (!params.getPointerRegList().isEmpty()) {
			comps.add(Compare.compareSubsPointers(params.getPointerRegList()));
		}
		if (params.getRewriteAddresses()) {
			comps.add(Compare.compareSubsMemEq());
		}
		return comps;
	}

	/**
	 * Assume the pointer registers point into the stack or the heap on entry.
	 */
	private List<Constraint> pointers(Environment env) {
		ArrayList<Constraint> hyps = new ArrayList<>();
		for (String r : params.getPointerRegList()) {
			Var v = env.findVar(r);
			if (v == null) {
				v = env.getArchitecture().findRegister(r);
			}
			com.microsoft.z3.Expr<?> init = env.getInitVar(v);
			if (init == null) {
				throw new ConfigurationException("pointer register " + r + " is not live in " + params.getFunc());
			}
			BitVecExpr p = ExpressionTranslator.asBitVector(init);
			hyps.add(Constraint.goal(r + "_is_pointer",
					ctx.mkOr(env.getStackRange().contains(ctx, p), env.getHeapRange().contains(ctx, p))));
		}
		return hyps;
	}

	private static Subroutine findFunction(BirFile program, String name) {
		Subroutine sub = program.getSubroutine(name);
		if (sub == null) {
			throw new ConfigurationException("could not find function " + name);
		}
		return sub;
	}
}
