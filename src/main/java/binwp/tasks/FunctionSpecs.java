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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;

import binwp.core.Architecture;
import binwp.core.BirFile.Arg;
import binwp.core.BirFile.Attribute;
import binwp.core.BirFile.Subroutine;
import binwp.core.BirFile.Var;
import binwp.core.Constraint;
import binwp.core.Environment;
import binwp.core.Environment.FunSpec;
import binwp.core.Environment.FunSpecSelector;
import binwp.util.ExpressionTranslator;
import binwp.util.Smtlib;
import binwp.util.VariableCollector;

/**
 * The function specs which decide how a call is treated. Most summarise the
 * callee by replacing the registers it may modify with uninterpreted functions
 * of its inputs, which is sound for deterministic callees and allows two
 * programs calling the same function with the same inputs to be compared.
 */
public class FunctionSpecs {
	/**
	 * Names of functions which never return normally.
	 */
	private static final Set<String> ERROR_FUNCTIONS = new HashSet<>(
			Arrays.asList("__assert_fail", "__VERIFIER_error", "abort"));

	/**
	 * The fallback spec, which assumes the callee has no effect other than
	 * popping the return address on x86.
	 */
	public static final FunSpec DEFAULT = FunSpec.summary("default", (env, post, tid) -> popReturnAddress(env, post));

	public static final FunSpecSelector VERIFIER_ERROR = (sub, arch) -> {
		if (!ERROR_FUNCTIONS.contains(sub.getName())) {
			return Optional.empty();
		}
		return Optional.of(FunSpec.summary("verifier-error",
				(env, post, tid) -> Constraint.goal("assert_fail", env.getContext().mkFalse(), tid)));
	};

	public static final FunSpecSelector VERIFIER_ASSUME = (sub, arch) -> {
		if (!sub.getName().equals("__VERIFIER_assume")) {
			return Optional.empty();
		}
		return Optional.of(FunSpec.summary("verifier-assume", (env, post, tid) -> {
			List<Var> inputs = inputs(env, sub);
			if (inputs.isEmpty()) {
				throw new IllegalArgumentException("__VERIFIER_assume has no argument on " + arch);
			}
			Context ctx = env.getContext();
			BitVecExpr arg = ExpressionTranslator.asBitVector(env.mkVar(inputs.get(0)));
			BoolExpr assumption = ctx.mkNot(ctx.mkEq(arg, ctx.mkBV(0, arg.getSortSize())));
			return Constraint.implies(Constraint.goal("verifier_assume", assumption, tid),
					popReturnAddress(env, post));
		}));
	};

	public static final FunSpecSelector VERIFIER_NONDET = (sub, arch) -> {
		if (!sub.getName().startsWith("__VERIFIER_nondet") || arch.getReturnRegister() == null) {
			return Optional.empty();
		}
		return Optional.of(FunSpec.summary("verifier-nondet", (env, post, tid) -> {
			Var ret = env.getArchitecture().getReturnRegister();
			Expr<?> value = env.getContext().mkConst(env.getVarGen().fresh(sub.getName()), env.sortOf(ret.getType()));
			return popReturnAddress(env, post.substitute(env.mkVar(ret), value));
		}));
	};

	public static final FunSpecSelector EMPTY = (sub, arch) -> {
		if (!isEmpty(sub)) {
			return Optional.empty();
		}
		return Optional.of(FunSpec.summary("empty", (env, post, tid) -> popReturnAddress(env, post)));
	};

	public static final FunSpecSelector ARG_TERMS = (sub, arch) -> {
		if (sub.getArgs().isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(FunSpec.summary("arg-terms", (env, post, tid) -> {
			ArrayList<Var> outputs = new ArrayList<>();
			for (Arg a : sub.getArgs()) {
				if (a.isOutput()) {
					outputs.add(a.getVar());
				}
			}
			return popReturnAddress(env, chaos(env, post, sub, outputs, inputs(env, sub)));
		}));
	};

	public static final FunSpecSelector RAX_OUT = (sub, arch) -> {
		Var ret = arch.getReturnRegister();
		if (ret == null || !VariableCollector.collectAssigned(sub).contains(ret)) {
			return Optional.empty();
		}
		return Optional.of(chaosSpec("rax-out", sub, Collections.singletonList(ret)));
	};

	public static final FunSpecSelector CHAOS_RAX = (sub, arch) -> {
		Var ret = arch.getReturnRegister();
		if (ret == null || !arch.isX86()) {
			return Optional.empty();
		}
		return Optional.of(chaosSpec("chaos-rax", sub, Collections.singletonList(ret)));
	};

	public static final FunSpecSelector CHAOS_CALLER_SAVED = (sub, arch) -> {
		if (!arch.isX86()) {
			return Optional.empty();
		}
		return Optional.of(chaosSpec("chaos-caller-saved", sub, arch.getCallerSavedRegisters()));
	};

	/**
	 * The function specs selectable by name, in their default order.
	 */
	private static final Map<String, FunSpecSelector> NAMED = new LinkedHashMap<>();

	static {
		NAMED.put("verifier-error", VERIFIER_ERROR);
		NAMED.put("verifier-assume", VERIFIER_ASSUME);
		NAMED.put("verifier-nondet", VERIFIER_NONDET);
		NAMED.put("empty", EMPTY);
		NAMED.put("arg-terms", ARG_TERMS);
		NAMED.put("chaos-caller-saved", CHAOS_CALLER_SAVED);
		NAMED.put("rax-out", RAX_OUT);
		NAMED.put("chaos-rax", CHAOS_RAX);
	}

	/**
	 * The specs used when none are configured.
	 *
	 * @return
	 */
	public static List<FunSpecSelector> defaults() {
		return Arrays.asList(VERIFIER_ASSUME, VERIFIER_NONDET, EMPTY, CHAOS_CALLER_SAVED);
	}

	public static boolean isKnown(String name) {
		return NAMED.containsKey(name);
	}

	/**
	 * Look up a function spec by name.
	 *
	 * @param name
	 * @return
	 * @throws IllegalArgumentException if there is no such spec.
	 */
	public static FunSpecSelector byName(String name) {
		FunSpecSelector s = NAMED.get(name);
		if (s == null) {
			throw new IllegalArgumentException("unknown function spec " + name);
		}
		return s;
	}

	public static FunSpecSelector defaultSelector() {
		return (sub, arch) -> Optional.of(DEFAULT);
	}

	/**
	 * Inline every subroutine whose name, or hex address, matches a given regular
	 * expression.
	 *
	 * @param regex
	 * @return
	 */
	public static FunSpecSelector inline(String regex) {
		Pattern pattern = Pattern.compile(regex);
		return (sub, arch) -> {
			Attribute.Address address = sub.getAttribute(Attribute.Address.class);
			boolean matches = pattern.matcher(sub.getName()).matches()
					|| (address != null && pattern.matcher(address.toString()).matches());
			return matches ? Optional.of(FunSpec.inline("inline")) : Optional.empty();
		};
	}

	/**
	 * A spec for a named function given by SMT-LIB2 formulas. The precondition
	 * must hold at the call site and the postcondition is assumed on return.
	 * Caller-saved registers are havocked across the call. In the postcondition,
	 * a register <code>x</code> denotes its value on return and
	 * <code>init_x</code> its value at the call site.
	 *
	 * @param name
	 * @param pre
	 * @param post
	 * @return
	 */
	public static FunSpecSelector userFuncSpec(String name, String pre, String post) {
		return (sub, arch) -> {
			if (!sub.getName().equals(name)) {
				return Optional.empty();
			}
			return Optional.of(FunSpec.summary("user-func-spec", (env, p, tid) -> {
				Context ctx = env.getContext();
				Map<String, Expr<?>> names = new LinkedHashMap<>();
				List<Expr<?>> inits = new ArrayList<>();
				List<Expr<?>> atCall = new ArrayList<>();
				for (Var r : env.getArchitecture().getRegisters()) {
					Expr<?> x = env.mkVar(r);
					Expr<?> init = ctx.mkConst(env.getVarGen().fresh("init_" + r.getName()), x.getSort());
					names.put(r.getName(), x);
					names.put("init_" + r.getName(), init);
					inits.add(init);
					atCall.add(x);
				}
				BoolExpr required = Smtlib.parse(ctx, pre, names);
				BoolExpr ensured = Smtlib.parse(ctx, post, names);
				// havoc outputs in both the ensured formula and the postcondition
				List<Var> outputs = env.getArchitecture().getCallerSavedRegisters();
				Expr<?>[] from = new Expr<?>[outputs.size()];
				Expr<?>[] to = new Expr<?>[outputs.size()];
				for (int i = 0; i != from.length; ++i) {
					from[i] = env.mkVar(outputs.get(i));
					to[i] = ctx.mkConst(env.getVarGen().fresh(name + "_" + outputs.get(i).getName()),
							from[i].getSort());
				}
				ensured = (BoolExpr) ensured.substitute(from, to);
				ensured = (BoolExpr) ensured.substitute(inits.toArray(new Expr<?>[0]), atCall.toArray(new Expr<?>[0]));
				Constraint returned = popReturnAddress(env, p.substitute(from, to));
				return Constraint.conjunction(Constraint.goal(name + "_pre", required, tid),
						Constraint.implies(Constraint.goal(name + "_post", ensured, tid), returned));
			}));
		};
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	/**
	 * Model the given output registers of a call as uninterpreted functions of the
	 * callee's inputs.
	 *
	 * @param env
	 * @param post
	 * @param callee
	 * @param outputs
	 * @param inputs
	 * @return
	 */
	public static Constraint chaos(Environment env, Constraint post, Subroutine callee, List<Var> outputs,
			List<Var> inputs) {
		Context ctx = env.getContext();
		Expr<?>[] args = new Expr<?>[inputs.size()];
		Sort[] domain = new Sort[inputs.size()];
		for (int i = 0; i != args.length; ++i) {
			args[i] = env.mkVar(inputs.get(i));
			domain[i] = args[i].getSort();
		}
		Expr<?>[] from = new Expr<?>[outputs.size()];
		Expr<?>[] to = new Expr<?>[outputs.size()];
		for (int i = 0; i != from.length; ++i) {
			Var out = outputs.get(i);
			FuncDecl<?> f = env.getCallSymbol(callee.getName() + "_" + out.getName(), domain,
					env.sortOf(out.getType()));
			from[i] = env.mkVar(out);
			to[i] = ctx.mkApp(f, args);
		}
		return post.substitute(from, to);
	}

	/**
	 * On x86 the callee pops the return address pushed by the call, so the stack
	 * pointer on return is one address higher than at the call.
	 *
	 * @param env
	 * @param post
	 * @return
	 */
	public static Constraint popReturnAddress(Environment env, Constraint post) {
		Architecture arch = env.getArchitecture();
		Var sp = arch.getStackPointer();
		if (!arch.isX86() || sp == null) {
			return post;
		}
		Context ctx = env.getContext();
		BitVecExpr x = ExpressionTranslator.asBitVector(env.mkVar(sp));
		return post.substitute(x, ctx.mkBVAdd(x, ctx.mkBV(arch.getAddressBytes(), x.getSortSize())));
	}

	/**
	 * Determine the inputs of a callee, either the argument registers of the
	 * architecture or the declared input arguments of the callee.
	 *
	 * @param env
	 * @param callee
	 * @return
	 */
	public static List<Var> inputs(Environment env, Subroutine callee) {
		if (env.useFunInputRegs() || callee.getArgs().isEmpty()) {
			return env.getArchitecture().getInputRegisters();
		}
		ArrayList<Var> inputs = new ArrayList<>();
		for (Arg a : callee.getArgs()) {
			if (a.isInput()) {
				inputs.add(a.getVar());
			}
		}
		return inputs;
	}

	private static FunSpec chaosSpec(String name, Subroutine sub, List<Var> outputs) {
		return FunSpec.summary(name,
				(env, post, tid) -> popReturnAddress(env, chaos(env, post, sub, outputs, inputs(env, sub))));
	}

	private static boolean isEmpty(Subroutine sub) {
		return sub.getBlocks().isEmpty();
	}
}
