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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;

import binwp.core.BirFile;
import binwp.core.BirFile.Block;
import binwp.core.BirFile.Elt;
import binwp.core.BirFile.Label;
import binwp.core.BirFile.Subroutine;
import binwp.core.BirFile.Tid;
import binwp.core.BirFile.Var;
import binwp.core.Constraint;
import binwp.core.Environment;
import binwp.core.Environment.Cond;
import binwp.core.Environment.FunSpec;
import binwp.core.Environment.LoopHandler;
import binwp.core.Environment.GraphVisitor;
import binwp.core.Weakening;
import binwp.util.ExpressionTranslator;
import binwp.util.TranslationException;
import binwp.util.UnboundVariableException;
import binwp.util.Util;
import binwp.util.VariableCollector;
import binwp.util.WidthMismatchException;

/**
 * Computes weakest preconditions of lifted subroutines by backward
 * substitution. Blocks are visited in postorder from the entry, so that the
 * precondition of every successor is known before the block itself is
 * visited. The one exception is a back edge, whose target is still being
 * visited. Back edges are passed to the loop handler of the environment.
 *
 * <p>
 * The precondition of each block is cached in the environment, and a block
 * reached along several paths is only visited once. Constraint trees share the
 * cached subtrees.
 * </p>
 */
public class PreconditionCompiler {
	private static final Logger logger = LoggerFactory.getLogger(PreconditionCompiler.class);

	/**
	 * The subroutines currently being visited, innermost first.
	 */
	private final Deque<Frame> frames = new ArrayDeque<>();

	// =========================================================================
	// Subroutines
	// =========================================================================

	/**
	 * Compute the precondition of a subroutine which guarantees a given
	 * postcondition on return.
	 *
	 * @param env
	 * @param post
	 * @param sub
	 * @return
	 */
	public Constraint visitSub(Environment env, Constraint post, Subroutine sub) {
		Block entry = sub.getEntry();
		if (entry == null) {
			throw new IllegalArgumentException("subroutine " + sub.getName() + " has no entry block");
		}
		ControlFlowGraph cfg = new ControlFlowGraph(sub);
		for (Var v : VariableCollector.collect(sub)) {
			env.mkVar(v);
		}
		LoopHandler loops = env.getLoopHandler();
		GraphVisitor previous = loops.getRecursiveCall();
		loops.setRecursiveCall((e, p, start) -> visitGraph(e, p, start, cfg));
		frames.push(new Frame(cfg, post));
		logger.debug("visiting subroutine {} ({} blocks)", sub.getName(), sub.getBlocks().size());
		try {
			return visitGraph(env, post, entry.getTid(), cfg);
		} finally {
			frames.pop();
			loops.setRecursiveCall(previous);
		}
	}

	/**
	 * Visit the blocks reachable from a given start block in postorder, and return
	 * the precondition of the start block.
	 *
	 * @param env
	 * @param post
	 * @param start
	 * @param cfg
	 * @return
	 */
	public Constraint visitGraph(Environment env, Constraint post, Tid start, ControlFlowGraph cfg) {
		Set<Tid> visited = new HashSet<>();
		Deque<Visit> stack = new ArrayDeque<>();
		visited.add(start);
		stack.push(new Visit(start, null, cfg.getSuccessors(start).iterator()));
		Constraint result = null;
		while (!stack.isEmpty()) {
			Visit top = stack.peek();
			if (top.successors.hasNext()) {
				Tid succ = top.successors.next();
				if (visited.add(succ) && env.getPrecondition(succ) == null) {
					stack.push(new Visit(succ, top.block, cfg.getSuccessors(succ).iterator()));
				}
			} else {
				stack.pop();
				result = visitBlock(env, post, cfg.getBlock(top.block), top.parent);
			}
		}
		return result;
	}

	// =========================================================================
	// Blocks
	// =========================================================================

	/**
	 * Compute the precondition of a block, or return the cached one. The
	 * postcondition is that of the enclosing subroutine.
	 *
	 * @param env
	 * @param post
	 * @param blk
	 * @return
	 */
	public Constraint visitBlock(Environment env, Constraint post, Block blk) {
		return visitBlock(env, post, blk, null);
	}

	private Constraint visitBlock(Environment env, Constraint post, Block blk, Tid predecessor) {
		Constraint pre = env.getPrecondition(blk.getTid());
		if (pre != null) {
			logger.trace("reusing precondition of {}", blk.getTid());
			return pre;
		}
		pre = post;
		List<Elt.Jmp> jmps = blk.getJmps();
		for (int i = jmps.size() - 1; i >= 0; --i) {
			pre = visitElement(env, pre, blk, jmps.get(i), predecessor);
		}
		List<Elt.Def> defs = blk.getDefs();
		for (int i = defs.size() - 1; i >= 0; --i) {
			pre = visitElement(env, pre, blk, defs.get(i), predecessor);
		}
		List<Elt.Phi> phis = blk.getPhis();
		for (int i = phis.size() - 1; i >= 0; --i) {
			pre = visitElement(env, pre, blk, phis.get(i), predecessor);
		}
		env.addPrecondition(blk.getTid(), pre);
		return pre;
	}

	// =========================================================================
	// Elements
	// =========================================================================

	/**
	 * Compute the precondition of a single block element. Phi nodes take the
	 * value of their first incoming edge.
	 *
	 * @param env
	 * @param post
	 * @param blk
	 * @param elt
	 * @return
	 */
	public Constraint visitElement(Environment env, Constraint post, Block blk, Elt elt) {
		return visitElement(env, post, blk, elt, null);
	}

	private Constraint visitElement(Environment env, Constraint post, Block blk, Elt elt, Tid predecessor) {
		if (elt instanceof Elt.Def) {
			return visitDef(env, post, (Elt.Def) elt);
		} else if (elt instanceof Elt.Phi) {
			return visitPhi(env, post, (Elt.Phi) elt, predecessor);
		} else if (elt instanceof Elt.Jmp) {
			return visitJmp(env, post, blk, (Elt.Jmp) elt);
		} else {
			throw new IllegalArgumentException("unknown block element encountered (" + elt.getClass().getName() + ")");
		}
	}

	/**
	 * The precondition of an assignment <code>x := e</code> is the postcondition
	 * with <code>e</code> substituted for <code>x</code>, surrounded by the side
	 * conditions arising from <code>e</code>.
	 *
	 * @param env
	 * @param post
	 * @param def
	 * @return
	 */
	public Constraint visitDef(Environment env, Constraint post, Elt.Def def) {
		return assign(env, post, def.getLhs(), def.getRhs(), def.getTid());
	}

	/**
	 * A phi node is treated as an assignment from the value flowing in along the
	 * edge from the given predecessor. This is incomplete when there are several
	 * incoming edges.
	 */
	private Constraint visitPhi(Environment env, Constraint post, Elt.Phi phi, Tid predecessor) {
		Map<Tid, BirFile.Expr> incoming = phi.getIncoming();
		if (incoming.isEmpty()) {
			return post;
		}
		BirFile.Expr value = predecessor == null ? null : incoming.get(predecessor);
		if (incoming.size() > 1) {
			env.weaken(Weakening.Kind.PHI_NODE, phi.getTid(),
					"using value from " + (value != null ? predecessor : "first incoming edge"));
		}
		if (value == null) {
			value = incoming.values().iterator().next();
		}
		return assign(env, post, phi.getLhs(), value, phi.getTid());
	}

	private Constraint assign(Environment env, Constraint post, Var lhs, BirFile.Expr rhs, Tid tid) {
		ExpressionTranslator.Result r = env.getTranslator().translate(rhs);
		Expr<?> x = env.getVar(lhs);
		if (x == null) {
			throw new UnboundVariableException(lhs);
		}
		Expr<?> e = r.getTerm();
		if (!x.getSort().equals(e.getSort())) {
			if (x instanceof BitVecExpr && e instanceof BitVecExpr) {
				throw new WidthMismatchException("assignment to " + lhs.getName(), ((BitVecExpr) x).getSortSize(),
						((BitVecExpr) e).getSortSize());
			}
			throw new TranslationException("cannot assign " + e.getSort() + " to " + lhs.getName());
		}
		ExpressionTranslator.Hooks hooks = r.getHooks();
		Constraint after = guard(post, hooks.getAssumeAfter(), hooks.getVerifyAfter(), tid);
		Constraint pre = after.substitute(x, e);
		return guard(pre, hooks.getAssumeBefore(), hooks.getVerifyBefore(), tid);
	}

	/**
	 * Compute the precondition of a jump given the precondition of the remaining
	 * jumps of the block, which hold when this jump is not taken.
	 *
	 * @param env
	 * @param fallthrough
	 * @param blk
	 * @param jmp
	 * @return
	 */
	public Constraint visitJmp(Environment env, Constraint fallthrough, Block blk, Elt.Jmp jmp) {
		Optional<Constraint> spec = env.getJmpSpec().apply(env, fallthrough, blk.getTid(), jmp);
		if (spec.isPresent()) {
			return spec.get();
		}
		BirFile.Expr condition = jmp.getCondition();
		if (condition instanceof BirFile.Expr.Constant && ((BirFile.Expr.Constant) condition).getValue().signum() == 0) {
			// never taken
			return fallthrough;
		}
		Constraint taken = visitTarget(env, fallthrough, jmp);
		if (jmp.isUnconditional()) {
			return taken;
		}
		Context ctx = env.getContext();
		ExpressionTranslator.Result r = env.getTranslator().translate(condition);
		BoolExpr g = Util.toBool(ctx, ExpressionTranslator.asBitVector(r.getTerm()));
		Constraint pre = Constraint.conjunction(
				Constraint.implies(Constraint.goal("jump_taken", g, jmp.getTid()), taken),
				Constraint.implies(Constraint.goal("jump_not_taken", ctx.mkNot(g), jmp.getTid()), fallthrough));
		ExpressionTranslator.Hooks hooks = r.getHooks();
		return guard(pre, Util.append(hooks.getAssumeBefore(), hooks.getAssumeAfter()),
				Util.append(hooks.getVerifyBefore(), hooks.getVerifyAfter()), jmp.getTid());
	}

	/**
	 * Compute the precondition holding when a jump is taken.
	 */
	private Constraint visitTarget(Environment env, Constraint fallthrough, Elt.Jmp jmp) {
		Frame frame = frames.peek();
		if (frame == null) {
			throw new IllegalStateException("jump " + jmp.getTid() + " visited outside of a subroutine");
		}
		if (jmp instanceof Elt.Goto) {
			Label target = ((Elt.Goto) jmp).getTarget();
			if (target instanceof Label.Direct) {
				return successor(env, frame, ((Label.Direct) target).getTarget());
			}
			env.weaken(Weakening.Kind.INDIRECT_JUMP, jmp.getTid(), "indirect jump not followed");
			return fallthrough;
		} else if (jmp instanceof Elt.Call) {
			return visitCall(env, frame, (Elt.Call) jmp);
		} else if (jmp instanceof Elt.Interrupt) {
			Elt.Interrupt irq = (Elt.Interrupt) jmp;
			Tid resume = irq.getReturn();
			Constraint post = resume == null ? frame.post : successor(env, frame, resume);
			return env.getIntSpec().apply(env, post, irq.getNumber());
		} else {
			return frame.post;
		}
	}

	private Constraint visitCall(Environment env, Frame frame, Elt.Call call) {
		Label ret = call.getReturn();
		Constraint returned;
		if (ret instanceof Label.Direct) {
			returned = successor(env, frame, ((Label.Direct) ret).getTarget());
		} else {
			returned = frame.post;
		}
		if (!(call.getTarget() instanceof Label.Direct)) {
			env.weaken(Weakening.Kind.INDIRECT_CALL, call.getTid(), "indirect call not followed");
			return returned;
		}
		Tid target = ((Label.Direct) call.getTarget()).getTarget();
		Subroutine callee = env.getSubroutine(target);
		if (callee == null) {
			env.weaken(Weakening.Kind.INDIRECT_CALL, call.getTid(), "call to unknown subroutine " + target);
			return returned;
		}
		Constraint pre = visitCall(env, returned, callee, call.getTid());
		BoolExpr called = env.getCalled(callee.getName());
		return pre.substitute(called, env.getContext().mkTrue());
	}

	/**
	 * Compute the precondition of a call to a given subroutine, using the function
	 * spec the environment selects for it.
	 *
	 * @param env
	 * @param post
	 * @param callee
	 * @param callSite
	 * @return
	 */
	public Constraint visitCall(Environment env, Constraint post, Subroutine callee, Tid callSite) {
		FunSpec spec = env.getSubHandler(callee);
		if (!spec.isInline()) {
			return spec.getSummary().apply(env, post, callSite);
		} else if (callee.getEntry() == null || isActive(callee)) {
			env.weaken(Weakening.Kind.RECURSIVE_INLINE, callSite, "cannot inline " + callee.getName());
			return FunctionSpecs.DEFAULT.getSummary().apply(env, post, callSite);
		}
		logger.debug("inlining {} at {}", callee.getName(), callSite);
		env.pushScope();
		try {
			return visitSub(env, post, callee);
		} finally {
			env.popScope();
		}
	}

	/**
	 * Bind every variable to a fresh constant along with a constant for its
	 * initial value, and return the hypotheses equating the two.
	 *
	 * @param env
	 * @param vars
	 * @return
	 */
	public static List<Constraint> initVariables(Environment env, Collection<Var> vars) {
		return env.initVars(vars);
	}

	/**
	 * Assume every function tracked by the environment has not been called on
	 * entry.
	 *
	 * @param env
	 * @return
	 */
	public static List<Constraint> notCalled(Environment env) {
		ArrayList<Constraint> hyps = new ArrayList<>();
		Context ctx = env.getContext();
		for (Map.Entry<String, BoolExpr> e : env.getCalledSymbols().entrySet()) {
			hyps.add(Constraint.goal("not_called_" + e.getKey(), ctx.mkNot(e.getValue())));
		}
		return hyps;
	}

	private Constraint successor(Environment env, Frame frame, Tid target) {
		Constraint pre = env.getPrecondition(target);
		if (pre != null) {
			return pre;
		} else if (!frame.cfg.contains(target)) {
			throw new IllegalArgumentException(
					"jump to " + target + " leaves subroutine " + frame.cfg.getSubroutine().getName());
		}
		// back edge
		return env.getLoopHandler().handle(env, frame.post, target);
	}

	private boolean isActive(Subroutine sub) {
		for (Frame f : frames) {
			if (f.cfg.getSubroutine().getTid().equals(sub.getTid())) {
				return true;
			}
		}
		return false;
	}

	static Constraint guard(Constraint post, List<Cond> assumes, List<Cond> verifies, Tid tid) {
		if (assumes.isEmpty() && verifies.isEmpty()) {
			return post;
		}
		ArrayList<Constraint> hyps = new ArrayList<>();
		for (Cond c : assumes) {
			hyps.add(Constraint.goal(c.getName(), c.getTerm(), tid));
		}
		ArrayList<Constraint> concs = new ArrayList<>();
		for (Cond c : verifies) {
			concs.add(Constraint.goal(c.getName(), c.getTerm(), tid));
		}
		concs.add(post);
		return Constraint.clause(hyps, concs);
	}

	private static final class Frame {
		private final ControlFlowGraph cfg;
		private final Constraint post;

		private Frame(ControlFlowGraph cfg, Constraint post) {
			this.cfg = cfg;
			this.post = post;
		}
	}

	private static final class Visit {
		private final Tid block;
		private final Tid parent;
		private final Iterator<Tid> successors;

		private Visit(Tid block, Tid parent, Iterator<Tid> successors) {
			this.block = block;
			this.parent = parent;
			this.successors = successors;
		}
	}
}
