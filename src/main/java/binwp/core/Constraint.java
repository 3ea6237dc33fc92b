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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;

import binwp.core.BirFile.Tid;

/**
 * A tree of named proof goals. A <code>Goal</code> is a single boolean formula
 * tagged with a name and, optionally, the term it was generated for. A
 * <code>Clause</code> says that its conclusions hold whenever its hypotheses
 * hold. Constraint trees are immutable and may share subtrees, which is what
 * keeps weakest preconditions over diamond-shaped control flow from blowing up.
 */
public abstract class Constraint {

	/**
	 * Convert this constraint into a single boolean formula. A subtree shared
	 * between several parents is converted once, and the resulting term is shared
	 * in the same way.
	 *
	 * @param ctx
	 * @return
	 */
	public BoolExpr eval(Context ctx) {
		return eval(ctx, new IdentityHashMap<>());
	}

	protected abstract BoolExpr eval(Context ctx, Map<Constraint, BoolExpr> cache);

	/**
	 * Simultaneously replace every occurrence of <code>from[i]</code> with
	 * <code>to[i]</code>.
	 *
	 * @param from
	 * @param to
	 * @return
	 */
	public Constraint substitute(Expr<?>[] from, Expr<?>[] to) {
		if (from.length != to.length) {
			throw new IllegalArgumentException("mismatched substitution (" + from.length + " vs " + to.length + ")");
		} else if (from.length == 0) {
			return this;
		}
		return substitute(from, to, new IdentityHashMap<>());
	}

	public Constraint substitute(Expr<?> from, Expr<?> to) {
		return substitute(new Expr<?>[] { from }, new Expr<?>[] { to });
	}

	protected abstract Constraint substitute(Expr<?>[] from, Expr<?>[] to, Map<Constraint, Constraint> cache);

	/**
	 * Collect the goals which evaluate to false under a given model. The
	 * conclusions of a clause are only inspected when its hypotheses hold in the
	 * model, since otherwise they are vacuously satisfied.
	 *
	 * @param model
	 * @return
	 */
	public List<Goal> getRefutedGoals(Model model) {
		ArrayList<Goal> goals = new ArrayList<>();
		collectRefuted(model, goals, new IdentityHashMap<>(), Collections.newSetFromMap(new IdentityHashMap<>()));
		return goals;
	}

	/**
	 * Check whether this constraint holds in a given model.
	 *
	 * @param model
	 * @return
	 */
	public boolean holds(Model model) {
		return holds(model, new IdentityHashMap<>());
	}

	protected abstract void collectRefuted(Model model, List<Goal> goals, Map<Constraint, Boolean> holds,
			Set<Constraint> visited);

	protected abstract boolean holds(Model model, Map<Constraint, Boolean> cache);

	/**
	 * Compute simple size statistics over this tree.
	 *
	 * @return
	 */
	public Stats getStats() {
		Stats stats = new Stats();
		stats.depth = count(stats, new IdentityHashMap<>());
		return stats;
	}

	/**
	 * Count the goals and clauses of this tree not seen before, returning its
	 * depth. The depth of every subtree visited is recorded.
	 */
	protected abstract int count(Stats stats, Map<Constraint, Integer> depths);

	// =========================================================================
	// Constructors
	// =========================================================================

	public static Goal goal(String name, BoolExpr term) {
		return new Goal(name, term, null);
	}

	public static Goal goal(String name, BoolExpr term, Tid origin) {
		return new Goal(name, term, origin);
	}

	/**
	 * Construct the trivially true constraint.
	 *
	 * @param ctx
	 * @return
	 */
	public static Goal trivial(Context ctx) {
		return new Goal("true", ctx.mkTrue(), null);
	}

	public static Constraint clause(List<? extends Constraint> hypotheses, List<? extends Constraint> conclusions) {
		return new Clause(hypotheses, conclusions);
	}

	public static Constraint conjunction(Constraint... conclusions) {
		return new Clause(Collections.emptyList(), Arrays.asList(conclusions));
	}

	/**
	 * Construct <code>hypothesis ==> conclusion</code>.
	 *
	 * @param hypothesis
	 * @param conclusion
	 * @return
	 */
	public static Constraint implies(Constraint hypothesis, Constraint conclusion) {
		return new Clause(Collections.singletonList(hypothesis), Collections.singletonList(conclusion));
	}

	// =========================================================================
	// Goals & Clauses
	// =========================================================================

	public static final class Goal extends Constraint {
		private final String name;
		private final BoolExpr term;
		private final Tid origin;

		private Goal(String name, BoolExpr term, Tid origin) {
			this.name = name;
			this.term = term;
			this.origin = origin;
		}

		public String getName() {
			return name;
		}

		public BoolExpr getTerm() {
			return term;
		}

		/**
		 * The term this goal was generated for, or <code>null</code>.
		 *
		 * @return
		 */
		public Tid getOrigin() {
			return origin;
		}

		@Override
		protected BoolExpr eval(Context ctx, Map<Constraint, BoolExpr> cache) {
			return term;
		}

		@Override
		protected Constraint substitute(Expr<?>[] from, Expr<?>[] to, Map<Constraint, Constraint> cache) {
			Constraint r = cache.get(this);
			if (r == null) {
				r = new Goal(name, (BoolExpr) term.substitute(from, to), origin);
				cache.put(this, r);
			}
			return r;
		}

		@Override
		protected void collectRefuted(Model model, List<Goal> goals, Map<Constraint, Boolean> holds,
				Set<Constraint> visited) {
			if (visited.add(this) && !holds(model, holds)) {
				goals.add(this);
			}
		}

		@Override
		protected boolean holds(Model model, Map<Constraint, Boolean> cache) {
			return !model.eval(term, true).isFalse();
		}

		@Override
		protected int count(Stats stats, Map<Constraint, Integer> depths) {
			if (depths.putIfAbsent(this, 1) == null) {
				stats.goals++;
			}
			return 1;
		}

		@Override
		public String toString() {
			return name + ": " + term;
		}
	}

	public static final class Clause extends Constraint {
		private final List<Constraint> hypotheses;
		private final List<Constraint> conclusions;

		private Clause(List<? extends Constraint> hypotheses, List<? extends Constraint> conclusions) {
			this.hypotheses = Collections.unmodifiableList(new ArrayList<>(hypotheses));
			this.conclusions = Collections.unmodifiableList(new ArrayList<>(conclusions));
		}

		public List<Constraint> getHypotheses() {
			return hypotheses;
		}

		public List<Constraint> getConclusions() {
			return conclusions;
		}

		@Override
		protected BoolExpr eval(Context ctx, Map<Constraint, BoolExpr> cache) {
			BoolExpr r = cache.get(this);
			if (r == null) {
				BoolExpr concs = and(ctx, conclusions, cache);
				r = hypotheses.isEmpty() ? concs : ctx.mkImplies(and(ctx, hypotheses, cache), concs);
				cache.put(this, r);
			}
			return r;
		}

		@Override
		protected Constraint substitute(Expr<?>[] from, Expr<?>[] to, Map<Constraint, Constraint> cache) {
			Constraint r = cache.get(this);
			if (r == null) {
				r = new Clause(substitute(hypotheses, from, to, cache), substitute(conclusions, from, to, cache));
				cache.put(this, r);
			}
			return r;
		}

		@Override
		protected void collectRefuted(Model model, List<Goal> goals, Map<Constraint, Boolean> holds,
				Set<Constraint> visited) {
			if (!visited.add(this)) {
				return;
			}
			for (Constraint h : hypotheses) {
				if (!h.holds(model, holds)) {
					return;
				}
			}
			for (Constraint c : conclusions) {
				c.collectRefuted(model, goals, holds, visited);
			}
		}

		@Override
		protected boolean holds(Model model, Map<Constraint, Boolean> cache) {
			Boolean r = cache.get(this);
			if (r == null) {
				r = !allHold(model, hypotheses, cache) || allHold(model, conclusions, cache);
				cache.put(this, r);
			}
			return r;
		}

		@Override
		protected int count(Stats stats, Map<Constraint, Integer> depths) {
			Integer d = depths.get(this);
			if (d != null) {
				return d;
			}
			stats.clauses++;
			int depth = 0;
			for (Constraint h : hypotheses) {
				depth = Math.max(depth, h.count(stats, depths));
			}
			for (Constraint c : conclusions) {
				depth = Math.max(depth, c.count(stats, depths));
			}
			depths.put(this, depth + 1);
			return depth + 1;
		}

		@Override
		public String toString() {
			return "(" + hypotheses + " ==> " + conclusions + ")";
		}

		private static BoolExpr and(Context ctx, List<Constraint> constraints, Map<Constraint, BoolExpr> cache) {
			switch (constraints.size()) {
			case 0:
				return ctx.mkTrue();
			case 1:
				return constraints.get(0).eval(ctx, cache);
			default:
				BoolExpr[] terms = new BoolExpr[constraints.size()];
				for (int i = 0; i != terms.length; ++i) {
					terms[i] = constraints.get(i).eval(ctx, cache);
				}
				return ctx.mkAnd(terms);
			}
		}

		private static boolean allHold(Model model, List<Constraint> constraints, Map<Constraint, Boolean> cache) {
			for (Constraint c : constraints) {
				if (!c.holds(model, cache)) {
					return false;
				}
			}
			return true;
		}

		private static List<Constraint> substitute(List<Constraint> constraints, Expr<?>[] from, Expr<?>[] to,
				Map<Constraint, Constraint> cache) {
			ArrayList<Constraint> result = new ArrayList<>(constraints.size());
			for (Constraint c : constraints) {
				result.add(c.substitute(from, to, cache));
			}
			return result;
		}
	}

	/**
	 * Size statistics for a constraint tree. Shared subtrees are counted once.
	 */
	public static final class Stats {
		private int goals;
		private int clauses;
		private int depth;

		public int getGoals() {
			return goals;
		}

		public int getClauses() {
			return clauses;
		}

		public int getDepth() {
			return depth;
		}

		@Override
		public String toString() {
			return "goals=" + goals + ", clauses=" + clauses + ", depth=" + depth;
		}
	}
}
