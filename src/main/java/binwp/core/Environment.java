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

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;

import binwp.core.BirFile.Elt;
import binwp.core.BirFile.Subroutine;
import binwp.core.BirFile.Tid;
import binwp.core.BirFile.Type;
import binwp.core.BirFile.Var;
import binwp.util.ExpressionTranslator;
import binwp.util.Util;

/**
 * The state of a weakest precondition analysis over one program. This binds
 * program variables to solver constants, caches the preconditions of visited
 * blocks, and holds the policies which decide how calls, jumps, interrupts,
 * loops and expression side conditions are treated.
 *
 * <p>
 * An environment can be <i>freshened</i>, meaning every solver constant it
 * creates carries a namespace suffix. This allows two programs which use the
 * same register names to be analysed together.
 * </p>
 */
public class Environment {
	private static final Logger logger = LoggerFactory.getLogger(Environment.class);

	/**
	 * Default lower and upper bounds of the stack region.
	 */
	public static final Range DEFAULT_STACK = new Range(new BigInteger("00007fffffff0000", 16),
			new BigInteger("00007fffffffffff", 16));

	/**
	 * Default lower and upper bounds of the heap region.
	 */
	public static final Range DEFAULT_HEAP = new Range(BigInteger.ZERO, new BigInteger("ffffffff", 16));

	private final Context ctx;
	private final VarGen varGen;
	private final Architecture arch;
	private final List<Subroutine> subroutines;
	private final List<FunSpecSelector> specs;
	private final FunSpecSelector defaultSpec;
	private final JmpSpec jmpSpec;
	private final IntSpec intSpec;
	private final List<ExpCond> expConds;
	private final LoopHandler loopHandler;
	private final int numUnroll;
	private final boolean freshen;
	private final String namespace;
	private final boolean useFunInputRegs;
	private final Range stack;
	private final Range heap;
	private final ExpressionTranslator translator;

	private final Map<Var, Expr<?>> vars = new LinkedHashMap<>();
	private final Map<Var, Expr<?>> initVars = new LinkedHashMap<>();
	private final Deque<Map<Tid, Constraint>> preconditions = new ArrayDeque<>();
	private final Map<Tid, FunSpec> subHandlers = new HashMap<>();
	private final Map<String, FuncDecl<?>> callSymbols = new LinkedHashMap<>();
	private final Map<String, BoolExpr> called = new LinkedHashMap<>();
	private final List<Weakening> weakenings = new ArrayList<>();

	private Environment(Builder builder) {
		this.ctx = builder.ctx;
		this.varGen = builder.varGen;
		this.arch = builder.arch;
		this.subroutines = new ArrayList<>(builder.subroutines);
		this.specs = new ArrayList<>(builder.specs);
		this.defaultSpec = builder.defaultSpec;
		this.jmpSpec = builder.jmpSpec;
		this.intSpec = builder.intSpec;
		this.expConds = new ArrayList<>(builder.expConds);
		this.loopHandler = builder.loopHandler != null ? builder.loopHandler : new Unroller();
		this.numUnroll = builder.numUnroll;
		this.freshen = builder.freshen;
		this.namespace = builder.namespace;
		this.useFunInputRegs = builder.useFunInputRegs;
		this.stack = builder.stack;
		this.heap = builder.heap;
		this.translator = new ExpressionTranslator(this);
		this.preconditions.push(new HashMap<>());
	}

	public Context getContext() {
		return ctx;
	}

	public VarGen getVarGen() {
		return varGen;
	}

	public Architecture getArchitecture() {
		return arch;
	}

	public List<Subroutine> getSubroutines() {
		return subroutines;
	}

	public JmpSpec getJmpSpec() {
		return jmpSpec;
	}

	public IntSpec getIntSpec() {
		return intSpec;
	}

	public List<ExpCond> getExpConds() {
		return expConds;
	}

	public LoopHandler getLoopHandler() {
		return loopHandler;
	}

	/**
	 * The maximum number of times the body of a loop is copied.
	 *
	 * @return
	 */
	public int getNumUnroll() {
		return numUnroll;
	}

	public boolean isFreshened() {
		return freshen;
	}

	public String getNamespace() {
		return namespace;
	}

	/**
	 * Determine whether function summaries read the architecture's argument
	 * registers, rather than the declared input arguments of the callee.
	 *
	 * @return
	 */
	public boolean useFunInputRegs() {
		return useFunInputRegs;
	}

	public Range getStackRange() {
		return stack;
	}

	public Range getHeapRange() {
		return heap;
	}

	public ExpressionTranslator getTranslator() {
		return translator;
	}

	// =========================================================================
	// Variables
	// =========================================================================

	/**
	 * Determine the name of the solver constant used for a given program name.
	 *
	 * @param name
	 * @return
	 */
	public String getConstantName(String name) {
		return freshen ? name + "_" + namespace : name;
	}

	/**
	 * Get the solver term currently bound to a variable, or <code>null</code> if
	 * it is unbound.
	 *
	 * @param var
	 * @return
	 */
	public Expr<?> getVar(Var var) {
		return vars.get(var);
	}

	/**
	 * Find a bound variable by name, ignoring its type. Returns
	 * <code>null</code> if there is none.
	 *
	 * @param name
	 * @return
	 */
	public Var findVar(String name) {
		for (Var v : vars.keySet()) {
			if (v.getName().equals(name)) {
				return v;
			}
		}
		return null;
	}

	public void bindVar(Var var, Expr<?> term) {
		vars.put(var, term);
	}

	public void unbindVar(Var var) {
		vars.remove(var);
	}

	/**
	 * Bind a variable to a solver constant named after it, unless already bound.
	 *
	 * @param var
	 * @return
	 */
	public Expr<?> mkVar(Var var) {
		Expr<?> term = vars.get(var);
		if (term == null) {
			term = ctx.mkConst(getConstantName(var.getName()), sortOf(var.getType()));
			vars.put(var, term);
		}
		return term;
	}

	public Map<Var, Expr<?>> getVars() {
		return Collections.unmodifiableMap(vars);
	}

	/**
	 * Get the constant holding the initial value of a variable, or
	 * <code>null</code> if none was created.
	 *
	 * @param var
	 * @return
	 */
	public Expr<?> getInitVar(Var var) {
		return initVars.get(var);
	}

	public Map<Var, Expr<?>> getInitVars() {
		return Collections.unmodifiableMap(initVars);
	}

	/**
	 * Create a constant <code>init_x</code> holding the initial value of a
	 * variable <code>x</code>, and return the hypothesis <code>x == init_x</code>.
	 *
	 * @param var
	 * @return
	 */
	public Constraint initVar(Var var) {
		Expr<?> x = mkVar(var);
		Expr<?> init = initVars.get(var);
		if (init == null) {
			init = ctx.mkConst("init_" + getConstantName(var.getName()), sortOf(var.getType()));
			initVars.put(var, init);
		}
		return Constraint.goal("init_" + getConstantName(var.getName()), Util.equal(ctx, x, init));
	}

	public List<Constraint> initVars(Collection<Var> vars) {
		ArrayList<Constraint> hyps = new ArrayList<>();
		for (Var v : vars) {
			hyps.add(initVar(v));
		}
		return hyps;
	}

	/**
	 * Get the hypotheses <code>x == init_x</code> for every variable with an
	 * initial value.
	 *
	 * @return
	 */
	public List<Constraint> getInitHypotheses() {
		ArrayList<Constraint> hyps = new ArrayList<>();
		for (Map.Entry<Var, Expr<?>> e : initVars.entrySet()) {
			String name = "init_" + getConstantName(e.getKey().getName());
			hyps.add(Constraint.goal(name, Util.equal(ctx, vars.get(e.getKey()), e.getValue())));
		}
		return hyps;
	}

	public Sort sortOf(Type type) {
		if (type instanceof Type.Imm) {
			return ctx.mkBitVecSort(((Type.Imm) type).getWidth());
		} else if (type instanceof Type.Mem) {
			Type.Mem m = (Type.Mem) type;
			return ctx.mkArraySort(ctx.mkBitVecSort(m.getAddressWidth()), ctx.mkBitVecSort(m.getWordWidth()));
		} else {
			throw new IllegalArgumentException("no sort for type " + type);
		}
	}

	// =========================================================================
	// Preconditions
	// =========================================================================

	/**
	 * Get the cached precondition of a block in the current scope, or
	 * <code>null</code> if there is none.
	 *
	 * @param block
	 * @return
	 */
	public Constraint getPrecondition(Tid block) {
		return preconditions.peek().get(block);
	}

	public void addPrecondition(Tid block, Constraint pre) {
		preconditions.peek().put(block, pre);
	}

	/**
	 * Start a fresh precondition scope, as needed for each level of a loop
	 * unrolling and for each inlined call.
	 */
	public void pushScope() {
		preconditions.push(new HashMap<>());
	}

	public void popScope() {
		if (preconditions.size() == 1) {
			throw new IllegalStateException("cannot pop outermost precondition scope");
		}
		preconditions.pop();
	}

	public Constraint trivialConstraint() {
		return Constraint.trivial(ctx);
	}

	// =========================================================================
	// Subroutines
	// =========================================================================

	public Subroutine getSubroutine(Tid tid) {
		for (Subroutine s : subroutines) {
			if (s.getTid().equals(tid)) {
				return s;
			}
		}
		return null;
	}

	public Subroutine getSubroutine(String name) {
		for (Subroutine s : subroutines) {
			if (s.getName().equals(name)) {
				return s;
			}
		}
		return null;
	}

	/**
	 * Determine how calls to a given subroutine are handled. The first selector
	 * which accepts the subroutine wins, otherwise the default is used.
	 *
	 * @param sub
	 * @return
	 */
	public FunSpec getSubHandler(Subroutine sub) {
		FunSpec spec = subHandlers.get(sub.getTid());
		if (spec == null) {
			for (FunSpecSelector selector : specs) {
				Optional<FunSpec> s = selector.select(sub, arch);
				if (s.isPresent()) {
					spec = s.get();
					break;
				}
			}
			if (spec == null) {
				spec = defaultSpec.select(sub, arch).orElseThrow(
						() -> new IllegalStateException("default function spec rejected " + sub.getName()));
			}
			logger.debug("calls to {} handled by {}", sub.getName(), spec.getName());
			subHandlers.put(sub.getTid(), spec);
		}
		return spec;
	}

	/**
	 * Get the uninterpreted function used to model an output of a called
	 * function. Such symbols are shared between environments, so that equal
	 * inputs to the same function give equal outputs in both programs.
	 *
	 * @param name
	 * @param domain
	 * @param range
	 * @return
	 */
	public FuncDecl<?> getCallSymbol(String name, Sort[] domain, Sort range) {
		FuncDecl<?> decl = callSymbols.get(name);
		if (decl == null) {
			decl = ctx.mkFuncDecl(name, domain, range);
			callSymbols.put(name, decl);
		}
		return decl;
	}

	/**
	 * Get the boolean tracking whether a given function has been called.
	 *
	 * @param name
	 * @return
	 */
	public BoolExpr getCalled(String name) {
		BoolExpr c = called.get(name);
		if (c == null) {
			c = ctx.mkBoolConst("called_" + getConstantName(name));
			called.put(name, c);
		}
		return c;
	}

	public Map<String, BoolExpr> getCalledSymbols() {
		return Collections.unmodifiableMap(called);
	}

	// =========================================================================
	// Weakenings
	// =========================================================================

	public void weaken(Weakening.Kind kind, Tid location, String detail) {
		logger.warn("precondition weakened at {} ({}): {}", location, kind, detail);
		weakenings.add(new Weakening(kind, location, detail));
	}

	public List<Weakening> getWeakenings() {
		return Collections.unmodifiableList(weakenings);
	}

	// =========================================================================
	// Policies
	// =========================================================================

	/**
	 * Computes the precondition of a call from the postcondition holding on
	 * return.
	 */
	public interface Summary {
		public Constraint apply(Environment env, Constraint post, Tid callSite);
	}

	/**
	 * Describes how calls to a function are handled. A spec either summarises the
	 * call or asks for the callee to be inlined.
	 */
	public static final class FunSpec {
		private final String name;
		private final Summary summary;

		private FunSpec(String name, Summary summary) {
			this.name = name;
			this.summary = summary;
		}

		public static FunSpec summary(String name, Summary summary) {
			return new FunSpec(name, Objects.requireNonNull(summary));
		}

		public static FunSpec inline(String name) {
			return new FunSpec(name, null);
		}

		public String getName() {
			return name;
		}

		public boolean isInline() {
			return summary == null;
		}

		public Summary getSummary() {
			if (summary == null) {
				throw new IllegalStateException("inline spec " + name + " has no summary");
			}
			return summary;
		}
	}

	public interface FunSpecSelector {
		public Optional<FunSpec> select(Subroutine sub, Architecture arch);
	}

	/**
	 * Overrides the treatment of a jump. An empty result means the default
	 * treatment applies.
	 */
	public interface JmpSpec {
		public Optional<Constraint> apply(Environment env, Constraint post, Tid block, Elt.Jmp jmp);
	}

	public interface IntSpec {
		public Constraint apply(Environment env, Constraint post, int number);
	}

	/**
	 * Generates a side condition for an expression, such as a check that an
	 * address is non-null.
	 */
	public interface ExpCond {
		public Optional<Cond> apply(Environment env, BirFile.Expr expr);
	}

	public static final class Cond {
		public enum Kind {
			VERIFY, ASSUME
		}

		public enum Placement {
			BEFORE, AFTER
		}

		private final String name;
		private final Kind kind;
		private final Placement placement;
		private final BoolExpr term;

		public Cond(String name, Kind kind, Placement placement, BoolExpr term) {
			this.name = name;
			this.kind = kind;
			this.placement = placement;
			this.term = term;
		}

		public String getName() {
			return name;
		}

		public Kind getKind() {
			return kind;
		}

		public Placement getPlacement() {
			return placement;
		}

		public BoolExpr getTerm() {
			return term;
		}
	}

	/**
	 * Computes the precondition of a subgraph from a given start block.
	 */
	public interface GraphVisitor {
		public Constraint visit(Environment env, Constraint post, Tid start);
	}

	/**
	 * Handles a back edge to a loop header.
	 */
	public interface LoopHandler {
		public Constraint handle(Environment env, Constraint post, Tid header);

		public GraphVisitor getRecursiveCall();

		public void setRecursiveCall(GraphVisitor visitor);
	}

	/**
	 * Unrolls loops a bounded number of times. Each unrolling visits the loop from
	 * its header in a fresh precondition scope. Once the bound is reached the loop
	 * is cut off with the trivial constraint.
	 */
	public static class Unroller implements LoopHandler {
		private final Map<Tid, Integer> depth = new HashMap<>();
		private GraphVisitor recursiveCall;

		@Override
		public GraphVisitor getRecursiveCall() {
			return recursiveCall;
		}

		@Override
		public void setRecursiveCall(GraphVisitor visitor) {
			this.recursiveCall = visitor;
		}

		@Override
		public Constraint handle(Environment env, Constraint post, Tid header) {
			int bound = Math.max(env.getNumUnroll(), 1);
			int d = depth.getOrDefault(header, 0);
			if (d >= bound - 1) {
				env.weaken(Weakening.Kind.LOOP_UNROLL_BOUND, header, "loop unrolled " + bound + " time(s)");
				return env.trivialConstraint();
			} else if (recursiveCall == null) {
				throw new IllegalStateException("loop handler invoked outside of a subroutine");
			}
			logger.debug("unrolling loop at {} (depth {})", header, d + 1);
			depth.put(header, d + 1);
			env.pushScope();
			try {
				return recursiveCall.visit(env, post, header);
			} finally {
				env.popScope();
				depth.put(header, d);
			}
		}
	}

	/**
	 * An inclusive range of addresses.
	 */
	public static final class Range {
		private final BigInteger low;
		private final BigInteger high;

		public Range(BigInteger low, BigInteger high) {
			if (low.compareTo(high) > 0) {
				throw new IllegalArgumentException("empty address range " + low + ".." + high);
			}
			this.low = low;
			this.high = high;
		}

		public BigInteger getLow() {
			return low;
		}

		public BigInteger getHigh() {
			return high;
		}

		/**
		 * Construct the formula <code>low &lt;= addr &lt;= high</code>.
		 *
		 * @param ctx
		 * @param addr
		 * @return
		 */
		public BoolExpr contains(Context ctx, BitVecExpr addr) {
			int width = addr.getSortSize();
			BitVecExpr lo = ctx.mkBV(low.toString(), width);
			BitVecExpr hi = ctx.mkBV(high.toString(), width);
			return ctx.mkAnd(ctx.mkBVULE(lo, addr), ctx.mkBVULE(addr, hi));
		}

		@Override
		public String toString() {
			return "0x" + low.toString(16) + "..0x" + high.toString(16);
		}
	}

	// =========================================================================
	// Builder
	// =========================================================================

	public static class Builder {
		private final Context ctx;
		private VarGen varGen;
		private Architecture arch = Architecture.X86_64;
		private List<Subroutine> subroutines = Collections.emptyList();
		private List<FunSpecSelector> specs = Collections.emptyList();
		private FunSpecSelector defaultSpec = (sub, arch) -> Optional
				.of(FunSpec.summary("identity", (env, post, tid) -> post));
		private JmpSpec jmpSpec = (env, post, blk, jmp) -> Optional.empty();
		private IntSpec intSpec = (env, post, n) -> post;
		private List<ExpCond> expConds = Collections.emptyList();
		private LoopHandler loopHandler;
		private int numUnroll = 5;
		private boolean freshen;
		private String namespace = "mod";
		private boolean useFunInputRegs = true;
		private Range stack = DEFAULT_STACK;
		private Range heap = DEFAULT_HEAP;

		public Builder(Context ctx) {
			this(ctx, new VarGen());
		}

		public Builder(Context ctx, VarGen varGen) {
			this.ctx = Objects.requireNonNull(ctx);
			this.varGen = Objects.requireNonNull(varGen);
		}

		public Builder varGen(VarGen varGen) {
			this.varGen = varGen;
			return this;
		}

		public Builder architecture(Architecture arch) {
			this.arch = arch;
			return this;
		}

		public Builder subroutines(List<Subroutine> subroutines) {
			this.subroutines = subroutines;
			return this;
		}

		public Builder specs(List<FunSpecSelector> specs) {
			this.specs = specs;
			return this;
		}

		public Builder defaultSpec(FunSpecSelector spec) {
			this.defaultSpec = spec;
			return this;
		}

		public Builder jmpSpec(JmpSpec spec) {
			this.jmpSpec = spec;
			return this;
		}

		public Builder intSpec(IntSpec spec) {
			this.intSpec = spec;
			return this;
		}

		public Builder expConds(List<ExpCond> conds) {
			this.expConds = conds;
			return this;
		}

		public Builder loopHandler(LoopHandler handler) {
			this.loopHandler = handler;
			return this;
		}

		public Builder numUnroll(int numUnroll) {
			if (numUnroll < 0) {
				throw new IllegalArgumentException("negative unroll count " + numUnroll);
			}
			this.numUnroll = numUnroll;
			return this;
		}

		/**
		 * Suffix every constant created by the environment with a namespace.
		 *
		 * @param freshen
		 * @return
		 */
		public Builder freshen(boolean freshen) {
			this.freshen = freshen;
			return this;
		}

		public Builder namespace(String namespace) {
			this.namespace = namespace;
			return this;
		}

		public Builder useFunInputRegs(boolean flag) {
			this.useFunInputRegs = flag;
			return this;
		}

		public Builder stackRange(Range range) {
			this.stack = range;
			return this;
		}

		public Builder heapRange(Range range) {
			this.heap = range;
			return this;
		}

		public Environment build() {
			return new Environment(this);
		}
	}
}
