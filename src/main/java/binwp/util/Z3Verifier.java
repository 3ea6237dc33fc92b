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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Statistics;
import com.microsoft.z3.Status;

import binwp.core.BirFile.Var;
import binwp.core.Constraint;
import binwp.core.Environment;

/**
 * A wrapper for the Z3 solver which checks constraints and extracts
 * counterexamples from its models.
 */
public class Z3Verifier {
    private static final Logger logger = LoggerFactory.getLogger(Z3Verifier.class);

    /**
     * The outcome of checking a constraint.
     */
    public enum Verdict {
        PROVED, REFUTED, UNKNOWN
    }

    private final Context ctx;

    /**
     * Record solver options.
     */
    public final Map<String, Integer> options;

    public Z3Verifier(Context ctx) {
        this.ctx = ctx;
        this.options = new LinkedHashMap<>();
    }

    /**
     * Limit the number of milliseconds spent on each check.
     *
     * @param millis
     */
    public Z3Verifier setTimeout(int millis) {
        options.put("timeout", millis);
        return this;
    }

    /**
     * Construct a solver configured with the registered options.
     *
     * @return
     */
    public Solver newSolver() {
        Solver solver = ctx.mkSolver();
        if (!options.isEmpty()) {
            Params params = ctx.mkParams();
            for (Map.Entry<String, Integer> e : options.entrySet()) {
                params.add(e.getKey(), e.getValue());
            }
            solver.setParameters(params);
        }
        return solver;
    }

    /**
     * Check a constraint by asserting its negation, so that an unsatisfiable
     * result means the constraint is valid.
     *
     * @param solver
     * @param ctx
     * @param constraint
     * @return
     */
    public static Status check(Solver solver, Context ctx, Constraint constraint) {
        return check(solver, ctx, constraint, true);
    }

    /**
     * Check a constraint. When <code>refute</code> holds the negation of the
     * constraint is asserted, otherwise the constraint itself is asserted and
     * the check determines whether it is satisfiable.
     *
     * @param solver
     * @param ctx
     * @param constraint
     * @param refute
     * @return
     */
    public static Status check(Solver solver, Context ctx, Constraint constraint, boolean refute) {
        BoolExpr formula = constraint.eval(ctx);
        solver.add(refute ? ctx.mkNot(formula) : formula);
        long start = System.currentTimeMillis();
        Status status = solver.check();
        logger.info("solver returned {} in {}ms", status, System.currentTimeMillis() - start);
        if (status == Status.UNKNOWN) {
            logger.warn("solver could not decide: {}", solver.getReasonUnknown());
        }
        return status;
    }

    /**
     * Exclude the value a variable takes in the current model and check again.
     * This is used to enumerate different counterexamples for the same
     * constraint.
     *
     * @param solver a solver whose last check was satisfiable.
     * @param ctx
     * @param var
     * @param pre
     * @return
     */
    public static Status exclude(Solver solver, Context ctx, Expr<?> var, Constraint pre) {
        Model model = solver.getModel();
        Expr<?> value = model.eval(var, true);
        logger.debug("excluding {} = {}", var, value);
        solver.add(ctx.mkNot(Util.equal(ctx, var, value)));
        return check(solver, ctx, pre);
    }

    public static Verdict verdict(Status status) {
        switch (status) {
        case UNSATISFIABLE:
            return Verdict.PROVED;
        case SATISFIABLE:
            return Verdict.REFUTED;
        default:
            return Verdict.UNKNOWN;
        }
    }

    public static Map<String, String> getStatistics(Solver solver) {
        Map<String, String> stats = new LinkedHashMap<>();
        for (Statistics.Entry e : solver.getStatistics().getEntries()) {
            stats.put(e.Key, e.getValueString());
        }
        return stats;
    }

    /**
     * Extract the initial values of registers from a model. Values are keyed by
     * the name of the solver constant denoting them, so registers of different
     * programs are distinguished by their namespace.
     *
     * @param model
     * @param envs
     * @return
     */
    public static Counterexample getCounterexample(Model model, Environment... envs) {
        Map<String, BigInteger> values = new LinkedHashMap<>();
        for (Environment env : envs) {
            for (Map.Entry<Var, Expr<?>> e : env.getInitVars().entrySet()) {
                if (e.getKey().isMemory()) {
                    continue;
                }
                Expr<?> v = model.eval(e.getValue(), true);
                if (v instanceof BitVecNum) {
                    values.put(env.getConstantName(e.getKey().getName()), ((BitVecNum) v).getBigInteger());
                }
            }
        }
        return new Counterexample(values);
    }

    /**
     * A concrete assignment of initial register values which falsifies a
     * constraint.
     */
    public static class Counterexample {
        private final Map<String, BigInteger> values;

        public Counterexample(Map<String, BigInteger> values) {
            this.values = Collections.unmodifiableMap(values);
        }

        public Map<String, BigInteger> getValues() {
            return values;
        }

        public BigInteger get(String name) {
            return values.get(name);
        }

        @Override
        public String toString() {
            List<String> items = new ArrayList<>();
            for (Map.Entry<String, BigInteger> e : values.entrySet()) {
                items.add(e.getKey() + " |-> 0x" + e.getValue().toString(16));
            }
            return String.join("\n", items);
        }
    }
}
